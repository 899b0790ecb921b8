/*
 * Copyright 2026 The Freshen Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.freshen.cache;

import java.time.Duration;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import com.github.freshen.cache.stats.CacheStats;
import com.google.errorprone.annotations.CheckReturnValue;

/**
 * A semi-persistent mapping from keys to values that is kept fresh by a background maintenance
 * task. Implementations of this interface are expected to be thread-safe, and can be safely
 * accessed by multiple concurrent threads.
 * <p>
 * Every cache owns a maintenance task that runs until {@link #close()} is called. Closing is
 * mandatory for the prompt release of the task and of the cached data; the cache is never closed on
 * the owner's behalf, so a handle should be scoped like any other resource:
 * <pre>{@code
 *   try (PointCache<String, Integer> cache = Freshen.newBuilder()
 *       .refreshInterval(Duration.ofSeconds(3))
 *       .build(String::length)) {
 *     Integer length = cache.get("one");
 *   }
 * }</pre>
 *
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of mapped values
 */
@NullMarked
public interface RefreshingCache<K, V> extends AutoCloseable {

  /**
   * Returns the value associated with the {@code key}, waiting as long as necessary for the value
   * to become available. If the calling thread is interrupted while waiting then the interrupt
   * status is restored and {@code null} is returned.
   *
   * @param key the key whose associated value is to be returned
   * @return the value to which the specified key is mapped, or {@code null} if it was not found
   * @throws NullPointerException if the specified key is null
   * @throws IllegalStateException if the cache has been closed
   */
  @Nullable V get(K key);

  /**
   * Returns the value associated with the {@code key}, waiting at most {@code timeout} for a
   * computation started by another thread to make the value available. Giving up early has no
   * effect on that computation, which continues for the benefit of later readers.
   *
   * @param key the key whose associated value is to be returned
   * @param timeout the maximum duration to wait
   * @return the value to which the specified key is mapped, or {@code null} if it was not found
   *         before the timeout elapsed
   * @throws NullPointerException if the specified key or timeout is null
   * @throws IllegalStateException if the cache has been closed
   */
  @Nullable V get(K key, Duration timeout);

  /**
   * Returns the approximate number of entries in this cache. The value returned is an estimate; the
   * actual count may differ if there are concurrent insertions or removals, or if some entries are
   * past their keep time but not yet swept. This inaccuracy can be mitigated by performing a
   * {@link #cleanUp()} first.
   *
   * @return the estimated number of mappings
   */
  @CheckReturnValue
  long estimatedSize();

  /**
   * Returns a current snapshot of this cache's cumulative statistics. All statistics are
   * initialized to zero, and are monotonically increasing over the lifetime of the cache. Unless
   * the cache was built with {@link Freshen#recordStats()} the snapshot is always empty.
   *
   * @return the current snapshot of the statistics of this cache
   */
  @CheckReturnValue
  CacheStats stats();

  /**
   * Performs one maintenance cycle on the calling thread: evicting entries that have outlived the
   * keep time and refreshing entries according to the cache's policy. Cycles are serialized, so
   * this call waits for a cycle already in progress on the background task.
   */
  void cleanUp();

  /**
   * Stops the maintenance task and discards all entries. This method is idempotent. Callers that
   * are waiting on a value when the cache is closed are released and receive {@code null}, while
   * any subsequent use of the cache fails with an {@link IllegalStateException}.
   */
  @Override
  void close();
}
