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

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

/**
 * Computes the value for a single key, for use in populating a {@link PointCache}.
 * <p>
 * The loader is invoked by the first thread that requests an absent key, and later by the cache's
 * maintenance task to proactively refresh an entry that is stale but still being read. A refresh
 * runs on the cache's executor and is bounded to half of the refresh interval; a loader that
 * overruns that bound is interrupted by a later maintenance cycle and its result is discarded.
 * <p>
 * Usage example:
 * <pre>{@code
 *   PointLoader<Key, Graph> loader = key -> createExpensiveGraph(key);
 *   PointCache<Key, Graph> cache = Freshen.newBuilder()
 *       .refreshInterval(Duration.ofMinutes(1))
 *       .build(loader);
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
@NullMarked
@FunctionalInterface
public interface PointLoader<K, V> {

  /**
   * Computes or retrieves the value corresponding to {@code key}.
   * <p>
   * <b>Warning:</b> loading <b>must not</b> attempt to update any mappings of this cache directly.
   *
   * @param key the non-null key whose value should be loaded
   * @return the value associated with {@code key}, or {@code null} to signal that the value could
   *         not be produced
   * @throws Exception or Error, in which case the mapping is unchanged
   * @throws InterruptedException if this method is interrupted. {@code InterruptedException} is
   *         treated like any other {@code Exception} in all respects except that, when it is
   *         caught, the thread's interrupt status is set
   */
  @Nullable V load(K key) throws Exception;
}
