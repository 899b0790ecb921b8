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

/**
 * A cache that lazily loads each key on its first request and keeps frequently read entries warm.
 * <p>
 * When a key is absent, the requesting thread inserts a pending entry and loads the value with the
 * cache's {@link PointLoader}. Other threads that request the same key while it is loading wait for
 * that single load rather than starting their own. If the load fails then the entry remains in a
 * failed state, reported as not found, until it is replaced by {@link #put} or evicted.
 * <p>
 * The maintenance task wakes every quarter of the refresh interval. An entry older than the keep
 * time is evicted. An entry older than the refresh interval that has been read since it was
 * written, and was read within the last half of the refresh interval, is reloaded in the background
 * and swapped in whole once the reload succeeds. Entries that are stale but cold are left to age
 * out.
 *
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of mapped values
 */
@NullMarked
public interface PointCache<K, V> extends RefreshingCache<K, V> {

  /**
   * Associates the {@code value} with the {@code key} in this cache, replacing any previous entry.
   * The entry is immediately readable and counts as both written and read at the current time.
   * <p>
   * A thread that is already waiting on an in-flight load of the replaced entry is unaffected; it
   * receives the result of that load rather than this value. This is a benign race for a manual
   * override, and later readers observe the new value.
   *
   * @param key the key with which the specified value is to be associated
   * @param value value to be associated with the specified key
   * @throws NullPointerException if the specified key or value is null
   * @throws IllegalStateException if the cache has been closed
   */
  void put(K key, V value);
}
