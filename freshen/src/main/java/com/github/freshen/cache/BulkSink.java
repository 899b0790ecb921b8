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

import java.util.function.BiConsumer;

import org.jspecify.annotations.NullMarked;

/**
 * The receiver of the mappings produced by a {@link BulkLoader} run. Each mapping is stamped with
 * the time of its write. Once the cache is closed the sink discards further writes and reports
 * itself as cancelled, so that a long-running loader can stop early.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
@NullMarked
public interface BulkSink<K, V> extends BiConsumer<K, V> {

  /**
   * Writes the mapping into the cache, replacing any previous value for the key.
   *
   * @param key the non-null key
   * @param value the non-null value
   * @throws NullPointerException if the key or value is null
   */
  @Override
  void accept(K key, V value);

  /**
   * Returns whether the cache has been closed, in which case the run's remaining writes would be
   * discarded.
   *
   * @return if the loader should stop producing mappings
   */
  boolean isCancelled();
}
