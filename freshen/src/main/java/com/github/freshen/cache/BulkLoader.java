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
 * Produces many mappings in a single invocation, for use in populating a {@link BulkCache}.
 * <p>
 * Each invocation writes its results through the supplied sink. The writes are merged into the
 * cache as they arrive; a key that an invocation does not write keeps its previous value until that
 * value ages past the cache's keep time. Readers may therefore observe mappings written by several
 * generations of the loader at once.
 * <p>
 * Usage example:
 * <pre>{@code
 *   BulkLoader<String, Rate> loader = sink -> {
 *     for (Rate rate : fetchExchangeRates()) {
 *       if (sink.isCancelled()) {
 *         return false;
 *       }
 *       sink.accept(rate.currency(), rate);
 *     }
 *     return true;
 *   };
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
@NullMarked
@FunctionalInterface
public interface BulkLoader<K, V> {

  /**
   * Computes or retrieves a set of mappings and writes them to {@code sink}. The sink may be called
   * any number of times and stamps each written entry with the time of the write. Once the cache is
   * closed the sink silently discards further writes and {@link BulkSink#isCancelled()} returns
   * {@code true}.
   *
   * @param sink the non-null receiver of the loaded mappings; neither keys nor values may be null
   * @return {@code true} if the run should be considered a successful population
   * @throws Exception or Error, in which case the run is treated as unsuccessful, though any
   *         mappings already written are retained
   * @throws InterruptedException if this method is interrupted. {@code InterruptedException} is
   *         treated like any other {@code Exception} in all respects except that, when it is
   *         caught, the thread's interrupt status is set
   */
  boolean loadAll(BulkSink<K, V> sink) throws Exception;
}
