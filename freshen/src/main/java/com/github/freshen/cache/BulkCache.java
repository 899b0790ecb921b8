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
 * A cache that is populated in bulk by repeated runs of a {@link BulkLoader}.
 * <p>
 * The first loader run starts as soon as the cache is built. Readers wait until a run has succeeded
 * at least once and then read whatever mappings are present. Thereafter the loader is run again
 * once the refresh interval has elapsed since the last successful run. Each run merges into the
 * existing mappings rather than replacing them, so a key that a run omits keeps serving its
 * previous value until it outlives the keep time.
 *
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of mapped values
 */
@NullMarked
public interface BulkCache<K, V> extends RefreshingCache<K, V> {

  /**
   * Returns whether a loader run has completed successfully. Until then, readers block.
   *
   * @return if the cache has been populated at least once
   */
  boolean isPopulated();
}
