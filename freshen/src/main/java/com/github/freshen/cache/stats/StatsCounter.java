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
package com.github.freshen.cache.stats;

import com.github.freshen.cache.RefreshingCache;

/**
 * Accumulates statistics during the operation of a {@link RefreshingCache} for presentation by
 * {@link RefreshingCache#stats}. This is solely intended for consumption by cache implementors.
 */
public interface StatsCounter {

  /**
   * Records cache hits. This should be called when a cache request returns a cached value.
   *
   * @param count the number of hits to record
   */
  void recordHits(int count);

  /**
   * Records cache misses. This should be called when a cache request returns no value, both by the
   * loading thread and by threads that waited on its load.
   *
   * @param count the number of misses to record
   */
  void recordMisses(int count);

  /**
   * Records the successful load of a new entry, or a successful run of a bulk loader.
   *
   * @param loadTime the number of nanoseconds the cache spent computing or retrieving the new value
   */
  void recordLoadSuccess(long loadTime);

  /**
   * Records a load that returned no value or threw an exception.
   *
   * @param loadTime the number of nanoseconds the cache spent computing or retrieving the new value
   *        prior to discovering the value doesn't exist or an exception being thrown
   */
  void recordLoadFailure(long loadTime);

  /**
   * Records a proactive refresh of a stale entry by the maintenance task.
   *
   * @param loadTime the number of nanoseconds the refresh took, or waited before giving up
   * @param success whether the refresh replaced the stale value
   */
  void recordRefresh(long loadTime, boolean success);

  /** Records the eviction of an entry that outlived the keep time. */
  void recordEviction();

  /**
   * Returns a snapshot of this counter's values. Note that this may be an inconsistent view, as it
   * may be interleaved with update operations.
   *
   * @return a snapshot of this counter's values
   */
  CacheStats snapshot();

  /**
   * Returns an accumulator that does not record any cache events.
   *
   * @return an accumulator that does not record metrics
   */
  static StatsCounter disabledStatsCounter() {
    return DisabledStatsCounter.INSTANCE;
  }
}
