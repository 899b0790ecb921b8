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

import java.util.concurrent.atomic.LongAdder;

/**
 * A thread-safe {@link StatsCounter} implementation for use by cache implementors.
 */
public final class ConcurrentStatsCounter implements StatsCounter {
  private final LongAdder hitCount;
  private final LongAdder missCount;
  private final LongAdder loadSuccessCount;
  private final LongAdder loadFailureCount;
  private final LongAdder totalLoadTime;
  private final LongAdder refreshCount;
  private final LongAdder refreshFailureCount;
  private final LongAdder evictionCount;

  /**
   * Constructs an instance with all counts initialized to zero.
   */
  public ConcurrentStatsCounter() {
    hitCount = new LongAdder();
    missCount = new LongAdder();
    loadSuccessCount = new LongAdder();
    loadFailureCount = new LongAdder();
    totalLoadTime = new LongAdder();
    refreshCount = new LongAdder();
    refreshFailureCount = new LongAdder();
    evictionCount = new LongAdder();
  }

  @Override
  public void recordHits(int count) {
    hitCount.add(count);
  }

  @Override
  public void recordMisses(int count) {
    missCount.add(count);
  }

  @Override
  public void recordLoadSuccess(long loadTime) {
    loadSuccessCount.increment();
    totalLoadTime.add(loadTime);
  }

  @Override
  public void recordLoadFailure(long loadTime) {
    loadFailureCount.increment();
    totalLoadTime.add(loadTime);
  }

  @Override
  public void recordRefresh(long loadTime, boolean success) {
    refreshCount.increment();
    if (!success) {
      refreshFailureCount.increment();
    }
    totalLoadTime.add(loadTime);
  }

  @Override
  public void recordEviction() {
    evictionCount.increment();
  }

  @Override
  public CacheStats snapshot() {
    // the adders are summed independently, so a racing refresh may be half counted
    long failures = negativeToMaxValue(refreshFailureCount.sum());
    long refreshes = negativeToMaxValue(refreshCount.sum());
    return CacheStats.of(
        negativeToMaxValue(hitCount.sum()),
        negativeToMaxValue(missCount.sum()),
        negativeToMaxValue(loadSuccessCount.sum()),
        negativeToMaxValue(loadFailureCount.sum()),
        negativeToMaxValue(totalLoadTime.sum()),
        Math.max(refreshes, failures),
        failures,
        negativeToMaxValue(evictionCount.sum()));
  }

  /** Returns {@code value}, if non-negative. Otherwise, returns {@link Long#MAX_VALUE}. */
  private static long negativeToMaxValue(long value) {
    return (value >= 0) ? value : Long.MAX_VALUE;
  }

  /**
   * Increments all counters by the values in {@code other}.
   *
   * @param other the counter to increment from
   */
  public void incrementBy(StatsCounter other) {
    CacheStats otherStats = other.snapshot();
    hitCount.add(otherStats.hitCount());
    missCount.add(otherStats.missCount());
    loadSuccessCount.add(otherStats.loadSuccessCount());
    loadFailureCount.add(otherStats.loadFailureCount());
    totalLoadTime.add(otherStats.totalLoadTime());
    refreshCount.add(otherStats.refreshCount());
    refreshFailureCount.add(otherStats.refreshFailureCount());
    evictionCount.add(otherStats.evictionCount());
  }

  @Override
  public String toString() {
    return snapshot().toString();
  }
}
