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

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import com.github.freshen.cache.PointCache;
import com.github.freshen.cache.RefreshingCache;
import com.google.errorprone.annotations.Immutable;

/**
 * Statistics about the performance of a {@link RefreshingCache}.
 * <p>
 * Cache statistics are incremented according to the following rules:
 * <ul>
 *   <li>When a lookup returns a value, {@code hitCount} is incremented.
 *   <li>When a lookup returns {@code null}, because the key is absent, its load failed, or the
 *       caller stopped waiting, {@code missCount} is incremented.
 *   <li>When a {@link PointCache} lookup inserts a new entry, the load that follows is recorded in
 *       {@code loadSuccessCount} or {@code loadFailureCount} and the lookup itself is a miss. Bulk
 *       loader runs are recorded the same way, without a lookup.
 *   <li>When the maintenance task reloads a stale entry, {@code refreshCount} is incremented, and
 *       {@code refreshFailureCount} as well if the reload did not produce a value.
 *   <li>The time spent in every load and refresh, in nanoseconds, is added to
 *       {@code totalLoadTime}.
 *   <li>When an entry is removed for outliving the keep time, {@code evictionCount} is
 *       incremented. No stats are modified when an entry is replaced by a put.
 * </ul>
 * <p>
 * This is a <em>value-based</em> class; use of identity-sensitive operations (including reference
 * equality ({@code ==}), identity hash code, or synchronization) on instances of {@code CacheStats}
 * may have unpredictable results and should be avoided.
 */
@Immutable
public final class CacheStats {
  private static final CacheStats EMPTY_STATS = new CacheStats(0L, 0L, 0L, 0L, 0L, 0L, 0L, 0L);

  private final long hitCount;
  private final long missCount;
  private final long loadSuccessCount;
  private final long loadFailureCount;
  private final long totalLoadTime;
  private final long refreshCount;
  private final long refreshFailureCount;
  private final long evictionCount;

  private CacheStats(long hitCount, long missCount, long loadSuccessCount, long loadFailureCount,
      long totalLoadTime, long refreshCount, long refreshFailureCount, long evictionCount) {
    if ((hitCount < 0) || (missCount < 0) || (loadSuccessCount < 0) || (loadFailureCount < 0)
        || (totalLoadTime < 0) || (refreshCount < 0) || (refreshFailureCount < 0)
        || (evictionCount < 0) || (refreshFailureCount > refreshCount)) {
      throw new IllegalArgumentException();
    }
    this.hitCount = hitCount;
    this.missCount = missCount;
    this.loadSuccessCount = loadSuccessCount;
    this.loadFailureCount = loadFailureCount;
    this.totalLoadTime = totalLoadTime;
    this.refreshCount = refreshCount;
    this.refreshFailureCount = refreshFailureCount;
    this.evictionCount = evictionCount;
  }

  /**
   * Returns a {@code CacheStats} representing the specified statistics.
   *
   * @param hitCount the number of cache hits
   * @param missCount the number of cache misses
   * @param loadSuccessCount the number of successful cache loads
   * @param loadFailureCount the number of failed cache loads
   * @param totalLoadTime the total load and refresh time (success and failure)
   * @param refreshCount the number of proactive refreshes attempted
   * @param refreshFailureCount the number of proactive refreshes that failed
   * @param evictionCount the number of entries evicted from the cache
   * @return a {@code CacheStats} representing the specified statistics
   * @throws IllegalArgumentException if a count is negative or more refreshes failed than ran
   */
  public static CacheStats of(long hitCount, long missCount, long loadSuccessCount,
      long loadFailureCount, long totalLoadTime, long refreshCount, long refreshFailureCount,
      long evictionCount) {
    return new CacheStats(hitCount, missCount, loadSuccessCount, loadFailureCount,
        totalLoadTime, refreshCount, refreshFailureCount, evictionCount);
  }

  /**
   * Returns a statistics instance where no cache events have been recorded.
   *
   * @return an empty statistics instance
   */
  public static CacheStats empty() {
    return EMPTY_STATS;
  }

  /**
   * Returns the number of lookups, defined as {@code hitCount + missCount}.
   *
   * @return the {@code hitCount + missCount}
   */
  public long requestCount() {
    return saturatedAdd(hitCount, missCount);
  }

  /** Returns the number of lookups that returned a value. */
  public long hitCount() {
    return hitCount;
  }

  /**
   * Returns the ratio of lookups that returned a value, or {@code 1.0} if there were no lookups.
   *
   * @return the ratio of lookups that returned a value
   */
  public double hitRate() {
    long requestCount = requestCount();
    return (requestCount == 0) ? 1.0 : (double) hitCount / requestCount;
  }

  /** Returns the number of lookups that returned {@code null}. */
  public long missCount() {
    return missCount;
  }

  /**
   * Returns the ratio of lookups that returned {@code null}, or {@code 0.0} if there were no
   * lookups.
   *
   * @return the ratio of lookups that returned {@code null}
   */
  public double missRate() {
    long requestCount = requestCount();
    return (requestCount == 0) ? 0.0 : (double) missCount / requestCount;
  }

  /** Returns the number of loads that produced a value. */
  public long loadSuccessCount() {
    return loadSuccessCount;
  }

  /** Returns the number of loads that returned no value or threw an exception. */
  public long loadFailureCount() {
    return loadFailureCount;
  }

  /**
   * Returns the total number of loads, defined as {@code loadSuccessCount + loadFailureCount}.
   *
   * @return the {@code loadSuccessCount + loadFailureCount}
   */
  public long loadCount() {
    return saturatedAdd(loadSuccessCount, loadFailureCount);
  }

  /** Returns the total number of nanoseconds spent loading and refreshing values. */
  public long totalLoadTime() {
    return totalLoadTime;
  }

  /**
   * Returns the average number of nanoseconds spent per load or refresh, or {@code 0.0} if there
   * were none.
   *
   * @return the average time spent loading a new value
   */
  public double averageLoadPenalty() {
    long totalCount = saturatedAdd(loadCount(), refreshCount);
    return (totalCount == 0) ? 0.0 : (double) totalLoadTime / totalCount;
  }

  /** Returns the number of proactive refreshes performed by the maintenance task. */
  public long refreshCount() {
    return refreshCount;
  }

  /** Returns the number of proactive refreshes that left the stale value in place. */
  public long refreshFailureCount() {
    return refreshFailureCount;
  }

  /** Returns the number of entries removed for outliving the keep time. */
  public long evictionCount() {
    return evictionCount;
  }

  /**
   * Returns a new {@code CacheStats} representing the difference between this {@code CacheStats}
   * and {@code other}. Negative values, which aren't supported by {@code CacheStats} will be
   * rounded up to zero.
   *
   * @param other the statistics to subtract with
   * @return the difference between this instance and {@code other}
   */
  public CacheStats minus(CacheStats other) {
    long refreshes = Math.max(0L, refreshCount - other.refreshCount);
    return new CacheStats(
        Math.max(0L, hitCount - other.hitCount),
        Math.max(0L, missCount - other.missCount),
        Math.max(0L, loadSuccessCount - other.loadSuccessCount),
        Math.max(0L, loadFailureCount - other.loadFailureCount),
        Math.max(0L, totalLoadTime - other.totalLoadTime),
        refreshes,
        Math.min(refreshes, Math.max(0L, refreshFailureCount - other.refreshFailureCount)),
        Math.max(0L, evictionCount - other.evictionCount));
  }

  /**
   * Returns a new {@code CacheStats} representing the sum of this {@code CacheStats} and
   * {@code other}. Counts that would overflow saturate at {@link Long#MAX_VALUE}.
   *
   * @param other the statistics to add with
   * @return the sum of the statistics
   */
  public CacheStats plus(CacheStats other) {
    return new CacheStats(
        saturatedAdd(hitCount, other.hitCount),
        saturatedAdd(missCount, other.missCount),
        saturatedAdd(loadSuccessCount, other.loadSuccessCount),
        saturatedAdd(loadFailureCount, other.loadFailureCount),
        saturatedAdd(totalLoadTime, other.totalLoadTime),
        saturatedAdd(refreshCount, other.refreshCount),
        saturatedAdd(refreshFailureCount, other.refreshFailureCount),
        saturatedAdd(evictionCount, other.evictionCount));
  }

  /** Returns the sum of two non-negative counts, or {@code Long.MAX_VALUE} if it would overflow. */
  private static long saturatedAdd(long a, long b) {
    long sum = a + b;
    return (sum < 0) ? Long.MAX_VALUE : sum;
  }

  @Override
  public int hashCode() {
    return Objects.hash(hitCount, missCount, loadSuccessCount, loadFailureCount,
        totalLoadTime, refreshCount, refreshFailureCount, evictionCount);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (o == this) {
      return true;
    } else if (!(o instanceof CacheStats)) {
      return false;
    }
    CacheStats other = (CacheStats) o;
    return hitCount == other.hitCount
        && missCount == other.missCount
        && loadSuccessCount == other.loadSuccessCount
        && loadFailureCount == other.loadFailureCount
        && totalLoadTime == other.totalLoadTime
        && refreshCount == other.refreshCount
        && refreshFailureCount == other.refreshFailureCount
        && evictionCount == other.evictionCount;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{'
        + "hitCount=" + hitCount + ", "
        + "missCount=" + missCount + ", "
        + "loadSuccessCount=" + loadSuccessCount + ", "
        + "loadFailureCount=" + loadFailureCount + ", "
        + "totalLoadTime=" + totalLoadTime + ", "
        + "refreshCount=" + refreshCount + ", "
        + "refreshFailureCount=" + refreshFailureCount + ", "
        + "evictionCount=" + evictionCount
        + '}';
  }
}
