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

import static java.util.Objects.requireNonNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;

import com.github.freshen.cache.stats.ConcurrentStatsCounter;
import com.github.freshen.cache.stats.StatsCounter;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.FormatMethod;

/**
 * A builder of {@link PointCache} and {@link BulkCache} instances.
 * <p>
 * Both kinds of cache keep their entries fresh by re-invoking the loader in the background, rather
 * than discarding entries when they expire. The {@linkplain #refreshInterval refresh interval} is
 * the target staleness window and must be specified; the {@linkplain #keepTime keep time} is an
 * optional hard ceiling on an entry's age, after which it is evicted regardless of use.
 * <p>
 * Usage example:
 * <pre>{@code
 *   PointCache<Key, Graph> graphs = Freshen.newBuilder()
 *       .refreshInterval(Duration.ofMinutes(1))
 *       .keepTime(Duration.ofHours(1))
 *       .recordStats()
 *       .build(key -> createExpensiveGraph(key));
 * }</pre>
 * <p>
 * Each cache owns a maintenance task that is submitted to the {@linkplain #executor executor}
 * through the {@linkplain #scheduler scheduler}, and that runs until the cache is
 * {@linkplain RefreshingCache#close() closed}. The returned caches are backed by a
 * {@link java.util.concurrent.ConcurrentHashMap} and are safe for use by any number of threads.
 *
 * @param <K> the most general key type this builder will be able to create caches for. This is
 *     normally {@code Object} unless it is constrained by using a method like {@code #build}
 * @param <V> the most general value type this builder will be able to create caches for
 */
public final class Freshen<K, V> {
  static final Logger logger = System.getLogger(Freshen.class.getName());
  static final Supplier<StatsCounter> ENABLED_STATS_COUNTER_SUPPLIER = ConcurrentStatsCounter::new;

  static final int UNSET_INT = -1;
  static final int DEFAULT_INITIAL_CAPACITY = 16;

  int initialCapacity = UNSET_INT;
  long refreshIntervalNanos = UNSET_INT;
  long keepTimeNanos = UNSET_INT;

  @Nullable Supplier<StatsCounter> statsCounterSupplier;
  @Nullable Scheduler scheduler;
  @Nullable Executor executor;
  @Nullable Ticker ticker;

  private Freshen() {}

  /** Ensures that the argument expression is true. */
  @FormatMethod
  static void requireArgument(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalArgumentException(String.format(template, args));
    }
  }

  /** Ensures that the state expression is true. */
  @FormatMethod
  static void requireState(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalStateException(String.format(template, args));
    }
  }

  /**
   * Constructs a new {@code Freshen} instance with default settings, meaning no keep time, the
   * system ticker, the common pool, and the system-wide scheduling thread.
   * <p>
   * Note that while this return type is {@code Freshen<Object, Object>}, type parameters on the
   * {@link #build} methods allow you to create a cache of any key and value type desired.
   *
   * @return a new instance with default settings
   */
  @CheckReturnValue
  public static Freshen<Object, Object> newBuilder() {
    return new Freshen<>();
  }

  /**
   * Constructs a new {@code Freshen} instance with the settings specified in {@code spec}.
   *
   * @param spec the specification to build from
   * @return a new instance with the specification's settings
   */
  @CheckReturnValue
  public static Freshen<Object, Object> from(FreshenSpec spec) {
    return spec.toBuilder();
  }

  /**
   * Constructs a new {@code Freshen} instance with the settings specified in {@code spec}.
   *
   * @param spec a String in the format specified by {@link FreshenSpec}
   * @return a new instance with the specification's settings
   */
  @CheckReturnValue
  public static Freshen<Object, Object> from(String spec) {
    return from(FreshenSpec.parse(spec));
  }

  /**
   * Sets the minimum total size for the internal map. Providing a large enough estimate at
   * construction time avoids the need for expensive resizing operations later, but setting this
   * value unnecessarily high wastes memory.
   *
   * @param initialCapacity minimum total size for the internal data structures
   * @return this {@code Freshen} instance (for chaining)
   * @throws IllegalArgumentException if {@code initialCapacity} is negative
   * @throws IllegalStateException if an initial capacity was already set
   */
  @CanIgnoreReturnValue
  public Freshen<K, V> initialCapacity(int initialCapacity) {
    requireState(this.initialCapacity == UNSET_INT,
        "initial capacity was already set to %s", this.initialCapacity);
    requireArgument(initialCapacity >= 0,
        "initial capacity must not be negative: %s", initialCapacity);
    this.initialCapacity = initialCapacity;
    return this;
  }

  int getInitialCapacity() {
    return (initialCapacity == UNSET_INT) ? DEFAULT_INITIAL_CAPACITY : initialCapacity;
  }

  /**
   * Specifies the target staleness window. An entry younger than this is never reloaded; an older
   * one is reloaded by the maintenance task if it is still being read (a {@link PointCache}), or on
   * the next loader run (a {@link BulkCache}). The interval also sets the maintenance cadence: a
   * point cache sweeps every quarter interval, and a bulk cache every five sixteenths.
   *
   * @param duration the length of time after an entry is written that it should be considered
   *     stale, and thus eligible for refresh
   * @return this {@code Freshen} instance (for chaining)
   * @throws IllegalArgumentException if {@code duration} is zero or negative
   * @throws IllegalStateException if the refresh interval was already set
   */
  @CanIgnoreReturnValue
  public Freshen<K, V> refreshInterval(Duration duration) {
    return refreshInterval(saturatedToNanos(duration), TimeUnit.NANOSECONDS);
  }

  /**
   * Specifies the target staleness window. See {@link #refreshInterval(Duration)}, which should be
   * preferred when feasible.
   *
   * @param duration the length of time after an entry is written that it should be considered
   *     stale, and thus eligible for refresh
   * @param unit the unit that {@code duration} is expressed in
   * @return this {@code Freshen} instance (for chaining)
   * @throws IllegalArgumentException if {@code duration} is zero or negative
   * @throws IllegalStateException if the refresh interval was already set
   */
  @CanIgnoreReturnValue
  public Freshen<K, V> refreshInterval(long duration, TimeUnit unit) {
    requireNonNull(unit);
    requireState(refreshIntervalNanos == UNSET_INT,
        "refresh interval was already set to %s ns", refreshIntervalNanos);
    requireArgument(duration > 0, "duration must be positive: %s %s", duration, unit);
    this.refreshIntervalNanos = unit.toNanos(duration);
    return this;
  }

  long getRefreshIntervalNanos() {
    return refreshIntervalNanos;
  }

  /**
   * Specifies that each entry should be automatically removed from the cache once this duration has
   * elapsed after it was last written, whether or not it is being read. A duration of zero, which
   * is the default, disables this eviction. To be meaningful the keep time should be no shorter
   * than the refresh interval, otherwise entries are evicted before they are ever refreshed.
   *
   * @param duration the length of time after an entry is written that it should be evicted
   * @return this {@code Freshen} instance (for chaining)
   * @throws IllegalArgumentException if {@code duration} is negative
   * @throws IllegalStateException if the keep time was already set
   */
  @CanIgnoreReturnValue
  public Freshen<K, V> keepTime(Duration duration) {
    return keepTime(saturatedToNanos(duration), TimeUnit.NANOSECONDS);
  }

  /**
   * Specifies the age at which entries are evicted. See {@link #keepTime(Duration)}, which should
   * be preferred when feasible.
   *
   * @param duration the length of time after an entry is written that it should be evicted
   * @param unit the unit that {@code duration} is expressed in
   * @return this {@code Freshen} instance (for chaining)
   * @throws IllegalArgumentException if {@code duration} is negative
   * @throws IllegalStateException if the keep time was already set
   */
  @CanIgnoreReturnValue
  public Freshen<K, V> keepTime(long duration, TimeUnit unit) {
    requireNonNull(unit);
    requireState(keepTimeNanos == UNSET_INT,
        "keep time was already set to %s ns", keepTimeNanos);
    requireArgument(duration >= 0, "duration cannot be negative: %s %s", duration, unit);
    this.keepTimeNanos = unit.toNanos(duration);
    return this;
  }

  long getKeepTimeNanos() {
    return (keepTimeNanos == UNSET_INT) ? 0L : keepTimeNanos;
  }

  /**
   * Specifies the executor to use when running the maintenance task and when performing a
   * proactive refresh. By default, {@link ForkJoinPool#commonPool()} is used.
   * <p>
   * The primary intent of this method is to facilitate testing of caches by executing tasks
   * directly on the same thread.
   *
   * @param executor the executor to use for asynchronous execution
   * @return this {@code Freshen} instance (for chaining)
   * @throws NullPointerException if the specified executor is null
   * @throws IllegalStateException if an executor was already set
   */
  @CanIgnoreReturnValue
  public Freshen<K, V> executor(Executor executor) {
    requireState(this.executor == null, "executor was already set to %s", this.executor);
    this.executor = requireNonNull(executor);
    return this;
  }

  Executor getExecutor() {
    return (executor == null) ? ForkJoinPool.commonPool() : executor;
  }

  /**
   * Specifies the scheduler that arms each maintenance cycle. By default,
   * {@link Scheduler#systemScheduler()} is used. A cache built with
   * {@link Scheduler#disabledScheduler()} performs maintenance only when
   * {@link RefreshingCache#cleanUp()} is called.
   *
   * @param scheduler the scheduler that submits each maintenance cycle to the
   *        {@link #executor(Executor)} after a given delay
   * @return this {@code Freshen} instance (for chaining)
   * @throws NullPointerException if the specified scheduler is null
   * @throws IllegalStateException if a scheduler was already set
   */
  @CanIgnoreReturnValue
  public Freshen<K, V> scheduler(Scheduler scheduler) {
    requireState(this.scheduler == null, "scheduler was already set to %s", this.scheduler);
    this.scheduler = requireNonNull(scheduler);
    return this;
  }

  Scheduler getScheduler() {
    return (scheduler == null) ? Scheduler.systemScheduler() : scheduler;
  }

  /**
   * Specifies a nanosecond-precision time source for use in determining when entries should be
   * refreshed or evicted. By default, {@link System#nanoTime} is used.
   * <p>
   * The primary intent of this method is to facilitate testing of caches with a fake time source.
   *
   * @param ticker a nanosecond-precision time source
   * @return this {@code Freshen} instance (for chaining)
   * @throws IllegalStateException if a ticker was already set
   * @throws NullPointerException if the specified ticker is null
   */
  @CanIgnoreReturnValue
  public Freshen<K, V> ticker(Ticker ticker) {
    requireState(this.ticker == null, "Ticker was already set to %s", this.ticker);
    this.ticker = requireNonNull(ticker);
    return this;
  }

  Ticker getTicker() {
    return (ticker == null) ? Ticker.systemTicker() : ticker;
  }

  /**
   * Enables the accumulation of {@link com.github.freshen.cache.stats.CacheStats} during the
   * operation of the cache. Without this {@link RefreshingCache#stats} will return zero for all
   * statistics. Note that recording statistics requires bookkeeping to be performed with each
   * operation, and thus imposes a performance penalty on cache operation.
   *
   * @return this {@code Freshen} instance (for chaining)
   * @throws IllegalStateException if statistics recording was already enabled
   */
  @CanIgnoreReturnValue
  public Freshen<K, V> recordStats() {
    requireState(this.statsCounterSupplier == null, "Statistics recording was already set");
    statsCounterSupplier = ENABLED_STATS_COUNTER_SUPPLIER;
    return this;
  }

  /**
   * Enables the accumulation of {@link com.github.freshen.cache.stats.CacheStats} during the
   * operation of the cache, using a {@link StatsCounter} created by the supplier for each cache.
   *
   * @param statsCounterSupplier a supplier instance that returns a new {@link StatsCounter}
   * @return this {@code Freshen} instance (for chaining)
   * @throws IllegalStateException if statistics recording was already enabled
   * @throws NullPointerException if the supplier is null
   */
  @CanIgnoreReturnValue
  public Freshen<K, V> recordStats(Supplier<? extends StatsCounter> statsCounterSupplier) {
    requireState(this.statsCounterSupplier == null, "Statistics recording was already set");
    requireNonNull(statsCounterSupplier);
    this.statsCounterSupplier = () -> requireNonNull(statsCounterSupplier.get());
    return this;
  }

  boolean isRecordingStats() {
    return (statsCounterSupplier != null);
  }

  StatsCounter getStatsCounter() {
    return (statsCounterSupplier == null)
        ? StatsCounter.disabledStatsCounter()
        : statsCounterSupplier.get();
  }

  /**
   * Builds a cache which lazily loads each requested key with the supplied {@code PointLoader}. If
   * another thread is currently loading the value for a key, a request simply waits for that thread
   * to finish and shares its result. The maintenance task starts immediately.
   * <p>
   * This method does not alter the state of this {@code Freshen} instance, so it can be invoked
   * again to create multiple independent caches.
   *
   * @param loader the loader used to obtain new values
   * @param <K1> the key type of the loader
   * @param <V1> the value type of the loader
   * @return a cache having the requested features
   * @throws IllegalStateException if the refresh interval was not set
   */
  @CheckReturnValue
  public <K1 extends K, V1 extends V> PointCache<K1, V1> build(
      PointLoader<? super K1, V1> loader) {
    requireNonNull(loader);
    requireRefreshInterval();

    @SuppressWarnings("unchecked")
    Freshen<K1, V1> self = (Freshen<K1, V1>) this;
    return new LocalPointCache<>(self, loader);
  }

  /**
   * Builds a cache which is populated by repeated runs of the supplied {@code BulkLoader}. The
   * first run is submitted immediately; lookups block until a run succeeds.
   * <p>
   * This method does not alter the state of this {@code Freshen} instance, so it can be invoked
   * again to create multiple independent caches.
   *
   * @param loader the loader used to obtain all of the mappings
   * @param <K1> the key type of the loader
   * @param <V1> the value type of the loader
   * @return a cache having the requested features
   * @throws IllegalStateException if the refresh interval was not set
   */
  @CheckReturnValue
  public <K1 extends K, V1 extends V> BulkCache<K1, V1> buildBulk(BulkLoader<K1, V1> loader) {
    requireNonNull(loader);
    requireRefreshInterval();

    @SuppressWarnings("unchecked")
    Freshen<K1, V1> self = (Freshen<K1, V1>) this;
    return new LocalBulkCache<>(self, loader);
  }

  void requireRefreshInterval() {
    requireState(refreshIntervalNanos != UNSET_INT, "refreshInterval must be specified");
    long keepTime = getKeepTimeNanos();
    if ((keepTime > 0) && (keepTime < refreshIntervalNanos)) {
      logger.log(Level.WARNING, "keepTime ({0} ns) is shorter than refreshInterval ({1} ns); "
          + "entries will be evicted before they are refreshed", keepTime, refreshIntervalNanos);
    }
  }

  /**
   * Returns the number of nanoseconds of the given duration without throwing or overflowing.
   * <p>
   * Instead of throwing {@link ArithmeticException}, this method silently saturates to either
   * {@link Long#MAX_VALUE} or {@link Long#MIN_VALUE}.
   */
  static long saturatedToNanos(Duration duration) {
    // Using a try/catch seems lazy, but the catch block will rarely get invoked (except for
    // durations longer than approximately +/- 292 years).
    try {
      return duration.toNanos();
    } catch (ArithmeticException tooBig) {
      return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
    }
  }

  /**
   * Returns a string representation for this Freshen instance. The exact form of the returned
   * string is not specified.
   */
  @Override
  public String toString() {
    StringBuilder s = new StringBuilder(64);
    s.append(getClass().getSimpleName()).append('{');
    int baseLength = s.length();
    if (initialCapacity != UNSET_INT) {
      s.append("initialCapacity=").append(initialCapacity).append(", ");
    }
    if (refreshIntervalNanos != UNSET_INT) {
      s.append("refreshInterval=").append(refreshIntervalNanos).append("ns, ");
    }
    if (keepTimeNanos != UNSET_INT) {
      s.append("keepTime=").append(keepTimeNanos).append("ns, ");
    }
    if (statsCounterSupplier != null) {
      s.append("recordStats, ");
    }
    if (s.length() > baseLength) {
      s.setLength(s.length() - 2);
    }
    return s.append('}').toString();
  }
}
