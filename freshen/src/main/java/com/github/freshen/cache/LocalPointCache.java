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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

import org.jspecify.annotations.Nullable;

import com.github.freshen.cache.stats.CacheStats;
import com.github.freshen.cache.stats.StatsCounter;

/**
 * A {@link PointCache} backed by a {@link ConcurrentHashMap} of {@link PointNode} slots.
 * <p>
 * The first reader of an absent key wins the {@code putIfAbsent} race and loads the value on its
 * own thread, while later readers wait on the slot's gate. The maintenance task sweeps the map
 * every quarter of the refresh interval, evicting entries that outlived the keep time and reloading
 * the stale entries that are still being read. A refresh runs on the executor without the sweep
 * waiting for it, and a later sweep cancels it if it has not completed within half of the refresh
 * interval.
 *
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of mapped values
 */
final class LocalPointCache<K, V> implements PointCache<K, V> {
  static final Logger logger = System.getLogger(LocalPointCache.class.getName());

  final ConcurrentHashMap<K, PointNode<V>> data;
  final ConcurrentHashMap<K, RefreshTask> refreshes;
  final PointLoader<? super K, V> loader;
  final MaintenanceTask maintenance;
  final ReentrantLock evictionLock;
  final StatsCounter statsCounter;
  final Executor executor;
  final Ticker ticker;
  final long refreshNanos;
  final long keepNanos;

  volatile boolean closed;

  LocalPointCache(Freshen<K, V> builder, PointLoader<? super K, V> loader) {
    this.data = new ConcurrentHashMap<>(builder.getInitialCapacity());
    this.refreshes = new ConcurrentHashMap<>();
    this.refreshNanos = builder.getRefreshIntervalNanos();
    this.statsCounter = builder.getStatsCounter();
    this.keepNanos = builder.getKeepTimeNanos();
    this.loader = requireNonNull(loader);
    this.executor = builder.getExecutor();
    this.evictionLock = new ReentrantLock();
    this.ticker = builder.getTicker();
    this.maintenance = new MaintenanceTask(builder.getScheduler(),
        executor, this::cleanUp, refreshNanos >> 2);
    maintenance.schedule(refreshNanos >> 2);
  }

  /* --------------- Reads and writes --------------- */

  @Override
  public @Nullable V get(K key) {
    return get(key, Long.MAX_VALUE);
  }

  @Override
  public @Nullable V get(K key, Duration timeout) {
    return get(key, Math.max(0L, Freshen.saturatedToNanos(timeout)));
  }

  @Nullable V get(K key, long timeoutNanos) {
    requireNonNull(key);
    requireOpen();

    PointNode<V> node = data.get(key);
    if (node == null) {
      PointNode<V> candidate = PointNode.pending(ticker.read());
      node = data.putIfAbsent(key, candidate);
      if (node == null) {
        statsCounter.recordMisses(1);
        return load(key, candidate);
      }
    }

    if (!node.ready.await(timeoutNanos)) {
      statsCounter.recordMisses(1);
      return null;
    }
    V value = node.value();
    if (value == null) {
      statsCounter.recordMisses(1);
      return null;
    }
    node.accessTime = ticker.read();
    statsCounter.recordHits(1);
    return value;
  }

  /**
   * Performs the first load of a newly inserted slot. The slot's gate is opened on every exit path
   * so that waiting readers are never stranded, and the slot is left in the failed state unless a
   * value was produced.
   */
  @Nullable V load(K key, PointNode<V> node) {
    boolean success = false;
    long startTime = ticker.read();
    try {
      V value = loader.load(key);
      if (value != null) {
        node.setLoaded(value, ticker.read());
        success = true;
      }
      return value;
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CompletionException(e);
    } catch (Exception e) {
      throw new CompletionException(e);
    } finally {
      long loadTime = ticker.read() - startTime;
      if (success) {
        statsCounter.recordLoadSuccess(loadTime);
      } else {
        statsCounter.recordLoadFailure(loadTime);
      }
      node.ready.open();
    }
  }

  @Override
  public void put(K key, V value) {
    requireNonNull(key);
    requireNonNull(value);
    requireOpen();
    data.put(key, PointNode.loaded(value, ticker.read()));
  }

  /* --------------- Maintenance --------------- */

  @Override
  public void cleanUp() {
    evictionLock.lock();
    try {
      if (!closed) {
        sweep();
      }
    } finally {
      evictionLock.unlock();
    }
  }

  /** Classifies every entry by age and use, refreshing the hot ones and evicting the expired. */
  void sweep() {
    long now = ticker.read();
    expireRefreshes(now);

    long recentNanos = refreshNanos >> 1;
    List<Map.Entry<K, PointNode<V>>> expired = new ArrayList<>();
    for (var entry : data.entrySet()) {
      PointNode<V> node = entry.getValue();
      long age = now - node.snapshot.writeTime;
      if ((keepNanos > 0) && (age > keepNanos)) {
        expired.add(entry);
      } else if ((age < refreshNanos) || node.isUnreadSinceWrite()) {
        continue;
      } else if ((now - node.accessTime) < recentNanos) {
        refresh(entry.getKey(), node, now);
      }
    }
    for (var entry : expired) {
      if (data.remove(entry.getKey(), entry.getValue())) {
        statsCounter.recordEviction();
      }
    }
  }

  /**
   * Submits a reload of the entry to the executor, unless one is already in flight. The sweep does
   * not wait for it; the outcome is applied by {@link RefreshTask#done()}.
   */
  void refresh(K key, PointNode<V> node, long now) {
    var task = new RefreshTask(key, node, now, () -> loader.load(key));
    if (refreshes.putIfAbsent(key, task) != null) {
      return;
    }
    try {
      executor.execute(task);
    } catch (RejectedExecutionException e) {
      refreshes.remove(key, task);
      logger.log(Level.WARNING, "Exception thrown when submitting refresh task", e);
      statsCounter.recordRefresh(ticker.read() - now, /* success= */ false);
    }
  }

  /** Cancels the in-flight refreshes that have run for longer than half of the refresh interval. */
  void expireRefreshes(long now) {
    long timeoutNanos = Math.max(1L, refreshNanos >> 1);
    for (var task : refreshes.values()) {
      long elapsed = now - task.startTime;
      if ((elapsed >= timeoutNanos) && task.cancel(/* mayInterruptIfRunning= */ true)) {
        logger.log(Level.WARNING, "Refresh of {0} did not complete within {1} ns; serving the "
            + "previous value", task.key, timeoutNanos);
        statsCounter.recordRefresh(elapsed, /* success= */ false);
      }
    }
  }

  /* --------------- Lifecycle --------------- */

  @Override
  public long estimatedSize() {
    return data.mappingCount();
  }

  @Override
  public CacheStats stats() {
    return statsCounter.snapshot();
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    maintenance.cancel();
    for (var task : refreshes.values()) {
      task.cancel(/* mayInterruptIfRunning= */ true);
    }
    refreshes.clear();
    data.clear();
  }

  void requireOpen() {
    Freshen.requireState(!closed, "cache has been closed");
  }

  /** A reload of a single entry, which replaces the entry's value when it completes. */
  final class RefreshTask extends FutureTask<@Nullable V> {
    final PointNode<V> node;
    final long startTime;
    final K key;

    RefreshTask(K key, PointNode<V> node, long startTime, Callable<@Nullable V> reload) {
      super(reload);
      this.key = key;
      this.node = node;
      this.startTime = startTime;
    }

    @Override
    protected void done() {
      refreshes.remove(key, this);
      if (isCancelled()) {
        return;
      }
      boolean success = false;
      try {
        V value = get();
        if (value != null) {
          node.setRefreshed(value, ticker.read());
          success = true;
        }
      } catch (ExecutionException e) {
        logger.log(Level.WARNING, "Exception thrown during refresh", e.getCause());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } finally {
        statsCounter.recordRefresh(ticker.read() - startTime, success);
      }
    }
  }
}
