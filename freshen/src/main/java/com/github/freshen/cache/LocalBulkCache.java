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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import org.jspecify.annotations.Nullable;

import com.github.freshen.cache.stats.CacheStats;
import com.github.freshen.cache.stats.StatsCounter;

/**
 * A {@link BulkCache} backed by a {@link ConcurrentHashMap} that only the loader's sink writes to.
 * <p>
 * The maintenance task runs its first cycle as soon as the cache is built and then every five
 * sixteenths of the refresh interval. A cycle evicts the entries that outlived the keep time and,
 * once the refresh interval has passed since the start of the last successful run, invokes the
 * loader again. Readers are held at a cache-wide gate until a run succeeds.
 *
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of mapped values
 */
final class LocalBulkCache<K, V> implements BulkCache<K, V> {
  static final Logger logger = System.getLogger(LocalBulkCache.class.getName());

  final ConcurrentHashMap<K, BulkEntry<V>> data;
  final MaintenanceTask maintenance;
  final ReentrantLock evictionLock;
  final StatsCounter statsCounter;
  final BulkLoader<K, V> loader;
  final BulkSink<K, V> sink;
  final ReadyGate ready;
  final Ticker ticker;
  final long refreshNanos;
  final long keepNanos;

  volatile long lastRefreshTime;
  volatile boolean populated;
  volatile boolean closed;

  LocalBulkCache(Freshen<K, V> builder, BulkLoader<K, V> loader) {
    this.data = new ConcurrentHashMap<>(builder.getInitialCapacity());
    this.refreshNanos = builder.getRefreshIntervalNanos();
    this.statsCounter = builder.getStatsCounter();
    this.keepNanos = builder.getKeepTimeNanos();
    this.evictionLock = new ReentrantLock();
    this.loader = requireNonNull(loader);
    this.sink = new LoaderSink();
    this.ticker = builder.getTicker();
    this.ready = new ReadyGate();
    this.maintenance = new MaintenanceTask(builder.getScheduler(), builder.getExecutor(),
        this::cleanUp, (refreshNanos >> 2) + (refreshNanos >> 4));
    maintenance.schedule(0L);
  }

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

    BulkEntry<V> entry = ready.await(timeoutNanos) ? data.get(key) : null;
    if (entry == null) {
      statsCounter.recordMisses(1);
      return null;
    }
    statsCounter.recordHits(1);
    return entry.value;
  }

  @Override
  public boolean isPopulated() {
    return populated;
  }

  @Override
  public void cleanUp() {
    evictionLock.lock();
    try {
      if (closed) {
        return;
      }
      long now = ticker.read();
      expireEntries(now);
      if (!populated || ((now - lastRefreshTime) >= refreshNanos)) {
        reload();
      }
    } finally {
      evictionLock.unlock();
    }
  }

  /** Removes the entries that were written longer ago than the keep time. */
  void expireEntries(long now) {
    if (keepNanos == 0) {
      return;
    }
    List<Map.Entry<K, BulkEntry<V>>> expired = new ArrayList<>();
    for (var entry : data.entrySet()) {
      if ((now - entry.getValue().writeTime) > keepNanos) {
        expired.add(entry);
      }
    }
    for (var entry : expired) {
      if (data.remove(entry.getKey(), entry.getValue())) {
        statsCounter.recordEviction();
      }
    }
  }

  /**
   * Runs the loader, merging its mappings into the cache. Keys that the run omits are left as they
   * were. A successful run records its start time as the last refresh and opens the gate. An
   * interrupted run restores the interrupt status, which the maintenance task clears when the run
   * was on one of its threads.
   */
  void reload() {
    boolean success = false;
    long startTime = ticker.read();
    try {
      success = loader.loadAll(sink);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.WARNING, "Interrupted while loading all entries", e);
    } catch (Exception e) {
      logger.log(Level.WARNING, "Exception thrown when loading all entries", e);
    } finally {
      long loadTime = ticker.read() - startTime;
      if (success && !closed) {
        statsCounter.recordLoadSuccess(loadTime);
        lastRefreshTime = startTime;
        populated = true;
        ready.open();
      } else {
        statsCounter.recordLoadFailure(loadTime);
      }
    }
  }


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
    data.clear();
    ready.open();
  }

  void requireOpen() {
    Freshen.requireState(!closed, "cache has been closed");
  }

  /** Stamps and stores the mappings produced by the loader until the cache is closed. */
  final class LoaderSink implements BulkSink<K, V> {

    @Override
    public void accept(K key, V value) {
      requireNonNull(key);
      requireNonNull(value);
      if (!closed) {
        data.put(key, new BulkEntry<>(value, ticker.read()));
      }
    }

    @Override
    public boolean isCancelled() {
      return closed;
    }
  }

  /** An immutable pairing of a loaded value with the time it was written. */
  static final class BulkEntry<V> {
    final V value;
    final long writeTime;

    BulkEntry(V value, long writeTime) {
      this.value = value;
      this.writeTime = writeTime;
    }
  }
}
