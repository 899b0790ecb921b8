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

import static com.github.freshen.testing.Awaits.await;
import static com.github.freshen.testing.ConcurrentTestHarness.scheduledExecutor;
import static com.github.freshen.testing.LoggingEvents.logEvents;
import static com.google.common.truth.Truth.assertThat;
import static org.slf4j.event.Level.WARN;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.expectThrows;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.jspecify.annotations.Nullable;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.github.freshen.testing.ConcurrentTestHarness;
import com.github.valfirst.slf4jtest.TestLoggerFactory;
import com.google.common.testing.FakeTicker;
import com.google.common.util.concurrent.Uninterruptibles;

/**
 * The tests for the lazily loaded, per-key cache. Unless a test needs the background task, the
 * cache is built with a disabled scheduler, a same-thread executor and a fake ticker, and its
 * maintenance is driven by calling {@code cleanUp()}.
 */
@Test(singleThreaded = true)
public final class PointCacheTest {
  static final Duration REFRESH = Duration.ofMinutes(1);

  @Nullable PointCache<String, Integer> cache;
  AtomicInteger loads;
  FakeTicker ticker;

  @BeforeMethod
  public void beforeMethod() {
    TestLoggerFactory.clear();
    loads = new AtomicInteger();
    ticker = new FakeTicker();
  }

  @AfterMethod(alwaysRun = true)
  public void afterMethod() {
    if (cache != null) {
      cache.close();
      cache = null;
    }
  }

  /* --------------- get --------------- */

  @Test
  public void get_lazy() {
    var cache = newCache(lengthLoader());
    cache.cleanUp();

    assertThat(loads.get()).isEqualTo(0);
    assertThat(cache.estimatedSize()).isEqualTo(0);
    assertThat(cache.stats().requestCount()).isEqualTo(0);
  }

  @Test
  public void get_sequential() {
    var cache = track(builder()
        .refreshInterval(Duration.ofSeconds(3))
        .keepTime(Duration.ofHours(1))
        .build(lengthLoader()));

    assertThat(cache.get("one")).isEqualTo(3);
    assertThat(cache.get("one")).isEqualTo(3);
    assertThat(loads.get()).isEqualTo(1);

    var stats = cache.stats();
    assertThat(stats.missCount()).isEqualTo(1);
    assertThat(stats.hitCount()).isEqualTo(1);
    assertThat(stats.loadSuccessCount()).isEqualTo(1);
  }

  @Test
  public void get_stale() {
    var cache = track(builder()
        .refreshInterval(Duration.ofSeconds(3))
        .keepTime(Duration.ofHours(1))
        .build(lengthLoader()));
    assertThat(cache.get("one")).isEqualTo(3);
    assertThat(cache.get("one")).isEqualTo(3);

    for (int i = 0; i < 7; i++) {
      ticker.advance(Duration.ofMillis(750));
      cache.cleanUp();
    }
    assertThat(cache.get("one")).isEqualTo(3);
    assertThat(cache.stats().missCount()).isEqualTo(1);
  }

  @Test
  public void get_coalesces() {
    var cache = newCache(key -> {
      loads.incrementAndGet();
      Uninterruptibles.sleepUninterruptibly(Duration.ofMillis(50));
      return key.length();
    });

    var results = ConcurrentTestHarness.race(10, () -> cache.get("abc"));
    assertThat(results).hasSize(10);
    assertThat(results).containsNoneOf(null, 0);
    assertThat(results.stream().distinct().count()).isEqualTo(1);
    assertThat(results.get(0)).isEqualTo(3);
    assertThat(loads.get()).isEqualTo(1);
  }

  @Test
  public void get_timeout() {
    var release = new CountDownLatch(1);
    var cache = newCache(key -> {
      loads.incrementAndGet();
      release.await();
      return key.length();
    });
    var result = new AtomicReference<Integer>();
    ConcurrentTestHarness.execute(() -> result.set(cache.get("abc")));
    await().until(() -> cache.estimatedSize() == 1);

    assertThat(cache.get("abc", Duration.ofMillis(10))).isNull();
    assertThat(cache.get("abc", Duration.ZERO)).isNull();
    assertThat(cache.get("abc", Duration.ofSeconds(-1))).isNull();

    release.countDown();
    await().until(() -> result.get() != null);
    assertThat(result.get()).isEqualTo(3);
    assertThat(cache.get("abc", Duration.ZERO)).isEqualTo(3);
    assertThat(loads.get()).isEqualTo(1);
  }

  @Test
  public void get_interrupted() {
    var release = new CountDownLatch(1);
    var cache = newCache(key -> {
      release.await();
      return key.length();
    });
    ConcurrentTestHarness.execute(() -> cache.get("abc"));
    await().until(() -> cache.estimatedSize() == 1);

    Thread.currentThread().interrupt();
    assertThat(cache.get("abc")).isNull();
    assertThat(Thread.interrupted()).isTrue();
    release.countDown();
  }

  @Test
  public void get_waiterSeesFailure() {
    var release = new CountDownLatch(1);
    var cache = newCache(key -> {
      loads.incrementAndGet();
      release.await();
      return null;
    });
    ConcurrentTestHarness.execute(() -> cache.get("abc"));
    await().until(() -> cache.estimatedSize() == 1);

    var done = new AtomicBoolean();
    var result = new AtomicReference<Integer>(-1);
    ConcurrentTestHarness.execute(() -> {
      result.set(cache.get("abc"));
      done.set(true);
    });
    release.countDown();

    await().untilTrue(done);
    assertThat(result.get()).isNull();
    assertThat(loads.get()).isEqualTo(1);
  }

  @Test
  public void get_loaderReturnsNull() {
    var cache = newCache(key -> {
      loads.incrementAndGet();
      return null;
    });
    assertThat(cache.get("a")).isNull();
    assertThat(cache.get("a")).isNull();
    assertThat(loads.get()).isEqualTo(1);
    assertThat(cache.estimatedSize()).isEqualTo(1);

    var stats = cache.stats();
    assertThat(stats.loadFailureCount()).isEqualTo(1);
    assertThat(stats.missCount()).isEqualTo(2);
  }

  @Test
  public void get_loaderThrows_unchecked() {
    var expected = new IllegalStateException();
    var cache = newCache(key -> {
      loads.incrementAndGet();
      throw expected;
    });

    var e = expectThrows(IllegalStateException.class, () -> cache.get("a"));
    assertThat(e).isSameInstanceAs(expected);
    assertThat(cache.get("a")).isNull();
    assertThat(loads.get()).isEqualTo(1);
    assertThat(cache.stats().loadFailureCount()).isEqualTo(1);
  }

  @Test
  public void get_loaderThrows_checked() {
    var expected = new IOException();
    var cache = newCache(key -> { throw expected; });

    var e = expectThrows(CompletionException.class, () -> cache.get("a"));
    assertThat(e).hasCauseThat().isSameInstanceAs(expected);
    assertThat(cache.get("a")).isNull();
  }

  @Test
  public void get_loaderThrows_interrupted() {
    var cache = newCache(key -> { throw new InterruptedException(); });

    var e = expectThrows(CompletionException.class, () -> cache.get("a"));
    assertThat(e).hasCauseThat().isInstanceOf(InterruptedException.class);
    assertThat(Thread.interrupted()).isTrue();
  }

  @Test
  public void get_null() {
    var cache = newCache(lengthLoader());
    assertThrows(NullPointerException.class, () -> cache.get(null));
    assertThrows(NullPointerException.class, () -> cache.get(null, Duration.ZERO));
    assertThrows(NullPointerException.class, () -> cache.get("a", null));
    assertThat(loads.get()).isEqualTo(0);
  }

  /* --------------- put --------------- */

  @Test
  public void put() {
    var cache = newCache(lengthLoader());
    cache.put("a", 7);

    assertThat(cache.get("a", Duration.ZERO)).isEqualTo(7);
    assertThat(loads.get()).isEqualTo(0);
    assertThat(cache.stats().hitCount()).isEqualTo(1);
  }

  @Test
  public void put_replacesFailed() {
    var cache = newCache(key -> null);
    assertThat(cache.get("a")).isNull();

    cache.put("a", 7);
    assertThat(cache.get("a")).isEqualTo(7);
  }

  @Test
  public void put_whileLoading() {
    var release = new CountDownLatch(1);
    var cache = newCache(key -> {
      release.await();
      return key.length();
    });
    var result = new AtomicReference<Integer>();
    ConcurrentTestHarness.execute(() -> result.set(cache.get("abc")));
    await().until(() -> cache.estimatedSize() == 1);

    cache.put("abc", 7);
    assertThat(cache.get("abc", Duration.ZERO)).isEqualTo(7);

    release.countDown();
    await().until(() -> result.get() != null);
    assertThat(result.get()).isEqualTo(3);
    assertThat(cache.get("abc")).isEqualTo(7);
  }

  @Test
  public void put_null() {
    var cache = newCache(lengthLoader());
    assertThrows(NullPointerException.class, () -> cache.put(null, 1));
    assertThrows(NullPointerException.class, () -> cache.put("a", null));
  }

  /* --------------- refresh --------------- */

  @Test
  public void refresh_fresh() {
    var cache = newCache(key -> loads.incrementAndGet());
    assertThat(cache.get("a")).isEqualTo(1);

    ticker.advance(Duration.ofSeconds(59));
    assertThat(cache.get("a")).isEqualTo(1);
    cache.cleanUp();

    assertThat(loads.get()).isEqualTo(1);
    assertThat(cache.stats().refreshCount()).isEqualTo(0);
  }

  @Test
  public void refresh_hot() {
    var cache = newCache(key -> loads.incrementAndGet());
    assertThat(cache.get("a")).isEqualTo(1);

    ticker.advance(Duration.ofSeconds(61));
    assertThat(cache.get("a")).isEqualTo(1);
    cache.cleanUp();

    assertThat(loads.get()).isEqualTo(2);
    assertThat(cache.get("a")).isEqualTo(2);
    assertThat(cache.stats().refreshCount()).isEqualTo(1);
    assertThat(cache.stats().refreshFailureCount()).isEqualTo(0);
  }

  @Test
  public void refresh_recentlyRead() {
    var cache = newCache(key -> loads.incrementAndGet());
    assertThat(cache.get("a")).isEqualTo(1);

    ticker.advance(Duration.ofSeconds(45));
    assertThat(cache.get("a")).isEqualTo(1);
    ticker.advance(Duration.ofSeconds(16));
    cache.cleanUp();

    assertThat(loads.get()).isEqualTo(2);
  }

  @Test
  public void refresh_cold() {
    var cache = newCache(key -> loads.incrementAndGet());
    assertThat(cache.get("a")).isEqualTo(1);

    ticker.advance(Duration.ofSeconds(61));
    cache.cleanUp();

    assertThat(loads.get()).isEqualTo(1);
    assertThat(cache.get("a")).isEqualTo(1);
  }

  @Test
  public void refresh_unreadSinceRefresh() {
    var cache = newCache(key -> loads.incrementAndGet());
    assertThat(cache.get("a")).isEqualTo(1);
    ticker.advance(Duration.ofSeconds(45));
    assertThat(cache.get("a")).isEqualTo(1);
    ticker.advance(Duration.ofSeconds(16));
    cache.cleanUp();
    assertThat(loads.get()).isEqualTo(2);

    ticker.advance(Duration.ofSeconds(61));
    cache.cleanUp();
    assertThat(loads.get()).isEqualTo(2);
  }

  @Test
  public void refresh_failedSlot() {
    var cache = newCache(key -> {
      loads.incrementAndGet();
      return null;
    });
    assertThat(cache.get("a")).isNull();

    ticker.advance(Duration.ofSeconds(61));
    cache.cleanUp();
    assertThat(loads.get()).isEqualTo(1);
  }

  @Test
  public void refresh_nullValue() {
    var cache = newCache(key -> (loads.incrementAndGet() == 1) ? 1 : null);
    assertThat(cache.get("a")).isEqualTo(1);
    ticker.advance(Duration.ofSeconds(61));
    assertThat(cache.get("a")).isEqualTo(1);
    cache.cleanUp();

    assertThat(loads.get()).isEqualTo(2);
    assertThat(cache.get("a")).isEqualTo(1);
    assertThat(cache.stats().refreshFailureCount()).isEqualTo(1);
  }

  @Test
  public void refresh_exception() {
    var expected = new IllegalStateException();
    var cache = newCache(key -> {
      if (loads.incrementAndGet() == 1) {
        return 1;
      }
      throw expected;
    });
    assertThat(cache.get("a")).isEqualTo(1);
    ticker.advance(Duration.ofSeconds(61));
    assertThat(cache.get("a")).isEqualTo(1);
    cache.cleanUp();

    assertThat(cache.get("a")).isEqualTo(1);
    assertThat(cache.stats().refreshFailureCount()).isEqualTo(1);
    assertThat(logEvents()
        .withMessage("Exception thrown during refresh")
        .withThrowable(expected)
        .withLevel(WARN))
        .hasSize(1);
  }

  @Test
  public void refresh_doesNotWait() {
    List<Runnable> submitted = new ArrayList<>();
    var cache = track(Freshen.newBuilder()
        .refreshInterval(REFRESH)
        .scheduler(Scheduler.disabledScheduler())
        .executor(submitted::add)
        .ticker(ticker::read)
        .recordStats()
        .build(key -> loads.incrementAndGet()));
    assertThat(cache.get("a")).isEqualTo(1);
    ticker.advance(Duration.ofSeconds(61));
    assertThat(cache.get("a")).isEqualTo(1);

    cache.cleanUp();
    assertThat(submitted).hasSize(1);
    assertThat(loads.get()).isEqualTo(1);
    assertThat(cache.get("a")).isEqualTo(1);

    submitted.get(0).run();
    assertThat(loads.get()).isEqualTo(2);
    assertThat(cache.get("a")).isEqualTo(2);
    assertThat(cache.stats().refreshCount()).isEqualTo(1);
  }

  @Test
  public void refresh_inFlight() {
    List<Runnable> submitted = new ArrayList<>();
    var cache = track(Freshen.newBuilder()
        .refreshInterval(REFRESH)
        .scheduler(Scheduler.disabledScheduler())
        .executor(submitted::add)
        .ticker(ticker::read)
        .build(lengthLoader()));
    cache.put("abc", 9);
    ticker.advance(Duration.ofSeconds(61));
    assertThat(cache.get("abc")).isEqualTo(9);

    cache.cleanUp();
    ticker.advance(Duration.ofSeconds(1));
    assertThat(cache.get("abc")).isEqualTo(9);
    cache.cleanUp();
    assertThat(submitted).hasSize(1);
  }

  @Test
  public void refresh_timeout() {
    List<Runnable> submitted = new ArrayList<>();
    var cache = track(Freshen.newBuilder()
        .refreshInterval(REFRESH)
        .scheduler(Scheduler.disabledScheduler())
        .executor(submitted::add)
        .ticker(ticker::read)
        .recordStats()
        .build(lengthLoader()));
    cache.put("abc", 9);
    ticker.advance(Duration.ofSeconds(61));
    assertThat(cache.get("abc")).isEqualTo(9);
    cache.cleanUp();
    assertThat(cache.stats().refreshFailureCount()).isEqualTo(0);

    ticker.advance(Duration.ofSeconds(30));
    cache.cleanUp();

    var task = (Future<?>) submitted.get(0);
    assertThat(task.isCancelled()).isTrue();
    assertThat(cache.get("abc")).isEqualTo(9);
    assertThat(loads.get()).isEqualTo(0);
    assertThat(cache.stats().refreshFailureCount()).isEqualTo(1);
    assertThat(logEvents()
        .withMessageContaining("did not complete")
        .withLevel(WARN))
        .hasSize(1);

    submitted.get(0).run();
    assertThat(loads.get()).isEqualTo(0);
    assertThat(cache.get("abc")).isEqualTo(9);
  }

  @Test
  public void refresh_rejected() {
    var cache = track(Freshen.newBuilder()
        .refreshInterval(REFRESH)
        .scheduler(Scheduler.disabledScheduler())
        .executor(task -> { throw new RejectedExecutionException(); })
        .ticker(ticker::read)
        .build(lengthLoader()));
    cache.put("abc", 9);
    ticker.advance(Duration.ofSeconds(61));
    assertThat(cache.get("abc")).isEqualTo(9);
    cache.cleanUp();

    assertThat(cache.get("abc")).isEqualTo(9);
    assertThat(logEvents()
        .withMessage("Exception thrown when submitting refresh task")
        .withThrowable(RejectedExecutionException.class)
        .withLevel(WARN))
        .hasSize(1);
  }

  /* --------------- evict --------------- */

  @Test
  public void evict_keepTime() {
    var cache = track(builder()
        .refreshInterval(Duration.ofSeconds(1))
        .keepTime(Duration.ofSeconds(2))
        .build(lengthLoader()));
    assertThat(cache.get("x")).isEqualTo(1);

    ticker.advance(Duration.ofSeconds(3));
    cache.cleanUp();
    assertThat(cache.estimatedSize()).isEqualTo(0);
    assertThat(cache.stats().evictionCount()).isEqualTo(1);

    assertThat(cache.get("x")).isEqualTo(1);
    assertThat(loads.get()).isEqualTo(2);
  }

  @Test
  public void evict_boundary() {
    var cache = track(builder()
        .refreshInterval(REFRESH)
        .keepTime(Duration.ofMinutes(2))
        .build(lengthLoader()));
    cache.put("a", 1);

    ticker.advance(Duration.ofMinutes(2));
    cache.cleanUp();
    assertThat(cache.estimatedSize()).isEqualTo(1);

    ticker.advance(Duration.ofNanos(1));
    cache.cleanUp();
    assertThat(cache.estimatedSize()).isEqualTo(0);
  }

  @Test
  public void evict_keepTimeDisabled() {
    var cache = newCache(lengthLoader());
    cache.put("a", 1);

    ticker.advance(Duration.ofDays(10));
    cache.cleanUp();
    assertThat(cache.estimatedSize()).isEqualTo(1);
    assertThat(cache.stats().evictionCount()).isEqualTo(0);
  }

  @Test
  public void evict_failedSlot() {
    var cache = track(builder()
        .refreshInterval(REFRESH)
        .keepTime(Duration.ofMinutes(2))
        .build(key -> (loads.incrementAndGet() == 1) ? null : key.length()));
    assertThat(cache.get("abc")).isNull();

    ticker.advance(Duration.ofMinutes(3));
    cache.cleanUp();
    assertThat(cache.get("abc")).isEqualTo(3);
  }

  /* --------------- lifecycle --------------- */

  @Test
  public void close() {
    var cache = newCache(lengthLoader());
    assertThat(cache.get("a")).isEqualTo(1);
    cache.close();

    assertThat(cache.estimatedSize()).isEqualTo(0);
    assertThrows(IllegalStateException.class, () -> cache.get("a"));
    assertThrows(IllegalStateException.class, () -> cache.get("a", Duration.ZERO));
    assertThrows(IllegalStateException.class, () -> cache.put("a", 1));

    cache.close();
    cache.cleanUp();
    assertThat(((LocalPointCache<?, ?>) cache).maintenance.cancelled).isTrue();
  }

  @Test
  public void maintenance_evictsInBackground() {
    var cache = track(Freshen.newBuilder()
        .refreshInterval(Duration.ofMillis(40))
        .keepTime(Duration.ofMillis(80))
        .scheduler(Scheduler.forScheduledExecutorService(scheduledExecutor))
        .executor(ConcurrentTestHarness.executor)
        .build(lengthLoader()));
    assertThat(cache.get("abc")).isEqualTo(3);

    await().until(() -> cache.estimatedSize() == 0);
  }

  @Test
  public void maintenance_refreshesInBackground() {
    var cache = track(Freshen.newBuilder()
        .refreshInterval(Duration.ofMillis(40))
        .scheduler(Scheduler.forScheduledExecutorService(scheduledExecutor))
        .executor(ConcurrentTestHarness.executor)
        .build(key -> loads.incrementAndGet()));

    await().until(() -> {
      Integer value = cache.get("a");
      return (value != null) && (value > 1);
    });
  }

  @Test
  public void maintenance_refreshesOnSingleThread() {
    var executor = Executors.newSingleThreadExecutor(ConcurrentTestHarness.DAEMON_FACTORY);
    try {
      var cache = track(Freshen.newBuilder()
          .refreshInterval(Duration.ofMillis(40))
          .scheduler(Scheduler.forScheduledExecutorService(scheduledExecutor))
          .executor(executor)
          .build(key -> loads.incrementAndGet()));

      await().until(() -> {
        Integer value = cache.get("a");
        return (value != null) && (value > 1);
      });
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  public void maintenance_refreshesOnDefaultExecutor() {
    var cache = track(Freshen.newBuilder()
        .refreshInterval(Duration.ofMillis(40))
        .scheduler(Scheduler.forScheduledExecutorService(scheduledExecutor))
        .build(key -> loads.incrementAndGet()));

    await().until(() -> {
      Integer value = cache.get("a");
      return (value != null) && (value > 1);
    });
  }

  @Test
  public void close_cancelsRefresh() {
    List<Runnable> submitted = new ArrayList<>();
    var cache = track(Freshen.newBuilder()
        .refreshInterval(REFRESH)
        .scheduler(Scheduler.disabledScheduler())
        .executor(submitted::add)
        .ticker(ticker::read)
        .build(lengthLoader()));
    cache.put("abc", 9);
    ticker.advance(Duration.ofSeconds(61));
    assertThat(cache.get("abc")).isEqualTo(9);
    cache.cleanUp();

    cache.close();
    assertThat(((Future<?>) submitted.get(0)).isCancelled()).isTrue();
    assertThat(((LocalPointCache<?, ?>) cache).refreshes).isEmpty();
  }

  @Test
  public void maintenance_stopsOnClose() {
    var cache = track(Freshen.newBuilder()
        .refreshInterval(Duration.ofMillis(40))
        .scheduler(Scheduler.forScheduledExecutorService(scheduledExecutor))
        .executor(ConcurrentTestHarness.executor)
        .build(lengthLoader()));
    var maintenance = ((LocalPointCache<?, ?>) cache).maintenance;
    await().until(maintenance::isScheduled);

    cache.close();
    assertThat(maintenance.isScheduled()).isFalse();
  }

  /* --------------- helpers --------------- */

  private Freshen<Object, Object> builder() {
    return Freshen.newBuilder()
        .scheduler(Scheduler.disabledScheduler())
        .executor(Runnable::run)
        .ticker(ticker::read)
        .recordStats();
  }

  private PointCache<String, Integer> newCache(PointLoader<String, Integer> loader) {
    return track(builder().refreshInterval(REFRESH).build(loader));
  }

  private PointCache<String, Integer> track(PointCache<String, Integer> cache) {
    this.cache = cache;
    return cache;
  }

  private PointLoader<String, Integer> lengthLoader() {
    return key -> {
      loads.incrementAndGet();
      return key.length();
    };
  }
}
