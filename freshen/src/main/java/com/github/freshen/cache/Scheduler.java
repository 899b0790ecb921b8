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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

/**
 * Arms the next maintenance cycle of a cache. A cache asks for one cycle at a time and only asks
 * for the following one after the current cycle has finished, so an implementation never has to
 * handle overlapping runs of the same cache.
 * <p>
 * A scheduler that throws or returns {@code null} leaves the cache without background maintenance;
 * it then performs maintenance only when {@link RefreshingCache#cleanUp()} is called.
 */
@NullMarked
@FunctionalInterface
public interface Scheduler {

  /**
   * Submits the maintenance cycle to the executor once the delay has elapsed.
   *
   * @param executor the executor to run the cycle on
   * @param cycle the maintenance cycle
   * @param delayNanos how long to wait before submitting the cycle, in nanoseconds
   * @return a future that can cancel the pending submission, or {@code null} if the cycle will
   *         never be submitted
   */
  @Nullable Future<?> schedule(Executor executor, Runnable cycle, long delayNanos);

  /**
   * Returns a scheduler that never runs a cycle, which leaves maintenance to explicit calls of
   * {@link RefreshingCache#cleanUp()}.
   *
   * @return a scheduler that discards every cycle
   */
  static Scheduler disabledScheduler() {
    return DisabledScheduler.INSTANCE;
  }

  /**
   * Returns a scheduler that waits on the system-wide scheduling thread of
   * {@link CompletableFuture#delayedExecutor}. This is the default.
   *
   * @return a scheduler that uses the system-wide scheduling thread
   */
  static Scheduler systemScheduler() {
    return SystemScheduler.INSTANCE;
  }

  /**
   * Returns a scheduler that waits on the given {@link ScheduledExecutorService}. Cycles are
   * discarded once it has been shut down.
   *
   * @param scheduledExecutorService the service that times each delay
   * @return a scheduler that delegates the delay to the service
   */
  static Scheduler forScheduledExecutorService(ScheduledExecutorService scheduledExecutorService) {
    return new ExecutorServiceScheduler(scheduledExecutorService);
  }
}

enum SystemScheduler implements Scheduler {
  INSTANCE;

  @Override
  public Future<?> schedule(Executor executor, Runnable cycle, long delayNanos) {
    requireNonNull(cycle);
    var delayed = CompletableFuture.delayedExecutor(delayNanos, TimeUnit.NANOSECONDS, executor);
    return CompletableFuture.runAsync(cycle, delayed);
  }
}

final class ExecutorServiceScheduler implements Scheduler {
  static final Logger logger = System.getLogger(ExecutorServiceScheduler.class.getName());

  final ScheduledExecutorService scheduledExecutorService;

  ExecutorServiceScheduler(ScheduledExecutorService scheduledExecutorService) {
    this.scheduledExecutorService = requireNonNull(scheduledExecutorService);
  }

  @Override
  public @Nullable Future<?> schedule(Executor executor, Runnable cycle, long delayNanos) {
    requireNonNull(executor);
    requireNonNull(cycle);
    if (scheduledExecutorService.isShutdown()) {
      return null;
    }
    return scheduledExecutorService.schedule(() -> {
      try {
        executor.execute(cycle);
      } catch (Throwable t) {
        logger.log(Level.WARNING, "Exception thrown when submitting the maintenance cycle", t);
        throw t;
      }
    }, delayNanos, TimeUnit.NANOSECONDS);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '[' + scheduledExecutorService + ']';
  }
}

enum DisabledScheduler implements Scheduler {
  INSTANCE;

  @Override
  public @Nullable Future<?> schedule(Executor executor, Runnable cycle, long delayNanos) {
    requireNonNull(executor);
    requireNonNull(cycle);
    return null;
  }
}
