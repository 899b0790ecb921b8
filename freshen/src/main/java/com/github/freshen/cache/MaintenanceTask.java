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
import java.util.concurrent.Executor;
import java.util.concurrent.Future;

import org.jspecify.annotations.Nullable;

/**
 * A periodic task that re-arms itself through the {@link Scheduler} after each run. Only one run is
 * ever pending, so a slow cycle delays the next one rather than overlapping with it. Once cancelled
 * the task never runs again, and a run that was already submitted returns without doing any work.
 * <p>
 * A scheduler that fails to arm a run is logged and leaves the task unscheduled. An interrupt
 * raised by the cycle itself is cleared when the cycle ends, as the thread belongs to the executor.
 */
final class MaintenanceTask implements Runnable {
  static final Logger logger = System.getLogger(MaintenanceTask.class.getName());

  final Scheduler scheduler;
  final Executor executor;
  final Runnable command;
  final long periodNanos;

  volatile @Nullable Future<?> future;
  volatile boolean cancelled;

  MaintenanceTask(Scheduler scheduler, Executor executor, Runnable command, long periodNanos) {
    this.scheduler = requireNonNull(scheduler);
    this.executor = requireNonNull(executor);
    this.command = requireNonNull(command);
    this.periodNanos = Math.max(1L, periodNanos);
  }

  /** Arms the next run to start after the delay, unless the task was cancelled. */
  void schedule(long delayNanos) {
    if (cancelled) {
      return;
    }
    try {
      future = scheduler.schedule(executor, this, delayNanos);
    } catch (Throwable t) {
      logger.log(Level.WARNING,
          "Exception thrown by scheduler; discarded the maintenance cycle", t);
      future = null;
    }
    if (cancelled) {
      cancelFuture();
    }
  }

  @Override
  public void run() {
    if (cancelled) {
      return;
    }
    boolean interrupted = Thread.currentThread().isInterrupted();
    try {
      command.run();
    } catch (Throwable t) {
      logger.log(Level.ERROR, "Exception thrown when performing the maintenance task", t);
    } finally {
      if (!interrupted && Thread.interrupted()) {
        logger.log(Level.DEBUG, "Cleared an interrupt raised by the maintenance task");
      }
      schedule(periodNanos);
    }
  }

  /** Returns if a future run is pending. */
  boolean isScheduled() {
    var pending = future;
    return !cancelled && (pending != null) && !pending.isDone();
  }

  /** Prevents any further runs. */
  void cancel() {
    cancelled = true;
    cancelFuture();
  }

  private void cancelFuture() {
    var pending = future;
    if (pending != null) {
      pending.cancel(/* mayInterruptIfRunning= */ false);
    }
  }
}
