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

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * A one-shot signal that any number of threads may wait on. The gate is opened at most once, by the
 * thread responsible for the work it guards, and stays open; opening it again has no effect.
 */
final class ReadyGate {
  static final ReadyGate OPEN = new ReadyGate(CompletableFuture.completedFuture(null));

  final CompletableFuture<@Nullable Void> future;

  ReadyGate() {
    this(new CompletableFuture<>());
  }

  private ReadyGate(CompletableFuture<@Nullable Void> future) {
    this.future = future;
  }

  /** Returns if the gate has been opened. */
  boolean isOpen() {
    return future.isDone();
  }

  /** Opens the gate, releasing all waiters, and returns if this call was the one to open it. */
  @CanIgnoreReturnValue
  boolean open() {
    return future.complete(null);
  }

  /**
   * Waits for the gate to open. A timeout of {@link Long#MAX_VALUE} waits without bound. If the
   * waiting thread is interrupted then its interrupt status is restored and the wait is abandoned.
   *
   * @param timeoutNanos the maximum time to wait, in nanoseconds
   * @return if the gate is open
   */
  boolean await(long timeoutNanos) {
    if (future.isDone()) {
      return true;
    }
    try {
      if (timeoutNanos == Long.MAX_VALUE) {
        future.get();
      } else {
        future.get(Math.max(0L, timeoutNanos), TimeUnit.NANOSECONDS);
      }
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } catch (TimeoutException e) {
      return false;
    } catch (ExecutionException | CancellationException e) {
      // never completed exceptionally, but done all the same
      return true;
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + (isOpen() ? "[open]" : "[closed]");
  }
}
