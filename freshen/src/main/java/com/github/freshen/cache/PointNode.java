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

import org.jspecify.annotations.Nullable;

/**
 * The slot that a {@link LocalPointCache} maps a key to.
 * <p>
 * The value and its write time are held together in an immutable {@link Snapshot} that is replaced
 * as a whole, so a reader never observes a value paired with another generation's write time. The
 * access time is a separate stamp that readers update without coordination. A slot is created
 * either pending, by the thread that will perform its first load, or already loaded by a put.
 */
final class PointNode<V> {
  final ReadyGate ready;

  volatile Snapshot<V> snapshot;
  volatile long accessTime;

  private PointNode(ReadyGate ready, Snapshot<V> snapshot, long accessTime) {
    this.ready = ready;
    this.snapshot = snapshot;
    this.accessTime = accessTime;
  }

  /** Returns a slot that is awaiting its first load, stamped with the time of its insertion. */
  static <V> PointNode<V> pending(long now) {
    return new PointNode<>(new ReadyGate(), new Snapshot<>(null, now), now);
  }

  /** Returns a slot holding the value, counted as both written and read at {@code now}. */
  static <V> PointNode<V> loaded(V value, long now) {
    return new PointNode<>(ReadyGate.OPEN, new Snapshot<>(requireNonNull(value), now), now);
  }

  /** Returns the value if a load has succeeded, or null if pending or failed. */
  @Nullable V value() {
    return snapshot.value;
  }

  /** Returns if the slot holds a value. */
  boolean isLoaded() {
    return (snapshot.value != null);
  }

  /**
   * Returns if the value has not been read since it was last written. A slot that never loaded is
   * treated as unread.
   */
  boolean isUnreadSinceWrite() {
    Snapshot<V> current = snapshot;
    return (current.value == null) || ((current.writeTime - accessTime) > 0);
  }

  /** Publishes a newly loaded value. The access stamp is written first so the pair is visible. */
  void setLoaded(V value, long now) {
    accessTime = now;
    snapshot = new Snapshot<>(value, now);
  }

  /** Replaces the value with a refreshed one, leaving the access stamp as is. */
  void setRefreshed(V value, long now) {
    snapshot = new Snapshot<>(value, now);
  }

  @Override
  public String toString() {
    Snapshot<V> current = snapshot;
    return getClass().getSimpleName() + "[value=" + current.value
        + ", writeTime=" + current.writeTime + ", accessTime=" + accessTime
        + ", " + ready + "]";
  }

  /** An immutable pairing of a value with the time it was written. */
  static final class Snapshot<V> {
    final @Nullable V value;
    final long writeTime;

    Snapshot(@Nullable V value, long writeTime) {
      this.value = value;
      this.writeTime = writeTime;
    }
  }
}
