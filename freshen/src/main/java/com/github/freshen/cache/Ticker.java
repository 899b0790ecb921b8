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

/**
 * A time source that returns a time value representing the number of nanoseconds elapsed since some
 * fixed but arbitrary point in time. Entry ages, last-read stamps, and the bulk refresh cadence are
 * all measured against this source, so only differences between two readings are meaningful.
 */
@FunctionalInterface
public interface Ticker {

  /**
   * Returns the number of nanoseconds elapsed since this ticker's fixed point of reference.
   *
   * @return the number of nanoseconds elapsed since this ticker's fixed point of reference
   */
  long read();

  /**
   * Returns a ticker that reads the current time using {@link System#nanoTime}.
   *
   * @return a ticker that reads the current time using {@link System#nanoTime}
   */
  static Ticker systemTicker() {
    return SystemTicker.INSTANCE;
  }
}

enum SystemTicker implements Ticker {
  INSTANCE;

  @Override public long read() {
    return System.nanoTime();
  }
}
