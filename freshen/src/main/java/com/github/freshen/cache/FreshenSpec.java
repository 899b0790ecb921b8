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

import static com.github.freshen.cache.Freshen.UNSET_INT;
import static com.github.freshen.cache.Freshen.requireArgument;
import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import org.jspecify.annotations.Nullable;

/**
 * A specification of a {@link Freshen} builder configuration.
 * <p>
 * {@code FreshenSpec} supports parsing configuration off of a string, which makes it especially
 * useful for reading cache settings from a properties file or the command line.
 * <p>
 * The string syntax is a series of comma-separated keys or key-value pairs, each corresponding to a
 * {@code Freshen} builder method.
 * <ul>
 *   <li>{@code initialCapacity=[integer]}: sets {@link Freshen#initialCapacity}.
 *   <li>{@code refreshInterval=[duration]}: sets {@link Freshen#refreshInterval}.
 *   <li>{@code keepTime=[duration]}: sets {@link Freshen#keepTime}.
 *   <li>{@code recordStats}: sets {@link Freshen#recordStats}.
 * </ul>
 * <p>
 * Durations are represented as either an ISO-8601 string using {@link Duration#parse(CharSequence)}
 * or by an integer followed by one of "d", "h", "m", or "s", representing days, hours, minutes, or
 * seconds respectively.
 * <p>
 * Whitespace before and after commas and equal signs is ignored. Keys may not be repeated.
 * {@code FreshenSpec} does not support configuring {@code Freshen} methods with non-value
 * parameters, such as the executor or ticker. These must be configured in code.
 */
public final class FreshenSpec {
  static final String SPLIT_OPTIONS = ",";
  static final String SPLIT_KEY_VALUE = "=";

  final String specification;

  int initialCapacity = UNSET_INT;
  boolean recordStats;

  @Nullable Duration refreshInterval;
  @Nullable Duration keepTime;

  private FreshenSpec(String specification) {
    this.specification = requireNonNull(specification);
  }

  /**
   * Returns a {@link Freshen} builder configured according to this specification.
   *
   * @return a builder configured to the specification
   */
  Freshen<Object, Object> toBuilder() {
    Freshen<Object, Object> builder = Freshen.newBuilder();
    if (initialCapacity != UNSET_INT) {
      builder.initialCapacity(initialCapacity);
    }
    if (refreshInterval != null) {
      builder.refreshInterval(refreshInterval);
    }
    if (keepTime != null) {
      builder.keepTime(keepTime);
    }
    if (recordStats) {
      builder.recordStats();
    }
    return builder;
  }

  /**
   * Creates a FreshenSpec from a string.
   *
   * @param specification the string form
   * @return the parsed specification
   * @throws IllegalArgumentException if the string is malformed, repeats a key, or names an
   *         unknown key
   */
  @SuppressWarnings("StringSplitter")
  public static FreshenSpec parse(String specification) {
    FreshenSpec spec = new FreshenSpec(specification);
    for (String option : specification.split(SPLIT_OPTIONS)) {
      spec.parseOption(option.trim());
    }
    return spec;
  }

  /** Parses and applies the configuration option. */
  void parseOption(String option) {
    if (option.isEmpty()) {
      return;
    }

    String[] keyAndValue = option.split(SPLIT_KEY_VALUE, -1);
    requireArgument(keyAndValue.length <= 2,
        "key-value pair %s with more than one equals sign", option);

    String key = keyAndValue[0].trim();
    String value = (keyAndValue.length == 1) ? null : keyAndValue[1].trim();

    configure(key, value);
  }

  /** Configures the setting. */
  void configure(String key, @Nullable String value) {
    switch (key) {
      case "initialCapacity":
        requireArgument(initialCapacity == UNSET_INT,
            "initial capacity was already set to %,d", initialCapacity);
        initialCapacity = parseInt(key, value);
        return;
      case "refreshInterval":
        requireArgument(refreshInterval == null, "refreshInterval was already set");
        refreshInterval = parseDuration(key, value);
        return;
      case "keepTime":
        requireArgument(keepTime == null, "keepTime was already set");
        keepTime = parseDuration(key, value);
        return;
      case "recordStats":
        requireArgument(value == null, "record stats does not take a value");
        requireArgument(!recordStats, "record stats was already set");
        recordStats = true;
        return;
      default:
        throw new IllegalArgumentException("Unknown key " + key);
    }
  }

  /** Returns a parsed int value. */
  static int parseInt(String key, @Nullable String value) {
    requireArgument((value != null) && !value.isEmpty(), "value of key %s was omitted", key);
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(String.format(
          "key %s value was set to %s, must be an integer", key, value), e);
    }
  }

  /** Returns a parsed duration value. */
  static Duration parseDuration(String key, @Nullable String value) {
    requireArgument((value != null) && !value.isEmpty(), "value of key %s omitted", key);

    @SuppressWarnings("NullAway")
    boolean isIsoFormat = value.contains("p") || value.contains("P");
    if (isIsoFormat) {
      Duration duration;
      try {
        duration = Duration.parse(value);
      } catch (RuntimeException e) {
        throw new IllegalArgumentException(String.format(
            "key %s invalid format; was %s, must be an ISO-8601 duration", key, value), e);
      }
      requireArgument(!duration.isNegative(),
          "key %s invalid format; was %s, but the duration cannot be negative", key, value);
      return duration;
    }

    long duration;
    try {
      duration = Long.parseLong(value.substring(0, value.length() - 1));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(String.format(
          "key %s value was set to %s, must be a long followed by a unit", key, value), e);
    }
    requireArgument(duration >= 0,
        "key %s invalid format; was %s, but the duration cannot be negative", key, value);
    TimeUnit unit = parseTimeUnit(key, value);
    return Duration.ofNanos(unit.toNanos(duration));
  }

  /** Returns a parsed {@link TimeUnit} value. */
  static TimeUnit parseTimeUnit(String key, String value) {
    char lastChar = Character.toLowerCase(value.charAt(value.length() - 1));
    switch (lastChar) {
      case 'd':
        return TimeUnit.DAYS;
      case 'h':
        return TimeUnit.HOURS;
      case 'm':
        return TimeUnit.MINUTES;
      case 's':
        return TimeUnit.SECONDS;
      default:
        throw new IllegalArgumentException(String.format(
            "key %s invalid format; was %s, must end with one of [dDhHmMsS]", key, value));
    }
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    } else if (!(o instanceof FreshenSpec)) {
      return false;
    }
    FreshenSpec spec = (FreshenSpec) o;
    return (initialCapacity == spec.initialCapacity)
        && (recordStats == spec.recordStats)
        && Objects.equals(refreshInterval, spec.refreshInterval)
        && Objects.equals(keepTime, spec.keepTime);
  }

  @Override
  public int hashCode() {
    return Objects.hash(initialCapacity, recordStats, refreshInterval, keepTime);
  }

  /**
   * Returns a string that can be used to parse an equivalent {@code FreshenSpec}. The order and
   * form of this representation is not guaranteed, except that parsing its output will produce a
   * {@code FreshenSpec} equal to this instance.
   *
   * @return a string representation of this specification
   */
  public String toParsableString() {
    return specification;
  }

  /**
   * Returns a string representation for this FreshenSpec instance. The form of this representation
   * is not guaranteed.
   */
  @Override
  public String toString() {
    return getClass().getSimpleName() + '{' + toParsableString() + '}';
  }
}
