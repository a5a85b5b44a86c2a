/*
 * Copyright 2026 Rackspace US, Inc.
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

package com.rackspace.vesta.app.utils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class DateTimeUtils {

  public static final String RELATIVE_TIME_PATTERN = "([0-9]+)(ms|s|m|h|d|w|n|y)-ago";
  public static final String EPOCH_MILLIS_PATTERN = "\\d{13,}";
  public static final String EPOCH_SECONDS_PATTERN = "\\d{1,12}";

  private static final Pattern RELATIVE_TIME = Pattern.compile(RELATIVE_TIME_PATTERN);
  private static final Pattern EPOCH_MILLIS = Pattern.compile(EPOCH_MILLIS_PATTERN);
  private static final Pattern EPOCH_SECONDS = Pattern.compile(EPOCH_SECONDS_PATTERN);

  private DateTimeUtils() {
  }

  /**
   * Gets the absolute Instant for a relative time such as <code>2h-ago</code>.
   */
  public static Instant getAbsoluteTimeFromRelativeTime(String relativeTime, Clock clock) {
    final Matcher match = RELATIVE_TIME.matcher(relativeTime);
    if (!match.matches()) {
      throw new IllegalArgumentException("Invalid relative time format");
    }
    final long amount = Long.parseLong(match.group(1));
    final Instant now = clock.instant();
    switch (match.group(2)) {
      case "ms":
        return now.minusMillis(amount);
      case "s":
        return now.minusSeconds(amount);
      case "m":
        return now.minus(Duration.ofMinutes(amount));
      case "h":
        return now.minus(Duration.ofHours(amount));
      case "d":
        return now.minus(Duration.ofDays(amount));
      case "w":
        return now.minus(Duration.ofDays(amount * 7));
      case "n":
        return now.atOffset(ZoneOffset.UTC).minusMonths(amount).toInstant();
      default:
        return now.atOffset(ZoneOffset.UTC).minusYears(amount).toInstant();
    }
  }

  /**
   * Checks if the string time is a valid ISO-8601 date-time in UTC or with a zone offset.
   */
  public static boolean isValidInstantInstance(String time) {
    try {
      parseIsoInstant(time);
      return true;
    } catch (DateTimeParseException dateTimeParseException) {
      return false;
    }
  }

  /**
   * Parses <code>2024-01-01T00:00:00Z</code> as well as offset forms such as
   * <code>2024-01-01T00:00:00+02:00</code>.
   */
  public static Instant parseIsoInstant(String time) {
    try {
      return Instant.parse(time);
    } catch (DateTimeParseException e) {
      return OffsetDateTime.parse(time).toInstant();
    }
  }

  public static boolean isValidEpochMillis(String time) {
    return EPOCH_MILLIS.matcher(time).matches();
  }

  public static boolean isValidEpochSeconds(String time) {
    return EPOCH_SECONDS.matcher(time).matches();
  }

  /**
   * Parses a query time given as ISO-8601, epoch millis, epoch seconds or relative time.
   * A null value means now.
   */
  public static Instant parseInstant(String instant, Clock clock) {
    if (instant == null) {
      return clock.instant();
    }
    if (isValidInstantInstance(instant)) {
      return parseIsoInstant(instant);
    } else if (isValidEpochMillis(instant)) {
      return Instant.ofEpochMilli(Long.parseLong(instant));
    } else if (isValidEpochSeconds(instant)) {
      return Instant.ofEpochSecond(Long.parseLong(instant));
    } else {
      return getAbsoluteTimeFromRelativeTime(instant, clock);
    }
  }

  /**
   * Rounds the epoch millis down to a multiple of the given width.
   */
  public static long alignDown(long epochMillis, Duration width) {
    final long widthMs = width.toMillis();
    if (widthMs <= 0) {
      return epochMillis;
    }
    return Math.floorDiv(epochMillis, widthMs) * widthMs;
  }

  /**
   * Expected number of samples of one point in <code>[startMs, endMs)</code> at the given
   * resolution, rounded up.
   */
  public static long expectedSamplesPerPointInRange(long startMs, long endMs,
                                                    Duration resolution) {
    final long span = endMs - startMs;
    if (span <= 0) {
      return 0;
    }
    final long resolutionMs = Math.max(1, resolution.toMillis());
    return (span + resolutionMs - 1) / resolutionMs;
  }
}
