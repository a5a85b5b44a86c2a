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

import com.rackspace.vesta.app.exceptions.MalformedTimestampException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the timestamp formats seen from upstream into epoch milliseconds.
 * <p>
 * Accepted inputs are ISO-8601 date-times with or without an offset (UTC is assumed when
 * absent) and with any number of fractional second digits, and epoch values given either as
 * a JSON number or a numeric string. Epoch values of 13 or more integral digits are read as
 * milliseconds, shorter ones as seconds. Sub-millisecond precision is rounded to the nearest
 * millisecond with ties going toward positive infinity.
 * </p>
 */
public class TimestampNormalizer {

  private static final Pattern NUMERIC = Pattern.compile("[+-]?\\d+(\\.\\d+)?");
  private static final Pattern ISO_WITH_FRACTION =
      Pattern.compile("(\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2})(?:[.,](\\d+))?(.*)");

  private static final DateTimeFormatter OFFSET_FORMAT = new DateTimeFormatterBuilder()
      .parseCaseInsensitive()
      .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
      .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
      .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
      .optionalStart().appendOffset("+HH", "Z").optionalEnd()
      .toFormatter();

  private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);
  private static final BigDecimal HALF = new BigDecimal("0.5");
  private static final int MILLIS_MIN_DIGITS = 13;

  private TimestampNormalizer() {
  }

  public static long toEpochMillis(Object raw) {
    if (raw == null) {
      throw new MalformedTimestampException(null, "missing");
    }
    if (raw instanceof Number) {
      return fromNumber((Number) raw);
    }
    if (raw instanceof CharSequence) {
      return fromString(raw.toString());
    }
    throw new MalformedTimestampException(raw, "unsupported type " + raw.getClass().getSimpleName());
  }

  private static long fromNumber(Number number) {
    if (number instanceof Double || number instanceof Float) {
      final double d = number.doubleValue();
      if (!Double.isFinite(d)) {
        throw new MalformedTimestampException(number, "not finite");
      }
      return fromEpoch(new BigDecimal(number.toString()), number);
    }
    if (number instanceof BigDecimal) {
      return fromEpoch((BigDecimal) number, number);
    }
    if (number instanceof BigInteger) {
      return fromEpoch(new BigDecimal((BigInteger) number), number);
    }
    return fromEpoch(BigDecimal.valueOf(number.longValue()), number);
  }

  private static long fromString(String value) {
    final String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new MalformedTimestampException(value, "empty");
    }
    if (NUMERIC.matcher(trimmed).matches()) {
      return fromEpoch(new BigDecimal(trimmed), value);
    }
    return fromIso(trimmed);
  }

  private static long fromEpoch(BigDecimal epoch, Object input) {
    final int integralDigits = epoch.abs().setScale(0, RoundingMode.DOWN).toPlainString().length();
    final BigDecimal millis = integralDigits >= MILLIS_MIN_DIGITS ?
        epoch : epoch.multiply(THOUSAND);
    try {
      return roundToMillis(millis);
    } catch (ArithmeticException e) {
      throw new MalformedTimestampException(input, e);
    }
  }

  private static long fromIso(String value) {
    final Matcher matcher = ISO_WITH_FRACTION.matcher(value);
    if (!matcher.matches()) {
      throw new MalformedTimestampException(value, "unrecognized format");
    }
    final String base = matcher.group(1).replace(' ', 'T');
    final String fraction = matcher.group(2);
    final String zone = matcher.group(3);

    final long epochSeconds;
    try {
      if (zone.isEmpty()) {
        epochSeconds = LocalDateTime.parse(base).toEpochSecond(ZoneOffset.UTC);
      } else {
        epochSeconds = OffsetDateTime.parse(base + zone, OFFSET_FORMAT).toEpochSecond();
      }
    } catch (DateTimeParseException e) {
      throw new MalformedTimestampException(value, e);
    }

    final BigDecimal fractionMillis = fraction == null ? BigDecimal.ZERO :
        new BigDecimal("0." + fraction).multiply(THOUSAND);
    return roundToMillis(BigDecimal.valueOf(epochSeconds).multiply(THOUSAND).add(fractionMillis));
  }

  /**
   * Nearest millisecond, ties toward positive infinity.
   */
  static long roundToMillis(BigDecimal millis) {
    return millis.add(HALF).setScale(0, RoundingMode.FLOOR).longValueExact();
  }
}
