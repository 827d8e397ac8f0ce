package com.verlumen.optimize.time;

import static com.verlumen.optimize.time.TimeRange.BoundType.DATE;
import static com.verlumen.optimize.time.TimeRange.BoundType.INDEX;
import static com.verlumen.optimize.time.TimeRange.BoundType.LINE;
import static com.verlumen.optimize.time.TimeRange.BoundType.NONE;

import com.verlumen.optimize.time.TimeRange.BoundType;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The accepted {@code --timerange} forms. Declaration order is the matching priority: the fixed
 * 8 and 10 digit forms must be tried before the open-ended line and index forms, which would
 * otherwise accept the same text.
 */
enum TimeRangeSyntax {
  DATE_STOP("-(\\d{8})", NONE, DATE),
  DATE_START("(\\d{8})-", DATE, NONE),
  DATE_SPAN("(\\d{8})-(\\d{8})", DATE, DATE),
  EPOCH_STOP("-(\\d{10})", NONE, DATE),
  EPOCH_START("(\\d{10})-", DATE, NONE),
  EPOCH_SPAN("(\\d{10})-(\\d{10})", DATE, DATE),
  LAST_LINES("(-\\d+)", NONE, LINE),
  FIRST_LINES("(\\d+)-", LINE, NONE),
  INDEX_SPAN("(\\d+)-(\\d+)", INDEX, INDEX);

  private static final int CALENDAR_DATE_LENGTH = 8;

  private final Pattern pattern;
  private final BoundType startType;
  private final BoundType stopType;

  TimeRangeSyntax(String regex, BoundType startType, BoundType stopType) {
    this.pattern = Pattern.compile(regex);
    this.startType = startType;
    this.stopType = stopType;
  }

  /**
   * Returns the range described by {@code text} if it has this form.
   *
   * @throws java.time.format.DateTimeParseException if an 8 digit side is not a calendar date
   * @throws NumberFormatException if a side does not fit in a long
   */
  Optional<TimeRange> match(String text) {
    Matcher matcher = pattern.matcher(text);
    if (!matcher.matches()) {
      return Optional.empty();
    }

    int group = 1;
    long start = 0;
    long stop = 0;
    if (startType != NONE) {
      start = toValue(startType, matcher.group(group++));
    }
    if (stopType != NONE) {
      stop = toValue(stopType, matcher.group(group));
    }
    return Optional.of(TimeRange.create(startType, stopType, start, stop));
  }

  private static long toValue(BoundType type, String digits) {
    if (type == DATE && digits.length() == CALENDAR_DATE_LENGTH) {
      return LocalDate.parse(digits, DateTimeFormatter.BASIC_ISO_DATE)
          .atStartOfDay(ZoneOffset.UTC)
          .toEpochSecond();
    }
    return Long.parseLong(digits);
  }
}
