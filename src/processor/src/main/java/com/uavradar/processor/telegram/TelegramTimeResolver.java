package com.uavradar.processor.telegram;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Resolves telegram time tokens into instants relative to a reference "now".
 *
 * <p>Telegram times carry no month or year (and bare tokens no day), so both are taken from
 * the reference instant, in UTC.
 */
final class TelegramTimeResolver {

  private TelegramTimeResolver() {}

  /**
   * Resolves a 10-digit {@code DDHHMMSSxx} token; the two trailing digits are ignored.
   *
   * <p>The day is placed in the reference month. When that month has no such day, the previous
   * month is used (January rolls back to December of the previous year).
   *
   * @param token ten digits
   * @param now reference instant
   * @return resolved instant, or empty when the token is not a valid date-time
   */
  static Optional<Instant> resolveCompound(String token, Instant now) {
    if (token == null || token.length() != 10) {
      return Optional.empty();
    }
    int day = Integer.parseInt(token.substring(0, 2));
    Optional<LocalTime> time = timeOfDay(
        Integer.parseInt(token.substring(2, 4)),
        Integer.parseInt(token.substring(4, 6)),
        Integer.parseInt(token.substring(6, 8)));
    if (time.isEmpty() || day < 1 || day > 31) {
      return Optional.empty();
    }

    YearMonth month = YearMonth.from(now.atZone(ZoneOffset.UTC));
    if (!month.isValidDay(day)) {
      month = month.minusMonths(1);
      if (!month.isValidDay(day)) {
        return Optional.empty();
      }
    }
    return Optional.of(month.atDay(day).atTime(time.get()).toInstant(ZoneOffset.UTC));
  }

  /**
   * Resolves a bare {@code HHMM} or {@code HHMMSS} token against the reference date.
   *
   * <p>A result strictly after {@code now} is moved back one calendar day.
   *
   * @param token four or six digits
   * @param now reference instant
   * @return resolved instant, or empty when the token is not a valid time of day
   */
  static Optional<Instant> resolveTimeOfDay(String token, Instant now) {
    if (token == null || (token.length() != 4 && token.length() != 6)) {
      return Optional.empty();
    }
    int seconds = token.length() == 6 ? Integer.parseInt(token.substring(4, 6)) : 0;
    Optional<LocalTime> time = timeOfDay(
        Integer.parseInt(token.substring(0, 2)),
        Integer.parseInt(token.substring(2, 4)),
        seconds);
    if (time.isEmpty()) {
      return Optional.empty();
    }

    ZonedDateTime reference = now.atZone(ZoneOffset.UTC);
    LocalDate date = reference.toLocalDate();
    ZonedDateTime resolved = date.atTime(time.get()).atZone(ZoneOffset.UTC);
    if (resolved.isAfter(reference)) {
      resolved = resolved.minusDays(1);
    }
    return Optional.of(resolved.toInstant());
  }

  private static Optional<LocalTime> timeOfDay(int hour, int minute, int second) {
    if (hour > 23 || minute > 59 || second > 59) {
      return Optional.empty();
    }
    return Optional.of(LocalTime.of(hour, minute, second));
  }
}
