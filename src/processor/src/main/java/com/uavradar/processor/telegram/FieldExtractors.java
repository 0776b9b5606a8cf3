package com.uavradar.processor.telegram;

import com.uavradar.processor.model.AircraftTypes;
import com.uavradar.processor.model.Coordinates;
import com.uavradar.processor.model.MessageType;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-matching rules for individual telegram fields.
 *
 * <p>All methods expect text already normalized by {@link MessageParser} (single spaces,
 * upper case). Patterns are compiled once; extractors keep no state between calls.
 */
public final class FieldExtractors {
  private static final Pattern MESSAGE_TYPE =
      Pattern.compile("^\\(?(FPL|DEP|ARR|CHG|CNL|DLA|RQS|RQP)");
  private static final Pattern FLIGHT_ID = Pattern.compile("-([A-Z0-9]{1,7})");
  private static final Pattern AIRCRAFT_TYPE = Pattern.compile("-([A-Z0-9]{2,4})(?=[\\s\\-/)]|$)");
  private static final Pattern REGISTRATION =
      Pattern.compile("-([A-Z]{1,2}[A-Z0-9]{1,5})(?=[\\s\\-/)]|$)");

  // DDHHMMSS followed by two digits whose meaning is not defined by the format.
  private static final Pattern COMPOUND_TIME = Pattern.compile("(?<![0-9.])(\\d{10})(?![0-9.])");
  // HHMM or HHMMSS, standalone or glued to an aerodrome code (UUEE0930).
  private static final Pattern BARE_TIME =
      Pattern.compile("(?:^|[^A-Z0-9.])(?:[A-Z]{4})?(\\d{6}|\\d{4})(?![0-9.NSEW])");

  private static final String SIGNED_DECIMAL = "((?:(?<![A-Z0-9])[+-])?\\d{1,3}\\.\\d{1,10})";
  private static final Pattern DECIMAL_PAIR = Pattern.compile(
      "(?<![0-9.])" + SIGNED_DECIMAL + "\\s*[,;/]?\\s*" + SIGNED_DECIMAL);
  private static final Pattern DEGREE_MINUTE =
      Pattern.compile("(?<!\\d)(\\d{2})(\\d{2})([NS])\\s?(\\d{3})(\\d{2})([EW])");

  private static final Pattern AERODROME = Pattern.compile("(?<![A-Z0-9])([A-Z]{4})(?![A-Z])");
  private static final Pattern ALTITUDE = Pattern.compile("(?<![A-Z])(?:FL|F|A)(\\d{3})(?!\\d)");

  private static final Pattern ROUTE = Pattern.compile("-N([^-]+)");
  private static final Pattern OPERATOR = Pattern.compile("-OPR/([^-]+)");
  private static final Pattern REMARKS = Pattern.compile("-RMK/([^-]+)");

  private FieldExtractors() {}

  public static Optional<MessageType> messageType(String text) {
    return firstGroup(MESSAGE_TYPE, text).map(MessageType::valueOf);
  }

  public static Optional<String> flightId(String text) {
    return firstGroup(FLIGHT_ID, text);
  }

  public static Optional<String> aircraftType(String text) {
    return firstGroup(AIRCRAFT_TYPE, text);
  }

  public static Optional<String> aircraftRegistration(String text) {
    return firstGroup(REGISTRATION, text);
  }

  /** Returns every 10-digit date-time token in order of appearance. */
  public static List<String> compoundTimeTokens(String text) {
    return allGroups(COMPOUND_TIME, text);
  }

  /** Returns every 4- or 6-digit time-of-day token in order of appearance. */
  public static List<String> bareTimeTokens(String text) {
    return allGroups(BARE_TIME, text);
  }

  /** Returns every decimal number pair in order of appearance, as written. */
  public static List<DecimalPair> decimalPairs(String text) {
    List<DecimalPair> pairs = new ArrayList<>();
    Matcher matcher = DECIMAL_PAIR.matcher(text);
    while (matcher.find()) {
      pairs.add(new DecimalPair(
          Double.parseDouble(matcher.group(1)),
          Double.parseDouble(matcher.group(2))));
    }
    return pairs;
  }

  /**
   * Returns every {@code DDMM[N|S]DDDMM[E|W]} point in order of appearance.
   *
   * <p>Entries are {@code null} where minutes or degrees are out of range, so positions stay
   * aligned with the departure/arrival order.
   */
  public static List<Coordinates> degreeMinuteCoordinates(String text) {
    List<Coordinates> points = new ArrayList<>();
    Matcher matcher = DEGREE_MINUTE.matcher(text);
    while (matcher.find()) {
      int latDeg = Integer.parseInt(matcher.group(1));
      int latMin = Integer.parseInt(matcher.group(2));
      int lonDeg = Integer.parseInt(matcher.group(4));
      int lonMin = Integer.parseInt(matcher.group(5));
      if (latMin >= 60 || lonMin >= 60) {
        points.add(null);
        continue;
      }
      double latitude = latDeg + latMin / 60.0;
      double longitude = lonDeg + lonMin / 60.0;
      if ("S".equals(matcher.group(3))) {
        latitude = -latitude;
      }
      if ("W".equals(matcher.group(6))) {
        longitude = -longitude;
      }
      Coordinates point = new Coordinates(longitude, latitude);
      points.add(point.isGloballyValid() ? point : null);
    }
    return points;
  }

  /** Returns standalone 4-letter codes, skipping UAV type designators. */
  public static List<String> aerodromes(String text) {
    List<String> codes = new ArrayList<>();
    for (String code : allGroups(AERODROME, text)) {
      if (!AircraftTypes.isKnown(code)) {
        codes.add(code);
      }
    }
    return codes;
  }

  /**
   * Returns the first altitude group ({@code F###}, {@code A###} or {@code FL###}) times 100.
   */
  public static Optional<Integer> altitude(String text) {
    return firstGroup(ALTITUDE, text).map(value -> Integer.parseInt(value) * 100);
  }

  public static Optional<String> route(String text) {
    return freeText(ROUTE, text);
  }

  public static Optional<String> operator(String text) {
    return freeText(OPERATOR, text);
  }

  public static Optional<String> remarks(String text) {
    return freeText(REMARKS, text);
  }

  private static Optional<String> firstGroup(Pattern pattern, String text) {
    Matcher matcher = pattern.matcher(text);
    return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
  }

  private static List<String> allGroups(Pattern pattern, String text) {
    List<String> values = new ArrayList<>();
    Matcher matcher = pattern.matcher(text);
    while (matcher.find()) {
      values.add(matcher.group(1));
    }
    return values;
  }

  private static Optional<String> freeText(Pattern pattern, String text) {
    return firstGroup(pattern, text)
        .map(String::trim)
        .filter(value -> !value.isEmpty());
  }

  /**
   * Two decimal numbers as they appear in the telegram, conventionally latitude first.
   *
   * @param first first number
   * @param second second number
   */
  public record DecimalPair(double first, double second) {
    /**
     * Resolves the pair into a point.
     *
     * <p>The pair is read as (lat, lon); when that reading is out of range but the transposed
     * one is not, the values are swapped.
     *
     * @return point, or empty when neither reading is a valid coordinate
     */
    public Optional<Coordinates> normalize() {
      Coordinates asLatLon = new Coordinates(second, first);
      if (asLatLon.isGloballyValid()) {
        return Optional.of(asLatLon);
      }
      Coordinates asLonLat = new Coordinates(first, second);
      if (asLonLat.isGloballyValid()) {
        return Optional.of(asLonLat);
      }
      return Optional.empty();
    }
  }
}
