package com.uavradar.processor.model;

import java.util.Set;

/** UAV aircraft type vocabulary. */
public final class AircraftTypes {
  public static final String QUAD = "QUAD";
  public static final String HELI = "HELI";
  public static final String FIXW = "FIXW";
  public static final String UNKN = "UNKN";

  /** Type codes accepted without remapping. */
  public static final Set<String> KNOWN = Set.of(
      QUAD, "HEXA", "OCTO",
      FIXW, HELI, "GYRO",
      "BALL", "GLID", "PARA",
      UNKN);

  private AircraftTypes() {}

  public static boolean isKnown(String code) {
    return code != null && KNOWN.contains(code);
  }

  /**
   * Maps an unrecognised type designator to a known code by substring.
   *
   * @param code upper-case designator
   * @return {@code QUAD}, {@code HELI}, {@code FIXW} or {@code UNKN}
   */
  public static String infer(String code) {
    if (code.contains("QUAD") || code.contains("MULTI")) {
      return QUAD;
    }
    if (code.contains("HELI")) {
      return HELI;
    }
    if (code.contains("FIXED") || code.contains("WING")) {
      return FIXW;
    }
    return UNKN;
  }
}
