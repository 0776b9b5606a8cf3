package com.uavradar.processor.model;

/**
 * Immutable geographic bounding box used as the territorial plausibility envelope.
 *
 * @param minLon minimum longitude
 * @param minLat minimum latitude
 * @param maxLon maximum longitude
 * @param maxLat maximum latitude
 */
public record Bbox(double minLon, double minLat, double maxLon, double maxLat) {
  /**
   * Checks whether a point is inside this bounding box.
   *
   * @param point point to test
   * @return {@code true} when the point is inside or on the border
   */
  public boolean contains(Coordinates point) {
    if (point == null) {
      return false;
    }
    return point.latitude() >= minLat
        && point.latitude() <= maxLat
        && point.longitude() >= minLon
        && point.longitude() <= maxLon;
  }
}
