package com.uavradar.processor.geo;

import java.util.Optional;

/**
 * Point-in-polygon region lookup provided by an external spatial service.
 *
 * <p>Caching is the implementation's concern. The processor calls it once per accepted
 * coordinate pair and treats failures as misses.
 */
public interface SpatialRegionLookup {
  /**
   * Returns the region containing a point.
   *
   * @param longitude WGS84 longitude
   * @param latitude WGS84 latitude
   * @return containing region when found
   */
  Optional<RegionInfo> geocode(double longitude, double latitude);
}
