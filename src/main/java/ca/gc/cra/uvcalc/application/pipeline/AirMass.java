package ca.gc.cra.uvcalc.application.pipeline;

/**
 * Relative optical path through the atmosphere for a spherical Earth with an effective layer height.
 */
public final class AirMass {
  static final double EARTH_RADIUS_METRES = 6_370_000.0;
  static final double LAYER_HEIGHT_METRES = 22_000.0;

  private AirMass() {
    // Utility
  }

  /**
   * @param szaDegrees solar zenith angle in degrees
   * @return {@code 1 / cos(asin(R sin(pi - sza) / (R + H)))}
   */
  public static double of(double szaDegrees) {
    double sza = Math.toRadians(szaDegrees);
    double sinTheta = EARTH_RADIUS_METRES * Math.sin(Math.PI - sza) / (EARTH_RADIUS_METRES + LAYER_HEIGHT_METRES);
    return 1 / Math.cos(Math.asin(sinTheta));
  }
}
