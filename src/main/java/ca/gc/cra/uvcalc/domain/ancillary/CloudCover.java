package ca.gc.cra.uvcalc.domain.ancillary;

import java.util.OptionalDouble;

/**
 * Sky condition used to choose between diffuse and clear-sky cosine correction.
 *
 * @param fraction observed cloud cover in [0, 1], empty when the clear-sky default is used
 */
public record CloudCover(OptionalDouble fraction) {
  /** Cloud cover at or above which the sky is treated as diffuse. */
  public static final double DIFFUSE_THRESHOLD = 0.9;

  public static CloudCover observed(double fraction) {
    return new CloudCover(OptionalDouble.of(fraction));
  }

  public static CloudCover clearSkyDefault() {
    return new CloudCover(OptionalDouble.empty());
  }

  /**
   * @param time minutes since midnight; daily observations ignore it
   */
  public boolean isDiffuse(double time) {
    return fraction.isPresent() && fraction.getAsDouble() >= DIFFUSE_THRESHOLD;
  }
}
