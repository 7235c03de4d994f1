package ca.gc.cra.uvcalc.domain.ancillary;

/**
 * Cosine correction selected for a section.
 */
public enum CosCorrectionMode {
  NONE("none"),
  DIFFUSE("diffuse"),
  CLEAR_SKY("clear_sky");

  private final String label;

  CosCorrectionMode(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
