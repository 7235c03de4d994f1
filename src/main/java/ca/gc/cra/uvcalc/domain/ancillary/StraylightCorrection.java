package ca.gc.cra.uvcalc.domain.ancillary;

/**
 * Whether stray-light correction applies to an instrument model.
 */
public enum StraylightCorrection {
  APPLIED("Applied"),
  NOT_APPLIED("Not applied"),
  UNDEFINED("Undefined");

  private final String label;

  StraylightCorrection(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
