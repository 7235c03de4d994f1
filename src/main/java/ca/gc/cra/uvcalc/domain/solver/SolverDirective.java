package ca.gc.cra.uvcalc.domain.solver;

import java.util.Locale;

/**
 * Input directives understood by the radiative-transfer solver, each with a fixed number of values.
 */
public enum SolverDirective {
  AEROSOL(2, "aerosol_angstrom %s %s"),
  ALBEDO(1, "albedo %s"),
  LATITUDE(2, "latitude %s %s"),
  LONGITUDE(2, "longitude %s %s"),
  OZONE(1, "mol_modify O3 %s DU"),
  PRESSURE(1, "pressure %s"),
  SPLINE(3, "spline %s %s %s"),
  SZA(1, "sza %s"),
  TIME(6, "time %s %s %s %s %s %s"),
  WAVELENGTH(2, "wavelength %s %s");

  private final int valueCount;
  private final String template;

  SolverDirective(int valueCount, String template) {
    this.valueCount = valueCount;
    this.template = template;
  }

  public int valueCount() {
    return valueCount;
  }

  String format(Object[] values) {
    return String.format(Locale.ROOT, template, values);
  }
}
