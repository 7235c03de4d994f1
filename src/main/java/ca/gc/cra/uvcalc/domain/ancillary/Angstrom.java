package ca.gc.cra.uvcalc.domain.ancillary;

/**
 * Ångström aerosol parameters.
 *
 * @param alpha wavelength exponent
 * @param beta turbidity coefficient
 */
public record Angstrom(double alpha, double beta) {}
