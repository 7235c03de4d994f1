package ca.gc.cra.uvcalc.domain.measurement;

/**
 * Instrument location in decimal degrees. Positive longitudes are west of Greenwich, following the
 * instrument's own convention.
 *
 * @param latitude decimal degrees, north positive
 * @param longitude decimal degrees, west positive
 */
public record Position(double latitude, double longitude) {}
