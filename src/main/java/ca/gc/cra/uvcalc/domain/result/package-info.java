/**
 * Corrected spectra produced by the correction pipeline.
 */
package ca.gc.cra.uvcalc.domain.result;
