/**
 * Progress reporting adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.uvcalc.infrastructure.progress;
