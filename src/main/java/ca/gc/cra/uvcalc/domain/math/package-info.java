/**
 * <strong>Purpose:</strong> Numerical kernels (interpolation, trapezoidal integration, smoothing spline).
 * <p><strong>Concurrency:</strong> Stateless or immutable; safe from any worker thread.
 *
 * @since 0.1.0
 */
package ca.gc.cra.uvcalc.domain.math;
