/**
 * <strong>Purpose:</strong> Request and response contract of the external radiative-transfer solver.
 * <p><strong>Pipeline role:</strong> Built by the correction pipeline, executed by the solver adapter.
 * <p><strong>Concurrency:</strong> Requests and results are immutable.
 *
 * @since 0.1.0
 */
package ca.gc.cra.uvcalc.domain.solver;
