/**
 * Adapter for the external radiative-transfer solver.
 *
 * <p><strong>Purpose:</strong> Translate {@link ca.gc.cra.uvcalc.domain.solver.SolverRequest} values into libRadtran
 * input files and parse the columnar output.</p>
 * <p><strong>Pipeline role:</strong> Implements {@link ca.gc.cra.uvcalc.application.port.RadiativeTransferPort} for
 * the correction pipeline.</p>
 * <p><strong>Concurrency:</strong> One process per call; concurrent calls never share files.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.uvcalc.infrastructure.solver;
