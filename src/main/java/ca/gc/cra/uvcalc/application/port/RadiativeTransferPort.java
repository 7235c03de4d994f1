package ca.gc.cra.uvcalc.application.port;

import ca.gc.cra.uvcalc.domain.solver.SolverRequest;
import ca.gc.cra.uvcalc.domain.solver.SolverResult;

/**
 * <strong>What:</strong> Port to the external radiative-transfer solver.
 * <p><strong>Why:</strong> The geometric part of the cosine correction comes from a separately installed solver;
 * the pipeline only knows the request/response contract.</p>
 * <p><strong>Thread-safety:</strong> Implementations must support concurrent calls; each call is independent.</p>
 * <p><strong>Error handling:</strong> Failures surface as {@link ca.gc.cra.uvcalc.domain.error.SolverException}; no
 * retry is attempted.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface RadiativeTransferPort {
  /**
   * Runs the solver synchronously.
   *
   * @param request validated request
   * @return parsed columns, one entry per requested output
   */
  SolverResult solve(SolverRequest request);
}
