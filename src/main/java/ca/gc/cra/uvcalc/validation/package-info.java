/**
 * <strong>Purpose:</strong> Input validation helpers shared by configuration records and parsers.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> No logs or metrics; failures raise {@link java.lang.IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.uvcalc.validation;
