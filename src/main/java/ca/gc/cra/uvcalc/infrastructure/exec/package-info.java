/**
 * Thread-pool construction for the job scheduler.
 *
 * <p><strong>Concurrency:</strong> Pools are fixed-size with daemon, named worker threads.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.uvcalc.infrastructure.exec;
