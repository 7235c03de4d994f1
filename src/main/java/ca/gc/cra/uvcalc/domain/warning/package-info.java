/**
 * Warning sinks threaded through parsing and correction calls.
 */
package ca.gc.cra.uvcalc.domain.warning;
