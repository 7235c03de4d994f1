/**
 * Configuration loading and object wiring.
 *
 * <p><strong>Purpose:</strong> Turn defaults, an optional YAML file and key/value overrides into a validated
 * {@link ca.gc.cra.uvcalc.config.UvcalcConfig}, then wire adapters through
 * {@link ca.gc.cra.uvcalc.config.CompositionRoot}.</p>
 * <p><strong>Precedence:</strong> overrides, then YAML ({@code common} merged with the profile section), then
 * {@link ca.gc.cra.uvcalc.config.ConfigDefaults}.</p>
 * <p><strong>Concurrency:</strong> Settings records are immutable and shared by every job.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.uvcalc.config;
