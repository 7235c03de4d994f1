package ca.gc.cra.uvcalc.config;

import java.util.Map;
import java.util.Objects;

/**
 * Effective configuration of one run, assembled from defaults, YAML and overrides.
 *
 * @param calculation physical settings and data origins
 * @param scheduler worker pool sizing and timeouts
 * @param solver solver launch settings
 * @param eubrewnet network service settings
 * @param metricsExporter {@code otlp} or {@code none}
 * @param otlpEndpoint OTLP collector endpoint
 * @param verbose raises the root log level to DEBUG
 * @since 0.1.0
 */
public record UvcalcConfig(
    CalculationSettings calculation,
    SchedulerSettings scheduler,
    SolverSettings solver,
    EubrewnetSettings eubrewnet,
    String metricsExporter,
    String otlpEndpoint,
    boolean verbose) {

  public UvcalcConfig {
    Objects.requireNonNull(calculation, "calculation");
    Objects.requireNonNull(scheduler, "scheduler");
    Objects.requireNonNull(solver, "solver");
    Objects.requireNonNull(eubrewnet, "eubrewnet");
    metricsExporter = Objects.requireNonNullElse(metricsExporter, "none");
    otlpEndpoint = Objects.requireNonNullElse(otlpEndpoint, "");
  }

  public static UvcalcConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    return new UvcalcConfig(
        CalculationSettings.fromMap(options),
        SchedulerSettings.fromMap(options),
        SolverSettings.fromMap(options),
        EubrewnetSettings.fromMap(options),
        ConfigValues.string(options, "metricsExporter", "none"),
        ConfigValues.string(options, "otlpEndpoint", ""),
        ConfigValues.bool(options, "verbose", false));
  }
}
