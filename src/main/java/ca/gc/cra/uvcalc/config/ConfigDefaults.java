package ca.gc.cra.uvcalc.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each configuration profile.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class ConfigDefaults {
  /** Profile used for batch irradiance calculations. */
  public static final String CALCULATION_PROFILE = "calculation";

  private ConfigDefaults() {}

  /**
   * @param profile configuration profile; only {@value #CALCULATION_PROFILE} is known
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String profile) {
    Objects.requireNonNull(profile, "profile");
    String normalized = profile.trim().toLowerCase(Locale.ROOT);
    if (!CALCULATION_PROFILE.equals(normalized)) {
      throw new IllegalArgumentException("Unsupported profile: " + profile);
    }
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otlpEndpoint", "http://localhost:4317");
    map.put("verbose", "false");

    CalculationSettings calc = CalculationSettings.defaults();
    map.put("arfColumn", Integer.toString(calc.arfColumn()));
    map.put("noCoscor", Boolean.toString(calc.noCoscor()));
    map.put("temperatureCorrection.factor", Double.toString(calc.temperatureCorrectionFactor()));
    map.put("temperatureCorrection.reference", Double.toString(calc.temperatureCorrectionReference()));
    map.put("defaults.albedo", Double.toString(calc.defaultAlbedo()));
    map.put("defaults.aerosol.alpha", Double.toString(calc.defaultAerosol().alpha()));
    map.put("defaults.aerosol.beta", Double.toString(calc.defaultAerosol().beta()));
    map.put("defaults.ozone", Double.toString(calc.defaultOzone()));
    map.put("defaults.straylight", calc.defaultStraylight().name());
    map.put("sources.uv", calc.uvDataSource().name());
    map.put("sources.ozone", calc.ozoneDataSource().name());
    map.put("sources.uvr", calc.uvrDataSource().name());
    map.put("sources.brewerModel", calc.brewerModelDataSource().name());

    SchedulerSettings scheduler = SchedulerSettings.defaults();
    map.put("scheduler.maxThreads", Integer.toString(scheduler.maxThreads()));
    map.put("scheduler.threadSurplus", Integer.toString(scheduler.threadSurplus()));
    map.put("scheduler.jobTimeoutSeconds", Long.toString(scheduler.jobTimeout().toSeconds()));
    map.put("scheduler.initTimeoutSeconds", Long.toString(scheduler.initTimeout().toSeconds()));

    SolverSettings solver = SolverSettings.defaults();
    map.put("solver.command", String.join(" ", solver.command()));
    map.put("solver.workDirectory", solver.workDirectory().toString());
    map.put("solver.dataPath", solver.dataPath());

    EubrewnetSettings eubrewnet = EubrewnetSettings.defaults();
    map.put("eubrewnet.baseUrl", eubrewnet.baseUrl().toString());
    map.put("eubrewnet.timeoutSeconds", Long.toString(eubrewnet.timeout().toSeconds()));
    return Map.copyOf(map);
  }
}
