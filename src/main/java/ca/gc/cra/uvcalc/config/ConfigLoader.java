package ca.gc.cra.uvcalc.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads the effective {@link UvcalcConfig} of a run.
 * <p><strong>Why:</strong> Keeps the precedence rules (overrides, YAML, defaults) in one place for every entry
 * point.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 * <p><strong>Observability:</strong> Logs the configuration origin at INFO and override conflicts at WARN.</p>
 *
 * @since 0.1.0
 */
public final class ConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

  private ConfigLoader() {}

  /**
   * @param yamlPath optional YAML file; a missing file means defaults only
   * @param overrides highest-precedence key/value pairs
   * @return validated configuration
   * @throws IOException when the YAML file exists but cannot be read
   */
  public static UvcalcConfig load(Path yamlPath, Map<String, String> overrides) throws IOException {
    String profile = ConfigDefaults.CALCULATION_PROFILE;
    Optional<Map<String, String>> yaml =
        yamlPath == null ? Optional.empty() : YamlConfigLoader.load(yamlPath, profile);
    if (yaml.isPresent()) {
      log.info("Loaded configuration from {}", yamlPath);
    } else {
      log.info("No configuration file found; using defaults");
    }
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        profile, yaml, overrides, ConfigDefaults.asFlatMap(profile), log::warn);
    return UvcalcConfig.fromMap(effective);
  }
}
