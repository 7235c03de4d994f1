package ca.gc.cra.uvcalc.config;

import ca.gc.cra.uvcalc.domain.error.ValidationException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML and explicit overrides while enforcing cross-key invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence overrides &gt; YAML &gt; defaults.
   *
   * @param profile active configuration profile
   * @param yaml optional YAML-derived settings for the profile
   * @param overrides programmatic overrides (may be empty)
   * @param defaults embedded defaults for the profile
   * @param warn consumer invoked when an override replaces a YAML key
   * @return immutable merged configuration map
   * @throws ValidationException when cross-key validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String profile,
      Optional<Map<String, String>> yaml,
      Map<String, String> overrides,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(profile, "profile");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> overridesCopy = overrides == null ? Map.of() : overrides;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : overridesCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("Override replaces YAML value for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    if (isEubrewnet(effective.get("sources.ozone"))) {
      if (isBlank(effective.get("eubrewnet.user")) || isBlank(effective.get("eubrewnet.password"))) {
        throw new ValidationException(
            "eubrewnet.user and eubrewnet.password are required when sources.ozone=EUBREWNET");
      }
    }
    String exporter = effective.getOrDefault("metricsExporter", "none").trim().toLowerCase(Locale.ROOT);
    if ("otlp".equals(exporter) && isBlank(effective.get("otlpEndpoint"))) {
      throw new ValidationException("otlpEndpoint is required when metricsExporter=otlp");
    }
  }

  private static boolean isEubrewnet(String value) {
    return value != null && value.trim().equalsIgnoreCase(DataSourceKind.EUBREWNET.name());
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
