package ca.gc.cra.uvcalc.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.uvcalc.domain.error.ValidationException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {
  private static final Map<String, String> DEFAULTS = ConfigDefaults.asFlatMap("calculation");

  @Test
  void overridesReplaceYamlAndEmitWarning() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "calculation",
        Optional.of(Map.of("arfColumn", "2", "noCoscor", "true")),
        Map.of("arfColumn", "5"),
        DEFAULTS,
        warnings::add);

    assertEquals("5", merged.get("arfColumn"));
    assertEquals("true", merged.get("noCoscor"));
    assertEquals("0.04", merged.get("defaults.albedo"));
    assertEquals(List.of("Override replaces YAML value for key: arfColumn"), warnings);
  }

  @Test
  void nullOverrideValuesAreIgnored() {
    Map<String, String> overrides = new HashMap<>();
    overrides.put("arfColumn", null);

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "calculation", Optional.empty(), overrides, DEFAULTS, msg -> {});

    assertEquals("3", merged.get("arfColumn"));
  }

  @Test
  void eubrewnetOzoneRequiresCredentials() {
    assertThrows(ValidationException.class, () -> ConfigMerger.buildEffectiveConfig(
        "calculation", Optional.empty(), Map.of("sources.ozone", "eubrewnet"), DEFAULTS, msg -> {}));

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "calculation",
        Optional.of(Map.of("eubrewnet.user", "brewer", "eubrewnet.password", "s3cret")),
        Map.of("sources.ozone", "EUBREWNET"),
        DEFAULTS,
        msg -> {});
    assertEquals("EUBREWNET", merged.get("sources.ozone"));
  }

  @Test
  void otlpExporterRequiresEndpoint() {
    assertThrows(ValidationException.class, () -> ConfigMerger.buildEffectiveConfig(
        "calculation", Optional.empty(), Map.of("metricsExporter", "OTLP", "otlpEndpoint", " "), DEFAULTS,
        msg -> {}));
  }
}
