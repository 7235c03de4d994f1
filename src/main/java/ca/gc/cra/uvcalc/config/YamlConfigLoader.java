package ca.gc.cra.uvcalc.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads UVCALC configuration from a YAML document and flattens sections into dotted key/value maps.
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and overlays the {@code profile} section on the {@code common} section.
   *
   * <p>Nested mappings become dotted keys ({@code defaults.aerosol.alpha}); lists of scalars are joined with a
   * single space, which is how {@code solver.command} may be written as a list.</p>
   *
   * @param path location of the YAML configuration
   * @param profile configuration profile (for example {@code calculation})
   * @return flat map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String profile) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(profile, "profile");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    String normalizedProfile = profile.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");

      Map<String, String> flattened = new LinkedHashMap<>();
      Object common = findSection(root, "common");
      if (common != null) {
        flatten(asMap(common, "common"), "", flattened);
      }
      Object profileSection = findSection(root, normalizedProfile);
      if (profileSection != null) {
        flatten(asMap(profileSection, normalizedProfile), "", flattened);
      }
      return Optional.of(Map.copyOf(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?> items) {
        target.put(composite, joinScalars(composite, items));
      } else {
        target.put(composite, value.toString());
      }
    }
  }

  private static String joinScalars(String key, Iterable<?> items) {
    StringJoiner joiner = new StringJoiner(" ");
    for (Object item : items) {
      if (item == null || item instanceof Map<?, ?> || item instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML list for key " + key + " must only contain scalars");
      }
      joiner.add(item.toString());
    }
    return joiner.toString();
  }
}
