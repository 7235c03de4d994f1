package ca.gc.cra.uvcalc.config;

import ca.gc.cra.uvcalc.domain.error.ValidationException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection settings of the EUBREWNET data service.
 *
 * @param baseUrl service root, without trailing slash
 * @param user basic-auth user for protected endpoints
 * @param password basic-auth password for protected endpoints
 * @param timeout connect and request timeout
 * @since 0.1.0
 */
public record EubrewnetSettings(URI baseUrl, Optional<String> user, Optional<String> password, Duration timeout) {

  public EubrewnetSettings {
    Objects.requireNonNull(baseUrl, "baseUrl");
    String raw = baseUrl.toString();
    if (raw.endsWith("/")) {
      baseUrl = URI.create(raw.substring(0, raw.length() - 1));
    }
    user = Objects.requireNonNullElse(user, Optional.empty());
    password = Objects.requireNonNullElse(password, Optional.empty());
    Objects.requireNonNull(timeout, "timeout");
  }

  public static EubrewnetSettings defaults() {
    return new EubrewnetSettings(
        URI.create("http://rbcce.aemet.es/eubrewnet"), Optional.empty(), Optional.empty(), Duration.ofSeconds(30));
  }

  public static EubrewnetSettings fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    EubrewnetSettings d = defaults();
    URI base;
    String rawBase = ConfigValues.string(options, "eubrewnet.baseUrl", d.baseUrl().toString());
    try {
      base = URI.create(rawBase);
    } catch (IllegalArgumentException ex) {
      throw new ValidationException("eubrewnet.baseUrl is not a valid URI: " + rawBase, ex);
    }
    return new EubrewnetSettings(
        base,
        Optional.ofNullable(ConfigValues.string(options, "eubrewnet.user", null)),
        Optional.ofNullable(ConfigValues.string(options, "eubrewnet.password", null)),
        ConfigValues.seconds(options, "eubrewnet.timeoutSeconds", d.timeout()));
  }

  public boolean hasCredentials() {
    return user.isPresent() && password.isPresent();
  }
}
