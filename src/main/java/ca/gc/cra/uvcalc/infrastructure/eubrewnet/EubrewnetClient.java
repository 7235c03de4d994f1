package ca.gc.cra.uvcalc.infrastructure.eubrewnet;

import ca.gc.cra.uvcalc.config.EubrewnetSettings;
import ca.gc.cra.uvcalc.domain.error.DataSourceException;
import ca.gc.cra.uvcalc.logging.Logs;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Thin HTTP client for the EUBREWNET data service.
 * <p><strong>Why:</strong> UV scans, calibrations and ozone can be fetched from the network instead of local
 * files; all three endpoints return JSON arrays.</p>
 * <p><strong>Failure model:</strong> a non-200 status or an undecodable body raises
 * {@link DataSourceException} naming the URL; transport failures propagate as {@link IOException}. Requests are
 * never retried.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; the underlying {@link HttpClient} is shared.</p>
 *
 * @since 0.1.0
 */
public final class EubrewnetClient {
  private static final Logger log = LoggerFactory.getLogger(EubrewnetClient.class);
  private static final int BODY_EXCERPT_CHARS = 200;

  private final EubrewnetSettings settings;
  private final HttpClient httpClient;
  private final JsonSupport json = new JsonSupport();

  public EubrewnetClient(EubrewnetSettings settings) {
    this(settings, HttpClient.newBuilder()
        .connectTimeout(Objects.requireNonNull(settings, "settings").timeout())
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build());
  }

  EubrewnetClient(EubrewnetSettings settings, HttpClient httpClient) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
  }

  /**
   * Issues a GET against {@code baseUrl + path} and decodes the JSON body.
   *
   * @param path endpoint path starting with {@code /}
   * @param query query parameters in insertion order
   * @param authenticated whether to send HTTP basic credentials
   * @return decoded object graph
   * @throws IOException on transport failure or interruption
   * @throws DataSourceException on an error status or malformed body
   */
  Object getJson(String path, Map<String, String> query, boolean authenticated) throws IOException {
    URI uri = uri(path, query);
    HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
        .timeout(settings.timeout())
        .header("Accept", "application/json")
        .GET();
    if (authenticated) {
      if (!settings.hasCredentials()) {
        throw new DataSourceException("EUBREWNET credentials are required for " + uri);
      }
      String token = settings.user().get() + ":" + settings.password().get();
      builder.header("Authorization",
          "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8)));
    }
    log.info("Retrieving data from {}", uri);
    HttpResponse<String> response;
    try {
      response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      InterruptedIOException interrupted = new InterruptedIOException("Interrupted while requesting " + uri);
      interrupted.initCause(ex);
      throw interrupted;
    }
    if (response.statusCode() != 200) {
      throw new DataSourceException("Error while trying to access eubrewnet (" + uri + "). HTTP "
          + response.statusCode() + ": " + Logs.truncate(response.body(), BODY_EXCERPT_CHARS));
    }
    try {
      return json.parse(response.body());
    } catch (IllegalArgumentException ex) {
      throw new DataSourceException("Invalid JSON returned by " + uri, ex);
    }
  }

  URI uri(String path, Map<String, String> query) {
    StringJoiner joiner = new StringJoiner("&", "?", "");
    joiner.setEmptyValue("");
    query.forEach((key, value) -> joiner.add(
        URLEncoder.encode(key, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8)));
    return URI.create(settings.baseUrl() + path + joiner);
  }
}
