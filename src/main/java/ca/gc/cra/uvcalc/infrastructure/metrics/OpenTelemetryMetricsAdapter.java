package ca.gc.cra.uvcalc.infrastructure.metrics;

import ca.gc.cra.uvcalc.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} that forwards scheduler and solver metrics to OpenTelemetry.
 * <p><strong>Behaviour:</strong> every key becomes a lazily created counter or long histogram whose name is the
 * key lower-cased with unsupported characters replaced by {@code _}; the original key is kept as the
 * {@code uvcalc.metric.key} attribute.</p>
 * <p><strong>Lifecycle:</strong> {@link #close()} flushes and shuts down the meter provider; call it once the batch
 * has finished.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("uvcalc.metric.key");
  private static final String FALLBACK_METRIC_NAME = "uvcalc.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /**
   * @param exporter {@code otlp} or {@code none}
   * @param endpoint OTLP collector endpoint, ignored for {@code none}
   */
  public OpenTelemetryMetricsAdapter(String exporter, String endpoint) {
    this(OpenTelemetryBootstrap.initialize(exporter, endpoint));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Instrument<LongCounter> instrument = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), k ->
        new Instrument<>(meter.counterBuilder(sanitizeName(k))
            .setUnit("1")
            .setDescription("UVCALC counter for " + k)
            .build(), Attributes.of(METRIC_KEY_ATTRIBUTE, k)));
    instrument.delegate().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Instrument<LongHistogram> instrument = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), k ->
        new Instrument<>(meter.histogramBuilder(sanitizeName(k))
            .ofLongs()
            .setDescription("UVCALC observation for " + k)
            .build(), Attributes.of(METRIC_KEY_ATTRIBUTE, k)));
    instrument.delegate().record(value, instrument.attributes());
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private record Instrument<T>(T delegate, Attributes attributes) {}
}
