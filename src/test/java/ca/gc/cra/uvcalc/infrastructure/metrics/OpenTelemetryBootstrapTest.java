package ca.gc.cra.uvcalc.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {

  @Test
  void exporterNoneFallsBackToNoop() {
    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize("none", null);
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.close();
  }

  @Test
  void unknownExporterFallsBackToNoop() {
    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize("prometheus", null);
    assertTrue(result.isNoop());
    result.close();
  }

  @Test
  void noopAdapterAcceptsCalls() {
    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter(null, null)) {
      adapter.increment("scheduler.jobs.submitted");
      adapter.observe("scheduler.job.latencyMillis", 5);
    }
  }
}
