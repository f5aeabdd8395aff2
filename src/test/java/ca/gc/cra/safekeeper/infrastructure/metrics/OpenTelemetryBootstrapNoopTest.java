package ca.gc.cra.safekeeper.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {
  private String previousExporter;

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");

    OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter(result);
    adapter.increment("ledger.store.success");
    adapter.close();
  }

  @Test
  void malformedResourceAttributesAreSkipped() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("env=test, broken, =x,team=ledger");

    assertEquals(2, attributes.size());
    assertEquals("ledger", attributes.get(AttributeKey.stringKey("team")));
  }
}
