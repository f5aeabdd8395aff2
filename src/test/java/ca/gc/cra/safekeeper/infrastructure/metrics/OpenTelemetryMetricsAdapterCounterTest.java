package ca.gc.cra.safekeeper.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterCounterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    OpenTelemetryBootstrap.BootstrapResult bootstrap = OpenTelemetryBootstrap.forTesting(reader);
    adapter = new OpenTelemetryMetricsAdapter(bootstrap);
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsRejectionCounterWithKeyAttribute() {
    adapter.increment("ledger.claim.rejected.not_yet_unlocked");
    adapter.increment("ledger.claim.rejected.not_yet_unlocked");
    adapter.forceFlush();

    Collection<MetricData> metrics = reader.collectAllMetrics();
    Optional<MetricData> maybeCounter = metrics.stream()
        .filter(metric -> metric.getName().equals("ledger.claim.rejected.not_yet_unlocked"))
        .findFirst();
    assertTrue(maybeCounter.isPresent(), "Expected counter metric to be exported");

    MetricData counter = maybeCounter.orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    AttributeKey<String> keyAttr = AttributeKey.stringKey("safekeeper.metric.key");
    assertEquals("ledger.claim.rejected.not_yet_unlocked", point.getAttributes().get(keyAttr));

    AttributeKey<String> serviceName = AttributeKey.stringKey("service.name");
    assertEquals("safekeeper", counter.getResource().getAttribute(serviceName));
    AttributeKey<String> serviceNamespace = AttributeKey.stringKey("service.namespace");
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(serviceNamespace));
  }

  @Test
  void sanitizeNameLowercasesAndReplacesIllegalCharacters() {
    assertEquals("ledgerevents.emitted.treasurestored",
        OpenTelemetryMetricsAdapter.sanitizeName("ledgerEvents.emitted.TreasureStored"));
    assertEquals("m1.bad_key", OpenTelemetryMetricsAdapter.sanitizeName("1.bad key"));
    assertEquals("safekeeper.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }
}
