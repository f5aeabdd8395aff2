package ca.gc.cra.safekeeper.api;

import ca.gc.cra.safekeeper.validation.Net;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies telemetry-related settings to the active JVM for OpenTelemetry bootstrapping.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Copies {@code metricsExporter}, {@code otelEndpoint}, and {@code otelResourceAttributes} into the
   * {@code otel.*} system properties read by the metrics bootstrap. Blank values leave the properties untouched.
   *
   * @param options effective configuration
   * @throws IllegalArgumentException if a value is malformed
   */
  static void configureMetrics(Map<String, String> options) {
    if (options == null || options.isEmpty()) {
      return;
    }
    String exporter = trim(options.get("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty()) {
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Configuring OpenTelemetry metrics exporter: {}", exporter);
      System.setProperty("otel.metrics.exporter", exporter);
    }

    String endpoint = trim(options.get("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      Net.validateHttpEndpoint(endpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }

    String attributes = trim(options.get("otelResourceAttributes"));
    if (!attributes.isEmpty()) {
      if (attributes.length() > MAX_RESOURCE_ATTRIBUTES_LENGTH) {
        throw new IllegalArgumentException(
            "otelResourceAttributes must be at most " + MAX_RESOURCE_ATTRIBUTES_LENGTH + " characters");
      }
      log.debug("Configuring OTEL_RESOURCE_ATTRIBUTES override");
      System.setProperty("otel.resource.attributes", attributes);
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
