package ca.gc.cra.safekeeper.infrastructure.metrics;

import ca.gc.cra.safekeeper.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; selected by {@code metricsExporter=none}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
