package ca.gc.cra.safekeeper.infrastructure.events;

import ca.gc.cra.safekeeper.application.port.LedgerEventEmitter;
import ca.gc.cra.safekeeper.application.port.MetricsPort;
import ca.gc.cra.safekeeper.domain.events.LedgerEvent;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits ledger events to structured logs and counts them per type.
 *
 * @since 0.1.0
 */
public final class LoggingLedgerEventEmitter implements LedgerEventEmitter {
  private static final Logger log = LoggerFactory.getLogger(LoggingLedgerEventEmitter.class);

  private final MetricsPort metrics;
  private final String metricPrefix;

  /**
   * Creates a logging emitter.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param metricPrefix prefix for emitted counters; {@code ledgerEvents} when blank
   */
  public LoggingLedgerEventEmitter(MetricsPort metrics, String metricPrefix) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix = metricPrefix == null || metricPrefix.isBlank() ? "ledgerEvents" : metricPrefix.trim();
  }

  /**
   * Creates a logging emitter using {@code ledgerEvents} as the metric prefix.
   *
   * @param metrics metrics adapter; may be {@code null}
   */
  public LoggingLedgerEventEmitter(MetricsPort metrics) {
    this(metrics, "ledgerEvents");
  }

  @Override
  public void emit(LedgerEvent event) {
    Objects.requireNonNull(event, "event");
    metrics.increment(metricPrefix + ".emitted." + event.type());

    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("type=" + event.type());
    for (Map.Entry<String, String> entry : event.attributes().entrySet()) {
      joiner.add(entry.getKey() + '=' + entry.getValue());
    }
    joiner.add("occurredAt=" + event.occurredAt());
    log.info("ledger.event {}", joiner);
  }
}
