package ca.gc.cra.safekeeper.domain.events;

import java.util.Map;

/**
 * <strong>What:</strong> Append-only notification emitted after a ledger operation commits.
 * <p><strong>Role:</strong> Domain event consumed by {@code LedgerEventEmitter} adapters (logs, Kafka, tests).</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable records.</p>
 *
 * @since 0.1.0
 */
public interface LedgerEvent {
  /**
   * Returns the event name, e.g. {@code TreasureStored}.
   *
   * @return stable event name used by serializers and log lines
   */
  String type();

  /**
   * Returns the ledger clock reading at which the operation committed.
   *
   * @return epoch seconds
   */
  long occurredAt();

  /**
   * Returns the event payload as ordered name/value pairs, excluding {@link #type()} and {@link #occurredAt()}.
   *
   * @return unmodifiable attributes; amounts are rendered as decimal strings
   */
  Map<String, String> attributes();
}
