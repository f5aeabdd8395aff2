package ca.gc.cra.safekeeper.application.port;

import ca.gc.cra.safekeeper.domain.events.LedgerEvent;

/**
 * <strong>What:</strong> Port for publishing committed ledger notifications.
 * <p><strong>Why:</strong> Keeps the ledger core decoupled from delivery transports (logging, Kafka, tests).</p>
 * <p><strong>Role:</strong> Outbound port implemented by adapters that forward {@link LedgerEvent} instances.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from any thread.</p>
 *
 * @since 0.1.0
 */
public interface LedgerEventEmitter extends AutoCloseable {
  /**
   * Emits a ledger event.
   *
   * @param event event payload; never {@code null}
   */
  void emit(LedgerEvent event);

  /**
   * Default no-op implementation for tests or disabled sinks.
   */
  LedgerEventEmitter NO_OP = new LedgerEventEmitter() {
    @Override public void emit(LedgerEvent event) {}

    @Override public void close() {}
  };

  @Override
  default void close() {}
}
