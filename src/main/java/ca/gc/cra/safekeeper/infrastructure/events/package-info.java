/**
 * Ledger event emitters: structured logging and in-memory capture.
 * <p><strong>Concurrency:</strong> Emitters are thread-safe.</p>
 * <p><strong>Metrics:</strong> The logging emitter counts {@code ledgerEvents.emitted.<type>}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.safekeeper.infrastructure.events;
