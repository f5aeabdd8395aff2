/**
 * Outbound ports the ledger core depends on: clock, value transfer, event emission, metrics, and state storage.
 * <p><strong>Role:</strong> Hexagonal boundaries implemented by infrastructure adapters.</p>
 * <p><strong>Concurrency:</strong> Each interface documents its threading contract.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.safekeeper.application.port;
