/**
 * <strong>Purpose:</strong> Ledger use case: treasure custody, fee accounting, and ownership.
 * <p><strong>Role:</strong> Application core; depends only on domain types and the ports in
 * {@code ca.gc.cra.safekeeper.application.port}.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.safekeeper.application.ledger.SafeKeeperLedger} serializes all
 * calls; mutating calls reject re-entry from inside a value transfer.</p>
 * <p><strong>Observability:</strong> Emits {@code ledger.*} counters through {@code MetricsPort}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.safekeeper.application.ledger;
