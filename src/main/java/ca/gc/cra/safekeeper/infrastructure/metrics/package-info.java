/**
 * Metrics adapters bridging {@link ca.gc.cra.safekeeper.application.port.MetricsPort} to OpenTelemetry or a no-op.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes the {@code ledger.*} and {@code ledgerEvents.*} namespaces.</p>
 * <p><strong>Security:</strong> Only counters and numeric observations leave the process; no addresses.</p>
 */
package ca.gc.cra.safekeeper.infrastructure.metrics;
