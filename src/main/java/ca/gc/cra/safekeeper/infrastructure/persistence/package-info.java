/**
 * Ledger state persistence adapters.
 * <p><strong>Concurrency:</strong> One writer per state file.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.safekeeper.infrastructure.persistence;
