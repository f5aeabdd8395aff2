/**
 * Escrow domain model: treasures, identities, fee arithmetic, and the mutable ledger aggregate.
 * <p><strong>Role:</strong> Domain layer with no infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Value types are immutable; {@link ca.gc.cra.safekeeper.domain.escrow.LedgerState}
 * relies on its owning ledger for serialization.</p>
 * <p><strong>Security:</strong> Amounts use {@link java.math.BigInteger} so arithmetic never overflows.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.safekeeper.domain.escrow;
