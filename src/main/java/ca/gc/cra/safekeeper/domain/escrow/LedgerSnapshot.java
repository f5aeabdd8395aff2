package ca.gc.cra.safekeeper.domain.escrow;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable copy of the complete persisted ledger state.
 * <p><strong>Why:</strong> State adapters save and restore the ledger between CLI invocations.</p>
 * <p><strong>Role:</strong> Domain value exchanged with {@code LedgerStatePort}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe across threads.</p>
 *
 * <p>The per-identity index tables are not stored: they are rebuilt from {@link #treasures()}, whose
 * order is creation order.</p>
 *
 * @param nextTreasureId id the next deposit receives; equals {@code treasures.size()}
 * @param feeBasisPoints current fee rate in {@code [0, 10000]}
 * @param feePolicy when the fee rate is charged
 * @param owner administrator identity; {@link Identity#NONE} once ownership was renounced
 * @param collectedFees withdrawable fee pool
 * @param heldValue total value currently held by the ledger
 * @param treasures every treasure ever created, ordered by id
 * @since 0.1.0
 */
public record LedgerSnapshot(
    long nextTreasureId,
    int feeBasisPoints,
    FeePolicy feePolicy,
    Identity owner,
    BigInteger collectedFees,
    BigInteger heldValue,
    List<Treasure> treasures) {

  /**
   * Validates cross-field invariants and defensively copies the treasure list.
   *
   * @throws IllegalArgumentException if the snapshot is internally inconsistent or a treasure names the zero
   *     address as its noble or beneficiary
   */
  public LedgerSnapshot {
    Objects.requireNonNull(feePolicy, "feePolicy");
    Objects.requireNonNull(owner, "owner");
    Objects.requireNonNull(collectedFees, "collectedFees");
    Objects.requireNonNull(heldValue, "heldValue");
    treasures = treasures == null ? List.of() : List.copyOf(treasures);
    if (!FeeCalculator.isValidRate(feeBasisPoints)) {
      throw new IllegalArgumentException("feeBasisPoints out of range: " + feeBasisPoints);
    }
    if (nextTreasureId != treasures.size()) {
      throw new IllegalArgumentException(
          "nextTreasureId " + nextTreasureId + " does not match " + treasures.size() + " treasures");
    }
    BigInteger escrowed = BigInteger.ZERO;
    for (int i = 0; i < treasures.size(); i++) {
      Treasure treasure = treasures.get(i);
      if (treasure.id() != i) {
        throw new IllegalArgumentException("treasure at position " + i + " has id " + treasure.id());
      }
      if (Identity.isNone(treasure.noble()) || Identity.isNone(treasure.beneficiary())) {
        throw new IllegalArgumentException("treasure " + i + " must have a noble and a beneficiary");
      }
      escrowed = escrowed.add(treasure.amount());
    }
    if (collectedFees.signum() < 0 || !heldValue.equals(escrowed.add(collectedFees))) {
      throw new IllegalArgumentException(
          "heldValue " + heldValue + " must equal escrowed " + escrowed + " plus fees " + collectedFees);
    }
  }

  /**
   * Returns the state of a freshly deployed ledger.
   *
   * @param owner deployer identity; must not be {@link Identity#NONE}
   * @param feeBasisPoints initial fee rate
   * @param feePolicy fee policy
   * @return empty snapshot
   * @throws IllegalArgumentException if the owner is absent
   */
  public static LedgerSnapshot genesis(Identity owner, int feeBasisPoints, FeePolicy feePolicy) {
    if (Identity.isNone(owner)) {
      throw new IllegalArgumentException("owner must be a valid address");
    }
    return new LedgerSnapshot(
        0L, feeBasisPoints, feePolicy, owner, BigInteger.ZERO, BigInteger.ZERO, List.of());
  }
}
