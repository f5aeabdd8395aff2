package ca.gc.cra.safekeeper.domain.escrow;

import java.math.BigInteger;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable snapshot of one escrow entry held by the ledger.
 * <p><strong>Why:</strong> Lookups hand out snapshots so callers can never mutate ledger state.</p>
 * <p><strong>Role:</strong> Domain value returned by {@code treasureDetails} and persisted by state adapters.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe across threads.</p>
 *
 * @param id dense zero-based sequence number assigned at creation
 * @param amount remaining claimable amount in the smallest value unit; zero once claimed
 * @param unlockTime epoch seconds before which claims are rejected
 * @param claimed {@code true} once the beneficiary has claimed
 * @param noble identity that deposited the value
 * @param beneficiary sole identity allowed to claim
 * @since 0.1.0
 */
public record Treasure(
    long id,
    BigInteger amount,
    long unlockTime,
    boolean claimed,
    Identity noble,
    Identity beneficiary) {

  /**
   * Validates the record invariants.
   *
   * @throws IllegalArgumentException if the id or amount is negative, or a claimed treasure still holds value
   */
  public Treasure {
    Objects.requireNonNull(amount, "amount");
    Objects.requireNonNull(noble, "noble");
    Objects.requireNonNull(beneficiary, "beneficiary");
    if (id < 0) {
      throw new IllegalArgumentException("id must not be negative (was " + id + ")");
    }
    if (amount.signum() < 0) {
      throw new IllegalArgumentException("amount must not be negative (was " + amount + ")");
    }
    if (claimed && amount.signum() != 0) {
      throw new IllegalArgumentException("claimed treasure " + id + " must hold zero amount");
    }
  }

  /**
   * Returns the terminal form of this treasure: claimed, with nothing left to claim.
   *
   * @return claimed copy of this treasure
   */
  public Treasure markClaimed() {
    return new Treasure(id, BigInteger.ZERO, unlockTime, true, noble, beneficiary);
  }

  /**
   * Returns whether the treasure can be claimed at the supplied instant.
   *
   * @param nowEpochSeconds current instant
   * @return {@code true} when {@code nowEpochSeconds >= unlockTime}
   */
  public boolean isUnlockedAt(long nowEpochSeconds) {
    return nowEpochSeconds >= unlockTime;
  }
}
