package ca.gc.cra.safekeeper.domain.escrow;

import java.util.Locale;

/**
 * <strong>What:</strong> When the ledger charges its fee rate.
 * <p><strong>Role:</strong> Configuration switch chosen at deployment and persisted with the ledger state.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum FeePolicy {
  /** Fee on deposit only; a claim pays out the full stored amount. */
  STORE_ONLY,
  /** Fee on deposit and again on the stored amount at claim time. */
  STORE_AND_CLAIM;

  /**
   * Returns whether claims are charged.
   *
   * @return {@code true} for {@link #STORE_AND_CLAIM}
   */
  public boolean chargesOnClaim() {
    return this == STORE_AND_CLAIM;
  }

  /**
   * Parses a policy name, defaulting to {@link #STORE_AND_CLAIM} when blank.
   *
   * @param value textual policy such as {@code store_only}; hyphens are accepted in place of underscores
   * @return parsed policy
   * @throws IllegalArgumentException if the value does not name a policy
   */
  public static FeePolicy fromString(String value) {
    if (value == null || value.isBlank()) {
      return STORE_AND_CLAIM;
    }
    try {
      return FeePolicy.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown feePolicy: " + value, ex);
    }
  }
}
