package ca.gc.cra.safekeeper.domain.escrow;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Result of applying a fee rate to a gross amount.
 *
 * @param fee portion retained by the fee pool
 * @param net portion left for the treasure or the payout; {@code fee + net} equals the gross amount
 * @since 0.1.0
 */
public record FeeSplit(BigInteger fee, BigInteger net) {
  public FeeSplit {
    Objects.requireNonNull(fee, "fee");
    Objects.requireNonNull(net, "net");
  }

  /**
   * Returns the gross amount the split was computed from.
   *
   * @return {@code fee + net}
   */
  public BigInteger gross() {
    return fee.add(net);
  }
}
