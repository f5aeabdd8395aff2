package ca.gc.cra.safekeeper.domain.escrow;

import java.math.BigInteger;
import java.util.Objects;

/**
 * <strong>What:</strong> Basis-point fee arithmetic shared by deposits and claims.
 * <p><strong>Why:</strong> Keeps truncating division in one place so {@code fee + net} always equals the gross
 * amount and no value is created or lost.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 */
public final class FeeCalculator {
  /** Denominator of a basis-point rate; a rate of {@value} is 100%. */
  public static final int BASIS_POINTS_DENOMINATOR = 10_000;

  private static final BigInteger DENOMINATOR = BigInteger.valueOf(BASIS_POINTS_DENOMINATOR);

  private FeeCalculator() {
    // Utility
  }

  /**
   * Splits {@code gross} into fee and net using floor division.
   *
   * @param gross non-negative amount in the smallest value unit
   * @param basisPoints rate in {@code [0, 10000]}
   * @return fee and net portions
   * @throws IllegalArgumentException if {@code gross} is negative or the rate is out of range
   */
  public static FeeSplit split(BigInteger gross, int basisPoints) {
    Objects.requireNonNull(gross, "gross");
    if (gross.signum() < 0) {
      throw new IllegalArgumentException("gross must not be negative (was " + gross + ")");
    }
    requireValidRate(basisPoints);
    if (gross.signum() == 0 || basisPoints == 0) {
      return new FeeSplit(BigInteger.ZERO, gross);
    }
    BigInteger fee = gross.multiply(BigInteger.valueOf(basisPoints)).divide(DENOMINATOR);
    return new FeeSplit(fee, gross.subtract(fee));
  }

  /**
   * Returns whether the rate lies within {@code [0, 10000]}.
   *
   * @param basisPoints candidate rate
   * @return {@code true} when the rate is usable
   */
  public static boolean isValidRate(int basisPoints) {
    return basisPoints >= 0 && basisPoints <= BASIS_POINTS_DENOMINATOR;
  }

  private static void requireValidRate(int basisPoints) {
    if (!isValidRate(basisPoints)) {
      throw new IllegalArgumentException(
          "basisPoints must be between 0 and " + BASIS_POINTS_DENOMINATOR + " (was " + basisPoints + ")");
    }
  }
}
