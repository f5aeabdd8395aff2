package ca.gc.cra.safekeeper.validation;

import java.math.BigInteger;

/**
 * <strong>What:</strong> Numeric validation and parsing helpers for CLI arguments and configuration values.
 * <p><strong>Why:</strong> Fee rates, unlock instants, page bounds, and deposit amounts arrive as text and must be
 * range-checked before they reach the ledger.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no logs; violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name parameter name used in diagnostics; {@code "value"} when blank
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value} for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a signed decimal {@code long}.
   *
   * @param name parameter name used in diagnostics
   * @param raw textual value
   * @return parsed value
   * @throws IllegalArgumentException if the text is blank or not a decimal integer
   */
  public static long parseLong(String name, String raw) {
    String text = Strings.requireNonBlank(name, raw);
    try {
      return Long.parseLong(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was " + text + ")", ex);
    }
  }

  /**
   * Parses a signed decimal {@code int}.
   *
   * @param name parameter name used in diagnostics
   * @param raw textual value
   * @return parsed value
   * @throws IllegalArgumentException if the text is blank, not a decimal integer, or out of {@code int} range
   */
  public static int parseInt(String name, String raw) {
    return (int) requireRange(name, parseLong(name, raw), Integer.MIN_VALUE, Integer.MAX_VALUE);
  }

  /**
   * Parses a non-negative amount in base units; amounts are unbounded.
   *
   * @param name parameter name used in diagnostics
   * @param raw decimal digits, optionally with {@code _} group separators
   * @return parsed amount, never negative
   * @throws IllegalArgumentException if the text is not a non-negative decimal integer
   */
  public static BigInteger parseAmount(String name, String raw) {
    String text = Strings.requireNonBlank(name, raw).replace("_", "");
    BigInteger amount;
    try {
      amount = new BigInteger(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a whole number (was " + raw.trim() + ")", ex);
    }
    if (amount.signum() < 0) {
      throw new IllegalArgumentException(label(name) + " must not be negative (was " + amount + ")");
    }
    return amount;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
