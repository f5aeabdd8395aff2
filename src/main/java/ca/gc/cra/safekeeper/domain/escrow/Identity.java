package ca.gc.cra.safekeeper.domain.escrow;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Account identity of a party interacting with the ledger.
 * <p><strong>Why:</strong> Nobles, beneficiaries, and the owner are compared by address only; the ledger never
 * authenticates them itself.</p>
 * <p><strong>Role:</strong> Domain value object supplied by the surrounding execution context.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across threads.</p>
 *
 * @param address 20-byte account address rendered as {@code 0x} followed by 40 lower-case hex digits
 * @since 0.1.0
 */
public record Identity(String address) {
  private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-f]{40}$");

  /** The all-zero address; stands for "no identity". */
  public static final Identity NONE = new Identity("0x0000000000000000000000000000000000000000");

  /**
   * Normalizes the address to lower case and validates its shape.
   *
   * @throws NullPointerException if {@code address} is {@code null}
   * @throws IllegalArgumentException if the address is not {@code 0x} plus 40 hex digits
   */
  public Identity {
    Objects.requireNonNull(address, "address");
    address = address.trim().toLowerCase(Locale.ROOT);
    if (!ADDRESS.matcher(address).matches()) {
      throw new IllegalArgumentException("address must be 0x followed by 40 hex digits (was " + address + ")");
    }
  }

  /**
   * Parses an address string.
   *
   * @param address textual address; {@code 0x} prefix optional
   * @return parsed identity
   * @throws IllegalArgumentException if the address is blank or malformed
   */
  public static Identity of(String address) {
    if (address == null || address.isBlank()) {
      throw new IllegalArgumentException("address must not be blank");
    }
    String trimmed = address.trim();
    return new Identity(trimmed.regionMatches(true, 0, "0x", 0, 2) ? trimmed : "0x" + trimmed);
  }

  /**
   * Returns whether the identity is absent, i.e. {@code null} or {@link #NONE}.
   *
   * @param identity candidate identity; may be {@code null}
   * @return {@code true} when no real identity was supplied
   */
  public static boolean isNone(Identity identity) {
    return identity == null || NONE.equals(identity);
  }

  @Override
  public String toString() {
    return address;
  }
}
