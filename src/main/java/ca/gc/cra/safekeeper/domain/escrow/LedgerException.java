package ca.gc.cra.safekeeper.domain.escrow;

import java.util.Objects;
import java.util.Optional;

/**
 * Unchecked exception raised when the ledger rejects an operation.
 *
 * <p>A rejected operation leaves every piece of ledger state exactly as it was before the call.</p>
 *
 * @since 0.1.0
 */
public final class LedgerException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final LedgerErrorKind kind;
  private final transient Identity account;

  /**
   * Creates an exception using the kind's default message.
   *
   * @param kind rejection reason; must not be {@code null}
   */
  public LedgerException(LedgerErrorKind kind) {
    this(kind, null, null);
  }

  /**
   * Creates an exception naming the account that triggered it.
   *
   * @param kind rejection reason; must not be {@code null}
   * @param account offending account, e.g. the unauthorized caller; may be {@code null}
   */
  public LedgerException(LedgerErrorKind kind, Identity account) {
    this(kind, account, null);
  }

  /**
   * Creates an exception with an underlying cause.
   *
   * @param kind rejection reason; must not be {@code null}
   * @param account offending account; may be {@code null}
   * @param cause root cause, e.g. the failure thrown by a value transfer; may be {@code null}
   */
  public LedgerException(LedgerErrorKind kind, Identity account, Throwable cause) {
    super(message(Objects.requireNonNull(kind, "kind"), account), cause);
    this.kind = kind;
    this.account = account;
  }

  /**
   * Returns the rejection reason.
   *
   * @return error kind
   */
  public LedgerErrorKind kind() {
    return kind;
  }

  /**
   * Returns the account named by the rejection, if any.
   *
   * @return offending account
   */
  public Optional<Identity> account() {
    return Optional.ofNullable(account);
  }

  private static String message(LedgerErrorKind kind, Identity account) {
    return account == null ? kind.message() : kind.message() + " (account " + account + ")";
  }
}
