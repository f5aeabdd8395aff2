package ca.gc.cra.safekeeper.domain.escrow;

import java.util.Locale;

/**
 * <strong>What:</strong> Reasons a ledger operation is rejected.
 * <p><strong>Why:</strong> Callers branch on the kind; the message is the operator-facing text.</p>
 * <p><strong>Observability:</strong> Kinds appear in metric keys such as {@code ledger.claim.rejected.not_beneficiary}.</p>
 *
 * @since 0.1.0
 */
public enum LedgerErrorKind {
  /** Beneficiary is missing or the zero address. */
  INVALID_BENEFICIARY("Beneficiary must be a valid address."),
  /** Deposit carried no value. */
  ZERO_VALUE("Treasure value must be greater than zero."),
  /** Unlock instant is not strictly after the current instant. */
  UNLOCK_TIME_IN_PAST("Unlock time must be in the future."),
  /** No treasure exists for the id. */
  NOT_FOUND("Treasure does not exist."),
  /** Caller is not the treasure's beneficiary. */
  NOT_BENEFICIARY("Not the beneficiary of this treasure."),
  /** Treasure was claimed before. */
  ALREADY_CLAIMED("Treasure already claimed."),
  /** Unlock instant has not been reached. */
  NOT_YET_UNLOCKED("Treasure not yet unlocked."),
  /** Treasure holds no value. */
  NOTHING_TO_CLAIM("No funds to claim."),
  /** Caller is not the owner. */
  UNAUTHORIZED("Caller is not the owner."),
  /** Fee rate above 10000 basis points. */
  FEE_TOO_HIGH("Fee cannot exceed 100%"),
  /** Fee rate below zero. */
  INVALID_FEE("Fee cannot be negative"),
  /** Fee withdrawal recipient is missing or the zero address. */
  INVALID_RECIPIENT("Recipient cannot be zero address"),
  /** New owner is missing or the zero address. */
  INVALID_OWNER("New owner cannot be zero address"),
  /** Value transfer port reported failure or threw. */
  TRANSFER_FAILED("Transfer failed."),
  /** A ledger operation was invoked while another one was executing on the same thread. */
  REENTRANT_CALL("ReentrancyGuard: reentrant call");

  private final String message;

  LedgerErrorKind(String message) {
    this.message = message;
  }

  /**
   * Returns the default operator-facing message.
   *
   * @return message text
   */
  public String message() {
    return message;
  }

  /**
   * Returns the lower-case token used in metric keys.
   *
   * @return metric token, e.g. {@code already_claimed}
   */
  public String metricToken() {
    return name().toLowerCase(Locale.ROOT);
  }
}
