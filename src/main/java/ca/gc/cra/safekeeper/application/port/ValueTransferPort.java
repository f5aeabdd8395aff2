package ca.gc.cra.safekeeper.application.port;

import ca.gc.cra.safekeeper.domain.escrow.Identity;
import java.math.BigInteger;

/**
 * <strong>What:</strong> Port that moves value out of the ledger's custody to a recipient.
 * <p><strong>Why:</strong> Claims and fee withdrawals pay out through whatever settlement mechanism hosts the ledger.</p>
 * <p><strong>Role:</strong> Outbound port invoked by the ledger core after it committed its own state.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Report whether the recipient accepted the value.</li>
 *   <li>Leave no partial transfer behind when reporting failure.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Invoked while the ledger holds its lock; implementations may call back into the
 * ledger, which rejects such re-entrant calls.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ValueTransferPort {
  /**
   * Attempts to transfer {@code amount} to {@code recipient}.
   *
   * @param recipient receiving identity; never {@code null} or {@link Identity#NONE}
   * @param amount positive amount in the smallest value unit
   * @return {@code true} when the value was delivered; {@code false} when the recipient rejected it
   * @throws RuntimeException implementations may throw; the ledger treats it the same as {@code false}
   */
  boolean transfer(Identity recipient, BigInteger amount);
}
