package ca.gc.cra.safekeeper.application.port;

import ca.gc.cra.safekeeper.domain.escrow.Identity;
import ca.gc.cra.safekeeper.domain.escrow.LedgerSnapshot;
import java.io.IOException;
import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Port for loading and saving the persisted ledger state between runs.
 * <p><strong>Why:</strong> The CLI applies one operation per invocation and must resume from the committed state.</p>
 * <p><strong>Role:</strong> Outbound port on the persistence side of the hexagon.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load the last saved snapshot together with the payout balances credited by value transfers.</li>
 *   <li>Replace the saved state atomically so a crash never leaves a half-written file.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations document their guarantees; the CLI uses one thread.</p>
 *
 * @since 0.1.0
 */
public interface LedgerStatePort {
  /**
   * Loads the saved state.
   *
   * @return saved state, or empty when nothing was deployed yet
   * @throws IOException if the state exists but cannot be read
   * @throws IllegalArgumentException if the saved state is malformed
   */
  Optional<StoredLedger> load() throws IOException;

  /**
   * Saves the state, replacing any previous one.
   *
   * @param ledger state to persist; must not be {@code null}
   * @throws IOException if the state cannot be written
   */
  void save(StoredLedger ledger) throws IOException;

  /**
   * Ledger snapshot plus the value each identity has received through transfers.
   *
   * @param snapshot ledger state
   * @param payouts cumulative value received per identity
   */
  record StoredLedger(LedgerSnapshot snapshot, Map<Identity, BigInteger> payouts) {
    public StoredLedger {
      Objects.requireNonNull(snapshot, "snapshot");
      payouts = payouts == null ? Map.of() : Map.copyOf(payouts);
    }
  }
}
