package ca.gc.cra.safekeeper.api;

import ca.gc.cra.safekeeper.application.ledger.SafeKeeperLedger;
import ca.gc.cra.safekeeper.application.port.LedgerStatePort;
import ca.gc.cra.safekeeper.application.port.LedgerStatePort.StoredLedger;
import ca.gc.cra.safekeeper.config.CompositionRoot;
import ca.gc.cra.safekeeper.domain.escrow.Identity;
import ca.gc.cra.safekeeper.infrastructure.transfer.InMemoryValueTransferAdapter;
import java.io.IOException;
import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ledger opened for one CLI invocation, together with the payout balances persisted beside it.
 *
 * <p>Not thread-safe; a session lives on the CLI thread for a single command.</p>
 */
final class LedgerSession {
  private final CompositionRoot root;
  private final LedgerStatePort store;
  private InMemoryValueTransferAdapter transfers;
  private SafeKeeperLedger ledger;

  LedgerSession(CompositionRoot root) {
    this.root = Objects.requireNonNull(root, "root");
    this.store = root.stateStore();
  }

  /**
   * Returns the current instant as seen by the ledger.
   *
   * @return epoch seconds
   */
  long now() {
    return root.clock().nowEpochSeconds();
  }

  /**
   * Loads the deployed ledger on first use.
   *
   * @return ledger resumed from the state file
   * @throws IOException if the state file cannot be read
   * @throws IllegalArgumentException if nothing has been deployed at the configured path
   */
  SafeKeeperLedger ledger() throws IOException {
    if (ledger == null) {
      Optional<StoredLedger> stored = store.load();
      if (stored.isEmpty()) {
        throw new IllegalArgumentException(
            "No ledger deployed at " + root.config().statePath() + "; run deploy first");
      }
      transfers = new InMemoryValueTransferAdapter(stored.get().payouts());
      ledger = root.openLedger(stored.get().snapshot(), transfers);
    }
    return ledger;
  }

  /**
   * Deploys a fresh ledger, discarding any state loaded earlier in this session.
   *
   * @param owner deployer
   * @return new ledger
   */
  SafeKeeperLedger deploy(Identity owner) {
    transfers = new InMemoryValueTransferAdapter();
    ledger = root.deployLedger(owner, transfers);
    return ledger;
  }

  /**
   * Returns the cumulative value {@code identity} has received.
   *
   * @param identity recipient
   * @return payout balance, zero when none
   * @throws IOException if the state file cannot be read
   */
  BigInteger payoutsOf(Identity identity) throws IOException {
    ledger();
    return transfers.balanceOf(identity);
  }

  boolean opened() {
    return ledger != null;
  }

  /**
   * Saves the ledger and payout balances.
   *
   * @throws IOException if the state file cannot be written
   * @throws IllegalStateException if no ledger was opened
   */
  void save() throws IOException {
    if (ledger == null) {
      throw new IllegalStateException("no ledger opened");
    }
    Map<Identity, BigInteger> payouts = transfers.balances();
    store.save(new StoredLedger(ledger.snapshot(), payouts));
  }
}
