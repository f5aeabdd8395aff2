package ca.gc.cra.safekeeper.application.ledger;

import ca.gc.cra.safekeeper.domain.escrow.Identity;
import ca.gc.cra.safekeeper.domain.escrow.LedgerState;
import ca.gc.cra.safekeeper.domain.escrow.Treasure;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Undo log wrapping every mutation of a {@link LedgerState} performed by one ledger operation.
 *
 * <p>Mutations apply immediately so the state is already terminal when control leaves the ledger for a value
 * transfer. Closing the transaction without {@link #commit()} replays the undo actions in reverse order.</p>
 *
 * @since 0.1.0
 */
final class LedgerTransaction implements AutoCloseable {
  private final LedgerState state;
  private final Deque<Runnable> undo = new ArrayDeque<>();
  private boolean committed;

  LedgerTransaction(LedgerState state) {
    this.state = Objects.requireNonNull(state, "state");
  }

  void append(Treasure treasure) {
    state.append(treasure);
    undo.push(() -> state.removeLast(treasure.id()));
  }

  void replace(Treasure treasure) {
    Treasure previous = state.treasure(treasure.id())
        .orElseThrow(() -> new IllegalArgumentException("unknown treasure " + treasure.id()));
    state.replace(treasure);
    undo.push(() -> state.replace(previous));
  }

  void setCollectedFees(BigInteger collectedFees) {
    BigInteger previous = state.collectedFees();
    state.setCollectedFees(collectedFees);
    undo.push(() -> state.setCollectedFees(previous));
  }

  void setHeldValue(BigInteger heldValue) {
    BigInteger previous = state.heldValue();
    state.setHeldValue(heldValue);
    undo.push(() -> state.setHeldValue(previous));
  }

  void setFeeBasisPoints(int feeBasisPoints) {
    int previous = state.feeBasisPoints();
    state.setFeeBasisPoints(feeBasisPoints);
    undo.push(() -> state.setFeeBasisPoints(previous));
  }

  void setOwner(Identity owner) {
    Identity previous = state.owner();
    state.setOwner(owner);
    undo.push(() -> state.setOwner(previous));
  }

  void commit() {
    committed = true;
    undo.clear();
  }

  @Override
  public void close() {
    if (committed) {
      return;
    }
    while (!undo.isEmpty()) {
      undo.pop().run();
    }
  }
}
