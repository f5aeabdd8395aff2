package ca.gc.cra.safekeeper.application.ledger;

import ca.gc.cra.safekeeper.domain.escrow.LedgerErrorKind;
import ca.gc.cra.safekeeper.domain.escrow.LedgerException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> Serializes top-level ledger operations and rejects re-entrant ones.
 * <p><strong>Why:</strong> A value transfer may call back into the ledger from inside a claim or withdrawal; such a
 * call must fail without touching state, independently of the commit-before-transfer ordering.</p>
 * <p><strong>Thread-safety:</strong> Other threads block on the lock until the running operation releases it; the
 * owning thread hitting the guard again receives {@link LedgerErrorKind#REENTRANT_CALL}.</p>
 *
 * @since 0.1.0
 */
final class ReentrancyGuard {
  private final ReentrantLock lock = new ReentrantLock();
  private boolean entered;

  /**
   * Enters the guarded section. Use with try-with-resources so the permit is always released.
   *
   * @return permit releasing the guard on {@link Permit#close()}
   * @throws LedgerException with {@link LedgerErrorKind#REENTRANT_CALL} when the calling thread is already inside
   */
  Permit enter() {
    lock.lock();
    if (entered) {
      lock.unlock();
      throw new LedgerException(LedgerErrorKind.REENTRANT_CALL);
    }
    entered = true;
    return new Permit();
  }

  /**
   * Acquires the lock for a read without marking the guard as entered, so lookups stay available to code running
   * inside a guarded operation.
   *
   * @return permit releasing the lock on {@link Permit#close()}
   */
  Permit read() {
    lock.lock();
    return new ReadPermit();
  }

  /** Scoped guard ownership. */
  class Permit implements AutoCloseable {
    private boolean released;

    @Override
    public void close() {
      if (released) {
        return;
      }
      released = true;
      release();
    }

    void release() {
      entered = false;
      lock.unlock();
    }
  }

  private final class ReadPermit extends Permit {
    @Override
    void release() {
      lock.unlock();
    }
  }
}
