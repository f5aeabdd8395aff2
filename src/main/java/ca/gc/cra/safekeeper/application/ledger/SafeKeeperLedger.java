package ca.gc.cra.safekeeper.application.ledger;

import ca.gc.cra.safekeeper.application.port.ClockPort;
import ca.gc.cra.safekeeper.application.port.LedgerEventEmitter;
import ca.gc.cra.safekeeper.application.port.MetricsPort;
import ca.gc.cra.safekeeper.application.port.ValueTransferPort;
import ca.gc.cra.safekeeper.domain.escrow.FeeCalculator;
import ca.gc.cra.safekeeper.domain.escrow.FeePolicy;
import ca.gc.cra.safekeeper.domain.escrow.FeeSplit;
import ca.gc.cra.safekeeper.domain.escrow.Identity;
import ca.gc.cra.safekeeper.domain.escrow.LedgerErrorKind;
import ca.gc.cra.safekeeper.domain.escrow.LedgerException;
import ca.gc.cra.safekeeper.domain.escrow.LedgerSnapshot;
import ca.gc.cra.safekeeper.domain.escrow.LedgerState;
import ca.gc.cra.safekeeper.domain.escrow.Treasure;
import ca.gc.cra.safekeeper.domain.events.FeeUpdated;
import ca.gc.cra.safekeeper.domain.events.FeesWithdrawn;
import ca.gc.cra.safekeeper.domain.events.LedgerEvent;
import ca.gc.cra.safekeeper.domain.events.OwnershipTransferred;
import ca.gc.cra.safekeeper.domain.events.TreasureClaimed;
import ca.gc.cra.safekeeper.domain.events.TreasureStored;
import ca.gc.cra.safekeeper.validation.Numbers;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Custodial, time-locked escrow ledger.
 * <p><strong>Why:</strong> Nobles lock value for a beneficiary that becomes claimable once an unlock instant passes;
 * the ledger charges a basis-point fee into a pool only the owner can withdraw.</p>
 * <p><strong>Role:</strong> Application core of the hexagon; all state transitions happen here.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create treasures and index them per noble and per beneficiary ({@link #store}).</li>
 *   <li>Release each treasure exactly once to its beneficiary after unlock ({@link #claim}).</li>
 *   <li>Account fees and let the owner tune the rate and drain the pool.</li>
 *   <li>Guard ownership of the administrator role.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Every operation runs under one lock. Mutating operations additionally hold a
 * {@link ReentrancyGuard}; a value transfer calling back into a mutating operation fails with
 * {@link LedgerErrorKind#REENTRANT_CALL}.</p>
 * <p><strong>Atomicity:</strong> Mutations are recorded in a {@link LedgerTransaction}. State is made terminal
 * before value leaves the ledger; a failed transfer rolls every mutation of the call back.</p>
 * <p><strong>Observability:</strong> Counters {@code ledger.<op>.success} and
 * {@code ledger.<op>.rejected.<kind>}, observation {@code ledger.store.lockSeconds}; events are emitted after
 * commit.</p>
 *
 * @since 0.1.0
 */
public final class SafeKeeperLedger {
  /** Fee rate a freshly deployed ledger starts with (0.42%). */
  public static final int DEFAULT_FEE_BASIS_POINTS = 42;
  /** Upper bound for a single page of ids. */
  public static final int MAX_PAGE_SIZE = 1_000;

  private static final Logger log = LoggerFactory.getLogger(SafeKeeperLedger.class);
  private static final String METRIC_PREFIX = "ledger.";

  private final LedgerState state;
  private final ClockPort clock;
  private final ValueTransferPort transfers;
  private final LedgerEventEmitter events;
  private final MetricsPort metrics;
  private final ReentrancyGuard guard = new ReentrancyGuard();

  /**
   * Resumes a ledger from a snapshot.
   *
   * @param snapshot persisted state; must not be {@code null}
   * @param clock current-instant source; must not be {@code null}
   * @param transfers payout mechanism; must not be {@code null}
   * @param events event sink; {@code null} falls back to {@link LedgerEventEmitter#NO_OP}
   * @param metrics metrics sink; {@code null} falls back to {@link MetricsPort#NO_OP}
   */
  public SafeKeeperLedger(
      LedgerSnapshot snapshot,
      ClockPort clock,
      ValueTransferPort transfers,
      LedgerEventEmitter events,
      MetricsPort metrics) {
    this.state = LedgerState.restore(snapshot);
    this.clock = Objects.requireNonNull(clock, "clock");
    this.transfers = Objects.requireNonNull(transfers, "transfers");
    this.events = events == null ? LedgerEventEmitter.NO_OP : events;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Deploys an empty ledger owned by {@code owner}.
   *
   * @param owner deployer; becomes the administrator
   * @param feeBasisPoints initial fee rate in {@code [0, 10000]}
   * @param feePolicy when the fee is charged
   * @param clock current-instant source
   * @param transfers payout mechanism
   * @param events event sink; may be {@code null}
   * @param metrics metrics sink; may be {@code null}
   * @return new ledger with {@code nextTreasureId() == 0}
   * @throws IllegalArgumentException if the owner is absent or the rate is out of range
   */
  public static SafeKeeperLedger deploy(
      Identity owner,
      int feeBasisPoints,
      FeePolicy feePolicy,
      ClockPort clock,
      ValueTransferPort transfers,
      LedgerEventEmitter events,
      MetricsPort metrics) {
    LedgerSnapshot genesis = LedgerSnapshot.genesis(owner, feeBasisPoints, feePolicy);
    log.info("Deploying ledger owned by {} with fee {} bp ({})", owner, feeBasisPoints, feePolicy);
    return new SafeKeeperLedger(genesis, clock, transfers, events, metrics);
  }

  /**
   * Locks {@code depositedValue} for {@code beneficiary} until {@code unlockTime}.
   *
   * @param caller noble making the deposit; must not be {@code null} or {@link Identity#NONE}
   * @param beneficiary sole identity allowed to claim
   * @param unlockTime epoch seconds; must be strictly after the current instant
   * @param depositedValue gross deposit; the fee is deducted before escrow
   * @return id of the new treasure
   * @throws LedgerException {@code INVALID_BENEFICIARY}, {@code ZERO_VALUE}, or {@code UNLOCK_TIME_IN_PAST}, checked in
   *     that order; {@code REENTRANT_CALL} when invoked from inside a transfer
   */
  public long store(Identity caller, Identity beneficiary, long unlockTime, BigInteger depositedValue) {
    Objects.requireNonNull(caller, "caller");
    if (Identity.isNone(caller)) {
      throw new IllegalArgumentException("caller must not be the zero address");
    }
    String op = "store";
    TreasureStored event;
    try (ReentrancyGuard.Permit permit = enter(op)) {
      if (Identity.isNone(beneficiary)) {
        throw reject(op, LedgerErrorKind.INVALID_BENEFICIARY);
      }
      if (depositedValue == null || depositedValue.signum() <= 0) {
        throw reject(op, LedgerErrorKind.ZERO_VALUE);
      }
      long now = clock.nowEpochSeconds();
      if (unlockTime <= now) {
        throw reject(op, LedgerErrorKind.UNLOCK_TIME_IN_PAST);
      }

      FeeSplit split = FeeCalculator.split(depositedValue, state.feeBasisPoints());
      long id = state.nextTreasureId();
      try (LedgerTransaction tx = new LedgerTransaction(state)) {
        tx.setCollectedFees(state.collectedFees().add(split.fee()));
        tx.setHeldValue(state.heldValue().add(depositedValue));
        tx.append(new Treasure(id, split.net(), unlockTime, false, caller, beneficiary));
        tx.commit();
      }
      log.debug("Stored treasure {} from {} for {}: net={} fee={} unlockTime={}",
          id, caller, beneficiary, split.net(), split.fee(), unlockTime);
      event = new TreasureStored(caller, beneficiary, split.net(), unlockTime, id, now);
      metrics.observe(METRIC_PREFIX + op + ".lockSeconds", unlockTime - now);
    }
    succeed(op, event);
    return event.treasureId();
  }

  /**
   * Releases a treasure to its beneficiary.
   *
   * @param caller claiming identity; must not be {@code null}
   * @param treasureId treasure to claim
   * @return net payout transferred to the caller
   * @throws LedgerException {@code NOT_FOUND}, {@code NOT_BENEFICIARY}, {@code ALREADY_CLAIMED},
   *     {@code NOT_YET_UNLOCKED}, or {@code NOTHING_TO_CLAIM}, checked in that order; {@code TRANSFER_FAILED} when the
   *     payout could not be delivered, in which case no state changed; {@code REENTRANT_CALL} when invoked from inside
   *     a transfer
   */
  public BigInteger claim(Identity caller, long treasureId) {
    Objects.requireNonNull(caller, "caller");
    String op = "claim";
    TreasureClaimed event;
    try (ReentrancyGuard.Permit permit = enter(op)) {
      Treasure treasure = state.treasure(treasureId)
          .orElseThrow(() -> reject(op, LedgerErrorKind.NOT_FOUND));
      if (!treasure.beneficiary().equals(caller)) {
        throw reject(op, LedgerErrorKind.NOT_BENEFICIARY);
      }
      if (treasure.claimed()) {
        throw reject(op, LedgerErrorKind.ALREADY_CLAIMED);
      }
      long now = clock.nowEpochSeconds();
      if (!treasure.isUnlockedAt(now)) {
        throw reject(op, LedgerErrorKind.NOT_YET_UNLOCKED);
      }
      if (treasure.amount().signum() <= 0) {
        throw reject(op, LedgerErrorKind.NOTHING_TO_CLAIM);
      }

      int claimRate = state.feePolicy().chargesOnClaim() ? state.feeBasisPoints() : 0;
      FeeSplit split = FeeCalculator.split(treasure.amount(), claimRate);
      BigInteger payout = split.net();
      try (LedgerTransaction tx = new LedgerTransaction(state)) {
        tx.setCollectedFees(state.collectedFees().add(split.fee()));
        tx.replace(treasure.markClaimed());
        tx.setHeldValue(state.heldValue().subtract(payout));
        if (payout.signum() > 0) {
          pay(op, caller, payout);
        }
        tx.commit();
      }
      log.debug("Claimed treasure {} by {}: payout={} fee={}", treasureId, caller, payout, split.fee());
      event = new TreasureClaimed(caller, payout, treasureId, now);
    }
    succeed(op, event);
    return event.amount();
  }

  /**
   * Changes the fee rate applied to subsequent deposits and claims.
   *
   * @param caller must be the owner
   * @param feeBasisPoints new rate in {@code [0, 10000]}
   * @throws LedgerException {@code UNAUTHORIZED}, {@code FEE_TOO_HIGH}, or {@code INVALID_FEE}
   */
  public void setFeeRate(Identity caller, int feeBasisPoints) {
    Objects.requireNonNull(caller, "caller");
    String op = "setFeeRate";
    FeeUpdated event;
    try (ReentrancyGuard.Permit permit = enter(op)) {
      requireOwner(op, caller);
      if (feeBasisPoints > FeeCalculator.BASIS_POINTS_DENOMINATOR) {
        throw reject(op, LedgerErrorKind.FEE_TOO_HIGH);
      }
      if (feeBasisPoints < 0) {
        throw reject(op, LedgerErrorKind.INVALID_FEE);
      }
      int previous = state.feeBasisPoints();
      try (LedgerTransaction tx = new LedgerTransaction(state)) {
        tx.setFeeBasisPoints(feeBasisPoints);
        tx.commit();
      }
      log.info("Fee rate changed from {} bp to {} bp by {}", previous, feeBasisPoints, caller);
      event = new FeeUpdated(feeBasisPoints, clock.nowEpochSeconds());
    }
    succeed(op, event);
  }

  /**
   * Drains the fee pool to {@code recipient}.
   *
   * @param caller must be the owner
   * @param recipient identity receiving the fees
   * @return withdrawn amount; zero when the pool was empty
   * @throws LedgerException {@code UNAUTHORIZED}, {@code INVALID_RECIPIENT}, or {@code TRANSFER_FAILED}, in which
   *     case the pool is left untouched
   */
  public BigInteger withdrawFees(Identity caller, Identity recipient) {
    Objects.requireNonNull(caller, "caller");
    String op = "withdrawFees";
    FeesWithdrawn event;
    try (ReentrancyGuard.Permit permit = enter(op)) {
      requireOwner(op, caller);
      if (Identity.isNone(recipient)) {
        throw reject(op, LedgerErrorKind.INVALID_RECIPIENT);
      }
      BigInteger amount = state.collectedFees();
      try (LedgerTransaction tx = new LedgerTransaction(state)) {
        tx.setCollectedFees(BigInteger.ZERO);
        tx.setHeldValue(state.heldValue().subtract(amount));
        if (amount.signum() > 0) {
          pay(op, recipient, amount);
        }
        tx.commit();
      }
      log.info("Withdrew {} in fees to {}", amount, recipient);
      event = new FeesWithdrawn(recipient, amount, clock.nowEpochSeconds());
    }
    succeed(op, event);
    return event.amount();
  }

  /**
   * Hands the administrator role to {@code newOwner}.
   *
   * @param caller must be the owner
   * @param newOwner next owner
   * @throws LedgerException {@code UNAUTHORIZED} or {@code INVALID_OWNER}
   */
  public void transferOwnership(Identity caller, Identity newOwner) {
    Objects.requireNonNull(caller, "caller");
    String op = "transferOwnership";
    OwnershipTransferred event;
    try (ReentrancyGuard.Permit permit = enter(op)) {
      requireOwner(op, caller);
      if (Identity.isNone(newOwner)) {
        throw reject(op, LedgerErrorKind.INVALID_OWNER);
      }
      event = changeOwner(caller, newOwner);
    }
    succeed(op, event);
  }

  /**
   * Gives up the administrator role for good; fee changes and withdrawals become impossible.
   *
   * @param caller must be the owner
   * @throws LedgerException {@code UNAUTHORIZED}
   */
  public void renounceOwnership(Identity caller) {
    Objects.requireNonNull(caller, "caller");
    String op = "renounceOwnership";
    OwnershipTransferred event;
    try (ReentrancyGuard.Permit permit = enter(op)) {
      requireOwner(op, caller);
      event = changeOwner(caller, Identity.NONE);
    }
    succeed(op, event);
  }

  /**
   * Returns a snapshot of a treasure.
   *
   * @param treasureId treasure id
   * @return immutable treasure
   * @throws LedgerException {@code NOT_FOUND} when no treasure has the id
   */
  public Treasure treasureDetails(long treasureId) {
    try (ReentrancyGuard.Permit permit = guard.read()) {
      return state.treasure(treasureId).orElseThrow(() -> new LedgerException(LedgerErrorKind.NOT_FOUND));
    }
  }

  /**
   * Lists the treasures deposited by {@code noble} in creation order.
   *
   * @param noble depositor
   * @return immutable list of ids, possibly empty
   */
  public List<Long> treasuresByNoble(Identity noble) {
    Objects.requireNonNull(noble, "noble");
    try (ReentrancyGuard.Permit permit = guard.read()) {
      return state.idsByNoble(noble);
    }
  }

  /**
   * Lists one page of the treasures deposited by {@code noble}.
   *
   * @param noble depositor
   * @param offset index of the first id to return; must not be negative
   * @param limit maximum number of ids in {@code [1, MAX_PAGE_SIZE]}
   * @return immutable page, empty past the end
   */
  public List<Long> treasuresByNoble(Identity noble, int offset, int limit) {
    return page(treasuresByNoble(noble), offset, limit);
  }

  /**
   * Lists the treasures {@code beneficiary} may claim, in creation order, including claimed ones.
   *
   * @param beneficiary beneficiary
   * @return immutable list of ids, possibly empty
   */
  public List<Long> treasuresByBeneficiary(Identity beneficiary) {
    Objects.requireNonNull(beneficiary, "beneficiary");
    try (ReentrancyGuard.Permit permit = guard.read()) {
      return state.idsByBeneficiary(beneficiary);
    }
  }

  /**
   * Lists one page of the treasures {@code beneficiary} may claim.
   *
   * @param beneficiary beneficiary
   * @param offset index of the first id to return; must not be negative
   * @param limit maximum number of ids in {@code [1, MAX_PAGE_SIZE]}
   * @return immutable page, empty past the end
   */
  public List<Long> treasuresByBeneficiary(Identity beneficiary, int offset, int limit) {
    return page(treasuresByBeneficiary(beneficiary), offset, limit);
  }

  public long nextTreasureId() {
    try (ReentrancyGuard.Permit permit = guard.read()) {
      return state.nextTreasureId();
    }
  }

  public int feeBasisPoints() {
    try (ReentrancyGuard.Permit permit = guard.read()) {
      return state.feeBasisPoints();
    }
  }

  public FeePolicy feePolicy() {
    return state.feePolicy();
  }

  public BigInteger collectedFees() {
    try (ReentrancyGuard.Permit permit = guard.read()) {
      return state.collectedFees();
    }
  }

  /**
   * Returns the total value in custody: unclaimed treasure amounts plus the fee pool.
   *
   * @return held value
   */
  public BigInteger heldValue() {
    try (ReentrancyGuard.Permit permit = guard.read()) {
      return state.heldValue();
    }
  }

  public Identity owner() {
    try (ReentrancyGuard.Permit permit = guard.read()) {
      return state.owner();
    }
  }

  /**
   * Captures the complete ledger state for persistence.
   *
   * @return immutable snapshot
   */
  public LedgerSnapshot snapshot() {
    try (ReentrancyGuard.Permit permit = guard.read()) {
      return state.snapshot();
    }
  }

  private OwnershipTransferred changeOwner(Identity previous, Identity next) {
    try (LedgerTransaction tx = new LedgerTransaction(state)) {
      tx.setOwner(next);
      tx.commit();
    }
    log.info("Ownership transferred from {} to {}", previous, next);
    return new OwnershipTransferred(previous, next, clock.nowEpochSeconds());
  }

  private ReentrancyGuard.Permit enter(String op) {
    try {
      return guard.enter();
    } catch (LedgerException ex) {
      metrics.increment(METRIC_PREFIX + op + ".rejected." + ex.kind().metricToken());
      log.warn("Rejected re-entrant {} call", op);
      throw ex;
    }
  }

  private void requireOwner(String op, Identity caller) {
    if (!caller.equals(state.owner()) || Identity.isNone(caller)) {
      metrics.increment(METRIC_PREFIX + op + ".rejected." + LedgerErrorKind.UNAUTHORIZED.metricToken());
      throw new LedgerException(LedgerErrorKind.UNAUTHORIZED, caller);
    }
  }

  private void pay(String op, Identity recipient, BigInteger amount) {
    boolean delivered;
    try {
      delivered = transfers.transfer(recipient, amount);
    } catch (RuntimeException ex) {
      log.warn("Transfer of {} to {} threw during {}; rolling back", amount, recipient, op, ex);
      metrics.increment(METRIC_PREFIX + op + ".rejected." + LedgerErrorKind.TRANSFER_FAILED.metricToken());
      throw new LedgerException(LedgerErrorKind.TRANSFER_FAILED, recipient, ex);
    }
    if (!delivered) {
      log.warn("Transfer of {} to {} was refused during {}; rolling back", amount, recipient, op);
      throw reject(op, LedgerErrorKind.TRANSFER_FAILED, recipient);
    }
  }

  private LedgerException reject(String op, LedgerErrorKind kind) {
    return reject(op, kind, null);
  }

  private LedgerException reject(String op, LedgerErrorKind kind, Identity account) {
    metrics.increment(METRIC_PREFIX + op + ".rejected." + kind.metricToken());
    log.debug("Rejected {}: {}", op, kind);
    return new LedgerException(kind, account);
  }

  private void succeed(String op, LedgerEvent event) {
    metrics.increment(METRIC_PREFIX + op + ".success");
    try {
      events.emit(event);
    } catch (RuntimeException ex) {
      metrics.increment(METRIC_PREFIX + "events.emit.error");
      log.warn("Ledger event emitter threw for {}", event.type(), ex);
    }
  }

  private static List<Long> page(List<Long> ids, int offset, int limit) {
    Numbers.requireRange("offset", offset, 0, Integer.MAX_VALUE);
    Numbers.requireRange("limit", limit, 1, MAX_PAGE_SIZE);
    if (offset >= ids.size()) {
      return List.of();
    }
    return List.copyOf(ids.subList(offset, Math.min(ids.size(), offset + limit)));
  }
}
