package ca.gc.cra.safekeeper.application.ledger;

import static ca.gc.cra.safekeeper.testutil.Identities.ALICE;
import static ca.gc.cra.safekeeper.testutil.Identities.BOB;
import static ca.gc.cra.safekeeper.testutil.Identities.CAROL;
import static ca.gc.cra.safekeeper.testutil.Identities.OWNER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.safekeeper.domain.escrow.FeePolicy;
import ca.gc.cra.safekeeper.domain.escrow.Identity;
import ca.gc.cra.safekeeper.domain.escrow.LedgerErrorKind;
import ca.gc.cra.safekeeper.domain.escrow.LedgerException;
import ca.gc.cra.safekeeper.domain.escrow.LedgerSnapshot;
import ca.gc.cra.safekeeper.domain.escrow.Treasure;
import ca.gc.cra.safekeeper.domain.events.FeeUpdated;
import ca.gc.cra.safekeeper.domain.events.FeesWithdrawn;
import ca.gc.cra.safekeeper.domain.events.OwnershipTransferred;
import ca.gc.cra.safekeeper.domain.events.TreasureClaimed;
import ca.gc.cra.safekeeper.domain.events.TreasureStored;
import ca.gc.cra.safekeeper.infrastructure.events.InMemoryLedgerEventEmitter;
import ca.gc.cra.safekeeper.testutil.ManualClock;
import ca.gc.cra.safekeeper.testutil.RecordingMetricsPort;
import ca.gc.cra.safekeeper.testutil.RecordingValueTransfer;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SafeKeeperLedgerTest {
  private static final long START = 1_700_000_000L;
  private static final long DAY = 86_400L;
  private static final BigInteger ONE_UNIT = new BigInteger("1000000000000000000");

  private ManualClock clock;
  private RecordingValueTransfer transfers;
  private InMemoryLedgerEventEmitter events;
  private RecordingMetricsPort metrics;
  private SafeKeeperLedger ledger;

  @BeforeEach
  void setUp() {
    clock = new ManualClock(START);
    transfers = new RecordingValueTransfer();
    events = new InMemoryLedgerEventEmitter();
    metrics = new RecordingMetricsPort();
    ledger = deploy(SafeKeeperLedger.DEFAULT_FEE_BASIS_POINTS, FeePolicy.STORE_AND_CLAIM);
  }

  private SafeKeeperLedger deploy(int feeBasisPoints, FeePolicy policy) {
    return SafeKeeperLedger.deploy(OWNER, feeBasisPoints, policy, clock, transfers, events, metrics);
  }

  @Test
  void deployStartsEmptyWithDeployerAsOwner() {
    assertEquals(0L, ledger.nextTreasureId());
    assertEquals(42, ledger.feeBasisPoints());
    assertEquals(FeePolicy.STORE_AND_CLAIM, ledger.feePolicy());
    assertEquals(OWNER, ledger.owner());
    assertEquals(BigInteger.ZERO, ledger.collectedFees());
    assertEquals(BigInteger.ZERO, ledger.heldValue());
  }

  @Test
  void deployRejectsZeroOwner() {
    assertThrows(IllegalArgumentException.class, () -> SafeKeeperLedger.deploy(
        Identity.NONE, 42, FeePolicy.STORE_AND_CLAIM, clock, transfers, events, metrics));
  }

  @Test
  void storeSplitsFeeAndIndexesTreasure() {
    BigInteger deposit = BigInteger.valueOf(1_000_000);

    long id = ledger.store(ALICE, BOB, START + DAY, deposit);

    assertEquals(0L, id);
    assertEquals(1L, ledger.nextTreasureId());
    Treasure treasure = ledger.treasureDetails(id);
    assertEquals(BigInteger.valueOf(995_800), treasure.amount());
    assertEquals(START + DAY, treasure.unlockTime());
    assertFalse(treasure.claimed());
    assertEquals(ALICE, treasure.noble());
    assertEquals(BOB, treasure.beneficiary());
    assertEquals(BigInteger.valueOf(4_200), ledger.collectedFees());
    assertEquals(deposit, treasure.amount().add(ledger.collectedFees()));
    assertEquals(deposit, ledger.heldValue());
    assertEquals(List.of(0L), ledger.treasuresByNoble(ALICE));
    assertEquals(List.of(0L), ledger.treasuresByBeneficiary(BOB));
    assertEquals(List.of(), ledger.treasuresByNoble(BOB));

    TreasureStored stored = events.ofType(TreasureStored.class).get(0);
    assertEquals(new TreasureStored(ALICE, BOB, BigInteger.valueOf(995_800), START + DAY, 0L, START), stored);
    assertEquals(1L, metrics.count("ledger.store.success"));
    assertEquals(List.of(DAY), metrics.observations("ledger.store.lockSeconds"));
  }

  @Test
  void storePreconditionsAreCheckedInOrder() {
    LedgerException zeroBeneficiary = assertThrows(LedgerException.class,
        () -> ledger.store(ALICE, Identity.NONE, START - 1, BigInteger.ZERO));
    assertEquals(LedgerErrorKind.INVALID_BENEFICIARY, zeroBeneficiary.kind());
    assertEquals("Beneficiary must be a valid address.", zeroBeneficiary.getMessage());

    LedgerException nullBeneficiary = assertThrows(LedgerException.class,
        () -> ledger.store(ALICE, null, START + DAY, BigInteger.TEN));
    assertEquals(LedgerErrorKind.INVALID_BENEFICIARY, nullBeneficiary.kind());

    LedgerException zeroValue = assertThrows(LedgerException.class,
        () -> ledger.store(ALICE, BOB, START - 1, BigInteger.ZERO));
    assertEquals(LedgerErrorKind.ZERO_VALUE, zeroValue.kind());

    LedgerException past = assertThrows(LedgerException.class,
        () -> ledger.store(ALICE, BOB, START, BigInteger.TEN));
    assertEquals(LedgerErrorKind.UNLOCK_TIME_IN_PAST, past.kind());

    assertEquals(0L, ledger.nextTreasureId());
    assertEquals(BigInteger.ZERO, ledger.heldValue());
    assertTrue(events.snapshot().isEmpty());
    assertEquals(2L, metrics.count("ledger.store.rejected.invalid_beneficiary"));
    assertEquals(1L, metrics.count("ledger.store.rejected.zero_value"));
    assertEquals(1L, metrics.count("ledger.store.rejected.unlock_time_in_past"));
  }

  @Test
  void storeRequiresCaller() {
    assertThrows(NullPointerException.class, () -> ledger.store(null, BOB, START + DAY, BigInteger.TEN));
    assertThrows(IllegalArgumentException.class,
        () -> ledger.store(Identity.NONE, BOB, START + DAY, BigInteger.TEN));
  }

  @Test
  void claimPaysNetOfClaimFeeAndMarksTreasureClaimed() {
    long id = ledger.store(ALICE, BOB, START + DAY, ONE_UNIT);
    clock.set(START + DAY);

    BigInteger payout = ledger.claim(BOB, id);

    assertEquals(new BigInteger("991617640000000000"), payout);
    assertEquals(new BigInteger("8382360000000000"), ledger.collectedFees());
    assertEquals(ONE_UNIT, payout.add(ledger.collectedFees()));
    Treasure claimed = ledger.treasureDetails(id);
    assertTrue(claimed.claimed());
    assertEquals(BigInteger.ZERO, claimed.amount());
    assertEquals(ledger.collectedFees(), ledger.heldValue());
    assertEquals(List.of(new RecordingValueTransfer.Payment(BOB, payout)), transfers.payments());
    assertEquals(new TreasureClaimed(BOB, payout, id, START + DAY), events.ofType(TreasureClaimed.class).get(0));
    assertEquals(1L, metrics.count("ledger.claim.success"));
  }

  @Test
  void storeOnlyPolicyDoesNotChargeOnClaim() {
    ledger = deploy(42, FeePolicy.STORE_ONLY);
    long id = ledger.store(ALICE, BOB, START + 10, ONE_UNIT);
    clock.advance(10);

    BigInteger payout = ledger.claim(BOB, id);

    assertEquals(new BigInteger("995800000000000000"), payout);
    assertEquals(new BigInteger("4200000000000000"), ledger.collectedFees());
  }

  @Test
  void claimPreconditionsAreCheckedInOrder() {
    long id = ledger.store(ALICE, BOB, START + DAY, BigInteger.valueOf(10_000));

    assertEquals(LedgerErrorKind.NOT_FOUND,
        assertThrows(LedgerException.class, () -> ledger.claim(BOB, 7)).kind());
    assertEquals(LedgerErrorKind.NOT_FOUND,
        assertThrows(LedgerException.class, () -> ledger.claim(BOB, -1)).kind());
    assertEquals(LedgerErrorKind.NOT_BENEFICIARY,
        assertThrows(LedgerException.class, () -> ledger.claim(ALICE, id)).kind());
    LedgerException early = assertThrows(LedgerException.class, () -> ledger.claim(BOB, id));
    assertEquals(LedgerErrorKind.NOT_YET_UNLOCKED, early.kind());
    assertEquals("Treasure not yet unlocked.", early.getMessage());

    clock.set(START + DAY);
    ledger.claim(BOB, id);
    assertEquals(LedgerErrorKind.ALREADY_CLAIMED,
        assertThrows(LedgerException.class, () -> ledger.claim(BOB, id)).kind());
    assertEquals(LedgerErrorKind.NOT_BENEFICIARY,
        assertThrows(LedgerException.class, () -> ledger.claim(ALICE, id)).kind());
    assertEquals(1, transfers.payments().size());
  }

  @Test
  void secondClaimIsAlwaysRejected() {
    long id = ledger.store(ALICE, BOB, START + 1, BigInteger.valueOf(500));
    clock.advance(5);
    ledger.claim(BOB, id);

    for (int i = 0; i < 3; i++) {
      clock.advance(DAY);
      LedgerException ex = assertThrows(LedgerException.class, () -> ledger.claim(BOB, id));
      assertEquals(LedgerErrorKind.ALREADY_CLAIMED, ex.kind());
    }
    assertEquals(3L, metrics.count("ledger.claim.rejected.already_claimed"));
  }

  @Test
  void fullFeeLeavesNothingToClaimWithoutCallingTransfer() {
    ledger.setFeeRate(OWNER, 10_000);
    long id = ledger.store(ALICE, BOB, START + 1, BigInteger.valueOf(777));

    assertEquals(BigInteger.ZERO, ledger.treasureDetails(id).amount());
    assertEquals(BigInteger.valueOf(777), ledger.collectedFees());

    clock.advance(1);
    LedgerException ex = assertThrows(LedgerException.class, () -> ledger.claim(BOB, id));
    assertEquals(LedgerErrorKind.NOTHING_TO_CLAIM, ex.kind());
    assertTrue(transfers.payments().isEmpty());
  }

  @Test
  void claimWithZeroNetPayoutCommitsWithoutTransfer() {
    long id = ledger.store(ALICE, BOB, START + 1, BigInteger.valueOf(3));
    ledger.setFeeRate(OWNER, 10_000);
    clock.advance(1);

    BigInteger payout = ledger.claim(BOB, id);

    assertEquals(BigInteger.ZERO, payout);
    assertTrue(ledger.treasureDetails(id).claimed());
    assertTrue(transfers.payments().isEmpty());
    assertEquals(BigInteger.valueOf(3), ledger.collectedFees());
    assertEquals(BigInteger.valueOf(3), ledger.heldValue());
  }

  @Test
  void refusedTransferRollsBackClaim() {
    long id = ledger.store(ALICE, BOB, START + 1, BigInteger.valueOf(10_000));
    clock.advance(1);
    LedgerSnapshot before = ledger.snapshot();
    events.clear();
    transfers.refuse();

    LedgerException ex = assertThrows(LedgerException.class, () -> ledger.claim(BOB, id));

    assertEquals(LedgerErrorKind.TRANSFER_FAILED, ex.kind());
    assertEquals("Transfer failed.", ex.getMessage().substring(0, "Transfer failed.".length()));
    assertEquals(before, ledger.snapshot());
    assertFalse(ledger.treasureDetails(id).claimed());
    assertTrue(events.snapshot().isEmpty());
    assertEquals(1L, metrics.count("ledger.claim.rejected.transfer_failed"));

    transfers.accept();
    assertEquals(BigInteger.valueOf(9_917), ledger.claim(BOB, id));
  }

  @Test
  void throwingTransferRollsBackAndKeepsCause() {
    long id = ledger.store(ALICE, BOB, START + 1, BigInteger.valueOf(10_000));
    clock.advance(1);
    LedgerSnapshot before = ledger.snapshot();
    IllegalStateException boom = new IllegalStateException("wallet offline");
    transfers.throwOnTransfer(boom);

    LedgerException ex = assertThrows(LedgerException.class, () -> ledger.claim(BOB, id));

    assertEquals(LedgerErrorKind.TRANSFER_FAILED, ex.kind());
    assertSame(boom, ex.getCause());
    assertEquals(before, ledger.snapshot());
  }

  @Test
  void reentrantClaimFromTransferIsRejectedAndOuterClaimPaysOnce() {
    long id = ledger.store(ALICE, BOB, START + 1, BigInteger.valueOf(10_000));
    clock.advance(1);
    AtomicReference<LedgerException> inner = new AtomicReference<>();
    List<Long> seenDuringTransfer = new ArrayList<>();
    transfers.during((recipient, amount) -> {
      seenDuringTransfer.add(ledger.nextTreasureId());
      try {
        ledger.claim(BOB, id);
      } catch (LedgerException ex) {
        inner.set(ex);
      }
    });

    BigInteger payout = ledger.claim(BOB, id);

    assertEquals(LedgerErrorKind.REENTRANT_CALL, inner.get().kind());
    assertEquals("ReentrancyGuard: reentrant call", inner.get().getMessage());
    assertEquals(List.of(1L), seenDuringTransfer);
    assertEquals(1, transfers.payments().size());
    assertEquals(payout, transfers.totalPaidTo(BOB));
    assertTrue(ledger.treasureDetails(id).claimed());
    assertEquals(1L, metrics.count("ledger.claim.rejected.reentrant_call"));
  }

  @Test
  void reentrantFailurePropagatedByTransferRollsBackOuterClaim() {
    long id = ledger.store(ALICE, BOB, START + 1, BigInteger.valueOf(10_000));
    clock.advance(1);
    LedgerSnapshot before = ledger.snapshot();
    transfers.during((recipient, amount) -> ledger.store(BOB, CAROL, START + DAY, BigInteger.ONE));

    LedgerException ex = assertThrows(LedgerException.class, () -> ledger.claim(BOB, id));

    assertEquals(LedgerErrorKind.TRANSFER_FAILED, ex.kind());
    assertEquals(LedgerErrorKind.REENTRANT_CALL, ((LedgerException) ex.getCause()).kind());
    assertEquals(before, ledger.snapshot());
  }

  @Test
  void indexListsKeepCreationOrderAcrossClaims() {
    long first = ledger.store(ALICE, BOB, START + 1, BigInteger.valueOf(100));
    long second = ledger.store(CAROL, BOB, START + 1, BigInteger.valueOf(200));
    long third = ledger.store(ALICE, CAROL, START + 1, BigInteger.valueOf(300));
    long self = ledger.store(BOB, BOB, START + 1, BigInteger.valueOf(400));
    clock.advance(1);

    ledger.claim(BOB, second);
    ledger.claim(BOB, first);

    assertEquals(List.of(first, third), ledger.treasuresByNoble(ALICE));
    assertEquals(List.of(first, second, self), ledger.treasuresByBeneficiary(BOB));
    assertEquals(List.of(self), ledger.treasuresByNoble(BOB));
    assertEquals(List.of(third), ledger.treasuresByBeneficiary(CAROL));
  }

  @Test
  void idsClaimIndependently() {
    long zero = ledger.store(ALICE, BOB, START + 10, BigInteger.valueOf(10_000));
    long one = ledger.store(ALICE, BOB, START + 20, BigInteger.valueOf(20_000));
    clock.set(START + 10);

    ledger.claim(BOB, zero);
    assertEquals(LedgerErrorKind.NOT_YET_UNLOCKED,
        assertThrows(LedgerException.class, () -> ledger.claim(BOB, one)).kind());

    clock.set(START + 20);
    ledger.claim(BOB, one);
    assertTrue(ledger.treasureDetails(zero).claimed());
    assertTrue(ledger.treasureDetails(one).claimed());
  }

  @Test
  void pagedLookupsSliceIndexLists() {
    for (int i = 0; i < 5; i++) {
      ledger.store(ALICE, BOB, START + 1, BigInteger.TEN);
    }

    assertEquals(List.of(1L, 2L), ledger.treasuresByNoble(ALICE, 1, 2));
    assertEquals(List.of(3L, 4L), ledger.treasuresByBeneficiary(BOB, 3, 10));
    assertEquals(List.of(), ledger.treasuresByBeneficiary(BOB, 5, 10));
    assertThrows(IllegalArgumentException.class, () -> ledger.treasuresByNoble(ALICE, -1, 2));
    assertThrows(IllegalArgumentException.class, () -> ledger.treasuresByNoble(ALICE, 0, 0));
    assertThrows(IllegalArgumentException.class,
        () -> ledger.treasuresByNoble(ALICE, 0, SafeKeeperLedger.MAX_PAGE_SIZE + 1));
  }

  @Test
  void treasureDetailsRejectsUnknownId() {
    LedgerException ex = assertThrows(LedgerException.class, () -> ledger.treasureDetails(0));
    assertEquals(LedgerErrorKind.NOT_FOUND, ex.kind());
  }

  @Test
  void setFeeRateIsOwnerOnlyAndBounded() {
    LedgerException unauthorized = assertThrows(LedgerException.class, () -> ledger.setFeeRate(ALICE, 10));
    assertEquals(LedgerErrorKind.UNAUTHORIZED, unauthorized.kind());
    assertEquals(ALICE, unauthorized.account().orElseThrow());

    assertEquals(LedgerErrorKind.FEE_TOO_HIGH,
        assertThrows(LedgerException.class, () -> ledger.setFeeRate(OWNER, 10_001)).kind());
    assertEquals(LedgerErrorKind.INVALID_FEE,
        assertThrows(LedgerException.class, () -> ledger.setFeeRate(OWNER, -1)).kind());
    assertEquals(42, ledger.feeBasisPoints());

    ledger.setFeeRate(OWNER, 10_000);
    assertEquals(10_000, ledger.feeBasisPoints());
    long id = ledger.store(ALICE, BOB, START + 1, BigInteger.valueOf(123));
    assertEquals(BigInteger.ZERO, ledger.treasureDetails(id).amount());
    assertEquals(new FeeUpdated(10_000, START), events.ofType(FeeUpdated.class).get(0));
    assertEquals(1L, metrics.count("ledger.setFeeRate.rejected.unauthorized"));
  }

  @Test
  void withdrawFeesDrainsPoolToRecipient() {
    ledger.store(ALICE, BOB, START + 1, BigInteger.valueOf(1_000_000));
    ledger.store(CAROL, BOB, START + 1, BigInteger.valueOf(2_000_000));
    BigInteger pool = ledger.collectedFees();
    assertEquals(BigInteger.valueOf(12_600), pool);

    assertEquals(LedgerErrorKind.UNAUTHORIZED,
        assertThrows(LedgerException.class, () -> ledger.withdrawFees(ALICE, ALICE)).kind());
    assertEquals(LedgerErrorKind.INVALID_RECIPIENT,
        assertThrows(LedgerException.class, () -> ledger.withdrawFees(OWNER, Identity.NONE)).kind());

    BigInteger withdrawn = ledger.withdrawFees(OWNER, CAROL);

    assertEquals(pool, withdrawn);
    assertEquals(BigInteger.ZERO, ledger.collectedFees());
    assertEquals(BigInteger.valueOf(3_000_000).subtract(pool), ledger.heldValue());
    assertEquals(pool, transfers.totalPaidTo(CAROL));
    assertEquals(new FeesWithdrawn(CAROL, pool, START), events.ofType(FeesWithdrawn.class).get(0));
  }

  @Test
  void withdrawingEmptyPoolCommitsWithoutTransfer() {
    assertEquals(BigInteger.ZERO, ledger.withdrawFees(OWNER, CAROL));
    assertTrue(transfers.payments().isEmpty());
    assertEquals(1, events.ofType(FeesWithdrawn.class).size());
  }

  @Test
  void failedWithdrawalLeavesPoolUntouched() {
    ledger.store(ALICE, BOB, START + 1, BigInteger.valueOf(1_000_000));
    LedgerSnapshot before = ledger.snapshot();
    transfers.refuse();

    LedgerException ex = assertThrows(LedgerException.class, () -> ledger.withdrawFees(OWNER, CAROL));

    assertEquals(LedgerErrorKind.TRANSFER_FAILED, ex.kind());
    assertEquals(before, ledger.snapshot());
  }

  @Test
  void ownershipCanBeTransferredAndRenounced() {
    assertEquals(LedgerErrorKind.INVALID_OWNER,
        assertThrows(LedgerException.class, () -> ledger.transferOwnership(OWNER, Identity.NONE)).kind());
    assertEquals(LedgerErrorKind.UNAUTHORIZED,
        assertThrows(LedgerException.class, () -> ledger.transferOwnership(ALICE, ALICE)).kind());

    ledger.transferOwnership(OWNER, ALICE);
    assertEquals(ALICE, ledger.owner());
    assertEquals(LedgerErrorKind.UNAUTHORIZED,
        assertThrows(LedgerException.class, () -> ledger.setFeeRate(OWNER, 1)).kind());

    ledger.renounceOwnership(ALICE);
    assertEquals(Identity.NONE, ledger.owner());
    assertEquals(LedgerErrorKind.UNAUTHORIZED,
        assertThrows(LedgerException.class, () -> ledger.withdrawFees(Identity.NONE, BOB)).kind());
    assertEquals(LedgerErrorKind.UNAUTHORIZED,
        assertThrows(LedgerException.class, () -> ledger.renounceOwnership(ALICE)).kind());

    assertEquals(
        List.of(new OwnershipTransferred(OWNER, ALICE, START), new OwnershipTransferred(ALICE, Identity.NONE, START)),
        events.ofType(OwnershipTransferred.class));
  }

  @Test
  void heldValueMatchesFeesPlusUnclaimedAmounts() {
    long a = ledger.store(ALICE, BOB, START + 1, BigInteger.valueOf(123_456_789));
    ledger.store(CAROL, ALICE, START + 5, BigInteger.valueOf(987_654_321));
    ledger.setFeeRate(OWNER, 250);
    long c = ledger.store(BOB, CAROL, START + 3, BigInteger.valueOf(55_555));
    clock.advance(3);
    ledger.claim(BOB, a);
    ledger.claim(CAROL, c);
    ledger.withdrawFees(OWNER, OWNER);

    LedgerSnapshot snapshot = ledger.snapshot();
    BigInteger unclaimed = snapshot.treasures().stream()
        .filter(treasure -> !treasure.claimed())
        .map(Treasure::amount)
        .reduce(BigInteger.ZERO, BigInteger::add);
    assertEquals(snapshot.collectedFees().add(unclaimed), snapshot.heldValue());
  }

  @Test
  void emitterFailureDoesNotUndoCommittedOperation() {
    ledger = SafeKeeperLedger.deploy(OWNER, 42, FeePolicy.STORE_AND_CLAIM, clock, transfers,
        event -> {
          throw new IllegalStateException("sink down");
        },
        metrics);

    long id = ledger.store(ALICE, BOB, START + 1, BigInteger.TEN);

    assertEquals(0L, id);
    assertEquals(1L, ledger.nextTreasureId());
    assertEquals(1L, metrics.count("ledger.events.emit.error"));
  }

  @Test
  void emitterMayReadLedgerDuringEmission() {
    List<Long> seen = new ArrayList<>();
    ledger = SafeKeeperLedger.deploy(OWNER, 42, FeePolicy.STORE_AND_CLAIM, clock, transfers,
        event -> seen.add(ledger.nextTreasureId()), metrics);

    ledger.store(ALICE, BOB, START + 1, BigInteger.TEN);

    assertEquals(List.of(1L), seen);
  }

  @Test
  void resumedLedgerContinuesFromSnapshot() {
    ledger.store(ALICE, BOB, START + 1, BigInteger.valueOf(10_000));
    LedgerSnapshot snapshot = ledger.snapshot();

    SafeKeeperLedger resumed = new SafeKeeperLedger(snapshot, clock, transfers, null, null);

    assertEquals(1L, resumed.nextTreasureId());
    assertEquals(List.of(0L), resumed.treasuresByNoble(ALICE));
    assertEquals(1L, resumed.store(ALICE, CAROL, START + 1, BigInteger.TEN));
  }
}
