package ca.gc.cra.safekeeper.domain.escrow;

import static ca.gc.cra.safekeeper.testutil.Identities.ALICE;
import static ca.gc.cra.safekeeper.testutil.Identities.BOB;
import static ca.gc.cra.safekeeper.testutil.Identities.OWNER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class LedgerSnapshotTest {

  private static Treasure open(long id, long amount) {
    return new Treasure(id, BigInteger.valueOf(amount), 100, false, ALICE, BOB);
  }

  @Test
  void genesisIsEmpty() {
    LedgerSnapshot genesis = LedgerSnapshot.genesis(OWNER, 42, FeePolicy.STORE_ONLY);

    assertEquals(0L, genesis.nextTreasureId());
    assertEquals(BigInteger.ZERO, genesis.heldValue());
    assertEquals(List.of(), genesis.treasures());
    assertThrows(IllegalArgumentException.class,
        () -> LedgerSnapshot.genesis(Identity.NONE, 42, FeePolicy.STORE_ONLY));
    assertThrows(IllegalArgumentException.class,
        () -> LedgerSnapshot.genesis(OWNER, 10_001, FeePolicy.STORE_ONLY));
  }

  @Test
  void acceptsConsistentState() {
    LedgerSnapshot snapshot = new LedgerSnapshot(2, 42, FeePolicy.STORE_AND_CLAIM, Identity.NONE,
        BigInteger.valueOf(7), BigInteger.valueOf(37), List.of(open(0, 30), open(1, 0).markClaimed()));

    assertEquals(2, snapshot.treasures().size());
  }

  @Test
  void copiesTreasureList() {
    List<Treasure> treasures = new ArrayList<>(List.of(open(0, 30)));
    LedgerSnapshot snapshot = new LedgerSnapshot(1, 42, FeePolicy.STORE_AND_CLAIM, OWNER,
        BigInteger.ZERO, BigInteger.valueOf(30), treasures);

    treasures.clear();

    assertEquals(1, snapshot.treasures().size());
  }

  @Test
  void rejectsInconsistentState() {
    assertThrows(IllegalArgumentException.class, () -> new LedgerSnapshot(2, 42, FeePolicy.STORE_AND_CLAIM,
        OWNER, BigInteger.ZERO, BigInteger.valueOf(30), List.of(open(0, 30))));
    assertThrows(IllegalArgumentException.class, () -> new LedgerSnapshot(1, 42, FeePolicy.STORE_AND_CLAIM,
        OWNER, BigInteger.ZERO, BigInteger.valueOf(30), List.of(open(4, 30))));
    assertThrows(IllegalArgumentException.class, () -> new LedgerSnapshot(1, 42, FeePolicy.STORE_AND_CLAIM,
        OWNER, BigInteger.ONE, BigInteger.valueOf(30), List.of(open(0, 30))));
    assertThrows(IllegalArgumentException.class, () -> new LedgerSnapshot(0, 42, FeePolicy.STORE_AND_CLAIM,
        OWNER, BigInteger.valueOf(-1), BigInteger.valueOf(-1), List.of()));
  }

  @Test
  void rejectsTreasureWithoutParties() {
    Treasure orphaned = new Treasure(0, BigInteger.TEN, 100, false, ALICE, Identity.NONE);
    Treasure anonymous = new Treasure(0, BigInteger.TEN, 100, false, Identity.NONE, BOB);

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> new LedgerSnapshot(1, 42,
        FeePolicy.STORE_AND_CLAIM, OWNER, BigInteger.ZERO, BigInteger.TEN, List.of(orphaned)));
    assertEquals("treasure 0 must have a noble and a beneficiary", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> new LedgerSnapshot(1, 42,
        FeePolicy.STORE_AND_CLAIM, OWNER, BigInteger.ZERO, BigInteger.TEN, List.of(anonymous)));
  }
}
