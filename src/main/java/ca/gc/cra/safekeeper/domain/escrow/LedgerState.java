package ca.gc.cra.safekeeper.domain.escrow;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Mutable ledger aggregate: treasure table, index tables, fee pool, owner, and counters.
 * <p><strong>Why:</strong> Gives the ledger core raw mutators it can pair with undo actions; this class performs no
 * precondition checks of its own beyond structural ones.</p>
 * <p><strong>Role:</strong> Domain aggregate owned by exactly one {@code SafeKeeperLedger}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; the owning ledger serializes access.</p>
 *
 * @since 0.1.0
 */
public final class LedgerState {
  private final FeePolicy feePolicy;
  private final List<Treasure> treasures;
  private final Map<Identity, List<Long>> byNoble = new HashMap<>();
  private final Map<Identity, List<Long>> byBeneficiary = new HashMap<>();
  private int feeBasisPoints;
  private Identity owner;
  private BigInteger collectedFees;
  private BigInteger heldValue;

  private LedgerState(LedgerSnapshot snapshot) {
    this.feePolicy = snapshot.feePolicy();
    this.feeBasisPoints = snapshot.feeBasisPoints();
    this.owner = snapshot.owner();
    this.collectedFees = snapshot.collectedFees();
    this.heldValue = snapshot.heldValue();
    this.treasures = new ArrayList<>(snapshot.treasures());
    for (Treasure treasure : treasures) {
      index(treasure);
    }
  }

  /**
   * Rebuilds a mutable state, including both index tables, from a snapshot.
   *
   * @param snapshot persisted state; must not be {@code null}
   * @return mutable state
   */
  public static LedgerState restore(LedgerSnapshot snapshot) {
    return new LedgerState(Objects.requireNonNull(snapshot, "snapshot"));
  }

  /**
   * Captures an immutable copy of the current state.
   *
   * @return snapshot
   */
  public LedgerSnapshot snapshot() {
    return new LedgerSnapshot(
        treasures.size(), feeBasisPoints, feePolicy, owner, collectedFees, heldValue, treasures);
  }

  public long nextTreasureId() {
    return treasures.size();
  }

  public FeePolicy feePolicy() {
    return feePolicy;
  }

  public int feeBasisPoints() {
    return feeBasisPoints;
  }

  public Identity owner() {
    return owner;
  }

  public BigInteger collectedFees() {
    return collectedFees;
  }

  public BigInteger heldValue() {
    return heldValue;
  }

  /**
   * Looks up a treasure by id.
   *
   * @param id treasure id; any value accepted
   * @return treasure when one exists for the id
   */
  public Optional<Treasure> treasure(long id) {
    if (id < 0 || id >= treasures.size()) {
      return Optional.empty();
    }
    return Optional.of(treasures.get((int) id));
  }

  /**
   * Returns the ids deposited by the noble, in creation order.
   *
   * @param noble depositor identity
   * @return immutable id list, possibly empty
   */
  public List<Long> idsByNoble(Identity noble) {
    return List.copyOf(byNoble.getOrDefault(noble, List.of()));
  }

  /**
   * Returns the ids claimable by the beneficiary, in creation order.
   *
   * @param beneficiary beneficiary identity
   * @return immutable id list, possibly empty
   */
  public List<Long> idsByBeneficiary(Identity beneficiary) {
    return List.copyOf(byBeneficiary.getOrDefault(beneficiary, List.of()));
  }

  /**
   * Appends a new treasure and indexes it for its noble and beneficiary.
   *
   * @param treasure treasure whose id must equal {@link #nextTreasureId()}
   * @throws IllegalArgumentException if the id is not the next one
   */
  public void append(Treasure treasure) {
    Objects.requireNonNull(treasure, "treasure");
    if (treasure.id() != treasures.size()) {
      throw new IllegalArgumentException(
          "treasure id " + treasure.id() + " is not the next id " + treasures.size());
    }
    treasures.add(treasure);
    index(treasure);
  }

  /**
   * Removes the most recently appended treasure and its index entries.
   *
   * @param id id of the last treasure
   * @throws IllegalStateException if {@code id} is not the last treasure
   */
  public void removeLast(long id) {
    int last = treasures.size() - 1;
    if (last < 0 || last != id) {
      throw new IllegalStateException("treasure " + id + " is not the last appended treasure");
    }
    Treasure removed = treasures.remove(last);
    unindexLast(byNoble, removed.noble(), id);
    unindexLast(byBeneficiary, removed.beneficiary(), id);
  }

  /**
   * Replaces an existing treasure; indices are unaffected because parties never change.
   *
   * @param treasure replacement with the same id, noble, and beneficiary
   */
  public void replace(Treasure treasure) {
    Objects.requireNonNull(treasure, "treasure");
    Treasure existing = treasure(treasure.id())
        .orElseThrow(() -> new IllegalArgumentException("unknown treasure " + treasure.id()));
    if (!existing.noble().equals(treasure.noble())
        || !existing.beneficiary().equals(treasure.beneficiary())) {
      throw new IllegalArgumentException("treasure " + treasure.id() + " parties must not change");
    }
    treasures.set((int) treasure.id(), treasure);
  }

  public void setFeeBasisPoints(int feeBasisPoints) {
    if (!FeeCalculator.isValidRate(feeBasisPoints)) {
      throw new IllegalArgumentException("feeBasisPoints out of range: " + feeBasisPoints);
    }
    this.feeBasisPoints = feeBasisPoints;
  }

  public void setOwner(Identity owner) {
    this.owner = Objects.requireNonNull(owner, "owner");
  }

  public void setCollectedFees(BigInteger collectedFees) {
    this.collectedFees = requireNonNegative("collectedFees", collectedFees);
  }

  public void setHeldValue(BigInteger heldValue) {
    this.heldValue = requireNonNegative("heldValue", heldValue);
  }

  private void index(Treasure treasure) {
    byNoble.computeIfAbsent(treasure.noble(), k -> new ArrayList<>()).add(treasure.id());
    byBeneficiary.computeIfAbsent(treasure.beneficiary(), k -> new ArrayList<>()).add(treasure.id());
  }

  private static void unindexLast(Map<Identity, List<Long>> index, Identity identity, long id) {
    List<Long> ids = index.get(identity);
    if (ids == null || ids.isEmpty() || ids.get(ids.size() - 1) != id) {
      throw new IllegalStateException("index for " + identity + " does not end with " + id);
    }
    ids.remove(ids.size() - 1);
    if (ids.isEmpty()) {
      index.remove(identity);
    }
  }

  private static BigInteger requireNonNegative(String name, BigInteger value) {
    Objects.requireNonNull(value, name);
    if (value.signum() < 0) {
      throw new IllegalArgumentException(name + " must not be negative (was " + value + ")");
    }
    return value;
  }
}
