package ca.gc.cra.safekeeper.infrastructure.transfer;

import ca.gc.cra.safekeeper.application.port.ValueTransferPort;
import ca.gc.cra.safekeeper.domain.escrow.Identity;
import java.math.BigInteger;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ValueTransferPort} that credits a per-identity payout balance.
 * <p><strong>Why:</strong> The CLI has no external value network; payouts are booked here and persisted with the
 * ledger state so recipients can inspect what they received.</p>
 * <p><strong>Thread-safety:</strong> Backed by concurrent maps; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Logs each credit at DEBUG and each refusal at INFO.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryValueTransferAdapter implements ValueTransferPort {
  private static final Logger log = LoggerFactory.getLogger(InMemoryValueTransferAdapter.class);

  private final ConcurrentHashMap<Identity, BigInteger> balances = new ConcurrentHashMap<>();
  private final Set<Identity> refusing = ConcurrentHashMap.newKeySet();

  /**
   * Creates an adapter with no prior payouts.
   */
  public InMemoryValueTransferAdapter() {
    this(Map.of());
  }

  /**
   * Creates an adapter seeded with previously persisted payouts.
   *
   * @param initialBalances cumulative value received per identity; {@code null} treated as empty
   * @throws IllegalArgumentException if any balance is negative
   */
  public InMemoryValueTransferAdapter(Map<Identity, BigInteger> initialBalances) {
    if (initialBalances != null) {
      for (Map.Entry<Identity, BigInteger> entry : initialBalances.entrySet()) {
        BigInteger amount = Objects.requireNonNull(entry.getValue(), "balance");
        if (amount.signum() < 0) {
          throw new IllegalArgumentException("payout balance must not be negative for " + entry.getKey());
        }
        balances.put(Objects.requireNonNull(entry.getKey(), "identity"), amount);
      }
    }
  }

  @Override
  public boolean transfer(Identity recipient, BigInteger amount) {
    Objects.requireNonNull(recipient, "recipient");
    Objects.requireNonNull(amount, "amount");
    if (refusing.contains(recipient)) {
      log.info("Recipient {} refuses transfers; rejecting {}", recipient, amount);
      return false;
    }
    balances.merge(recipient, amount, BigInteger::add);
    log.debug("Credited {} to {}", amount, recipient);
    return true;
  }

  /**
   * Makes every later transfer to {@code recipient} report failure.
   *
   * @param recipient identity that refuses value
   */
  public void refuseTransfersTo(Identity recipient) {
    refusing.add(Objects.requireNonNull(recipient, "recipient"));
  }

  /**
   * Returns the cumulative value received by {@code identity}.
   *
   * @param identity recipient
   * @return balance, zero when nothing was received
   */
  public BigInteger balanceOf(Identity identity) {
    return balances.getOrDefault(identity, BigInteger.ZERO);
  }

  /**
   * Returns a copy of all balances ordered by address.
   *
   * @return immutable balances
   */
  public Map<Identity, BigInteger> balances() {
    Map<Identity, BigInteger> ordered = new TreeMap<>((a, b) -> a.address().compareTo(b.address()));
    ordered.putAll(balances);
    return Collections.unmodifiableMap(ordered);
  }
}
