package ca.gc.cra.safekeeper.domain.events;

import ca.gc.cra.safekeeper.domain.escrow.Identity;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Emitted when a noble deposits value for a beneficiary.
 *
 * @param noble depositor
 * @param beneficiary identity allowed to claim
 * @param amount net amount escrowed after the deposit fee
 * @param unlockTime epoch seconds at which the treasure unlocks
 * @param treasureId id assigned to the new treasure
 * @param occurredAt epoch seconds at which the deposit committed
 * @since 0.1.0
 */
public record TreasureStored(
    Identity noble,
    Identity beneficiary,
    BigInteger amount,
    long unlockTime,
    long treasureId,
    long occurredAt) implements LedgerEvent {

  public TreasureStored {
    Objects.requireNonNull(noble, "noble");
    Objects.requireNonNull(beneficiary, "beneficiary");
    Objects.requireNonNull(amount, "amount");
  }

  @Override
  public String type() {
    return "TreasureStored";
  }

  @Override
  public Map<String, String> attributes() {
    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put("noble", noble.toString());
    attributes.put("beneficiary", beneficiary.toString());
    attributes.put("amount", amount.toString());
    attributes.put("unlockTime", Long.toString(unlockTime));
    attributes.put("treasureId", Long.toString(treasureId));
    return Collections.unmodifiableMap(attributes);
  }
}
