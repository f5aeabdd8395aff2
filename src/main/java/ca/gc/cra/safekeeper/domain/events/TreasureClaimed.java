package ca.gc.cra.safekeeper.domain.events;

import ca.gc.cra.safekeeper.domain.escrow.Identity;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Emitted when a beneficiary claims a treasure and the payout was transferred.
 *
 * @param beneficiary claiming identity that received the payout
 * @param amount net payout after the claim fee
 * @param treasureId claimed treasure
 * @param occurredAt epoch seconds at which the claim committed
 * @since 0.1.0
 */
public record TreasureClaimed(Identity beneficiary, BigInteger amount, long treasureId, long occurredAt)
    implements LedgerEvent {

  public TreasureClaimed {
    Objects.requireNonNull(beneficiary, "beneficiary");
    Objects.requireNonNull(amount, "amount");
  }

  @Override
  public String type() {
    return "TreasureClaimed";
  }

  @Override
  public Map<String, String> attributes() {
    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put("beneficiary", beneficiary.toString());
    attributes.put("amount", amount.toString());
    attributes.put("treasureId", Long.toString(treasureId));
    return Collections.unmodifiableMap(attributes);
  }
}
