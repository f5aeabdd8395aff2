package ca.gc.cra.safekeeper.domain.events;

import ca.gc.cra.safekeeper.domain.escrow.Identity;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Emitted when the owner drains the fee pool.
 *
 * @param recipient identity that received the fees
 * @param amount drained amount; zero when the pool was empty
 * @param occurredAt epoch seconds at which the withdrawal committed
 * @since 0.1.0
 */
public record FeesWithdrawn(Identity recipient, BigInteger amount, long occurredAt) implements LedgerEvent {
  public FeesWithdrawn {
    Objects.requireNonNull(recipient, "recipient");
    Objects.requireNonNull(amount, "amount");
  }

  @Override
  public String type() {
    return "FeesWithdrawn";
  }

  @Override
  public Map<String, String> attributes() {
    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put("recipient", recipient.toString());
    attributes.put("amount", amount.toString());
    return Collections.unmodifiableMap(attributes);
  }
}
