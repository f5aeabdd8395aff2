package ca.gc.cra.safekeeper.domain.events;

import ca.gc.cra.safekeeper.domain.escrow.Identity;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Emitted when the administrator role moves to another identity or is renounced.
 *
 * @param previousOwner former owner
 * @param newOwner new owner; {@link Identity#NONE} after a renounce
 * @param occurredAt epoch seconds at which the change committed
 * @since 0.1.0
 */
public record OwnershipTransferred(Identity previousOwner, Identity newOwner, long occurredAt)
    implements LedgerEvent {

  public OwnershipTransferred {
    Objects.requireNonNull(previousOwner, "previousOwner");
    Objects.requireNonNull(newOwner, "newOwner");
  }

  @Override
  public String type() {
    return "OwnershipTransferred";
  }

  @Override
  public Map<String, String> attributes() {
    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put("previousOwner", previousOwner.toString());
    attributes.put("newOwner", newOwner.toString());
    return Collections.unmodifiableMap(attributes);
  }
}
