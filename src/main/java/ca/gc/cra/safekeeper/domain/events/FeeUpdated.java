package ca.gc.cra.safekeeper.domain.events;

import java.util.Map;

/**
 * Emitted when the owner changes the fee rate.
 *
 * @param feeBasisPoints new rate
 * @param occurredAt epoch seconds at which the change committed
 * @since 0.1.0
 */
public record FeeUpdated(int feeBasisPoints, long occurredAt) implements LedgerEvent {
  @Override
  public String type() {
    return "FeeUpdated";
  }

  @Override
  public Map<String, String> attributes() {
    return Map.of("feeBasisPoints", Integer.toString(feeBasisPoints));
  }
}
