package ca.gc.cra.safekeeper.infrastructure.events;

import ca.gc.cra.safekeeper.application.port.LedgerEventEmitter;
import ca.gc.cra.safekeeper.domain.events.LedgerEvent;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory emitter used for tests and dry runs.
 *
 * @since 0.1.0
 */
public final class InMemoryLedgerEventEmitter implements LedgerEventEmitter {
  private final CopyOnWriteArrayList<LedgerEvent> events = new CopyOnWriteArrayList<>();

  @Override
  public void emit(LedgerEvent event) {
    events.add(Objects.requireNonNull(event, "event"));
  }

  /**
   * Returns the events emitted so far, oldest first.
   *
   * @return immutable list of events
   */
  public List<LedgerEvent> snapshot() {
    return List.copyOf(events);
  }

  /**
   * Returns the emitted events of one type.
   *
   * @param type event class
   * @param <T> event type
   * @return immutable list, oldest first
   */
  public <T extends LedgerEvent> List<T> ofType(Class<T> type) {
    return events.stream().filter(type::isInstance).map(type::cast).toList();
  }

  /**
   * Clears the captured events.
   */
  public void clear() {
    events.clear();
  }
}
