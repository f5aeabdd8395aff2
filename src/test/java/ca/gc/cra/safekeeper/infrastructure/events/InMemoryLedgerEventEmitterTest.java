package ca.gc.cra.safekeeper.infrastructure.events;

import static ca.gc.cra.safekeeper.testutil.Identities.ALICE;
import static ca.gc.cra.safekeeper.testutil.Identities.BOB;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.safekeeper.domain.events.FeeUpdated;
import ca.gc.cra.safekeeper.domain.events.OwnershipTransferred;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryLedgerEventEmitterTest {

  @Test
  void capturesEventsInOrderAndFiltersByType() {
    InMemoryLedgerEventEmitter emitter = new InMemoryLedgerEventEmitter();
    FeeUpdated first = new FeeUpdated(1, 10);
    OwnershipTransferred second = new OwnershipTransferred(ALICE, BOB, 11);
    FeeUpdated third = new FeeUpdated(2, 12);

    emitter.emit(first);
    emitter.emit(second);
    emitter.emit(third);

    assertEquals(List.of(first, second, third), emitter.snapshot());
    assertEquals(List.of(first, third), emitter.ofType(FeeUpdated.class));

    emitter.clear();
    assertTrue(emitter.snapshot().isEmpty());
  }
}
