package ca.gc.cra.safekeeper.adapter.kafka;

import static ca.gc.cra.safekeeper.testutil.Identities.ALICE;
import static ca.gc.cra.safekeeper.testutil.Identities.BOB;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.safekeeper.domain.events.FeeUpdated;
import ca.gc.cra.safekeeper.domain.events.OwnershipTransferred;
import ca.gc.cra.safekeeper.domain.events.TreasureClaimed;
import ca.gc.cra.safekeeper.domain.events.TreasureStored;
import ca.gc.cra.safekeeper.testutil.RecordingMetricsPort;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.junit.jupiter.api.Test;

class KafkaLedgerEventEmitterTest {

  @Test
  void publishesStoredEventAsJsonKeyedByTreasure() {
    MockProducer<String, byte[]> producer = MockProducerFactory.autoCompleting();
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    KafkaLedgerEventEmitter emitter = new KafkaLedgerEventEmitter(producer, "ledger.events", metrics);

    emitter.emit(new TreasureStored(ALICE, BOB, new BigInteger("995800000000000000"), 2_000, 3, 1_000));

    List<ProducerRecord<String, byte[]>> history = producer.history();
    assertEquals(1, history.size());
    ProducerRecord<String, byte[]> record = history.get(0);
    assertEquals("ledger.events", record.topic());
    assertEquals("treasure-3", record.key());
    String json = new String(record.value(), StandardCharsets.UTF_8);
    assertEquals("{\"schemaVersion\":1,\"type\":\"TreasureStored\",\"occurredAt\":1000,\"treasureId\":3,"
        + "\"unlockTime\":2000,\"noble\":\"" + ALICE.address() + "\",\"beneficiary\":\"" + BOB.address()
        + "\",\"amount\":\"995800000000000000\"}", json);
    assertEquals(1L, metrics.count("ledgerEvents.kafka.sent"));
  }

  @Test
  void ledgerWideEventsShareOneKey() {
    assertEquals("ledger", KafkaLedgerEventEmitter.key(new FeeUpdated(10, 1)));
    assertEquals("ledger", KafkaLedgerEventEmitter.key(new OwnershipTransferred(ALICE, BOB, 1)));
    assertEquals("treasure-9", KafkaLedgerEventEmitter.key(new TreasureClaimed(BOB, BigInteger.ONE, 9, 1)));
  }

  @Test
  void serializesAdministrativeEvents() {
    KafkaLedgerEventEmitter emitter =
        new KafkaLedgerEventEmitter(MockProducerFactory.autoCompleting(), "ledger.events", null);

    String fee = new String(emitter.serialize(new FeeUpdated(75, 5)), StandardCharsets.UTF_8);
    String owner = new String(emitter.serialize(new OwnershipTransferred(ALICE, BOB, 6)), StandardCharsets.UTF_8);

    assertEquals("{\"schemaVersion\":1,\"type\":\"FeeUpdated\",\"occurredAt\":5,\"feeBasisPoints\":75}", fee);
    assertTrue(owner.contains("\"previousOwner\":\"" + ALICE.address() + "\""));
    assertTrue(owner.contains("\"newOwner\":\"" + BOB.address() + "\""));
  }

  @Test
  void failedSendIsCounted() {
    MockProducer<String, byte[]> producer = MockProducerFactory.manual();
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    KafkaLedgerEventEmitter emitter = new KafkaLedgerEventEmitter(producer, "ledger.events", metrics);

    emitter.emit(new FeeUpdated(1, 1));
    assertTrue(producer.errorNext(new IllegalStateException("broker down")));

    assertEquals(1L, metrics.count("ledgerEvents.kafka.sent"));
    assertEquals(1L, metrics.count("ledgerEvents.kafka.error"));
  }

  @Test
  void closeFlushesAndClosesProducer() {
    MockProducer<String, byte[]> producer = MockProducerFactory.autoCompleting();
    KafkaLedgerEventEmitter emitter = new KafkaLedgerEventEmitter(producer, "ledger.events", null);

    emitter.close();

    assertTrue(producer.closed());
  }

  @Test
  void rejectsInvalidTopic() {
    assertThrows(IllegalArgumentException.class,
        () -> new KafkaLedgerEventEmitter(MockProducerFactory.autoCompleting(), "bad topic!", null));
  }
}
