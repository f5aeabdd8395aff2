package ca.gc.cra.safekeeper.adapter.kafka;

import ca.gc.cra.safekeeper.application.port.LedgerEventEmitter;
import ca.gc.cra.safekeeper.application.port.MetricsPort;
import ca.gc.cra.safekeeper.domain.events.FeeUpdated;
import ca.gc.cra.safekeeper.domain.events.FeesWithdrawn;
import ca.gc.cra.safekeeper.domain.events.LedgerEvent;
import ca.gc.cra.safekeeper.domain.events.OwnershipTransferred;
import ca.gc.cra.safekeeper.domain.events.TreasureClaimed;
import ca.gc.cra.safekeeper.domain.events.TreasureStored;
import ca.gc.cra.safekeeper.validation.Strings;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link LedgerEventEmitter} that publishes ledger events to Kafka as JSON.
 * <p><strong>Why:</strong> Lets downstream indexers follow deposits, claims, and fee changes without reading the
 * state file.</p>
 * <p><strong>Role:</strong> Outbound adapter selected by {@code eventSink=kafka}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Serialize each event with a Jackson streaming generator.</li>
 *   <li>Key records by treasure id, or by the event type for ledger-wide events, so per-treasure order holds.</li>
 *   <li>Flush and close the producer on shutdown.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Mirrors the supplied {@link Producer}; {@link KafkaProducer} is thread-safe.</p>
 * <p><strong>Observability:</strong> Counts {@code ledgerEvents.kafka.sent} and {@code ledgerEvents.kafka.error};
 * logs asynchronous send failures at ERROR.</p>
 *
 * @since 0.1.0
 */
public final class KafkaLedgerEventEmitter implements LedgerEventEmitter {
  private static final Logger log = LoggerFactory.getLogger(KafkaLedgerEventEmitter.class);
  static final int SCHEMA_VERSION = 1;

  private final Producer<String, byte[]> producer;
  private final String topic;
  private final MetricsPort metrics;
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Creates an emitter publishing through a new {@link KafkaProducer}.
   *
   * @param bootstrapServers comma-separated bootstrap servers; must not be blank
   * @param topic destination topic
   * @param metrics metrics sink; may be {@code null}
   */
  public KafkaLedgerEventEmitter(String bootstrapServers, String topic, MetricsPort metrics) {
    this(createProducer(bootstrapServers), topic, metrics);
  }

  KafkaLedgerEventEmitter(Producer<String, byte[]> producer, String topic, MetricsPort metrics) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.sanitizeTopic("kafkaTopic", topic);
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public void emit(LedgerEvent event) {
    Objects.requireNonNull(event, "event");
    byte[] payload = serialize(event);
    ProducerRecord<String, byte[]> record = new ProducerRecord<>(topic, key(event), payload);
    producer.send(record, (metadata, ex) -> {
      if (ex != null) {
        metrics.increment("ledgerEvents.kafka.error");
        log.error("Kafka publish failure for {} on topic {}", event.type(), topic, ex);
      }
    });
    metrics.increment("ledgerEvents.kafka.sent");
  }

  /**
   * Flushes pending sends and closes the producer.
   */
  @Override
  public void close() {
    try {
      producer.flush();
    } catch (RuntimeException ex) {
      log.warn("Kafka producer flush failed during shutdown", ex);
    } finally {
      producer.close(Duration.ofSeconds(5));
    }
  }

  static String key(LedgerEvent event) {
    if (event instanceof TreasureStored stored) {
      return "treasure-" + stored.treasureId();
    }
    if (event instanceof TreasureClaimed claimed) {
      return "treasure-" + claimed.treasureId();
    }
    return "ledger";
  }

  byte[] serialize(LedgerEvent event) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
      gen.writeStringField("type", event.type());
      gen.writeNumberField("occurredAt", event.occurredAt());
      if (event instanceof TreasureStored stored) {
        gen.writeNumberField("treasureId", stored.treasureId());
        gen.writeNumberField("unlockTime", stored.unlockTime());
        gen.writeStringField("noble", stored.noble().address());
        gen.writeStringField("beneficiary", stored.beneficiary().address());
        gen.writeStringField("amount", stored.amount().toString());
      } else if (event instanceof TreasureClaimed claimed) {
        gen.writeNumberField("treasureId", claimed.treasureId());
        gen.writeStringField("beneficiary", claimed.beneficiary().address());
        gen.writeStringField("amount", claimed.amount().toString());
      } else if (event instanceof FeeUpdated updated) {
        gen.writeNumberField("feeBasisPoints", updated.feeBasisPoints());
      } else if (event instanceof FeesWithdrawn withdrawn) {
        gen.writeStringField("recipient", withdrawn.recipient().address());
        gen.writeStringField("amount", withdrawn.amount().toString());
      } else if (event instanceof OwnershipTransferred transferred) {
        gen.writeStringField("previousOwner", transferred.previousOwner().address());
        gen.writeStringField("newOwner", transferred.newOwner().address());
      } else {
        gen.writeObjectFieldStart("attributes");
        for (Map.Entry<String, String> entry : event.attributes().entrySet()) {
          gen.writeStringField(entry.getKey(), entry.getValue());
        }
        gen.writeEndObject();
      }
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to serialize " + event.type(), ex);
    }
    return out.toByteArray();
  }

  private static Producer<String, byte[]> createProducer(String bootstrapServers) {
    String servers = Strings.requireNonBlank("kafkaBootstrap", bootstrapServers);
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, servers);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}
