/**
 * Kafka adapters publishing ledger events.
 * <p><strong>Concurrency:</strong> Relies on the thread-safe {@code KafkaProducer}.</p>
 * <p><strong>Security:</strong> Payloads carry addresses and amounts only.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.safekeeper.adapter.kafka;
