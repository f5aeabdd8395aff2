/**
 * Ledger notifications emitted after operations commit.
 * <p><strong>Concurrency:</strong> Immutable records; safe to hand to asynchronous publishers.
 * <p><strong>Observability:</strong> Event names double as log prefixes and Kafka record keys.
 *
 * @since 0.1.0
 */
package ca.gc.cra.safekeeper.domain.events;
