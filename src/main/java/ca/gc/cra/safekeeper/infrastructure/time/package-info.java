/**
 * Time adapters implementing {@link ca.gc.cra.safekeeper.application.port.ClockPort}.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 */
package ca.gc.cra.safekeeper.infrastructure.time;
