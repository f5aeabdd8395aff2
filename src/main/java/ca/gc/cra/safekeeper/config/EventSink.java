package ca.gc.cra.safekeeper.config;

import java.util.Locale;

/**
 * Destination for ledger events.
 *
 * @since 0.1.0
 */
public enum EventSink {
  /** Structured log lines through SLF4J. */
  LOG,
  /** JSON records on a Kafka topic. */
  KAFKA,
  /** Events are discarded. */
  NONE;

  /**
   * Parses a sink name, defaulting to {@link #LOG} when blank.
   *
   * @param value textual sink such as {@code "kafka"}
   * @return parsed sink
   * @throws IllegalArgumentException if the value does not name a sink
   */
  public static EventSink fromString(String value) {
    if (value == null || value.isBlank()) {
      return LOG;
    }
    try {
      return EventSink.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown eventSink: " + value, ex);
    }
  }
}
