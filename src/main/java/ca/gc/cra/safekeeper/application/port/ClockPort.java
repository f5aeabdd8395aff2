package ca.gc.cra.safekeeper.application.port;

/**
 * <strong>What:</strong> Port supplying the current instant that gates deposits and claims.
 * <p><strong>Why:</strong> The ledger never advances time itself; deployments plug in the system clock, a block
 * timestamp source, or a fixed instant for scripted runs.</p>
 * <p><strong>Role:</strong> Outbound port consumed by the ledger core.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose the current instant in whole epoch seconds.</li>
 *   <li>Never move backwards between two reads.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see ca.gc.cra.safekeeper.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current instant.
   *
   * @return seconds since 1970-01-01T00:00:00Z; monotonically non-decreasing across calls
   */
  long nowEpochSeconds();

  /**
   * Default {@link ClockPort} backed by the JVM wall clock.
   */
  ClockPort SYSTEM = () -> System.currentTimeMillis() / 1000L;

  /**
   * Returns a clock frozen at the supplied instant.
   *
   * @param epochSeconds instant reported by every read
   * @return fixed clock
   */
  static ClockPort fixed(long epochSeconds) {
    return () -> epochSeconds;
  }
}
