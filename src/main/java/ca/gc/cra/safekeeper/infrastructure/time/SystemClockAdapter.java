package ca.gc.cra.safekeeper.infrastructure.time;

import ca.gc.cra.safekeeper.application.port.ClockPort;
import java.time.Clock;
import java.util.Objects;

/**
 * {@link ClockPort} implementation backed by a {@link Clock}, truncated to whole seconds.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  /**
   * Creates an adapter reading the system UTC clock.
   */
  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  /**
   * Creates an adapter reading the supplied clock.
   *
   * @param clock time source; must not be {@code null}
   */
  public SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the current epoch second.
   *
   * @return seconds since the epoch
   * @implNote Uses {@link java.time.Instant#getEpochSecond()}, which floors sub-second precision.
   */
  @Override
  public long nowEpochSeconds() {
    return clock.instant().getEpochSecond();
  }
}
