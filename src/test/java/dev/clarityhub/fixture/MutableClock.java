package dev.clarityhub.fixture;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * UTC clock for tests that need time to move, e.g. across a day boundary.
 *
 * <pre>{@code
 * MutableClock clock = MutableClock.at("2026-03-01T23:59:00Z");
 * clock.advance(Duration.ofMinutes(2));
 * }</pre>
 */
public final class MutableClock extends Clock {

  private Instant now;

  private MutableClock(Instant now) {
    this.now = now;
  }

  public static MutableClock at(String instant) {
    return new MutableClock(Instant.parse(instant));
  }

  public void advance(Duration duration) {
    now = now.plus(duration);
  }

  @Override
  public ZoneId getZone() {
    return ZoneOffset.UTC;
  }

  @Override
  public Clock withZone(ZoneId zone) {
    throw new UnsupportedOperationException("MutableClock is fixed to UTC");
  }

  @Override
  public Instant instant() {
    return now;
  }
}
