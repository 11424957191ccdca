package com.logicsignalprotector.cortexconnector.connection;

import java.time.Duration;

/**
 * Reconnect delay: starts at {@code initial}, doubles after every failure, never exceeds {@code
 * max}. With the defaults the sequence is 2, 4, 8, 16, 32, 60, 60, ... seconds.
 *
 * <p>Not thread-safe; owned by the supervisor thread.
 */
public class ExponentialBackoff {

  private final Duration initial;
  private final Duration max;
  private Duration current;

  public ExponentialBackoff(Duration initial, Duration max) {
    if (initial == null || initial.isNegative() || initial.isZero()) {
      throw new IllegalArgumentException("initial backoff must be positive");
    }
    if (max == null || max.compareTo(initial) < 0) {
      throw new IllegalArgumentException("max backoff must be >= initial");
    }
    this.initial = initial;
    this.max = max;
    this.current = initial;
  }

  /** Returns the delay to wait now and doubles the next one. */
  public Duration nextDelay() {
    Duration delay = current;
    Duration doubled = current.multipliedBy(2);
    current = doubled.compareTo(max) > 0 ? max : doubled;
    return delay;
  }

  public Duration peek() {
    return current;
  }

  public void reset() {
    current = initial;
  }
}
