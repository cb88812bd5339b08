package com.github.automata.clock;

import java.time.Duration;

/**
 * A {@link Stopwatch} with a fixed delay: times out once at least the delay has elapsed since it
 * was started or last reset.
 */
public final class Timer {
  private final Stopwatch stopwatch;
  private final Duration delay;

  public Timer(final Clock clock, final Duration delay) {
    if (delay.isNegative()) {
      throw new IllegalArgumentException("Timer delay cannot be negative: " + delay);
    }
    this.stopwatch = new Stopwatch(clock);
    this.delay = delay;
  }

  public boolean isTimeout() {
    return stopwatch.elapsed().compareTo(delay) >= 0;
  }

  public Duration elapsed() {
    return stopwatch.elapsed();
  }

  public Duration getDelay() {
    return delay;
  }

  public void reset() {
    stopwatch.reset();
  }

  @Override
  public String toString() {
    return "Timer [delay=" + delay + ", elapsed=" + elapsed() + "]";
  }
}
