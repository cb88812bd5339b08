package com.github.automata.clock;

import java.time.Duration;

/**
 * Measures time elapsed on a {@link Clock} since it was started or last reset.
 */
public final class Stopwatch {
  private final Clock clock;
  private Timestamp start;

  public Stopwatch(final Clock clock) {
    this.clock = clock;
    this.start = clock.now();
  }

  public Duration elapsed() {
    return clock.now().since(start);
  }

  public void reset() {
    start = clock.now();
  }

  @Override
  public String toString() {
    return "Stopwatch [elapsed=" + elapsed() + "]";
  }
}
