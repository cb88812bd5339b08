package com.github.automata.clock;

import java.time.Duration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Deterministic clock for tests and simulations.
 *
 * - starts at the given timestamp, zero by default<br>
 * - moves only when told to, and never backwards<br>
 * - {@link #share()} hands out this same instance, so every holder sees every advance<br>
 */
public final class ManualClock implements Clock {
  private static final Logger logger = LogManager.getLogger(ManualClock.class.getSimpleName());

  private Timestamp now;

  public ManualClock() {
    this(Timestamp.fromNanos(0L));
  }

  public ManualClock(final Timestamp start) {
    this.now = start;
  }

  @Override
  public synchronized Timestamp now() {
    return now;
  }

  public synchronized void advanceBy(final Duration delta) {
    if (delta.isNegative() || delta.isZero()) {
      throw new IllegalArgumentException("Cannot advance clock by a non-positive duration " + delta);
    }
    now = now.plus(delta);
    if (logger.isDebugEnabled()) {
      logger.debug("Advanced by " + delta + " to " + now);
    }
  }

  public synchronized void advanceTo(final Timestamp timestamp) {
    if (timestamp.compareTo(now) < 0) {
      throw new IllegalArgumentException(
          "Cannot move clock backwards from " + now + " to " + timestamp);
    }
    now = timestamp;
  }

  @Override
  public synchronized String toString() {
    return "ManualClock [now=" + now + "]";
  }
}
