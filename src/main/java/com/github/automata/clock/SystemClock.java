package com.github.automata.clock;

/**
 * Monotonic clock over {@link System#nanoTime()}.
 */
public final class SystemClock implements Clock {
  private static final SystemClock INSTANCE = new SystemClock();

  private SystemClock() {}

  public static SystemClock getInstance() {
    return INSTANCE;
  }

  @Override
  public Timestamp now() {
    return Timestamp.fromNanos(System.nanoTime());
  }

  @Override
  public String toString() {
    return "SystemClock";
  }
}
