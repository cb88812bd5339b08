package com.github.automata.clock;

import java.time.Duration;

/**
 * An instant on a monotonic time line, in nanoseconds from the clock's own origin. Only timestamps
 * of the same clock are comparable.
 */
public final class Timestamp implements Comparable<Timestamp> {
  private final long nanos;

  private Timestamp(final long nanos) {
    this.nanos = nanos;
  }

  public static Timestamp fromNanos(final long nanos) {
    return new Timestamp(nanos);
  }

  public static Timestamp fromMillis(final long millis) {
    return new Timestamp(Duration.ofMillis(millis).toNanos());
  }

  public static Timestamp fromSecs(final long secs) {
    return new Timestamp(Duration.ofSeconds(secs).toNanos());
  }

  public static Timestamp fromMinutes(final long minutes) {
    return new Timestamp(Duration.ofMinutes(minutes).toNanos());
  }

  public long getNanos() {
    return nanos;
  }

  public Timestamp plus(final Duration duration) {
    return new Timestamp(nanos + duration.toNanos());
  }

  /**
   * Time elapsed from {@code earlier} to this timestamp, zero if {@code earlier} is later.
   */
  public Duration since(final Timestamp earlier) {
    return nanos <= earlier.nanos ? Duration.ZERO : Duration.ofNanos(nanos - earlier.nanos);
  }

  @Override
  public int compareTo(final Timestamp other) {
    return Long.compare(nanos, other.nanos);
  }

  @Override
  public int hashCode() {
    return Long.hashCode(nanos);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return nanos == ((Timestamp) obj).nanos;
  }

  @Override
  public String toString() {
    return "Timestamp [" + Duration.ofNanos(nanos) + "]";
  }
}
