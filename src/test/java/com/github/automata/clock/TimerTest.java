package com.github.automata.clock;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Duration;

import org.junit.Test;

/**
 * Timer and stopwatch behavior on a manual clock.
 */
public class TimerTest {

  @Test
  public void testTimeoutIsInclusive() {
    final ManualClock clock = new ManualClock();
    final Timer timer = new Timer(clock, Duration.ofSeconds(5));
    assertFalse(timer.isTimeout());
    clock.advanceBy(Duration.ofMillis(4_999L));
    assertFalse(timer.isTimeout());
    clock.advanceBy(Duration.ofMillis(1L));
    assertTrue(timer.isTimeout());
    assertEquals(Duration.ofSeconds(5), timer.elapsed());
  }

  @Test
  public void testResetRestartsTheDelay() {
    final ManualClock clock = new ManualClock();
    final Timer timer = new Timer(clock, Duration.ofMinutes(10));
    clock.advanceBy(Duration.ofMinutes(15));
    assertTrue(timer.isTimeout());
    timer.reset();
    assertFalse(timer.isTimeout());
    assertEquals(Duration.ZERO, timer.elapsed());
    clock.advanceBy(Duration.ofMinutes(10));
    assertTrue(timer.isTimeout());
  }

  @Test
  public void testZeroDelayTimesOutImmediately() {
    assertTrue(new Timer(new ManualClock(), Duration.ZERO).isTimeout());
  }

  @Test
  public void testNegativeDelayIsRejected() {
    try {
      new Timer(new ManualClock(), Duration.ofSeconds(-1));
      fail("expected a negative delay to be rejected");
    } catch (IllegalArgumentException expected) {
      assertTrue(expected.getMessage().contains("negative"));
    }
  }

  @Test
  public void testStopwatch() {
    final ManualClock clock = new ManualClock(Timestamp.fromSecs(100));
    final Stopwatch stopwatch = new Stopwatch(clock);
    clock.advanceBy(Duration.ofSeconds(3));
    assertEquals(Duration.ofSeconds(3), stopwatch.elapsed());
    stopwatch.reset();
    clock.advanceBy(Duration.ofSeconds(1));
    assertEquals(Duration.ofSeconds(1), stopwatch.elapsed());
  }

}
