package com.github.automata;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

/**
 * Tests for the swap container's hand-out and poisoning behavior.
 */
public class TakeableTest {

  @Test
  public void testBorrowReplacesValue() {
    final Takeable<String> takeable = new Takeable<>("closed");
    takeable.borrow(value -> value + "-open");
    assertEquals("closed-open", takeable.get());
    assertTrue(takeable.isUsable());

    takeable.set("half-open");
    assertEquals("half-open", takeable.get());
  }

  @Test
  public void testBorrowResultReturnsByProduct() {
    final Takeable<Integer> takeable = new Takeable<>(41);
    final String output = takeable.borrowResult(value -> new Takeable.Swap<>(value + 1, "ticked"));
    assertEquals("ticked", output);
    assertEquals(Integer.valueOf(42), takeable.get());
  }

  @Test
  public void testValueIsHandedOutExclusively() {
    final Takeable<StringBuilder> takeable = new Takeable<>(new StringBuilder("a"));
    takeable.borrow(value -> {
      // the holder is empty while the transformation runs
      assertFalse(takeable.isUsable());
      return value.append('b');
    });
    assertEquals("ab", takeable.get().toString());
  }

  @Test
  public void testFailedBorrowPoisonsTheHolder() {
    final Takeable<String> takeable = new Takeable<>("value");
    try {
      takeable.borrow(value -> {
        throw new IllegalArgumentException("handler blew up");
      });
      fail("expected the transformation to fail");
    } catch (IllegalArgumentException expected) {
      assertEquals("handler blew up", expected.getMessage());
    }
    assertFalse(takeable.isUsable());

    try {
      takeable.get();
      fail("expected read to fail");
    } catch (IllegalStateException expected) {
      assertEquals(Takeable.EMPTY_MESSAGE, expected.getMessage());
    }
    try {
      takeable.set("again");
      fail("expected write to fail");
    } catch (IllegalStateException expected) {
      assertEquals(Takeable.EMPTY_MESSAGE, expected.getMessage());
    }
    try {
      takeable.borrow(value -> value);
      fail("expected another transformation to fail");
    } catch (IllegalStateException expected) {
      assertEquals(Takeable.EMPTY_MESSAGE, expected.getMessage());
    }
  }

  @Test
  public void testTakeEmptiesTheHolder() {
    final Takeable<String> takeable = new Takeable<>("only");
    assertEquals("only", takeable.take());
    assertFalse(takeable.isUsable());
    try {
      takeable.take();
      fail("expected a second take to fail");
    } catch (IllegalStateException expected) {
      assertEquals(Takeable.EMPTY_MESSAGE, expected.getMessage());
    }
  }

  @Test
  public void testNullSwapPoisonsTheHolder() {
    final Takeable<String> takeable = new Takeable<>("value");
    try {
      takeable.<String>borrowResult(value -> null);
      fail("expected a missing swap to fail");
    } catch (IllegalStateException expected) {
      assertFalse(takeable.isUsable());
    }
  }

}
