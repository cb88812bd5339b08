package com.github.automata;

import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * A single-slot holder that lends its value out to a transformation and takes the result back.
 * While a transformation runs the slot is empty; if the transformation throws, the slot stays empty
 * for good and every later access except {@link #isUsable()} fails with an
 * {@link IllegalStateException}. On the normal path the holder always ends up with exactly one
 * value.
 *
 * Not thread-safe; owned by one machine instance.
 */
public final class Takeable<T> {
  static final String EMPTY_MESSAGE = "the value has already been removed from the Takeable";

  private T value;
  private boolean present;

  public Takeable(final T value) {
    this.value = value;
    this.present = true;
  }

  public T get() {
    ensurePresent();
    return value;
  }

  public void set(final T value) {
    ensurePresent();
    this.value = value;
  }

  /**
   * Replace the held value with {@code f(value)}.
   */
  public void borrow(final UnaryOperator<T> function) {
    final T current = take();
    final T next = function.apply(current);
    install(next);
  }

  /**
   * Replace the held value with the first half of the swap {@code f(value)} and return its second
   * half.
   */
  public <R> R borrowResult(final Function<T, Swap<T, R>> function) {
    final T current = take();
    final Swap<T, R> swap = function.apply(current);
    if (swap == null) {
      throw new IllegalStateException("Transformation returned no value for the Takeable");
    }
    install(swap.getValue());
    return swap.getResult();
  }

  /**
   * Remove the value for good. The holder is unusable afterwards.
   */
  public T take() {
    ensurePresent();
    final T current = value;
    value = null;
    present = false;
    return current;
  }

  public boolean isUsable() {
    return present;
  }

  private void install(final T next) {
    value = next;
    present = true;
  }

  private void ensurePresent() {
    if (!present) {
      throw new IllegalStateException(EMPTY_MESSAGE);
    }
  }

  @Override
  public String toString() {
    return present ? "Takeable [" + value + "]" : "Takeable [<empty>]";
  }

  /**
   * The value to put back into a {@link Takeable} together with a by-product of the
   * transformation.
   */
  public static final class Swap<T, R> {
    private final T value;
    private final R result;

    public Swap(final T value, final R result) {
      this.value = value;
      this.result = result;
    }

    public T getValue() {
      return value;
    }

    public R getResult() {
      return result;
    }

    @Override
    public String toString() {
      return "Swap [value=" + value + ", result=" + result + "]";
    }
  }
}
