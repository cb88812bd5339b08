package com.github.automata;

/**
 * This object encapsulates what a {@link Handler} computed: the payload of the next state and,
 * optionally, the payload of the produced output. Either may be null for unit symbols.
 *
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class TransitionResult {
  private final Object nextState;
  private final Object output;

  private TransitionResult(final Object nextState, final Object output) {
    this.nextState = nextState;
    this.output = output;
  }

  public static TransitionResult of(final Object nextState) {
    return new TransitionResult(nextState, null);
  }

  public static TransitionResult of(final Object nextState, final Object output) {
    return new TransitionResult(nextState, output);
  }

  public Object getNextState() {
    return nextState;
  }

  public Object getOutput() {
    return output;
  }

  @Override
  public String toString() {
    return "TransitionResult [nextState=" + nextState + ", output=" + output + "]";
  }
}
