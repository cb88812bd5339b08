package com.github.automata;

/**
 * A structured trace of one fired transition: which machine, which (state, input) pair it started
 * from and which (state, output) pair it ended in.
 */
public final class TransitionRecord {
  private final String machineName;
  private final Variant fromState;
  private final Variant input;
  private final Variant toState;
  private final Variant output;

  public TransitionRecord(final String machineName, final Variant fromState, final Variant input,
      final Variant toState, final Variant output) {
    this.machineName = machineName;
    this.fromState = fromState;
    this.input = input;
    this.toState = toState;
    this.output = output;
  }

  public String getMachineName() {
    return machineName;
  }

  public Variant getFromState() {
    return fromState;
  }

  public Variant getInput() {
    return input;
  }

  public Variant getToState() {
    return toState;
  }

  public Variant getOutput() {
    return output;
  }

  /**
   * {@code name: (from, input) -> (to, output)}, by symbol name only.
   */
  @Override
  public String toString() {
    return machineName + ": (" + fromState.getName() + ", " + input.getName() + ") -> ("
        + toState.getName() + ", " + output.getName() + ")";
  }
}
