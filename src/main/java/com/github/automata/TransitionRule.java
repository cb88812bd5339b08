package com.github.automata;

/**
 * One parsed transition line: {@code (from[, input]) -> (to[, output]) [: guard] [= handler]}.
 * Symbols are kept as the qualified keys written in the specification; they are resolved against
 * the declared alphabets by {@link SpecificationValidator} and {@link TransitionTableBuilder}.
 *
 * Several rules may share a (from, input) pair. They are tried in declaration order and the first
 * whose guard holds wins.
 */
public final class TransitionRule {
  private final String fromState;
  private final String input;
  private final String toState;
  private final String output;
  private final GuardExpression guard;
  private final String handler;
  private final int line;

  public TransitionRule(final String fromState, final String input, final String toState,
      final String output, final GuardExpression guard, final String handler, final int line) {
    if (fromState == null || toState == null) {
      throw new IllegalArgumentException("Transition rule needs both a from-state and a to-state");
    }
    this.fromState = fromState;
    this.input = input;
    this.toState = toState;
    this.output = output;
    this.guard = guard;
    this.handler = handler;
    this.line = line;
  }

  public String getFromState() {
    return fromState;
  }

  /**
   * Null when the rule fires on {@code Nothing}.
   */
  public String getInput() {
    return input;
  }

  public String getToState() {
    return toState;
  }

  /**
   * Null when the rule produces {@code Nothing}.
   */
  public String getOutput() {
    return output;
  }

  public GuardExpression getGuard() {
    return guard;
  }

  public String getHandler() {
    return handler;
  }

  public boolean hasInput() {
    return input != null;
  }

  public boolean hasOutput() {
    return output != null;
  }

  public boolean hasGuard() {
    return guard != null;
  }

  public boolean hasHandler() {
    return handler != null;
  }

  public boolean isSelfLoop() {
    return fromState.equals(toState);
  }

  /**
   * Line of the specification text this rule was parsed from, 0 if built programmatically.
   */
  public int getLine() {
    return line;
  }

  /**
   * Canonical diagnostic form, {@code (from,input) -> (to,output) : guard = handler}, with
   * placeholders for absent parts.
   */
  @Override
  public String toString() {
    return "(" + fromState + "," + (input != null ? input : "NoInput") + ") -> (" + toState + ","
        + (output != null ? output : "NoOutput") + ") : "
        + (guard != null ? guard.toString() : "NoGuard") + " = "
        + (handler != null ? handler : "NoHandler");
  }

  /**
   * Grammar form of this rule, as it would be written in a specification.
   */
  public String toSource() {
    final StringBuilder builder = new StringBuilder("(").append(fromState);
    if (input != null) {
      builder.append(", ").append(input);
    }
    builder.append(") -> (").append(toState);
    if (output != null) {
      builder.append(", ").append(output);
    }
    builder.append(')');
    if (guard != null) {
      builder.append(" : ").append(guard);
    }
    if (handler != null) {
      builder.append(" = ").append(handler);
    }
    return builder.toString();
  }
}
