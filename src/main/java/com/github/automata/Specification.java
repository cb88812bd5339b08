package com.github.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The abstract specification of a machine: ordered symbol lists, ordered transition rules and the
 * free-form annotations {@code derive(...)} and {@code generate_structs(...)}. This is the stable,
 * enumerable form handed to anything that wants to render or inspect a machine. It is immutable.
 */
public final class Specification {
  private final List<String> inputs;
  private final List<String> states;
  private final List<String> outputs;
  private final List<TransitionRule> transitions;
  private final List<String> derives;
  private final boolean generateStructs;

  public Specification(final List<String> inputs, final List<String> states,
      final List<String> outputs, final List<TransitionRule> transitions,
      final List<String> derives, final boolean generateStructs) {
    this.inputs = freeze(inputs);
    this.states = freeze(states);
    this.outputs = freeze(outputs);
    this.transitions = freeze(transitions);
    this.derives = freeze(derives);
    this.generateStructs = generateStructs;
  }

  private static <T> List<T> freeze(final List<T> list) {
    if (list == null) {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(new ArrayList<>(list));
  }

  public List<String> getInputs() {
    return inputs;
  }

  public List<String> getStates() {
    return states;
  }

  public List<String> getOutputs() {
    return outputs;
  }

  public List<TransitionRule> getTransitions() {
    return transitions;
  }

  public List<String> getDerives() {
    return derives;
  }

  public boolean isGenerateStructs() {
    return generateStructs;
  }

  public List<String> getSymbols(final Alphabet alphabet) {
    switch (alphabet) {
      case STATE:
        return states;
      case INPUT:
        return inputs;
      case OUTPUT:
        return outputs;
      default:
        throw new IllegalArgumentException("Unsupported alphabet " + alphabet);
    }
  }

  /**
   * The first declared state, null if none was declared.
   */
  public String getInitialState() {
    return states.isEmpty() ? null : states.get(0);
  }

  /**
   * Re-emit this specification in the grammar it was parsed from. Parsing the result yields an
   * equivalent specification.
   */
  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder();
    appendList(builder, "inputs", inputs);
    appendList(builder, "states", states);
    appendList(builder, "outputs", outputs);
    builder.append("transitions(\n");
    for (final TransitionRule rule : transitions) {
      builder.append("  ").append(rule.toSource()).append(",\n");
    }
    builder.append(")");
    if (!derives.isEmpty()) {
      builder.append(",\n");
      appendList(builder, "derive", derives);
      builder.setLength(builder.length() - 2);
    }
    if (generateStructs) {
      builder.append(",\ngenerate_structs(true)");
    }
    return builder.append('\n').toString();
  }

  private static void appendList(final StringBuilder builder, final String section,
      final List<String> symbols) {
    builder.append(section).append('(');
    for (int i = 0; i < symbols.size(); i++) {
      builder.append(i == 0 ? "" : ", ").append(symbols.get(i));
    }
    builder.append("),\n");
  }
}
