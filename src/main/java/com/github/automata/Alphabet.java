package com.github.automata;

/**
 * The three symbol alphabets of a machine. Each alphabet reserves identity 0 for a synthetic
 * sentinel: {@code Failure} for states, {@code Nothing} for inputs and outputs.
 */
public enum Alphabet {
  STATE("state", "Failure"),
  INPUT("input", "Nothing"),
  OUTPUT("output", "Nothing");

  private final String label;
  private final String sentinelName;

  private Alphabet(final String label, final String sentinelName) {
    this.label = label;
    this.sentinelName = sentinelName;
  }

  public String getLabel() {
    return label;
  }

  public String getSentinelName() {
    return sentinelName;
  }
}
