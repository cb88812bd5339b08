package com.github.automata;

/**
 * A single problem found while parsing or validating a specification. Line and column are 1-based;
 * a line of 0 means the problem is not tied to a particular place in the source text (e.g. an
 * empty state alphabet or a bad binding).
 */
public final class Diagnostic {
  private final int line;
  private final int column;
  private final String message;

  public Diagnostic(final int line, final int column, final String message) {
    this.line = line;
    this.column = column;
    this.message = message;
  }

  public static Diagnostic of(final String message) {
    return new Diagnostic(0, 0, message);
  }

  public static Diagnostic at(final TransitionRule rule, final String message) {
    return new Diagnostic(rule.getLine(), 0, message);
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    if (line <= 0) {
      return message;
    }
    if (column <= 0) {
      return "line " + line + ": " + message;
    }
    return "line " + line + ", column " + column + ": " + message;
  }
}
