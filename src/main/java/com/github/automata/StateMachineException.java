package com.github.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Unified single exception that's thrown and handled by this library. The code enum encapsulates
 * the various error conditions, from specification errors caught while compiling an
 * {@link Automaton} to invalid transitions hit at runtime. Compile-time failures additionally carry
 * every {@link Diagnostic} that was collected, never just the first one.
 */
public final class StateMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;
  private final List<Diagnostic> diagnostics;

  public StateMachineException(final Code code) {
    super(code.getDescription());
    this.code = code;
    this.diagnostics = Collections.emptyList();
  }

  public StateMachineException(final Code code, final String message) {
    super(message);
    this.code = code;
    this.diagnostics = Collections.emptyList();
  }

  public StateMachineException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
    this.diagnostics = Collections.emptyList();
  }

  public StateMachineException(final Code code, final List<Diagnostic> diagnostics) {
    super(describe(code, diagnostics));
    this.code = code;
    this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
  }

  public Code getCode() {
    return code;
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  private static String describe(final Code code, final List<Diagnostic> diagnostics) {
    final StringBuilder builder = new StringBuilder(code.getDescription());
    for (final Diagnostic diagnostic : diagnostics) {
      builder.append("\n    ").append(diagnostic);
    }
    return builder.toString();
  }

  public static enum Code {
    // 1.
    SYNTAX_ERROR("Specification text could not be parsed"),
    // 2.
    INVALID_SPECIFICATION("Specification failed semantic validation"),
    // 3.
    INVALID_MACHINE_CONFIG("State machine configuration is invalid"),
    // 4.
    UNKNOWN_SYMBOL("Symbol is not declared in the requested alphabet"),
    // 5.
    INVALID_PAYLOAD("Payload does not match the type bound to its symbol"),
    // 6.
    INVALID_TRANSITION("No transition rule matches the current state and input"),
    // 7.
    MACHINE_FAILED("State machine is in the Failure state and cannot service requests"),
    // 8.
    OUTPUT_MISMATCH("Produced output does not match the expected output symbol"),
    // 9.
    HANDLER_FAILURE(
        "A guard or handler failed mid-transition. The machine state is no longer usable");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
