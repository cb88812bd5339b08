package com.github.automata;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

/**
 * Tests for the library's single exception type.
 */
public class StateMachineExceptionTest {

  @Test
  public void testExceptionCannotBeSubclassed() {
    assertTrue(Modifier.isFinal(StateMachineException.class.getModifiers()));
  }

  @Test
  public void testDiagnosticsAreCopiedAndListedInMessage() {
    final List<Diagnostic> diagnostics = new ArrayList<>();
    diagnostics.add(new Diagnostic(3, 7, "Unexpected token"));
    diagnostics.add(Diagnostic.of("At least one state is required"));
    final StateMachineException problem =
        new StateMachineException(StateMachineException.Code.SYNTAX_ERROR, diagnostics);

    // later changes to the caller's list do not leak in
    diagnostics.clear();
    assertEquals(2, problem.getDiagnostics().size());
    assertEquals(StateMachineException.Code.SYNTAX_ERROR, problem.getCode());
    assertEquals("Specification text could not be parsed"
        + "\n    line 3, column 7: Unexpected token"
        + "\n    At least one state is required", problem.getMessage());
  }

}
