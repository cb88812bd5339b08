package com.github.automata;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automata.SpecificationTokenizer.Kind;
import com.github.automata.SpecificationTokenizer.Token;
import com.github.automata.StateMachineException.Code;

/**
 * Parses the textual machine grammar into a {@link Specification}.
 *
 * <pre>
 * inputs(Symbol, ...)
 * states(Symbol, ...)
 * outputs(Symbol, ...)
 * transitions(
 *   (FromState[, Input]) -&gt; (ToState[, Output]) [: guard-expr] [= handler],
 *   ...
 * )
 * derive(Trait, ...)
 * generate_structs(bool)
 * </pre>
 *
 * Sections may come in any order, separated by optional commas. Symbols may be qualified with
 * either {@code ::} or {@code .} separators. Guard expressions are references combined with
 * {@code !}, {@code &&}, {@code ||} and parentheses; anything else is rejected.
 *
 * Notes:<br>
 * 1. the parser does not stop at the first problem. It resynchronises at the next list item or
 * section and reports every syntax error it found in one {@link StateMachineException}<br>
 * 2. instances are single use; the static entry points create a fresh one per call<br>
 */
public final class SpecificationParser {
  private static final Logger logger =
      LogManager.getLogger(SpecificationParser.class.getSimpleName());

  private final List<Token> tokens;
  private final List<Diagnostic> errors = new ArrayList<>();
  private int index;

  private SpecificationParser(final String source) {
    this.tokens = new SpecificationTokenizer(source).tokenize();
  }

  /**
   * Parse a whole specification or fail with {@link Code#SYNTAX_ERROR} listing every error found.
   */
  public static Specification parse(final String source) throws StateMachineException {
    final SpecificationParser parser = new SpecificationParser(source);
    final Specification specification = parser.parseSpecification();
    if (!parser.errors.isEmpty()) {
      logger.error("Rejected specification with " + parser.errors.size() + " syntax error(s)");
      throw new StateMachineException(Code.SYNTAX_ERROR, parser.errors);
    }
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Parsed specification: %d states, %d inputs, %d outputs, %d rules",
          specification.getStates().size(), specification.getInputs().size(),
          specification.getOutputs().size(), specification.getTransitions().size()));
    }
    return specification;
  }

  /**
   * Parse a single transition line, e.g. {@code (S1, I1) -> (S2) : ready && !busy = handle_it}.
   */
  public static TransitionRule parseTransition(final String source) throws StateMachineException {
    final SpecificationParser parser = new SpecificationParser(source);
    TransitionRule rule = null;
    try {
      rule = parser.transition();
      if (!parser.at(Kind.END)) {
        parser.fail(parser.current(), "unexpected " + parser.current().describe()
            + " after transition");
      }
    } catch (SyntaxError error) {
      parser.errors.add(error.diagnostic);
    }
    if (!parser.errors.isEmpty()) {
      throw new StateMachineException(Code.SYNTAX_ERROR, parser.errors);
    }
    return rule;
  }

  private Specification parseSpecification() {
    List<String> inputs = null;
    List<String> states = null;
    List<String> outputs = null;
    List<TransitionRule> transitions = null;
    List<String> derives = null;
    Boolean generateStructs = null;

    while (!at(Kind.END)) {
      final int start = index;
      final Token section = current();
      try {
        if (!section.is(Kind.IDENTIFIER)) {
          fail(section, "expected a section name but found " + section.describe());
        }
        advance();
        expect(Kind.LEFT_PAREN, "'(' after section " + section.text);
        switch (section.text) {
          case "inputs":
            inputs = checkDuplicate(section, inputs, symbolList());
            break;
          case "states":
            states = checkDuplicate(section, states, symbolList());
            break;
          case "outputs":
            outputs = checkDuplicate(section, outputs, symbolList());
            break;
          case "transitions":
            transitions = checkDuplicate(section, transitions, transitionList());
            break;
          case "derive":
            derives = checkDuplicate(section, derives, symbolList());
            break;
          case "generate_structs":
            generateStructs = checkDuplicate(section, generateStructs, bool());
            break;
          default:
            fail(section, "unknown section '" + section.text + "'");
        }
        expect(Kind.RIGHT_PAREN, "')' to close section " + section.text);
        if (at(Kind.COMMA)) {
          advance();
        }
      } catch (SyntaxError error) {
        errors.add(error.diagnostic);
        skipSection(start);
      }
    }

    return new Specification(inputs, states, outputs, transitions, derives,
        generateStructs != null && generateStructs);
  }

  private <T> T checkDuplicate(final Token section, final T previous, final T parsed) {
    if (previous != null) {
      errors.add(new Diagnostic(section.line, section.column,
          "duplicate section '" + section.text + "'"));
      return previous;
    }
    return parsed;
  }

  private List<String> symbolList() {
    final List<String> symbols = new ArrayList<>();
    while (!at(Kind.RIGHT_PAREN) && !at(Kind.END)) {
      final int start = index;
      try {
        symbols.add(path("a symbol"));
        listSeparator();
      } catch (SyntaxError error) {
        errors.add(error.diagnostic);
        skipListItem(start);
      }
    }
    return symbols;
  }

  private List<TransitionRule> transitionList() {
    final List<TransitionRule> rules = new ArrayList<>();
    while (!at(Kind.RIGHT_PAREN) && !at(Kind.END)) {
      final int start = index;
      try {
        rules.add(transition());
        listSeparator();
      } catch (SyntaxError error) {
        errors.add(error.diagnostic);
        skipListItem(start);
      }
    }
    return rules;
  }

  // after an item: ',' (possibly trailing) or the closing ')' of the list
  private void listSeparator() throws SyntaxError {
    if (at(Kind.COMMA)) {
      advance();
    } else if (!at(Kind.RIGHT_PAREN)) {
      fail(current(), "expected ',' or ')' but found " + current().describe());
    }
  }

  private boolean bool() throws SyntaxError {
    final Token token = current();
    if (token.is(Kind.IDENTIFIER) && ("true".equals(token.text) || "false".equals(token.text))) {
      advance();
      return Boolean.parseBoolean(token.text);
    }
    throw new SyntaxError(token, "expected true or false but found " + token.describe());
  }

  private TransitionRule transition() throws SyntaxError {
    final Token first = current();
    expect(Kind.LEFT_PAREN, "'(' to open a transition");
    final String fromState = path("a from-state");
    String input = null;
    if (at(Kind.COMMA)) {
      advance();
      input = path("an input");
    }
    expect(Kind.RIGHT_PAREN, "')' after the from-state");
    expect(Kind.ARROW, "'->'");
    expect(Kind.LEFT_PAREN, "'(' to open the target of the transition");
    final String toState = path("a to-state");
    String output = null;
    if (at(Kind.COMMA)) {
      advance();
      output = path("an output");
    }
    expect(Kind.RIGHT_PAREN, "')' after the to-state");

    GuardExpression guard = null;
    String handler = null;
    if (at(Kind.COLON)) {
      advance();
      guard = disjunction();
      if (!at(Kind.EQUALS) && !atItemBoundary()) {
        fail(current(), "invalid guard expression, unexpected " + current().describe());
      }
    }
    if (at(Kind.EQUALS)) {
      advance();
      handler = Symbol.simpleName(path("a handler name"));
      if (!atItemBoundary()) {
        fail(current(), "invalid handler expression, unexpected " + current().describe());
      }
    }
    return new TransitionRule(fromState, input, toState, output, guard, handler, first.line);
  }

  private boolean atItemBoundary() {
    return at(Kind.COMMA) || at(Kind.RIGHT_PAREN) || at(Kind.END);
  }

  private GuardExpression disjunction() throws SyntaxError {
    GuardExpression left = conjunction();
    while (at(Kind.OR)) {
      advance();
      left = GuardExpression.or(left, conjunction());
    }
    return left;
  }

  private GuardExpression conjunction() throws SyntaxError {
    GuardExpression left = unary();
    while (at(Kind.AND)) {
      advance();
      left = GuardExpression.and(left, unary());
    }
    return left;
  }

  private GuardExpression unary() throws SyntaxError {
    final Token token = current();
    if (token.is(Kind.NOT)) {
      advance();
      return GuardExpression.not(unary());
    }
    if (token.is(Kind.LEFT_PAREN)) {
      advance();
      final GuardExpression grouped = disjunction();
      expect(Kind.RIGHT_PAREN, "')' to close the guard group");
      return grouped;
    }
    if (token.is(Kind.IDENTIFIER)) {
      final String name = path("a guard name");
      if (at(Kind.LEFT_PAREN)) {
        fail(current(), "invalid guard expression, '" + name + "(...)' calls are not supported");
      }
      return GuardExpression.reference(name);
    }
    throw new SyntaxError(token, "invalid guard expression, unexpected " + token.describe());
  }

  private String path(final String what) throws SyntaxError {
    final Token head = current();
    if (!head.is(Kind.IDENTIFIER)) {
      throw new SyntaxError(head, "expected " + what + " but found " + head.describe());
    }
    advance();
    final StringBuilder key = new StringBuilder(head.text);
    while (at(Kind.PATH_SEPARATOR) || at(Kind.DOT)) {
      advance();
      final Token segment = current();
      if (!segment.is(Kind.IDENTIFIER)) {
        throw new SyntaxError(segment,
            "expected an identifier after path separator but found " + segment.describe());
      }
      advance();
      key.append('.').append(segment.text);
    }
    return key.toString();
  }

  /**
   * Rewind to the start of the broken item and skip it entirely: stop before the ',' or ')' that
   * ends it at the list's own nesting level.
   */
  private void skipListItem(final int start) {
    index = start;
    int depth = 0;
    while (!at(Kind.END)) {
      final Token token = current();
      if (token.is(Kind.LEFT_PAREN)) {
        depth++;
      } else if (token.is(Kind.RIGHT_PAREN)) {
        if (depth == 0) {
          return;
        }
        depth--;
      } else if (token.is(Kind.COMMA) && depth == 0) {
        advance();
        return;
      }
      advance();
    }
  }

  /**
   * Rewind to the start of the broken section and skip past its closing ')' and trailing ','.
   */
  private void skipSection(final int start) {
    index = start;
    int depth = 0;
    while (!at(Kind.END)) {
      final Token token = current();
      advance();
      if (token.is(Kind.LEFT_PAREN)) {
        depth++;
      } else if (token.is(Kind.RIGHT_PAREN)) {
        depth--;
        if (depth <= 0) {
          break;
        }
      } else if (token.is(Kind.COMMA) && depth == 0) {
        return;
      }
    }
    if (at(Kind.COMMA)) {
      advance();
    }
  }

  private void expect(final Kind kind, final String what) throws SyntaxError {
    if (!at(kind)) {
      throw new SyntaxError(current(), "expected " + what + " but found " + current().describe());
    }
    advance();
  }

  private void fail(final Token token, final String message) throws SyntaxError {
    throw new SyntaxError(token, message);
  }

  private Token current() {
    return tokens.get(index);
  }

  private boolean at(final Kind kind) {
    return current().is(kind);
  }

  private void advance() {
    if (index < tokens.size() - 1) {
      index++;
    }
  }

  /**
   * Unwinds the parser to the nearest recovery point. Never escapes this class.
   */
  private static final class SyntaxError extends Exception {
    private static final long serialVersionUID = 1L;
    private final Diagnostic diagnostic;

    private SyntaxError(final Token token, final String message) {
      super(message, null, false, false);
      this.diagnostic = new Diagnostic(token.line, token.column, message);
    }
  }
}
