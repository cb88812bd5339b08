package com.github.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automata.StateMachineException.Code;
import com.github.automata.TransitionTable.Candidate;

/**
 * Compiles a validated {@link Specification} and its {@link Bindings} into a
 * {@link TransitionTable}. This runs once per automaton; dispatch afterwards is an array lookup
 * plus guard evaluation, never a re-parse.
 *
 * Besides symbol resolution the builder checks that every payload it will have to build at
 * dispatch time has a factory bound next to its type.
 */
public final class TransitionTableBuilder<D> {
  private static final Logger logger =
      LogManager.getLogger(TransitionTableBuilder.class.getSimpleName());

  private Specification specification;
  private Bindings<D> bindings;

  public static <D> TransitionTableBuilder<D> newBuilder() {
    return new TransitionTableBuilder<>();
  }

  public TransitionTableBuilder<D> specification(final Specification specification) {
    this.specification = specification;
    return this;
  }

  public TransitionTableBuilder<D> bindings(final Bindings<D> bindings) {
    this.bindings = bindings;
    return this;
  }

  public TransitionTable<D> build() throws StateMachineException {
    if (specification == null || bindings == null) {
      throw new StateMachineException(Code.INVALID_SPECIFICATION,
          "Both a specification and its bindings are needed to build a transition table");
    }
    final List<Diagnostic> diagnostics = new ArrayList<>();
    if (specification.getStates().isEmpty()) {
      diagnostics.add(Diagnostic.of("No states are defined"));
      throw new StateMachineException(Code.INVALID_SPECIFICATION, diagnostics);
    }

    // 1. symbol tables, with the payload types bound to each alphabet
    final SymbolTable states = new SymbolTable(Alphabet.STATE, specification.getStates(),
        bindings.getPayloadTypes(Alphabet.STATE));
    final SymbolTable inputs = new SymbolTable(Alphabet.INPUT, specification.getInputs(),
        bindings.getPayloadTypes(Alphabet.INPUT));
    final SymbolTable outputs = new SymbolTable(Alphabet.OUTPUT, specification.getOutputs(),
        bindings.getPayloadTypes(Alphabet.OUTPUT));

    // 2. one candidate per rule, bucketed by (state id, input id) in declaration order
    final List<List<List<Candidate<D>>>> buckets = new ArrayList<>(states.size());
    for (int stateId = 0; stateId < states.size(); stateId++) {
      final List<List<Candidate<D>>> row = new ArrayList<>(inputs.size());
      for (int inputId = 0; inputId < inputs.size(); inputId++) {
        row.add(new ArrayList<Candidate<D>>());
      }
      buckets.add(row);
    }
    for (final TransitionRule rule : specification.getTransitions()) {
      final Candidate<D> candidate = compile(rule, states, inputs, outputs, diagnostics);
      if (candidate != null) {
        final int inputId = rule.hasInput() ? inputs.find(rule.getInput()).getId() : 0;
        buckets.get(candidate.from.getId()).get(inputId).add(candidate);
      }
    }

    // 3. the initial state may have to be built too
    final Symbol initial = states.get(1);
    final Supplier<Object> initialFactory = initial.hasPayloadType() ? factory(initial) : null;

    if (!diagnostics.isEmpty()) {
      logger.error("Failed to build transition table with " + diagnostics.size()
          + " problem(s)");
      throw new StateMachineException(Code.INVALID_SPECIFICATION, diagnostics);
    }

    final List<List<List<Candidate<D>>>> table = new ArrayList<>(states.size());
    for (final List<List<Candidate<D>>> row : buckets) {
      final List<List<Candidate<D>>> frozen = new ArrayList<>(row.size());
      for (final List<Candidate<D>> bucket : row) {
        frozen.add(Collections.unmodifiableList(bucket));
      }
      table.add(Collections.unmodifiableList(frozen));
    }
    logger.info(String.format("Built transition table: %d rules over %d states x %d inputs",
        specification.getTransitions().size(), states.size() - 1, inputs.size() - 1));
    return new TransitionTable<>(specification, states, inputs, outputs,
        Collections.unmodifiableList(table), initialFactory);
  }

  private Candidate<D> compile(final TransitionRule rule, final SymbolTable states,
      final SymbolTable inputs, final SymbolTable outputs, final List<Diagnostic> diagnostics) {
    final int before = diagnostics.size();
    final Symbol from = resolve(states, rule.getFromState(), rule, diagnostics);
    if (rule.hasInput()) {
      resolve(inputs, rule.getInput(), rule, diagnostics);
    }
    final Symbol to = resolve(states, rule.getToState(), rule, diagnostics);
    final Symbol output =
        rule.hasOutput() ? resolve(outputs, rule.getOutput(), rule, diagnostics) : outputs.sentinel();

    Guard<D> guard = null;
    if (rule.hasGuard()) {
      final Map<String, Guard<D>> resolved = new HashMap<>();
      for (final String reference : rule.getGuard().references()) {
        final Guard<D> bound = bindings.findGuard(reference);
        if (bound == null) {
          diagnostics.add(Diagnostic.at(rule, "Unbound guard: " + reference + " in " + rule));
        } else {
          resolved.put(reference, bound);
        }
      }
      if (diagnostics.size() == before) {
        guard = rule.getGuard().bind(resolved);
      }
    }

    Handler<D> handler = null;
    Callback<D> callback = null;
    if (rule.hasHandler()) {
      handler = bindings.findHandler(rule.getHandler());
      if (handler == null) {
        callback = bindings.findCallback(rule.getHandler());
        if (callback == null) {
          diagnostics.add(
              Diagnostic.at(rule, "Unbound handler: " + rule.getHandler() + " in " + rule));
        }
      }
    }
    if (diagnostics.size() > before) {
      return null;
    }

    // without a typed handler the engine builds the next payloads itself
    Supplier<Object> toFactory = null;
    Supplier<Object> outputFactory = null;
    if (handler == null) {
      if (to.hasPayloadType() && from.getId() != to.getId()) {
        toFactory = requireFactory(to, rule, diagnostics);
      }
      if (output.hasPayloadType()) {
        outputFactory = requireFactory(output, rule, diagnostics);
      }
    }
    if (diagnostics.size() > before) {
      return null;
    }
    return new Candidate<>(rule, from, to, output, guard, handler, callback, toFactory,
        outputFactory);
  }

  private static Symbol resolve(final SymbolTable table, final String reference,
      final TransitionRule rule, final List<Diagnostic> diagnostics) {
    final Symbol symbol = table.find(reference);
    if (symbol == null) {
      diagnostics.add(Diagnostic.at(rule,
          "Unknown " + table.getAlphabet().getLabel() + ": " + reference + " in " + rule));
    }
    return symbol;
  }

  private Supplier<Object> requireFactory(final Symbol symbol, final TransitionRule rule,
      final List<Diagnostic> diagnostics) {
    final Supplier<Object> factory = factory(symbol);
    if (factory == null) {
      diagnostics.add(Diagnostic.at(rule, "No payload factory bound for "
          + symbol.getAlphabet().getLabel() + " " + symbol.getName() + " of type "
          + symbol.getPayloadType().getName() + ", needed by " + rule));
    }
    return factory;
  }

  /**
   * The factory bound next to the symbol's payload type, null if there is none.
   */
  private Supplier<Object> factory(final Symbol symbol) {
    final Supplier<?> bound = bindings.findPayloadFactory(symbol.getAlphabet(), symbol.getKey());
    if (bound == null) {
      logger.debug("No payload factory bound for " + symbol.getKey());
      return null;
    }
    return () -> bound.get();
  }

  private TransitionTableBuilder() {}
}
