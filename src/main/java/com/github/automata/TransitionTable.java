package com.github.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.Supplier;

/**
 * The compiled, closed-form dispatch table of one specification: ordered rule candidates indexed
 * densely by (state id, input id), plus the three symbol tables. Built once by
 * {@link TransitionTableBuilder} and shared read-only by every machine spawned from it.
 *
 * The transition function and the liveness function go through the same candidate selection, so a
 * liveness query can never disagree with what dispatch would do for the same data and state.
 */
public final class TransitionTable<D> {
  private final Specification specification;
  private final SymbolTable states;
  private final SymbolTable inputs;
  private final SymbolTable outputs;
  // [state id][input id] -> candidates in declaration order
  private final List<List<List<Candidate<D>>>> candidates;
  private final Supplier<Object> initialPayloadFactory;

  TransitionTable(final Specification specification, final SymbolTable states,
      final SymbolTable inputs, final SymbolTable outputs,
      final List<List<List<Candidate<D>>>> candidates,
      final Supplier<Object> initialPayloadFactory) {
    this.specification = specification;
    this.states = states;
    this.inputs = inputs;
    this.outputs = outputs;
    this.candidates = candidates;
    this.initialPayloadFactory = initialPayloadFactory;
  }

  public Specification getSpecification() {
    return specification;
  }

  public SymbolTable getStates() {
    return states;
  }

  public SymbolTable getInputs() {
    return inputs;
  }

  public SymbolTable getOutputs() {
    return outputs;
  }

  public SymbolTable getSymbols(final Alphabet alphabet) {
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
   * Rules registered for the (state, input) pair in the order they are tried.
   */
  public List<TransitionRule> rules(final int stateId, final int inputId) {
    final List<Candidate<D>> row = candidates.get(stateId).get(inputId);
    final List<TransitionRule> rules = new ArrayList<>(row.size());
    for (final Candidate<D> candidate : row) {
      rules.add(candidate.rule);
    }
    return Collections.unmodifiableList(rules);
  }

  /**
   * The transition function. Returns (Failure, Nothing) when no rule matches.
   *
   * @throws PayloadMismatchException if a handler returns payloads of the wrong type
   */
  public Step transition(final D data, final Variant state, final Variant input) {
    final Candidate<D> candidate = select(data, state, input.getId());
    if (candidate == null) {
      return new Step(Variant.sentinel(states), Variant.sentinel(outputs), null);
    }
    return candidate.fire(data, state, input);
  }

  /**
   * The liveness function: the id of the output the transition function would produce, or empty
   * if it would fail. Evaluates guards but never runs a handler or callback.
   */
  public OptionalInt liveness(final D data, final Variant state, final int inputId) {
    final Candidate<D> candidate = select(data, state, inputId);
    return candidate == null ? OptionalInt.empty() : OptionalInt.of(candidate.output.getId());
  }

  private Candidate<D> select(final D data, final Variant state, final int inputId) {
    for (final Candidate<D> candidate : candidates.get(state.getId()).get(inputId)) {
      if (candidate.admits(data, state)) {
        return candidate;
      }
    }
    return null;
  }

  /**
   * The initial state variant, the first declared state.
   */
  Variant initialState(final Object payload) throws StateMachineException {
    final Symbol initial = states.get(1);
    if (payload == null && initial.hasPayloadType()) {
      if (initialPayloadFactory == null) {
        throw new StateMachineException(StateMachineException.Code.INVALID_PAYLOAD,
            "Initial state " + initial.getName() + " needs a payload of type "
                + initial.getPayloadType().getName());
      }
      return new Variant(initial, initialPayloadFactory.get());
    }
    return variant(initial, payload);
  }

  /**
   * Wrap a payload into a variant of the given symbol, checking it against the bound type.
   */
  static Variant variant(final Symbol symbol, final Object payload) throws StateMachineException {
    final String problem = payloadProblem(symbol, payload);
    if (problem != null) {
      throw new StateMachineException(StateMachineException.Code.INVALID_PAYLOAD, problem);
    }
    return new Variant(symbol, payload);
  }

  static String payloadProblem(final Symbol symbol, final Object payload) {
    if (symbol.hasPayloadType()) {
      if (!symbol.getPayloadType().isInstance(payload)) {
        return symbol.getAlphabet().getLabel() + " " + symbol.getName() + " expects a "
            + symbol.getPayloadType().getName() + " payload but got "
            + (payload == null ? "none" : payload.getClass().getName());
      }
    } else if (payload != null) {
      return symbol.getAlphabet().getLabel() + " " + symbol.getName()
          + " carries no payload but got a " + payload.getClass().getName();
    }
    return null;
  }

  /**
   * What one firing of the transition function yields.
   */
  public static final class Step {
    private final Variant nextState;
    private final Variant output;
    private final TransitionRule rule;

    Step(final Variant nextState, final Variant output, final TransitionRule rule) {
      this.nextState = nextState;
      this.output = output;
      this.rule = rule;
    }

    public Variant getNextState() {
      return nextState;
    }

    public Variant getOutput() {
      return output;
    }

    /**
     * The rule that fired, null if none matched.
     */
    public TransitionRule getRule() {
      return rule;
    }

    public boolean isFailure() {
      return nextState.isFailure();
    }

    @Override
    public String toString() {
      return "Step [nextState=" + nextState + ", output=" + output + ", rule=" + rule + "]";
    }
  }

  /**
   * Raised from inside a transition when a handler hands back payloads that do not fit the symbols
   * of the rule it fired for.
   */
  public static final class PayloadMismatchException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    PayloadMismatchException(final String message) {
      super(message);
    }
  }

  /**
   * One compiled rule: resolved symbols, the bound guard and the firing strategy.
   */
  static final class Candidate<D> {
    final TransitionRule rule;
    final Symbol from;
    final Symbol to;
    final Symbol output;
    // null when the rule has no guard
    private final Guard<D> guard;
    private final Handler<D> handler;
    private final Callback<D> callback;
    private final Supplier<Object> toFactory;
    private final Supplier<Object> outputFactory;

    Candidate(final TransitionRule rule, final Symbol from, final Symbol to, final Symbol output,
        final Guard<D> guard, final Handler<D> handler, final Callback<D> callback,
        final Supplier<Object> toFactory, final Supplier<Object> outputFactory) {
      this.rule = rule;
      this.from = from;
      this.to = to;
      this.output = output;
      this.guard = guard;
      this.handler = handler;
      this.callback = callback;
      this.toFactory = toFactory;
      this.outputFactory = outputFactory;
    }

    boolean admits(final D data, final Variant state) {
      return guard == null || guard.test(data, state);
    }

    Step fire(final D data, final Variant state, final Variant input) {
      if (handler != null) {
        final TransitionResult result = handler.handle(data, state, input);
        if (result == null) {
          throw new PayloadMismatchException(
              "Handler " + rule.getHandler() + " returned no result in " + rule);
        }
        return new Step(checked(to, result.getNextState()), checked(output, result.getOutput()),
            rule);
      }
      if (callback != null) {
        callback.run(data);
      }
      final Object nextPayload =
          from.getId() == to.getId() ? state.getPayload() : create(toFactory);
      return new Step(new Variant(to, nextPayload), new Variant(output, create(outputFactory)),
          rule);
    }

    private Variant checked(final Symbol symbol, final Object payload) {
      final String problem = payloadProblem(symbol, payload);
      if (problem != null) {
        throw new PayloadMismatchException(
            "Handler " + rule.getHandler() + " returned a bad payload: " + problem + " in " + rule);
      }
      return new Variant(symbol, payload);
    }

    private static Object create(final Supplier<Object> factory) {
      return factory == null ? null : factory.get();
    }

    @Override
    public String toString() {
      return rule.toString();
    }
  }

}
