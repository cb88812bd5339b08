package com.github.automata;

import java.util.OptionalInt;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automata.StateMachineException.Code;
import com.github.automata.TransitionTable.PayloadMismatchException;
import com.github.automata.TransitionTable.Step;

/**
 * The runtime engine behind {@link StateMachine}. Every mutating call goes the same way:<br>
 * 1. snapshot the current state and the input for diagnostics<br>
 * 2. hand the state out of its {@link Takeable} to the transition function<br>
 * 3. install whatever state comes back<br>
 * 4. fail hard on Failure, else emit a trace record and return the output<br>
 */
final class StateMachineImpl<D> implements StateMachine<D> {
  private static final Logger logger = LogManager.getLogger(StateMachineImpl.class.getSimpleName());

  private final String machineName;
  private final TransitionTable<D> table;
  private final D data;
  private final Takeable<Variant> state;
  private final Variant nothing;
  // null when tracing is switched off
  private final TransitionListener listener;
  private final MachineStatistics statistics;

  StateMachineImpl(final String machineName, final TransitionTable<D> table, final D data,
      final Variant initialState, final TransitionListener listener) {
    this.machineName = machineName;
    this.table = table;
    this.data = data;
    this.state = new Takeable<>(initialState);
    this.nothing = Variant.sentinel(table.getInputs());
    this.listener = listener;
    this.statistics = new MachineStatistics(machineName);
    logDebug(machineName, "Started in state " + initialState);
  }

  @Override
  public void step() throws StateMachineException {
    fire(nothing);
  }

  @Override
  public Variant produce() throws StateMachineException {
    return fire(nothing);
  }

  @Override
  public <O> O produce(final Class<O> outputType) throws StateMachineException {
    ensureAlive();
    return fire(nothing, outputType);
  }

  @Override
  public Variant produce(final String output) throws StateMachineException {
    ensureAlive();
    final Symbol expected = table.getOutputs().lookup(output);
    return expect(expected, fire(nothing));
  }

  @Override
  public void consume(final String input) throws StateMachineException {
    ensureAlive();
    fire(inputOf(input));
  }

  @Override
  public void consume(final Object input) throws StateMachineException {
    ensureAlive();
    fire(inputOf(input));
  }

  @Override
  public Variant relay(final String input) throws StateMachineException {
    ensureAlive();
    return fire(inputOf(input));
  }

  @Override
  public Variant relay(final Object input) throws StateMachineException {
    ensureAlive();
    return fire(inputOf(input));
  }

  @Override
  public <O> O relay(final String input, final Class<O> outputType)
      throws StateMachineException {
    ensureAlive();
    return fire(inputOf(input), outputType);
  }

  @Override
  public <O> O relay(final Object input, final Class<O> outputType)
      throws StateMachineException {
    ensureAlive();
    return fire(inputOf(input), outputType);
  }

  @Override
  public boolean canStep() {
    return live(0).isPresent();
  }

  @Override
  public boolean canConsume(final String input) {
    final Symbol symbol = table.getInputs().find(input);
    return symbol != null && live(symbol.getId()).isPresent();
  }

  @Override
  public boolean canConsume(final Class<?> inputType) {
    final Symbol symbol = findByType(table.getInputs(), inputType);
    return symbol != null && live(symbol.getId()).isPresent();
  }

  @Override
  public boolean canProduce(final String output) {
    return predicts(0, table.getOutputs().find(output));
  }

  @Override
  public boolean canProduce(final Class<?> outputType) {
    return predicts(0, findByType(table.getOutputs(), outputType));
  }

  @Override
  public boolean canRelay(final String input, final String output) {
    final Symbol symbol = table.getInputs().find(input);
    return symbol != null && predicts(symbol.getId(), table.getOutputs().find(output));
  }

  @Override
  public boolean canRelay(final Class<?> inputType, final Class<?> outputType) {
    final Symbol symbol = findByType(table.getInputs(), inputType);
    return symbol != null
        && predicts(symbol.getId(), findByType(table.getOutputs(), outputType));
  }

  @Override
  public Variant getState() {
    return state.get();
  }

  @Override
  public D getData() {
    return data;
  }

  @Override
  public boolean isFailed() {
    return !state.isUsable() || state.get().isFailure();
  }

  @Override
  public String getName() {
    return machineName;
  }

  @Override
  public MachineStatistics getStatistics() {
    return statistics;
  }

  private OptionalInt live(final int inputId) {
    return table.liveness(data, state.get(), inputId);
  }

  private boolean predicts(final int inputId, final Symbol output) {
    if (output == null) {
      return false;
    }
    final OptionalInt predicted = live(inputId);
    return predicted.isPresent() && predicted.getAsInt() == output.getId();
  }

  private Variant fire(final Variant input) throws StateMachineException {
    ensureAlive();
    final Variant from = state.get();
    final Step step;
    try {
      step = state.<Step>borrowResult(current -> {
        final Step next = table.transition(data, current, input);
        return new Takeable.Swap<>(next.getNextState(), next);
      });
    } catch (PayloadMismatchException mismatch) {
      statistics.failure();
      logError(machineName, mismatch.getMessage());
      throw new StateMachineException(Code.INVALID_PAYLOAD, mismatch.getMessage(), mismatch);
    } catch (RuntimeException failure) {
      statistics.failure();
      final String message = String.format("Guard or handler failed on (%s, %s): %s",
          from.getName(), input.getName(), failure.getMessage());
      logError(machineName, message, failure);
      throw new StateMachineException(Code.HANDLER_FAILURE, message, failure);
    }

    if (step.isFailure()) {
      statistics.failure();
      final String message =
          "Invalid transition from " + from.getName() + " using input " + input.getName();
      logError(machineName, message);
      throw new StateMachineException(Code.INVALID_TRANSITION, message);
    }

    statistics.success();
    if (listener != null) {
      listener.onTransition(new TransitionRecord(machineName, from, input, step.getNextState(),
          step.getOutput()));
    }
    return step.getOutput();
  }

  private <O> O fire(final Variant input, final Class<O> outputType)
      throws StateMachineException {
    final Symbol expected = table.getOutputs().lookup(outputType);
    return expect(expected, fire(input)).getPayload(outputType);
  }

  private Variant expect(final Symbol expected, final Variant produced)
      throws StateMachineException {
    if (produced.getId() != expected.getId()) {
      final String message = "Expected output " + expected.getName() + " but " + machineName
          + " produced " + produced.getName();
      logWarning(machineName, message);
      throw new StateMachineException(Code.OUTPUT_MISMATCH, message);
    }
    return produced;
  }

  private Variant inputOf(final String input) throws StateMachineException {
    return TransitionTable.variant(table.getInputs().lookup(input), null);
  }

  private Variant inputOf(final Object input) throws StateMachineException {
    if (input instanceof Variant) {
      final Variant foreign = (Variant) input;
      return TransitionTable.variant(table.getInputs().lookup(foreign.getName()),
          foreign.getPayload());
    }
    if (input == null) {
      throw new StateMachineException(Code.UNKNOWN_SYMBOL, "Input cannot be null");
    }
    final Symbol symbol = findByType(table.getInputs(), input.getClass());
    if (symbol == null) {
      throw new StateMachineException(Code.UNKNOWN_SYMBOL,
          "No input is bound to payload type " + input.getClass().getName());
    }
    return TransitionTable.variant(symbol, input);
  }

  // exact type first, then its superclasses
  private static Symbol findByType(final SymbolTable symbols, final Class<?> type) {
    for (Class<?> candidate = type; candidate != null; candidate = candidate.getSuperclass()) {
      final Symbol symbol = symbols.findByPayloadType(candidate);
      if (symbol != null) {
        return symbol;
      }
    }
    return null;
  }

  private void ensureAlive() throws StateMachineException {
    if (state.isUsable() && state.get().isFailure()) {
      throw new StateMachineException(Code.MACHINE_FAILED,
          "State machine " + machineName + " is in the Failure state");
    }
  }

  private static void logError(final String machineName, final String message) {
    logger.error(new StringBuilder().append("[m:").append(machineName).append("] ")
        .append(message).toString());
  }

  private static void logError(final String machineName, final String message,
      final Throwable error) {
    logger.error(new StringBuilder().append("[m:").append(machineName).append("] ")
        .append(message).toString(), error);
  }

  private static void logWarning(final String machineName, final String message) {
    logger.warn(new StringBuilder().append("[m:").append(machineName).append("] ")
        .append(message).toString());
  }

  private static void logDebug(final String machineName, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineName).append("] ")
          .append(message).toString());
    }
  }

  @Override
  public String toString() {
    return "StateMachine [name=" + machineName + ", state=" + state + ", statistics="
        + statistics + "]";
  }

}
