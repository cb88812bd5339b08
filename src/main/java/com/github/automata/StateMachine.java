package com.github.automata;

/**
 * A live instance of a compiled {@link Automaton}: the current state, the user's instance data and
 * the dispatch table shared with every other instance of the same automaton.
 *
 * Notes for users:<br>
 * 1. an instance is single-owner. It performs no locking and assumes at most one mutating call in
 * flight; share it across threads only under the caller's own synchronization.<br>
 *
 * 2. liveness queries ({@code can*}) are pure. They evaluate guards but never run handlers and
 * never change state, so check them before a mutating call whenever the input may not apply.<br>
 *
 * 3. a mutating call for which no rule matches is fatal for the instance: it moves to the Failure
 * state, the call throws {@link StateMachineException.Code#INVALID_TRANSITION} and every further
 * mutating call throws {@link StateMachineException.Code#MACHINE_FAILED}. Other instances of the
 * same automaton are unaffected.<br>
 *
 * 4. if a guard or handler throws mid-transition the state is lost for good; the call throws
 * {@link StateMachineException.Code#HANDLER_FAILURE} and any later access to the state throws
 * {@link IllegalStateException}.<br>
 *
 * 5. inputs are named by symbol name, or given as objects. An object is matched to the input whose
 * payload type it is an instance of, except a {@link Variant}, which is matched by name so that an
 * output of one machine can be fed straight into another.<br>
 *
 * 6. the expected-output variants ({@code produce(Class)}, {@code relay(..., Class)}) check the
 * produced output after the transition has happened. On a mismatch the machine has still moved to
 * its next state.<br>
 */
public interface StateMachine<D> {

  ///// Mutating API /////
  /**
   * Fire with input Nothing, discarding the output. For unconditional and timer driven rules.
   */
  void step() throws StateMachineException;

  /**
   * Fire with input Nothing and return the output.
   */
  Variant produce() throws StateMachineException;

  /**
   * Fire with input Nothing and return the payload of the output bound to the given type.
   */
  <O> O produce(final Class<O> outputType) throws StateMachineException;

  /**
   * Fire with input Nothing, expecting the named output.
   */
  Variant produce(final String output) throws StateMachineException;

  /**
   * Fire with the named unit input, discarding the output.
   */
  void consume(final String input) throws StateMachineException;

  /**
   * Fire with the given input payload or variant, discarding the output.
   */
  void consume(final Object input) throws StateMachineException;

  Variant relay(final String input) throws StateMachineException;

  Variant relay(final Object input) throws StateMachineException;

  <O> O relay(final String input, final Class<O> outputType) throws StateMachineException;

  <O> O relay(final Object input, final Class<O> outputType) throws StateMachineException;


  ///// Liveness queries /////
  boolean canStep();

  /**
   * False for names that are not inputs of this machine.
   */
  boolean canConsume(final String input);

  boolean canConsume(final Class<?> inputType);

  boolean canProduce(final String output);

  boolean canProduce(final Class<?> outputType);

  boolean canRelay(final String input, final String output);

  boolean canRelay(final Class<?> inputType, final Class<?> outputType);


  ///// Accessors /////
  Variant getState();

  D getData();

  /**
   * True once the machine has entered the Failure state, or once a guard or handler failure has
   * left it without a state.
   */
  boolean isFailed();

  String getName();

  MachineStatistics getStatistics();

}
