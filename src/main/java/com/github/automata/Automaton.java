package com.github.automata;

import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automata.Bindings.BindingsBuilder;
import com.github.automata.StateMachineConfiguration.StateMachineConfigurationBuilder;

/**
 * A compiled machine definition: the specification, its bindings and the dispatch table built
 * from them. Compile once with the {@code AutomatonBuilder}, then spawn as many independent
 * {@link StateMachine} instances as needed with {@link #newMachine(Object)}.
 *
 * Instances are immutable and can be shared across threads.
 */
public final class Automaton<D> {
  private static final Logger logger = LogManager.getLogger(Automaton.class.getSimpleName());

  private final StateMachineConfiguration config;
  private final Bindings<D> bindings;
  private final TransitionTable<D> table;
  private final TransitionListener listener;

  private Automaton(final StateMachineConfiguration config, final Bindings<D> bindings,
      final TransitionTable<D> table, final TransitionListener listener) {
    this.config = config;
    this.bindings = bindings;
    this.table = table;
    this.listener = listener;
  }

  /**
   * Start a machine in the first declared state. A payload-carrying initial state is built by the
   * factory bound to it.
   */
  public StateMachine<D> newMachine(final D data) throws StateMachineException {
    return newMachine(data, null);
  }

  /**
   * Start a machine in the first declared state, carrying the given payload.
   */
  public StateMachine<D> newMachine(final D data, final Object initialPayload)
      throws StateMachineException {
    final Variant initial = table.initialState(initialPayload);
    return new StateMachineImpl<>(config.getMachineName(), table, data, initial, listener);
  }

  public Specification getSpecification() {
    return table.getSpecification();
  }

  public TransitionTable<D> getTransitionTable() {
    return table;
  }

  public Bindings<D> getBindings() {
    return bindings;
  }

  public StateMachineConfiguration getConfiguration() {
    return config;
  }

  @Override
  public String toString() {
    return "Automaton [config=" + config + ", states=" + table.getStates() + "]";
  }

  /**
   * A simple builder to let users use fluent APIs to compile automata.
   */
  public final static class AutomatonBuilder<D> {
    private StateMachineConfiguration config;
    private String source;
    private Specification specification;
    private final BindingsBuilder<D> bindings = BindingsBuilder.newBuilder();
    private TransitionListener listener = new LoggingTransitionListener();

    public static <D> AutomatonBuilder<D> newBuilder() {
      return new AutomatonBuilder<>();
    }

    public AutomatonBuilder<D> config(final StateMachineConfiguration config) {
      this.config = config;
      return this;
    }

    /**
     * Specification text, parsed at {@link #build()} time.
     */
    public AutomatonBuilder<D> specification(final String source) {
      this.source = source;
      this.specification = null;
      return this;
    }

    public AutomatonBuilder<D> specification(final Specification specification) {
      this.specification = specification;
      this.source = null;
      return this;
    }

    public AutomatonBuilder<D> guard(final String name, final Guard<D> guard) {
      bindings.guard(name, guard);
      return this;
    }

    public AutomatonBuilder<D> handler(final String name, final Handler<D> handler) {
      bindings.handler(name, handler);
      return this;
    }

    public AutomatonBuilder<D> callback(final String name, final Callback<D> callback) {
      bindings.callback(name, callback);
      return this;
    }

    /**
     * A state payload type without a factory. Every rule entering a different state must then
     * have a typed handler, and a machine must be started with an explicit payload.
     */
    public AutomatonBuilder<D> statePayload(final String state, final Class<?> payloadType) {
      bindings.payloadType(Alphabet.STATE, state, payloadType);
      return this;
    }

    /**
     * A state payload type with the factory used where no typed handler supplies the payload,
     * including the initial state.
     */
    public <T> AutomatonBuilder<D> statePayload(final String state, final Class<T> payloadType,
        final Supplier<? extends T> factory) {
      bindings.payloadType(Alphabet.STATE, state, payloadType, factory);
      return this;
    }

    public AutomatonBuilder<D> inputPayload(final String input, final Class<?> payloadType) {
      bindings.payloadType(Alphabet.INPUT, input, payloadType);
      return this;
    }

    public AutomatonBuilder<D> outputPayload(final String output, final Class<?> payloadType) {
      bindings.payloadType(Alphabet.OUTPUT, output, payloadType);
      return this;
    }

    public <T> AutomatonBuilder<D> outputPayload(final String output, final Class<T> payloadType,
        final Supplier<? extends T> factory) {
      bindings.payloadType(Alphabet.OUTPUT, output, payloadType, factory);
      return this;
    }

    /**
     * Replace the default logging trace sink.
     */
    public AutomatonBuilder<D> listener(final TransitionListener listener) {
      this.listener = listener;
      return this;
    }

    /**
     * Parse, validate and compile. Nothing is left to do per dispatch afterwards.
     */
    public Automaton<D> build() throws StateMachineException {
      if (config == null) {
        config = StateMachineConfigurationBuilder.newBuilder().machineName("automaton").build();
      }
      if (specification == null) {
        if (source == null) {
          throw new StateMachineException(StateMachineException.Code.INVALID_SPECIFICATION,
              "No specification given for " + config.getMachineName());
        }
        specification = SpecificationParser.parse(source);
      }
      final Bindings<D> bound = bindings.build();
      SpecificationValidator.validate(specification, bound, config.getRoleCheckMode());
      final TransitionTable<D> table = TransitionTableBuilder.<D>newBuilder()
          .specification(specification).bindings(bound).build();
      logger.info(new StringBuilder().append("[m:").append(config.getMachineName())
          .append("] Compiled automaton with ").append(specification.getStates().size())
          .append(" states and ").append(specification.getTransitions().size())
          .append(" rules").toString());
      return new Automaton<>(config, bound, table,
          config.getTraceTransitions() ? listener : null);
    }

    private AutomatonBuilder() {}
  }

}
