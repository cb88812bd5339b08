package com.github.automata;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

import com.github.automata.Automaton.AutomatonBuilder;
import com.github.automata.StateMachineConfiguration.StateMachineConfigurationBuilder;
import com.github.automata.StateMachineException.Code;

/**
 * Tests to maintain the sanity and correctness of StateMachine.
 */
public class StateMachineTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final Logger logger = LogManager.getLogger(StateMachineTest.class.getSimpleName());

  static final String LOCK = "inputs(Key, Drill),\n"
      + "states(Open, Closed, Broken),\n"
      + "outputs(Click),\n"
      + "transitions(\n"
      + "  (Open, Key) -> (Closed, Click) = handle_click,\n"
      + "  (Closed, Key) -> (Open, Click) = handle_click,\n"
      + "  (Open, Drill) -> (Broken),\n"
      + "  (Closed, Drill) -> (Broken),\n"
      + ")";

  static final String SIMPLE = "inputs(I1, I2),\n"
      + "states(S1, S2, S3),\n"
      + "outputs(O1, O2),\n"
      + "transitions(\n"
      + "  (S1, I1) -> (S2, O1),\n"
      + "  (S2, I2) -> (S3, O2),\n"
      + "  (S3) -> (S1),\n"
      + ")";

  static final String FLIP_FLOP =
      "states(Flip, Flop), transitions((Flip) -> (Flop), (Flop) -> (Flip))";

  @Test
  public void testLockFlow() throws StateMachineException {
    // 1. compile the lock
    final RecordingTransitionListener listener = new RecordingTransitionListener();
    final Automaton<Lock> automaton = lockAutomaton(listener, true);

    // 2. spawn an instance, it starts in the first declared state
    final StateMachine<Lock> machine = automaton.newMachine(new Lock());
    assertTrue(machine.getState().is("Open"));
    assertEquals("lock", machine.getName());

    // 3. lock it
    assertTrue(machine.canConsume("Key"));
    assertTrue(machine.canRelay("Key", "Click"));
    final Variant click = machine.relay("Key");
    assertTrue(click.is("Click"));
    assertTrue(machine.getState().is("Closed"));
    assertEquals(1, machine.getData().clicks);

    // 4. unlock it
    machine.consume("Key");
    assertTrue(machine.getState().is("Open"));
    assertEquals(2, machine.getData().clicks);

    // 5. break it
    assertTrue(machine.canConsume("Drill"));
    assertFalse(machine.canRelay("Drill", "Click"));
    machine.consume("Drill");
    assertTrue(machine.getState().is("Broken"));
    assertFalse(machine.canConsume("Key"));
    assertFalse(machine.canConsume("Drill"));
    assertFalse(machine.canStep());

    // 6. one trace record per transition
    assertEquals(3, listener.getRecords().size());
    assertEquals("lock: (Open, Key) -> (Closed, Click)", listener.getRecords().get(0).toString());
    assertEquals("lock: (Open, Drill) -> (Broken, Nothing)", listener.last().toString());
    logger.info(machine.getStatistics().toString());
  }

  @Test
  public void testRejectedInputEntersFailure() throws StateMachineException {
    final StateMachine<Lock> machine = lockAutomaton(null, true).newMachine(new Lock());
    machine.consume("Drill");
    assertFalse(machine.canConsume("Key"));

    // 1. the rejected input fails the instance without touching its data
    try {
      machine.consume("Key");
      fail("expected an invalid transition");
    } catch (StateMachineException problem) {
      assertEquals(Code.INVALID_TRANSITION, problem.getCode());
      assertEquals("Invalid transition from Broken using input Key", problem.getMessage());
    }
    assertTrue(machine.isFailed());
    assertTrue(machine.getState().isFailure());
    assertEquals(0, machine.getData().clicks);

    // 2. nothing works any more
    assertFalse(machine.canConsume("Key"));
    assertFalse(machine.canStep());
    try {
      machine.step();
      fail("expected the failed machine to reject further calls");
    } catch (StateMachineException problem) {
      assertEquals(Code.MACHINE_FAILED, problem.getCode());
    }

    // 3. statistics tell the story
    assertEquals(1, machine.getStatistics().getTransitionSuccesses());
    assertEquals(1, machine.getStatistics().getTransitionFailures());
    assertTrue(machine.getStatistics().getLastTransitionMillis() > 0L);
  }

  @Test
  public void testInstancesAreIndependent() throws StateMachineException {
    final Automaton<Lock> automaton = lockAutomaton(null, true);
    final StateMachine<Lock> first = automaton.newMachine(new Lock());
    final StateMachine<Lock> second = automaton.newMachine(new Lock());
    first.consume("Drill");
    try {
      first.consume("Drill");
      fail("expected an invalid transition");
    } catch (StateMachineException expected) {
      assertTrue(first.isFailed());
    }
    assertFalse(second.isFailed());
    second.consume("Key");
    assertTrue(second.getState().is("Closed"));
  }

  @Test
  public void testUnknownInputName() throws StateMachineException {
    final StateMachine<Lock> machine = lockAutomaton(null, true).newMachine(new Lock());
    assertFalse(machine.canConsume("Hammer"));
    try {
      machine.consume("Hammer");
      fail("expected an unknown symbol");
    } catch (StateMachineException problem) {
      assertEquals(Code.UNKNOWN_SYMBOL, problem.getCode());
    }
    // a bad argument is not a failed transition
    assertFalse(machine.isFailed());
    assertTrue(machine.getState().is("Open"));
  }

  @Test
  public void testUnconditionalStep() throws StateMachineException {
    final StateMachine<Object> machine = AutomatonBuilder.<Object>newBuilder()
        .specification(SIMPLE).build().newMachine(null);
    assertFalse(machine.canStep());
    assertTrue(machine.relay("I1").is("O1"));
    assertTrue(machine.relay("I2").is("O2"));
    assertTrue(machine.getState().is("S3"));

    // S3 has a single unconditional rule whatever the inputs are
    assertFalse(machine.canConsume("I1"));
    assertFalse(machine.canConsume("I2"));
    assertTrue(machine.canStep());
    machine.step();
    assertTrue(machine.getState().is("S1"));
  }

  @Test
  public void testFlipFlop() throws StateMachineException {
    final StateMachine<Object> machine = AutomatonBuilder.<Object>newBuilder()
        .specification(FLIP_FLOP).build().newMachine(null);
    for (int i = 0; i < 4; i++) {
      assertTrue(machine.canStep());
      assertTrue(machine.produce().isNothing());
      assertTrue(machine.getState().is(i % 2 == 0 ? "Flop" : "Flip"));
    }
    assertEquals(4, machine.getStatistics().getTransitionSuccesses());
  }

  @Test
  public void testProduceExpectedOutput() throws StateMachineException {
    final Automaton<Object> automaton = AutomatonBuilder.<Object>newBuilder()
        .specification("states(S1, S2), outputs(O1, O2), transitions((S1) -> (S2, O1))").build();

    final StateMachine<Object> machine = automaton.newMachine(null);
    assertTrue(machine.canProduce("O1"));
    assertFalse(machine.canProduce("O2"));
    assertTrue(machine.produce("O1").is("O1"));

    // the output is checked after the fact, the machine has already moved on
    final StateMachine<Object> other = automaton.newMachine(null);
    try {
      other.produce("O2");
      fail("expected an output mismatch");
    } catch (StateMachineException problem) {
      assertEquals(Code.OUTPUT_MISMATCH, problem.getCode());
      assertEquals("Expected output O2 but automaton produced O1", problem.getMessage());
    }
    assertTrue(other.getState().is("S2"));
    assertFalse(other.isFailed());
  }

  @Test
  public void testTypedPayloads() throws StateMachineException {
    final Automaton<Object> automaton = tallyAutomaton();
    final StateMachine<Object> machine = automaton.newMachine(null);
    assertEquals(0, machine.getState().getPayload(Tally.class).total);

    // 1. inputs are matched by payload type, outputs narrowed to the expected type
    assertTrue(machine.canConsume(Add.class));
    assertTrue(machine.canRelay(Add.class, Total.class));
    assertEquals(5, machine.relay(new Add(5), Total.class).value);
    assertEquals(12, machine.relay(new Add(7), Total.class).value);
    assertEquals(12, machine.getState().getPayload(Tally.class).total);

    // 2. a machine can start from a given payload
    final StateMachine<Object> seeded = automaton.newMachine(null, new Tally(100));
    seeded.consume(new Add(1));
    assertEquals(101, seeded.getState().maybe(Tally.class).get().total);
  }

  @Test
  public void testTypedInputNeedsPayload() throws StateMachineException {
    final StateMachine<Object> machine = tallyAutomaton().newMachine(null);
    try {
      machine.consume("Add");
      fail("expected a missing payload to be rejected");
    } catch (StateMachineException problem) {
      assertEquals(Code.INVALID_PAYLOAD, problem.getCode());
    }
    try {
      machine.consume(Integer.valueOf(3));
      fail("expected an unbound payload type to be rejected");
    } catch (StateMachineException problem) {
      assertEquals(Code.UNKNOWN_SYMBOL, problem.getCode());
    }
    try {
      tallyAutomaton().newMachine(null, "not a tally");
      fail("expected a bad initial payload to be rejected");
    } catch (StateMachineException problem) {
      assertEquals(Code.INVALID_PAYLOAD, problem.getCode());
    }
  }

  @Test
  public void testHandlerFailurePoisonsMachine() throws StateMachineException {
    final StateMachine<Object> machine = AutomatonBuilder.<Object>newBuilder()
        .specification("inputs(Go), states(Idle, Busy), transitions((Idle, Go) -> (Busy) = handle_go)")
        .handler("handle_go", (data, state, input) -> {
          throw new IllegalStateException("downstream unavailable");
        }).build().newMachine(null);
    try {
      machine.consume("Go");
      fail("expected the handler failure to surface");
    } catch (StateMachineException problem) {
      assertEquals(Code.HANDLER_FAILURE, problem.getCode());
      assertEquals("downstream unavailable", problem.getCause().getMessage());
    }
    assertTrue(machine.isFailed());
    try {
      machine.getState();
      fail("expected the state to be gone");
    } catch (IllegalStateException expected) {
      assertEquals(Takeable.EMPTY_MESSAGE, expected.getMessage());
    }
    try {
      machine.consume("Go");
      fail("expected further use to fail");
    } catch (IllegalStateException expected) {
      assertEquals(Takeable.EMPTY_MESSAGE, expected.getMessage());
    }
  }

  @Test
  public void testHandlerPayloadMismatch() throws StateMachineException {
    final StateMachine<Object> machine = AutomatonBuilder.<Object>newBuilder()
        .specification("inputs(Go), states(Idle, Busy), transitions((Idle, Go) -> (Busy) = handle_go)")
        .statePayload("Busy", Tally.class)
        .handler("handle_go", (data, state, input) -> TransitionResult.of("wrong"))
        .build().newMachine(null);
    try {
      machine.consume("Go");
      fail("expected a payload mismatch");
    } catch (StateMachineException problem) {
      assertEquals(Code.INVALID_PAYLOAD, problem.getCode());
    }
    assertEquals(1, machine.getStatistics().getTransitionFailures());
    try {
      machine.getState();
      fail("expected the state to be gone");
    } catch (IllegalStateException expected) {
      assertEquals(Takeable.EMPTY_MESSAGE, expected.getMessage());
    }
  }

  @Test
  public void testCallbackPayloads() throws StateMachineException {
    final Automaton<Object> automaton = AutomatonBuilder.<Object>newBuilder()
        .specification("inputs(Tick, Reset), states(Running, Stopped), outputs(Ticked),"
            + " transitions((Running, Tick) -> (Running, Ticked) = on_tick,"
            + " (Running, Reset) -> (Stopped), (Stopped, Reset) -> (Running))")
        .statePayload("Running", Tally.class, Tally::new)
        .outputPayload("Ticked", Total.class, Total::new)
        .callback("on_tick", data -> logger.debug("tick")).build();
    final Tally initial = new Tally(3);
    final StateMachine<Object> machine = automaton.newMachine(null, initial);

    // 1. a self loop without a typed handler keeps the payload, the output comes from its factory
    final Variant ticked = machine.relay("Tick");
    assertSame(initial, machine.getState().getPayload());
    assertNotNull(ticked.getPayload(Total.class));

    // 2. entering a state without a typed handler builds its payload with the bound factory
    machine.consume("Reset");
    assertNull(machine.getState().getPayload());
    machine.consume("Reset");
    assertNotSame(initial, machine.getState().getPayload());
    assertEquals(0, machine.getState().getPayload(Tally.class).total);
  }

  @Test
  public void testQualifiedNamesWithPathSeparator() throws StateMachineException {
    final StateMachine<Object> machine = AutomatonBuilder.<Object>newBuilder()
        .specification("inputs(inputs::Go), states(states::Idle, states::Busy),"
            + " outputs(outputs::Done),"
            + " transitions((states::Idle, inputs::Go) -> (states::Busy, outputs::Done)"
            + " = Self::on_go)")
        .statePayload("states::Busy", Tally.class, Tally::new)
        .callback("Self::on_go", data -> logger.debug("go")).build().newMachine(null);

    // 1. every spelling of a qualified name finds the same symbol
    assertTrue(machine.getState().is("states::Idle"));
    assertTrue(machine.getState().is("states.Idle"));
    assertTrue(machine.getState().is("Idle"));
    assertTrue(machine.canConsume("inputs::Go"));
    assertTrue(machine.canRelay("inputs::Go", "outputs::Done"));

    // 2. and drives the machine
    assertTrue(machine.relay("inputs::Go").is("outputs::Done"));
    assertTrue(machine.getState().is("states::Busy"));
    assertEquals(0, machine.getState().getPayload(Tally.class).total);
    assertEquals("states.Busy", machine.getState().getSymbol().getKey());
  }

  @Test
  public void testInitialPayloadWithoutFactory() throws StateMachineException {
    final Automaton<Object> automaton = AutomatonBuilder.<Object>newBuilder()
        .specification("inputs(Go), states(Idle, Busy), transitions((Idle, Go) -> (Busy))")
        .statePayload("Idle", Tally.class).build();
    try {
      automaton.newMachine(null);
      fail("expected a missing initial payload to be rejected");
    } catch (StateMachineException problem) {
      assertEquals(Code.INVALID_PAYLOAD, problem.getCode());
    }
    final Tally initial = new Tally(9);
    assertSame(initial, automaton.newMachine(null, initial).getState().getPayload());
  }

  @Test
  public void testTracingSwitchedOff() throws StateMachineException {
    final RecordingTransitionListener listener = new RecordingTransitionListener();
    final StateMachine<Lock> machine = lockAutomaton(listener, false).newMachine(new Lock());
    machine.consume("Key");
    machine.consume("Key");
    assertTrue(listener.getRecords().isEmpty());
    assertEquals(2, machine.getStatistics().getTransitionSuccesses());
  }

  @Test
  public void testCompileErrorsSurfaceAtBuild() {
    try {
      AutomatonBuilder.<Object>newBuilder().specification("states(A), transitions((A) -> B)")
          .build();
      fail("expected a syntax error");
    } catch (StateMachineException problem) {
      assertEquals(Code.SYNTAX_ERROR, problem.getCode());
    }
    try {
      AutomatonBuilder.<Object>newBuilder().specification("states(A), transitions((A) -> (B))")
          .build();
      fail("expected a validation error");
    } catch (StateMachineException problem) {
      assertEquals(Code.INVALID_SPECIFICATION, problem.getCode());
      assertEquals("Unknown state: B in (A,NoInput) -> (B,NoOutput) : NoGuard = NoHandler",
          problem.getDiagnostics().get(0).getMessage());
    }
    try {
      AutomatonBuilder.<Object>newBuilder().build();
      fail("expected a missing specification to be rejected");
    } catch (StateMachineException problem) {
      assertEquals(Code.INVALID_SPECIFICATION, problem.getCode());
    }
  }

  private static Automaton<Lock> lockAutomaton(final TransitionListener listener,
      final boolean trace) throws StateMachineException {
    final StateMachineConfiguration config = StateMachineConfigurationBuilder.newBuilder()
        .machineName("lock").roleCheckMode(RoleCheckMode.BOTH).traceTransitions(trace).build();
    final AutomatonBuilder<Lock> builder = AutomatonBuilder.<Lock>newBuilder().config(config)
        .specification(LOCK).callback("handle_click", lock -> lock.clicks++);
    if (listener != null) {
      builder.listener(listener);
    }
    return builder.build();
  }

  private static Automaton<Object> tallyAutomaton() throws StateMachineException {
    return AutomatonBuilder.<Object>newBuilder()
        .specification("inputs(Add), states(Counting), outputs(Sum),"
            + " transitions((Counting, Add) -> (Counting, Sum) = handle_add)")
        .statePayload("Counting", Tally.class, Tally::new).inputPayload("Add", Add.class)
        .outputPayload("Sum", Total.class).handler("handle_add", (data, state, input) -> {
          final int total =
              state.getPayload(Tally.class).total + input.getPayload(Add.class).amount;
          return TransitionResult.of(new Tally(total), new Total(total));
        }).build();
  }

  public static final class Lock {
    int clicks;
  }

  public static final class Tally {
    final int total;

    public Tally() {
      this(0);
    }

    public Tally(final int total) {
      this.total = total;
    }
  }

  public static final class Add {
    final int amount;

    public Add(final int amount) {
      this.amount = amount;
    }
  }

  public static final class Total {
    final int value;

    public Total() {
      this(0);
    }

    public Total(final int value) {
      this.value = value;
    }
  }

}
