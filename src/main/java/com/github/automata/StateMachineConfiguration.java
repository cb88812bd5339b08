package com.github.automata;

/**
 * This class encapsulates all the configuration parameters for an {@link Automaton} and the
 * machines it spawns. Use the {@code StateMachineConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. the machine name shows up in every trace record and log line of the machines spawned from the
 * automaton, so give machines that talk to each other distinct names.<br>
 * 2. the role check mode decides how guards and handlers are told apart at compile time. See
 * {@link RoleCheckMode}.<br>
 * 3. with traceTransitions off no {@link TransitionListener} is notified, not even an explicitly
 * registered one.<br>
 */
public final class StateMachineConfiguration {
  private final String machineName;
  private final RoleCheckMode roleCheckMode;
  private final boolean traceTransitions;

  public String getMachineName() {
    return machineName;
  }

  public RoleCheckMode getRoleCheckMode() {
    return roleCheckMode;
  }

  public boolean getTraceTransitions() {
    return traceTransitions;
  }

  public final static class StateMachineConfigurationBuilder {
    private String machineName;
    private RoleCheckMode roleCheckMode = RoleCheckMode.BOTH;
    private boolean traceTransitions = true;

    public static StateMachineConfigurationBuilder newBuilder() {
      return new StateMachineConfigurationBuilder();
    }

    public StateMachineConfigurationBuilder machineName(final String machineName) {
      this.machineName = machineName;
      return this;
    }

    public StateMachineConfigurationBuilder roleCheckMode(final RoleCheckMode roleCheckMode) {
      this.roleCheckMode = roleCheckMode;
      return this;
    }

    public StateMachineConfigurationBuilder traceTransitions(final boolean traceTransitions) {
      this.traceTransitions = traceTransitions;
      return this;
    }

    public StateMachineConfiguration build() throws StateMachineException {
      final StateMachineConfiguration config =
          new StateMachineConfiguration(machineName, roleCheckMode, traceTransitions);
      config.validate();
      return config;
    }

    private StateMachineConfigurationBuilder() {}
  }

  private void validate() throws StateMachineException {
    StringBuilder messages = new StringBuilder();
    if (machineName == null || machineName.trim().isEmpty()) {
      messages.append("Machine name cannot be null or blank. ");
    }
    if (roleCheckMode == null) {
      messages.append("RoleCheckMode cannot be null. ");
    }
    if (messages.length() > 0) {
      throw new StateMachineException(StateMachineException.Code.INVALID_MACHINE_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "StateMachineConfiguration [machineName=" + machineName + ", roleCheckMode="
        + roleCheckMode + ", traceTransitions=" + traceTransitions + "]";
  }

  private StateMachineConfiguration(final String machineName, final RoleCheckMode roleCheckMode,
      final boolean traceTransitions) {
    this.machineName = machineName;
    this.roleCheckMode = roleCheckMode;
    this.traceTransitions = traceTransitions;
  }

}
