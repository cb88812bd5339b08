package com.github.automata;

/**
 * Simple statistics holder for a machine instance. Like the instance itself it is not
 * thread-safe.
 */
public final class MachineStatistics {
  private final long startMillis = System.currentTimeMillis();
  private final String machineName;
  int transitionSuccesses;
  int transitionFailures;
  // 0 until the first transition, successful or not
  long lastTransitionMillis;

  MachineStatistics(final String machineName) {
    this.machineName = machineName;
  }

  public String getMachineName() {
    return machineName;
  }

  public int getTransitionSuccesses() {
    return transitionSuccesses;
  }

  public int getTransitionFailures() {
    return transitionFailures;
  }

  public long getLastTransitionMillis() {
    return lastTransitionMillis;
  }

  public long getAliveTimeMillis() {
    return System.currentTimeMillis() - startMillis;
  }

  void success() {
    transitionSuccesses++;
    lastTransitionMillis = System.currentTimeMillis();
  }

  void failure() {
    transitionFailures++;
    lastTransitionMillis = System.currentTimeMillis();
  }

  @Override
  public String toString() {
    return "MachineStatistics [machineName=" + machineName + ", transitionSuccesses="
        + transitionSuccesses + ", transitionFailures=" + transitionFailures
        + ", lastTransitionMillis=" + lastTransitionMillis + ", aliveTimeMillis="
        + getAliveTimeMillis() + "]";
  }

}
