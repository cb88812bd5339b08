package com.github.automata;

/**
 * Receives one {@link TransitionRecord} per successful mutating call on a machine. Injected per
 * automaton, so machines can be traced independently and tests can capture records directly.
 */
@FunctionalInterface
public interface TransitionListener {

  void onTransition(TransitionRecord record);

}
