package com.github.automata;

/**
 * A side-effecting handler that needs no payload transformation. After it runs the next state and
 * output payloads come from the factories bound to their types, the current state payload being
 * kept when the rule loops back to the same state.
 */
@FunctionalInterface
public interface Callback<D> {

  void run(D data);

}
