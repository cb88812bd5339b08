package com.github.automata;

/**
 * A side-effect free predicate gating a transition rule. Guards receive the machine's instance data
 * and a read-only view of the current state. They are evaluated both when dispatching and when
 * answering liveness queries, so they must not mutate either argument.
 */
@FunctionalInterface
public interface Guard<D> {

  boolean test(D data, Variant state);

}
