package com.github.automata;

/**
 * Computes the payloads of a rule's next state and output from the current state and the consumed
 * input. The current state is handed over exclusively for the duration of the call. When the rule
 * has no input, {@code input} is the {@code Nothing} variant.
 *
 * The returned payloads must match the types bound to the rule's to-state and output symbols.
 */
@FunctionalInterface
public interface Handler<D> {

  TransitionResult handle(D data, Variant state, Variant input);

}
