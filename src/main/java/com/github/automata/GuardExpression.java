package com.github.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A boolean guard over named guard predicates. The shape is closed on purpose: references combined
 * with negation, conjunction and disjunction, nothing else. Binding an expression against the
 * registered {@link Guard}s yields a single composite guard evaluated at dispatch time.
 */
public abstract class GuardExpression {

  private GuardExpression() {}

  public static GuardExpression reference(final String name) {
    return new Reference(name);
  }

  public static GuardExpression not(final GuardExpression operand) {
    return new Not(operand);
  }

  public static GuardExpression and(final GuardExpression left, final GuardExpression right) {
    return new And(left, right);
  }

  public static GuardExpression or(final GuardExpression left, final GuardExpression right) {
    return new Or(left, right);
  }

  /**
   * Referenced guard names, left to right, duplicates kept.
   */
  public List<String> references() {
    final List<String> names = new ArrayList<>();
    collect(names);
    return Collections.unmodifiableList(names);
  }

  abstract void collect(List<String> names);

  /**
   * Resolve every reference against the given guards. Callers are expected to have validated that
   * all references are bound.
   */
  abstract <D> Guard<D> bind(Map<String, Guard<D>> guards);

  // needed to decide on parenthesization when rendering
  abstract int precedence();

  String render(final GuardExpression child) {
    return child.precedence() < precedence() ? "(" + child + ")" : child.toString();
  }

  public static final class Reference extends GuardExpression {
    private final String name;

    private Reference(final String name) {
      this.name = name;
    }

    public String getName() {
      return name;
    }

    @Override
    void collect(final List<String> names) {
      names.add(name);
    }

    @Override
    <D> Guard<D> bind(final Map<String, Guard<D>> guards) {
      final Guard<D> guard = guards.get(name);
      if (guard == null) {
        throw new IllegalStateException("Unbound guard: " + name);
      }
      return guard;
    }

    @Override
    int precedence() {
      return 4;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public static final class Not extends GuardExpression {
    private final GuardExpression operand;

    private Not(final GuardExpression operand) {
      this.operand = operand;
    }

    public GuardExpression getOperand() {
      return operand;
    }

    @Override
    void collect(final List<String> names) {
      operand.collect(names);
    }

    @Override
    <D> Guard<D> bind(final Map<String, Guard<D>> guards) {
      final Guard<D> inner = operand.bind(guards);
      return (data, state) -> !inner.test(data, state);
    }

    @Override
    int precedence() {
      return 3;
    }

    @Override
    public String toString() {
      return "!" + render(operand);
    }
  }

  public static final class And extends GuardExpression {
    private final GuardExpression left;
    private final GuardExpression right;

    private And(final GuardExpression left, final GuardExpression right) {
      this.left = left;
      this.right = right;
    }

    public GuardExpression getLeft() {
      return left;
    }

    public GuardExpression getRight() {
      return right;
    }

    @Override
    void collect(final List<String> names) {
      left.collect(names);
      right.collect(names);
    }

    @Override
    <D> Guard<D> bind(final Map<String, Guard<D>> guards) {
      final Guard<D> first = left.bind(guards);
      final Guard<D> second = right.bind(guards);
      return (data, state) -> first.test(data, state) && second.test(data, state);
    }

    @Override
    int precedence() {
      return 2;
    }

    @Override
    public String toString() {
      return render(left) + " && " + render(right);
    }
  }

  public static final class Or extends GuardExpression {
    private final GuardExpression left;
    private final GuardExpression right;

    private Or(final GuardExpression left, final GuardExpression right) {
      this.left = left;
      this.right = right;
    }

    public GuardExpression getLeft() {
      return left;
    }

    public GuardExpression getRight() {
      return right;
    }

    @Override
    void collect(final List<String> names) {
      left.collect(names);
      right.collect(names);
    }

    @Override
    <D> Guard<D> bind(final Map<String, Guard<D>> guards) {
      final Guard<D> first = left.bind(guards);
      final Guard<D> second = right.bind(guards);
      return (data, state) -> first.test(data, state) || second.test(data, state);
    }

    @Override
    int precedence() {
      return 1;
    }

    @Override
    public String toString() {
      return render(left) + " || " + render(right);
    }
  }
}
