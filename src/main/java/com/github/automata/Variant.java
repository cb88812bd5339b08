package com.github.automata;

import java.util.Optional;

/**
 * A value of one alphabet's tagged union: the symbol it is tagged with and that symbol's payload.
 * Unit symbols carry a null payload. Used for current states, inputs fed to a machine and outputs
 * produced by it.
 */
public final class Variant {
  private final Symbol symbol;
  private final Object payload;

  Variant(final Symbol symbol, final Object payload) {
    this.symbol = symbol;
    this.payload = payload;
  }

  static Variant sentinel(final SymbolTable table) {
    return new Variant(table.sentinel(), null);
  }

  public Symbol getSymbol() {
    return symbol;
  }

  public Alphabet getAlphabet() {
    return symbol.getAlphabet();
  }

  public int getId() {
    return symbol.getId();
  }

  public String getName() {
    return symbol.getName();
  }

  public Object getPayload() {
    return payload;
  }

  /**
   * Typed payload access. Fails if this variant's payload is not of the requested type, including
   * when the variant is a unit symbol.
   */
  public <T> T getPayload(final Class<T> type) {
    if (!type.isInstance(payload)) {
      throw new IllegalStateException(
          "Variant " + symbol.getName() + " does not hold a " + type.getSimpleName());
    }
    return type.cast(payload);
  }

  public <T> Optional<T> maybe(final Class<T> type) {
    return type.isInstance(payload) ? Optional.of(type.cast(payload)) : Optional.<T>empty();
  }

  /**
   * Check the tag by simple name or qualified key.
   */
  public boolean is(final String keyOrName) {
    final String key = Symbol.normalize(keyOrName);
    return symbol.getName().equals(key) || symbol.getKey().equals(key);
  }

  public boolean isFailure() {
    return symbol.getAlphabet() == Alphabet.STATE && symbol.isSentinel();
  }

  public boolean isNothing() {
    return symbol.getAlphabet() != Alphabet.STATE && symbol.isSentinel();
  }

  @Override
  public String toString() {
    return payload == null ? symbol.getName() : symbol.getName() + "(" + payload + ")";
  }
}
