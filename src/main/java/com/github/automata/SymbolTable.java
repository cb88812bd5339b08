package com.github.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical, order-preserving registry of the symbols of one alphabet. Identity 0 always holds the
 * alphabet's sentinel; declared symbols follow in declaration order. Symbols can be found by their
 * qualified key, their simple name or the payload type bound to them.
 *
 * Instances are immutable once built and safe to share between machines and threads.
 */
public final class SymbolTable {
  private final Alphabet alphabet;
  private final Symbol[] symbols;
  private final Map<String, Symbol> byKey = new HashMap<>();
  private final Map<String, Symbol> byName = new HashMap<>();
  private final Map<Class<?>, Symbol> byPayloadType = new HashMap<>();

  /**
   * @param keys declared keys in declaration order, assumed already validated for uniqueness
   * @param payloadTypes payload types by key or simple name; symbols missing here are unit symbols
   */
  SymbolTable(final Alphabet alphabet, final List<String> keys,
      final Map<String, Class<?>> payloadTypes) {
    this.alphabet = alphabet;
    this.symbols = new Symbol[keys.size() + 1];
    this.symbols[0] = Symbol.sentinel(alphabet);
    for (int i = 0; i < keys.size(); i++) {
      final String key = keys.get(i);
      Class<?> payloadType = payloadTypes.get(key);
      if (payloadType == null) {
        payloadType = payloadTypes.get(Symbol.simpleName(key));
      }
      final Symbol symbol = new Symbol(alphabet, i + 1, key, payloadType);
      symbols[i + 1] = symbol;
      byKey.put(key, symbol);
      byName.put(symbol.getName(), symbol);
      if (payloadType != null) {
        byPayloadType.put(payloadType, symbol);
      }
    }
  }

  public Alphabet getAlphabet() {
    return alphabet;
  }

  public Symbol sentinel() {
    return symbols[0];
  }

  /**
   * Number of identities including the sentinel, i.e. declared symbols + 1.
   */
  public int size() {
    return symbols.length;
  }

  public Symbol get(final int id) {
    return symbols[id];
  }

  /**
   * Declared symbols in declaration order, sentinel excluded.
   */
  public List<Symbol> declared() {
    final List<Symbol> declared = new ArrayList<>(symbols.length - 1);
    for (int i = 1; i < symbols.length; i++) {
      declared.add(symbols[i]);
    }
    return Collections.unmodifiableList(declared);
  }

  /**
   * Look up a declared symbol by qualified key first, then by simple name. Keys may use either
   * separator. Returns null if there is no such symbol; the sentinel is never returned.
   */
  public Symbol find(final String keyOrName) {
    if (keyOrName == null) {
      return null;
    }
    final String key = Symbol.normalize(keyOrName);
    final Symbol symbol = byKey.get(key);
    return symbol != null ? symbol : byName.get(key);
  }

  public Symbol findByPayloadType(final Class<?> payloadType) {
    return byPayloadType.get(payloadType);
  }

  public Symbol lookup(final String keyOrName) throws StateMachineException {
    final Symbol symbol = find(keyOrName);
    if (symbol == null) {
      throw new StateMachineException(StateMachineException.Code.UNKNOWN_SYMBOL,
          "Unknown " + alphabet.getLabel() + ": " + keyOrName);
    }
    return symbol;
  }

  public Symbol lookup(final Class<?> payloadType) throws StateMachineException {
    final Symbol symbol = payloadType == null ? null : byPayloadType.get(payloadType);
    if (symbol == null) {
      throw new StateMachineException(StateMachineException.Code.UNKNOWN_SYMBOL,
          "No " + alphabet.getLabel() + " is bound to payload type "
              + (payloadType == null ? null : payloadType.getName()));
    }
    return symbol;
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder("SymbolTable [alphabet=").append(alphabet)
        .append(", symbols=");
    for (int i = 0; i < symbols.length; i++) {
      builder.append(i == 0 ? "" : ", ").append(i).append(':').append(symbols[i].getKey());
    }
    return builder.append(']').toString();
  }
}
