package com.github.automata;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * The user code a specification refers to by name: guards, handlers and callbacks, plus the Java
 * payload types bound to state, input and output symbols. Every name is tagged with its role at
 * registration time, which is what lets the validator check roles structurally instead of sniffing
 * name prefixes.
 *
 * Guards, handlers and callbacks are keyed by the last segment of the name they are registered
 * under, so {@code Self::ready} and {@code ready} bind the same reference. Payload types are keyed
 * by symbol key, either separator accepted, or by simple name.
 * A payload type can come with a factory, which is how the engine builds payloads no typed handler
 * returns. Instances are immutable; use the {@code BindingsBuilder} to build one.
 */
public final class Bindings<D> {
  private final Map<String, Guard<D>> guards;
  private final Map<String, Handler<D>> handlers;
  private final Map<String, Callback<D>> callbacks;
  private final Map<Alphabet, Map<String, Class<?>>> payloadTypes;
  private final Map<Alphabet, Map<String, Supplier<?>>> payloadFactories;

  private Bindings(final Map<String, Guard<D>> guards, final Map<String, Handler<D>> handlers,
      final Map<String, Callback<D>> callbacks,
      final Map<Alphabet, Map<String, Class<?>>> payloadTypes,
      final Map<Alphabet, Map<String, Supplier<?>>> payloadFactories) {
    this.guards = Collections.unmodifiableMap(new LinkedHashMap<>(guards));
    this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
    this.callbacks = Collections.unmodifiableMap(new LinkedHashMap<>(callbacks));
    this.payloadTypes = freeze(payloadTypes);
    this.payloadFactories = freeze(payloadFactories);
  }

  private static <V> Map<Alphabet, Map<String, V>> freeze(
      final Map<Alphabet, Map<String, V>> perAlphabet) {
    final Map<Alphabet, Map<String, V>> frozen = new EnumMap<>(Alphabet.class);
    for (final Alphabet alphabet : Alphabet.values()) {
      final Map<String, V> entries = perAlphabet.get(alphabet);
      frozen.put(alphabet, entries == null ? Collections.<String, V>emptyMap()
          : Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }
    return Collections.unmodifiableMap(frozen);
  }

  public Map<String, Guard<D>> getGuards() {
    return guards;
  }

  public Map<String, Handler<D>> getHandlers() {
    return handlers;
  }

  public Map<String, Callback<D>> getCallbacks() {
    return callbacks;
  }

  /**
   * Payload types keyed by symbol key or simple name, as registered.
   */
  public Map<String, Class<?>> getPayloadTypes(final Alphabet alphabet) {
    return payloadTypes.get(alphabet);
  }

  /**
   * The factory bound next to the payload type of the symbol, null if none was given.
   */
  public Supplier<?> findPayloadFactory(final Alphabet alphabet, final String key) {
    return find(payloadFactories.get(alphabet), key);
  }

  public Guard<D> findGuard(final String reference) {
    return find(guards, reference);
  }

  public Handler<D> findHandler(final String reference) {
    return find(handlers, reference);
  }

  public Callback<D> findCallback(final String reference) {
    return find(callbacks, reference);
  }

  public boolean isGuard(final String reference) {
    return findGuard(reference) != null;
  }

  /**
   * True if the name is bound as either a typed handler or a callback.
   */
  public boolean isHandler(final String reference) {
    return findHandler(reference) != null || findCallback(reference) != null;
  }

  private static <T> T find(final Map<String, T> bound, final String reference) {
    if (reference == null) {
      return null;
    }
    final String key = Symbol.normalize(reference);
    final T exact = bound.get(key);
    return exact != null ? exact : bound.get(Symbol.simpleName(key));
  }

  @Override
  public String toString() {
    return "Bindings [guards=" + guards.keySet() + ", handlers=" + handlers.keySet()
        + ", callbacks=" + callbacks.keySet() + ", payloadTypes=" + payloadTypes + "]";
  }

  public final static class BindingsBuilder<D> {
    private final Map<String, Guard<D>> guards = new LinkedHashMap<>();
    private final Map<String, Handler<D>> handlers = new LinkedHashMap<>();
    private final Map<String, Callback<D>> callbacks = new LinkedHashMap<>();
    private final Map<Alphabet, Map<String, Class<?>>> payloadTypes =
        new EnumMap<>(Alphabet.class);
    private final Map<Alphabet, Map<String, Supplier<?>>> payloadFactories =
        new EnumMap<>(Alphabet.class);

    public static <D> BindingsBuilder<D> newBuilder() {
      return new BindingsBuilder<>();
    }

    public BindingsBuilder<D> guard(final String name, final Guard<D> guard) {
      guards.put(Symbol.simpleName(name), guard);
      return this;
    }

    public BindingsBuilder<D> handler(final String name, final Handler<D> handler) {
      handlers.put(Symbol.simpleName(name), handler);
      return this;
    }

    public BindingsBuilder<D> callback(final String name, final Callback<D> callback) {
      callbacks.put(Symbol.simpleName(name), callback);
      return this;
    }

    /**
     * Bind a payload type the engine never has to build itself: every rule entering the symbol
     * has a typed handler, or only loops back to it.
     */
    public BindingsBuilder<D> payloadType(final Alphabet alphabet, final String symbol,
        final Class<?> payloadType) {
      entries(payloadTypes, alphabet).put(Symbol.normalize(symbol), payloadType);
      return this;
    }

    /**
     * Bind a payload type with the factory that builds its default value.
     */
    public <T> BindingsBuilder<D> payloadType(final Alphabet alphabet, final String symbol,
        final Class<T> payloadType, final Supplier<? extends T> factory) {
      payloadType(alphabet, symbol, payloadType);
      entries(payloadFactories, alphabet).put(Symbol.normalize(symbol), factory);
      return this;
    }

    private static <V> Map<String, V> entries(final Map<Alphabet, Map<String, V>> perAlphabet,
        final Alphabet alphabet) {
      Map<String, V> entries = perAlphabet.get(alphabet);
      if (entries == null) {
        entries = new LinkedHashMap<>();
        perAlphabet.put(alphabet, entries);
      }
      return entries;
    }

    public Bindings<D> build() {
      return new Bindings<>(guards, handlers, callbacks, payloadTypes, payloadFactories);
    }

    private BindingsBuilder() {}
  }

}
