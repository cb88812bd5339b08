package com.github.automata;

/**
 * This object represents immutable metadata about a declared symbol: which alphabet it belongs to,
 * its dense identity (declaration order, 1-based), its qualified key as written in the
 * specification and, optionally, the Java type of the payload its variants carry.
 */
public final class Symbol {
  private final Alphabet alphabet;
  private final int id;
  private final String key;
  private final String name;
  // null for unit symbols that carry no payload
  private final Class<?> payloadType;

  Symbol(final Alphabet alphabet, final int id, final String key, final Class<?> payloadType) {
    this.alphabet = alphabet;
    this.id = id;
    this.key = key;
    this.name = simpleName(key);
    this.payloadType = payloadType;
  }

  static Symbol sentinel(final Alphabet alphabet) {
    return new Symbol(alphabet, 0, alphabet.getSentinelName(), null);
  }

  /**
   * The stored form of a qualified key: {@code states::Open} and {@code states.Open} are the same
   * key, kept as {@code states.Open}.
   */
  public static String normalize(final String key) {
    return key == null ? null : key.replace("::", ".");
  }

  /**
   * Last segment of a qualified key, {@code states.Open} is {@code Open}.
   */
  static String simpleName(final String key) {
    final String normalized = normalize(key);
    if (normalized == null) {
      return null;
    }
    final int dot = normalized.lastIndexOf('.');
    return dot < 0 ? normalized : normalized.substring(dot + 1);
  }

  public Alphabet getAlphabet() {
    return alphabet;
  }

  public int getId() {
    return id;
  }

  public String getKey() {
    return key;
  }

  public String getName() {
    return name;
  }

  public Class<?> getPayloadType() {
    return payloadType;
  }

  public boolean hasPayloadType() {
    return payloadType != null;
  }

  public boolean isSentinel() {
    return id == 0;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((alphabet == null) ? 0 : alphabet.hashCode());
    result = prime * result + id;
    result = prime * result + ((key == null) ? 0 : key.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    Symbol other = (Symbol) obj;
    if (alphabet != other.alphabet || id != other.id) {
      return false;
    }
    if (key == null) {
      if (other.key != null) {
        return false;
      }
    } else if (!key.equals(other.key)) {
      return false;
    }
    return true;
  }

  @Override
  public String toString() {
    return "Symbol [alphabet=" + alphabet + ", id=" + id + ", key=" + key + "]";
  }
}
