package com.github.automata.clock;

/**
 * External time source read by guards and handlers. The core never owns a clock exclusively:
 * implementations must be safe to read from several threads and to hand out to several machines.
 */
public interface Clock {

  Timestamp now();

  /**
   * A handle onto the same time line, for another owner. Clocks that keep no per-owner state can
   * return themselves.
   */
  default Clock share() {
    return this;
  }

}
