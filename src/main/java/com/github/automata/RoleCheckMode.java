package com.github.automata;

/**
 * This represents how the validator tells guards and handlers apart when checking a specification.
 */
public enum RoleCheckMode {
  // name-prefix heuristic: handlers may not start with guard_, guards may not start with handle_
  NAME_PREFIX,
  // structural: every guard reference must be bound as a guard and every handler reference as a
  // handler or callback, and no name may be bound in both roles
  ROLE_TAGGED,
  // apply both checks
  BOTH;

  public boolean checksPrefixes() {
    return this == NAME_PREFIX || this == BOTH;
  }

  public boolean checksRoles() {
    return this == ROLE_TAGGED || this == BOTH;
  }
}
