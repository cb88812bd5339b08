package com.github.automata;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automata.StateMachineException.Code;

/**
 * Semantic checks over a parsed {@link Specification}, optionally against the {@link Bindings}
 * that will back it. Every problem is collected; nothing stops at the first one.
 *
 * Checks, in the order their diagnostics are reported:<br>
 * 1. at least one state is declared<br>
 * 2. symbol names are unique per alphabet and do not shadow the Nothing/Failure sentinels<br>
 * 3. every state, input and output a rule mentions is declared<br>
 * 4. guard and handler names respect the configured {@link RoleCheckMode}<br>
 * 5. with bindings: every reference is bound, payload types bind declared symbols only and no
 * payload type is bound twice within one alphabet<br>
 */
public final class SpecificationValidator {
  private static final Logger logger =
      LogManager.getLogger(SpecificationValidator.class.getSimpleName());

  static final String HANDLER_PREFIX = "handle_";
  static final String GUARD_PREFIX = "guard_";

  private SpecificationValidator() {}

  /**
   * Validate the specification alone, with the name-prefix heuristic.
   */
  public static void validate(final Specification specification) throws StateMachineException {
    validate(specification, null, RoleCheckMode.NAME_PREFIX);
  }

  /**
   * Validate and fail with {@link Code#INVALID_SPECIFICATION} carrying every diagnostic found.
   *
   * @param bindings may be null, in which case binding and role-tag checks are skipped
   */
  public static void validate(final Specification specification, final Bindings<?> bindings,
      final RoleCheckMode mode) throws StateMachineException {
    final List<Diagnostic> diagnostics = check(specification, bindings, mode);
    if (!diagnostics.isEmpty()) {
      logger.error("Specification failed validation with " + diagnostics.size()
          + " problem(s)");
      throw new StateMachineException(Code.INVALID_SPECIFICATION, diagnostics);
    }
  }

  public static List<Diagnostic> check(final Specification specification,
      final Bindings<?> bindings, final RoleCheckMode mode) {
    final List<Diagnostic> diagnostics = new ArrayList<>();
    if (specification.getStates().isEmpty()) {
      diagnostics.add(Diagnostic.of("No states are defined"));
    }
    for (final Alphabet alphabet : Alphabet.values()) {
      checkDeclarations(alphabet, specification.getSymbols(alphabet), diagnostics);
    }

    final Map<Alphabet, Set<String>> declared = new HashMap<>();
    for (final Alphabet alphabet : Alphabet.values()) {
      declared.put(alphabet, knownNames(specification.getSymbols(alphabet)));
    }

    for (final TransitionRule rule : specification.getTransitions()) {
      checkKnown(Alphabet.STATE, rule.getFromState(), rule, declared, diagnostics);
      if (rule.hasInput()) {
        checkKnown(Alphabet.INPUT, rule.getInput(), rule, declared, diagnostics);
      }
      checkKnown(Alphabet.STATE, rule.getToState(), rule, declared, diagnostics);
      if (rule.hasOutput()) {
        checkKnown(Alphabet.OUTPUT, rule.getOutput(), rule, declared, diagnostics);
      }
      if (mode.checksPrefixes()) {
        checkPrefixes(rule, diagnostics);
      }
      if (bindings != null) {
        checkBound(rule, bindings, mode, diagnostics);
      }
    }

    if (bindings != null) {
      checkNameClashes(bindings, diagnostics);
      for (final Alphabet alphabet : Alphabet.values()) {
        checkPayloadTypes(alphabet, bindings, declared.get(alphabet), diagnostics);
      }
    }
    return diagnostics;
  }

  private static void checkDeclarations(final Alphabet alphabet, final List<String> keys,
      final List<Diagnostic> diagnostics) {
    final Set<String> seen = new HashSet<>();
    for (final String key : keys) {
      final String name = Symbol.simpleName(key);
      if (name.equals(alphabet.getSentinelName())) {
        diagnostics.add(Diagnostic.of(
            "Reserved " + alphabet.getLabel() + " name cannot be declared: " + key));
      }
      if (!seen.add(name)) {
        diagnostics.add(Diagnostic.of("Duplicate " + alphabet.getLabel() + ": " + key));
      }
    }
  }

  private static Set<String> knownNames(final List<String> keys) {
    final Set<String> names = new HashSet<>();
    for (final String key : keys) {
      names.add(key);
      names.add(Symbol.simpleName(key));
    }
    return names;
  }

  private static void checkKnown(final Alphabet alphabet, final String reference,
      final TransitionRule rule, final Map<Alphabet, Set<String>> declared,
      final List<Diagnostic> diagnostics) {
    if (!declared.get(alphabet).contains(reference)) {
      diagnostics.add(Diagnostic.at(rule,
          "Unknown " + alphabet.getLabel() + ": " + reference + " in " + rule));
    }
  }

  private static void checkPrefixes(final TransitionRule rule,
      final List<Diagnostic> diagnostics) {
    if (rule.hasHandler() && rule.getHandler().startsWith(GUARD_PREFIX)) {
      diagnostics.add(Diagnostic.at(rule, "Handler cannot start with " + GUARD_PREFIX
          + " prefix: " + rule.getHandler() + " in " + rule));
    }
    if (rule.hasGuard()) {
      for (final String reference : rule.getGuard().references()) {
        if (Symbol.simpleName(reference).startsWith(HANDLER_PREFIX)) {
          diagnostics.add(Diagnostic.at(rule, "Guard cannot start with " + HANDLER_PREFIX
              + " prefix: " + reference + " in " + rule));
        }
      }
    }
  }

  private static void checkBound(final TransitionRule rule, final Bindings<?> bindings,
      final RoleCheckMode mode, final List<Diagnostic> diagnostics) {
    if (rule.hasGuard()) {
      for (final String reference : rule.getGuard().references()) {
        if (bindings.isGuard(reference)) {
          continue;
        }
        if (mode.checksRoles() && bindings.isHandler(reference)) {
          diagnostics.add(Diagnostic.at(rule,
              "Guard " + reference + " is bound as a handler in " + rule));
        } else {
          diagnostics.add(Diagnostic.at(rule, "Unbound guard: " + reference + " in " + rule));
        }
      }
    }
    if (rule.hasHandler()) {
      final String handler = rule.getHandler();
      if (!bindings.isHandler(handler)) {
        if (mode.checksRoles() && bindings.isGuard(handler)) {
          diagnostics.add(Diagnostic.at(rule,
              "Handler " + handler + " is bound as a guard in " + rule));
        } else {
          diagnostics.add(Diagnostic.at(rule, "Unbound handler: " + handler + " in " + rule));
        }
      }
    }
  }

  private static void checkNameClashes(final Bindings<?> bindings,
      final List<Diagnostic> diagnostics) {
    for (final String name : bindings.getHandlers().keySet()) {
      if (bindings.getCallbacks().containsKey(name)) {
        diagnostics.add(Diagnostic.of("Name " + name + " is bound both as a handler and a callback"));
      }
    }
    for (final String name : bindings.getGuards().keySet()) {
      if (bindings.getHandlers().containsKey(name) || bindings.getCallbacks().containsKey(name)) {
        diagnostics.add(Diagnostic.of("Name " + name + " is bound both as a guard and a handler"));
      }
    }
  }

  private static void checkPayloadTypes(final Alphabet alphabet, final Bindings<?> bindings,
      final Set<String> declared, final List<Diagnostic> diagnostics) {
    final Map<Class<?>, String> owners = new HashMap<>();
    for (final Map.Entry<String, Class<?>> entry : bindings.getPayloadTypes(alphabet).entrySet()) {
      final String symbol = entry.getKey();
      final Class<?> type = entry.getValue();
      if (!declared.contains(symbol)) {
        diagnostics.add(Diagnostic.of(
            "Payload type " + typeName(type) + " bound to unknown " + alphabet.getLabel() + ": "
                + symbol));
        continue;
      }
      if (type == null) {
        diagnostics.add(Diagnostic.of(
            "Payload type of " + alphabet.getLabel() + " " + symbol + " cannot be null"));
        continue;
      }
      final String owner = owners.put(type, symbol);
      if (owner != null) {
        diagnostics.add(Diagnostic.of("Payload type " + typeName(type) + " is bound to both "
            + alphabet.getLabel() + "s " + owner + " and " + symbol));
      }
    }
  }

  private static String typeName(final Class<?> type) {
    return type == null ? "null" : type.getName();
  }

}
