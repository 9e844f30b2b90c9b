package com.github.processfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Structural matching of a pattern against a value. A failed match is not an error, it simply
 * produces no bindings. Matching is a pure function of its inputs.
 */
public final class PatternMatcher {

  /**
   * Returns the bindings produced by matching, in binding order, or empty if the value does not
   * match. A variable bound twice only matches equal values.
   */
  public static Optional<Map<String, Value>> match(final Pattern pattern, final Value value) {
    final Map<String, Value> bindings = new LinkedHashMap<>();
    if (matchInto(pattern, value, bindings)) {
      return Optional.of(Collections.unmodifiableMap(bindings));
    }
    return Optional.empty();
  }

  /**
   * Matches the arguments of a message against the formals of a receive.
   */
  public static Optional<Map<String, Value>> matchArguments(final Pattern formals,
      final List<Value> payload) {
    return match(formals, Value.ofList(payload));
  }

  private static boolean matchInto(final Pattern pattern, final Value value,
      final Map<String, Value> bindings) {
    switch (pattern.getKind()) {
      case WILDCARD:
        return true;
      case VARIABLE:
        return bind(((Pattern.Variable) pattern).getName(), value, bindings);
      case LITERAL:
        return ((Pattern.Literal) pattern).getValue().equals(value);
      case TYPED:
        return ((Pattern.Typed) pattern).getType().accepts(value);
      case LIST:
      case TUPLE:
        return matchSequence((Pattern.Sequence) pattern, value, bindings);
      case MAP:
        return matchMap((Pattern.MapPattern) pattern, value, bindings);
      case SET:
        return matchSet((Pattern.SetPattern) pattern, value, bindings);
      case QUOTE: {
        if (value.getKind() != Value.Kind.NAME) {
          return false;
        }
        final ChannelName name = value.asName();
        if (name.getKind() != ChannelName.Kind.QUOTED) {
          return false;
        }
        return matchInto(((Pattern.Quote) pattern).getInner(), name.getQuoted(), bindings);
      }
      case VAR_REF:
        // unresolved references never match, they are resolved before a pattern is matched
        return false;
      case AND: {
        final Map<String, Value> scratch = new LinkedHashMap<>(bindings);
        for (Pattern operand : ((Pattern.Connective) pattern).getOperands()) {
          if (!matchInto(operand, value, scratch)) {
            return false;
          }
        }
        bindings.putAll(scratch);
        return true;
      }
      case OR:
        for (Pattern operand : ((Pattern.Connective) pattern).getOperands()) {
          if (matchInto(operand, value, new LinkedHashMap<>(bindings))) {
            return true;
          }
        }
        return false;
      case NOT:
        return !matchInto(((Pattern.Connective) pattern).getOperands().get(0), value,
            new LinkedHashMap<>(bindings));
      default:
        return false;
    }
  }

  private static boolean bind(final String name, final Value value,
      final Map<String, Value> bindings) {
    final Value existing = bindings.get(name);
    if (existing != null) {
      return existing.equals(value);
    }
    bindings.put(name, value);
    return true;
  }

  private static boolean matchSequence(final Pattern.Sequence pattern, final Value value,
      final Map<String, Value> bindings) {
    final Value.Kind expected =
        pattern.getKind() == Pattern.Kind.LIST ? Value.Kind.LIST : Value.Kind.TUPLE;
    if (value.getKind() != expected) {
      return false;
    }
    final List<Value> elements = value.asList();
    final List<Pattern> patterns = pattern.getElements();
    if (pattern.getRemainder() == null ? elements.size() != patterns.size()
        : elements.size() < patterns.size()) {
      return false;
    }
    final Map<String, Value> scratch = new LinkedHashMap<>(bindings);
    for (int index = 0; index < patterns.size(); index++) {
      if (!matchInto(patterns.get(index), elements.get(index), scratch)) {
        return false;
      }
    }
    if (pattern.getRemainder() != null) {
      final List<Value> rest = new ArrayList<>(elements.subList(patterns.size(), elements.size()));
      if (!bind(pattern.getRemainder(), Value.ofList(rest), scratch)) {
        return false;
      }
    }
    bindings.putAll(scratch);
    return true;
  }

  private static boolean matchMap(final Pattern.MapPattern pattern, final Value value,
      final Map<String, Value> bindings) {
    if (value.getKind() != Value.Kind.MAP) {
      return false;
    }
    final Map<Value, Value> entries = value.asMap();
    if (pattern.getRemainder() == null && entries.size() != pattern.getEntries().size()) {
      return false;
    }
    final Map<String, Value> scratch = new LinkedHashMap<>(bindings);
    final Map<Value, Value> rest = new LinkedHashMap<>(entries);
    for (Map.Entry<Value, Pattern> entry : pattern.getEntries().entrySet()) {
      final Value actual = entries.get(entry.getKey());
      if (actual == null || !matchInto(entry.getValue(), actual, scratch)) {
        return false;
      }
      rest.remove(entry.getKey());
    }
    if (pattern.getRemainder() != null && !bind(pattern.getRemainder(), Value.ofMap(rest), scratch)) {
      return false;
    }
    bindings.putAll(scratch);
    return true;
  }

  private static boolean matchSet(final Pattern.SetPattern pattern, final Value value,
      final Map<String, Value> bindings) {
    if (value.getKind() != Value.Kind.SET) {
      return false;
    }
    final Set<Value> elements = value.asSet();
    if (!elements.containsAll(pattern.getElements())) {
      return false;
    }
    if (pattern.getRemainder() == null) {
      return elements.size() == pattern.getElements().size();
    }
    final Set<Value> rest = new LinkedHashSet<>(elements);
    rest.removeAll(pattern.getElements());
    return bind(pattern.getRemainder(), Value.ofSet(rest), bindings);
  }

  private PatternMatcher() {}
}
