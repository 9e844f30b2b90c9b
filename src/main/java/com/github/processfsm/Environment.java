package com.github.processfsm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable mapping from bound names to values. Every write returns a new environment so that a
 * child instance can be handed a frozen snapshot of its parent's bindings without any way of
 * leaking its own bindings back to the parent or to its siblings.
 */
public final class Environment {
  private static final Environment EMPTY = new Environment(Collections.<String, Value>emptyMap());

  private final Map<String, Value> bindings;

  private Environment(final Map<String, Value> bindings) {
    this.bindings = bindings;
  }

  public static Environment empty() {
    return EMPTY;
  }

  public Environment bind(final String name, final Value value) {
    final Map<String, Value> copy = new LinkedHashMap<>(bindings);
    // rebinding moves the name to the end, shadowing reads the newest binding anyway
    copy.remove(name);
    copy.put(name, value);
    return new Environment(Collections.unmodifiableMap(copy));
  }

  public Environment bindAll(final Map<String, Value> additions) {
    if (additions.isEmpty()) {
      return this;
    }
    final Map<String, Value> copy = new LinkedHashMap<>(bindings);
    for (Map.Entry<String, Value> addition : additions.entrySet()) {
      copy.remove(addition.getKey());
      copy.put(addition.getKey(), addition.getValue());
    }
    return new Environment(Collections.unmodifiableMap(copy));
  }

  public Environment unbind(final String name) {
    if (!bindings.containsKey(name)) {
      return this;
    }
    final Map<String, Value> copy = new LinkedHashMap<>(bindings);
    copy.remove(name);
    return new Environment(Collections.unmodifiableMap(copy));
  }

  public Optional<Value> lookup(final String name) {
    return Optional.ofNullable(bindings.get(name));
  }

  public boolean isBound(final String name) {
    return bindings.containsKey(name);
  }

  public Map<String, Value> asMap() {
    return bindings;
  }

  public int size() {
    return bindings.size();
  }

  @Override
  public int hashCode() {
    return bindings.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Environment)) {
      return false;
    }
    return bindings.equals(((Environment) obj).bindings);
  }

  @Override
  public String toString() {
    return "Environment " + bindings;
  }
}
