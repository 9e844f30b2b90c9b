package com.github.processfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable runtime value: what processes send, receive, bind and compute. Collections keep
 * their insertion order so that everything derived from them stays deterministic.
 */
public final class Value {
  public enum Kind {
    NIL, BOOL, INT, STRING, URI, NAME, LIST, TUPLE, SET, MAP, PROCESS;
  }

  private static final Value NIL = new Value(Kind.NIL, null);
  private static final Value TRUE = new Value(Kind.BOOL, Boolean.TRUE);
  private static final Value FALSE = new Value(Kind.BOOL, Boolean.FALSE);

  private final Kind kind;
  private final Object payload;

  private Value(final Kind kind, final Object payload) {
    this.kind = kind;
    this.payload = payload;
  }

  public static Value nil() {
    return NIL;
  }

  public static Value ofBool(final boolean value) {
    return value ? TRUE : FALSE;
  }

  public static Value ofInt(final long value) {
    return new Value(Kind.INT, value);
  }

  public static Value ofString(final String value) {
    return new Value(Kind.STRING, Objects.requireNonNull(value));
  }

  public static Value ofUri(final String value) {
    return new Value(Kind.URI, Objects.requireNonNull(value));
  }

  public static Value ofName(final ChannelName name) {
    return new Value(Kind.NAME, Objects.requireNonNull(name));
  }

  public static Value ofList(final List<Value> elements) {
    return new Value(Kind.LIST, Collections.unmodifiableList(new ArrayList<>(elements)));
  }

  public static Value ofTuple(final List<Value> elements) {
    return new Value(Kind.TUPLE, Collections.unmodifiableList(new ArrayList<>(elements)));
  }

  public static Value ofSet(final Set<Value> elements) {
    return new Value(Kind.SET, Collections.unmodifiableSet(new LinkedHashSet<>(elements)));
  }

  public static Value ofMap(final Map<Value, Value> entries) {
    return new Value(Kind.MAP, Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
  }

  static Value ofProcess(final Term term, final Environment environment) {
    return new Value(Kind.PROCESS, new Closure(term, environment));
  }

  public static Value list(final Value... elements) {
    final List<Value> values = new ArrayList<>(elements.length);
    Collections.addAll(values, elements);
    return ofList(values);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isNil() {
    return kind == Kind.NIL;
  }

  public boolean asBool() {
    return (Boolean) expect(Kind.BOOL);
  }

  public long asInt() {
    return (Long) expect(Kind.INT);
  }

  public String asString() {
    if (kind == Kind.STRING || kind == Kind.URI) {
      return (String) payload;
    }
    throw new IllegalStateException("Value " + this + " is not a string");
  }

  public ChannelName asName() {
    return (ChannelName) expect(Kind.NAME);
  }

  /**
   * Elements of a LIST or TUPLE.
   */
  @SuppressWarnings("unchecked")
  public List<Value> asList() {
    if (kind == Kind.LIST || kind == Kind.TUPLE) {
      return (List<Value>) payload;
    }
    throw new IllegalStateException("Value " + this + " is not a list or tuple");
  }

  @SuppressWarnings("unchecked")
  public Set<Value> asSet() {
    return (Set<Value>) expect(Kind.SET);
  }

  @SuppressWarnings("unchecked")
  public Map<Value, Value> asMap() {
    return (Map<Value, Value>) expect(Kind.MAP);
  }

  Closure asClosure() {
    return (Closure) expect(Kind.PROCESS);
  }

  private Object expect(final Kind expected) {
    if (kind != expected) {
      throw new IllegalStateException("Value " + this + " is not of kind " + expected);
    }
    return payload;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, payload);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Value)) {
      return false;
    }
    final Value other = (Value) obj;
    return kind == other.kind && Objects.equals(payload, other.payload);
  }

  @Override
  public String toString() {
    switch (kind) {
      case NIL:
        return "Nil";
      case STRING:
        return "\"" + payload + "\"";
      case URI:
        return "`" + payload + "`";
      case LIST:
        return join(asList(), "[", "]");
      case TUPLE:
        return join(asList(), "(", ")");
      case SET:
        return join(asSet(), "Set(", ")");
      case MAP: {
        final StringBuilder builder = new StringBuilder("{");
        final Iterator<Map.Entry<Value, Value>> entries = asMap().entrySet().iterator();
        while (entries.hasNext()) {
          final Map.Entry<Value, Value> entry = entries.next();
          builder.append(entry.getKey()).append(": ").append(entry.getValue());
          if (entries.hasNext()) {
            builder.append(", ");
          }
        }
        return builder.append('}').toString();
      }
      default:
        return String.valueOf(payload);
    }
  }

  private static String join(final Iterable<Value> values, final String open,
      final String close) {
    final StringBuilder builder = new StringBuilder(open);
    final Iterator<Value> iterator = values.iterator();
    while (iterator.hasNext()) {
      builder.append(iterator.next());
      if (iterator.hasNext()) {
        builder.append(", ");
      }
    }
    return builder.append(close).toString();
  }

  /**
   * A quoted process together with the environment it was quoted in.
   */
  static final class Closure {
    private final Term term;
    private final Environment environment;

    private Closure(final Term term, final Environment environment) {
      this.term = term;
      this.environment = environment;
    }

    Term getTerm() {
      return term;
    }

    Environment getEnvironment() {
      return environment;
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(term) * 31 + environment.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Closure)) {
        return false;
      }
      final Closure other = (Closure) obj;
      return term == other.term && environment.equals(other.environment);
    }

    @Override
    public String toString() {
      return "@{" + term.getKind() + "}";
    }
  }
}
