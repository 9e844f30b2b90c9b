package com.github.processfsm;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Structural patterns matched against values by receives, match cases, let bindings and the
 * {@code matches} expression. The variants are closed, {@link PatternMatcher} switches over
 * {@link #getKind()}.
 */
public abstract class Pattern {
  public enum Kind {
    WILDCARD, VARIABLE, LITERAL, TYPED, LIST, TUPLE, MAP, SET, QUOTE, VAR_REF, AND, OR, NOT;
  }

  private Pattern() {}

  public abstract Kind getKind();

  /**
   * Names this pattern binds on a successful match, in binding order.
   */
  public final List<String> boundVariables() {
    final List<String> names = new ArrayList<>();
    collectBound(names);
    return names;
  }

  abstract void collectBound(List<String> names);

  /**
   * Names referenced through {@code =x}; they have to be resolved against an environment before the
   * pattern can be matched.
   */
  public final List<String> references() {
    final List<String> names = new ArrayList<>();
    collectReferences(names);
    return names;
  }

  abstract void collectReferences(List<String> names);

  /**
   * Replaces every variable reference with the literal it is bound to. Callers make sure all
   * {@link #references()} are bound.
   */
  abstract Pattern resolve(Environment environment);

  public static Pattern wildcard() {
    return Wildcard.INSTANCE;
  }

  public static Pattern var(final String name) {
    return new Variable(name);
  }

  public static Pattern literal(final Value value) {
    return new Literal(value);
  }

  public static Pattern typed(final SimpleType type) {
    return new Typed(type);
  }

  public static Pattern list(final Pattern... elements) {
    return new Sequence(Kind.LIST, Arrays.asList(elements), null);
  }

  public static Pattern listWithRemainder(final List<Pattern> elements, final String remainder) {
    return new Sequence(Kind.LIST, elements, remainder);
  }

  public static Pattern tuple(final Pattern... elements) {
    return new Sequence(Kind.TUPLE, Arrays.asList(elements), null);
  }

  public static Pattern map(final Map<Value, Pattern> entries, final String remainder) {
    return new MapPattern(entries, remainder);
  }

  public static Pattern set(final Set<Value> elements, final String remainder) {
    return new SetPattern(elements, remainder);
  }

  public static Pattern quote(final Pattern inner) {
    return new Quote(inner);
  }

  public static Pattern varRef(final String name) {
    return new VarRef(name);
  }

  public static Pattern and(final Pattern left, final Pattern right) {
    return new Connective(Kind.AND, Arrays.asList(left, right));
  }

  public static Pattern or(final Pattern left, final Pattern right) {
    return new Connective(Kind.OR, Arrays.asList(left, right));
  }

  public static Pattern not(final Pattern operand) {
    return new Connective(Kind.NOT, Collections.singletonList(operand));
  }

  static final class Wildcard extends Pattern {
    private static final Wildcard INSTANCE = new Wildcard();

    @Override
    public Kind getKind() {
      return Kind.WILDCARD;
    }

    @Override
    void collectBound(List<String> names) {}

    @Override
    void collectReferences(List<String> names) {}

    @Override
    Pattern resolve(Environment environment) {
      return this;
    }

    @Override
    public String toString() {
      return "_";
    }
  }

  static final class Variable extends Pattern {
    private final String name;

    private Variable(final String name) {
      this.name = Objects.requireNonNull(name);
    }

    String getName() {
      return name;
    }

    @Override
    public Kind getKind() {
      return Kind.VARIABLE;
    }

    @Override
    void collectBound(List<String> names) {
      if (!names.contains(name)) {
        names.add(name);
      }
    }

    @Override
    void collectReferences(List<String> names) {}

    @Override
    Pattern resolve(Environment environment) {
      return this;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  static final class Literal extends Pattern {
    private final Value value;

    private Literal(final Value value) {
      this.value = Objects.requireNonNull(value);
    }

    Value getValue() {
      return value;
    }

    @Override
    public Kind getKind() {
      return Kind.LITERAL;
    }

    @Override
    void collectBound(List<String> names) {}

    @Override
    void collectReferences(List<String> names) {}

    @Override
    Pattern resolve(Environment environment) {
      return this;
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }

  static final class Typed extends Pattern {
    private final SimpleType type;

    private Typed(final SimpleType type) {
      this.type = Objects.requireNonNull(type);
    }

    SimpleType getType() {
      return type;
    }

    @Override
    public Kind getKind() {
      return Kind.TYPED;
    }

    @Override
    void collectBound(List<String> names) {}

    @Override
    void collectReferences(List<String> names) {}

    @Override
    Pattern resolve(Environment environment) {
      return this;
    }

    @Override
    public String toString() {
      return type.name();
    }
  }

  /**
   * List or tuple of element patterns. Only lists take a remainder, bound to the trailing
   * elements.
   */
  static final class Sequence extends Pattern {
    private final Kind kind;
    private final List<Pattern> elements;
    private final String remainder;

    private Sequence(final Kind kind, final List<Pattern> elements, final String remainder) {
      this.kind = kind;
      this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
      this.remainder = remainder;
    }

    List<Pattern> getElements() {
      return elements;
    }

    String getRemainder() {
      return remainder;
    }

    @Override
    public Kind getKind() {
      return kind;
    }

    @Override
    void collectBound(List<String> names) {
      for (Pattern element : elements) {
        element.collectBound(names);
      }
      if (remainder != null && !names.contains(remainder)) {
        names.add(remainder);
      }
    }

    @Override
    void collectReferences(List<String> names) {
      for (Pattern element : elements) {
        element.collectReferences(names);
      }
    }

    @Override
    Pattern resolve(Environment environment) {
      final List<Pattern> resolved = new ArrayList<>(elements.size());
      for (Pattern element : elements) {
        resolved.add(element.resolve(environment));
      }
      return new Sequence(kind, resolved, remainder);
    }

    @Override
    public String toString() {
      final StringBuilder builder = new StringBuilder(kind == Kind.LIST ? "[" : "(");
      final Iterator<Pattern> iterator = elements.iterator();
      while (iterator.hasNext()) {
        builder.append(iterator.next());
        if (iterator.hasNext()) {
          builder.append(", ");
        }
      }
      if (remainder != null) {
        builder.append(elements.isEmpty() ? "..." : " ...").append(remainder);
      }
      return builder.append(kind == Kind.LIST ? "]" : ")").toString();
    }
  }

  static final class MapPattern extends Pattern {
    private final Map<Value, Pattern> entries;
    private final String remainder;

    private MapPattern(final Map<Value, Pattern> entries, final String remainder) {
      this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
      this.remainder = remainder;
    }

    Map<Value, Pattern> getEntries() {
      return entries;
    }

    String getRemainder() {
      return remainder;
    }

    @Override
    public Kind getKind() {
      return Kind.MAP;
    }

    @Override
    void collectBound(List<String> names) {
      for (Pattern value : entries.values()) {
        value.collectBound(names);
      }
      if (remainder != null && !names.contains(remainder)) {
        names.add(remainder);
      }
    }

    @Override
    void collectReferences(List<String> names) {
      for (Pattern value : entries.values()) {
        value.collectReferences(names);
      }
    }

    @Override
    Pattern resolve(Environment environment) {
      final Map<Value, Pattern> resolved = new LinkedHashMap<>();
      for (Map.Entry<Value, Pattern> entry : entries.entrySet()) {
        resolved.put(entry.getKey(), entry.getValue().resolve(environment));
      }
      return new MapPattern(resolved, remainder);
    }

    @Override
    public String toString() {
      return "{" + entries + (remainder == null ? "" : " ..." + remainder) + "}";
    }
  }

  static final class SetPattern extends Pattern {
    private final Set<Value> elements;
    private final String remainder;

    private SetPattern(final Set<Value> elements, final String remainder) {
      this.elements = Collections.unmodifiableSet(new LinkedHashSet<>(elements));
      this.remainder = remainder;
    }

    Set<Value> getElements() {
      return elements;
    }

    String getRemainder() {
      return remainder;
    }

    @Override
    public Kind getKind() {
      return Kind.SET;
    }

    @Override
    void collectBound(List<String> names) {
      if (remainder != null && !names.contains(remainder)) {
        names.add(remainder);
      }
    }

    @Override
    void collectReferences(List<String> names) {}

    @Override
    Pattern resolve(Environment environment) {
      return this;
    }

    @Override
    public String toString() {
      return "Set(" + elements + (remainder == null ? "" : " ..." + remainder) + ")";
    }
  }

  /**
   * {@code @p}: matches a quoted name whose value matches p.
   */
  static final class Quote extends Pattern {
    private final Pattern inner;

    private Quote(final Pattern inner) {
      this.inner = Objects.requireNonNull(inner);
    }

    Pattern getInner() {
      return inner;
    }

    @Override
    public Kind getKind() {
      return Kind.QUOTE;
    }

    @Override
    void collectBound(List<String> names) {
      inner.collectBound(names);
    }

    @Override
    void collectReferences(List<String> names) {
      inner.collectReferences(names);
    }

    @Override
    Pattern resolve(Environment environment) {
      return new Quote(inner.resolve(environment));
    }

    @Override
    public String toString() {
      return "@" + inner;
    }
  }

  static final class VarRef extends Pattern {
    private final String name;

    private VarRef(final String name) {
      this.name = Objects.requireNonNull(name);
    }

    String getName() {
      return name;
    }

    @Override
    public Kind getKind() {
      return Kind.VAR_REF;
    }

    @Override
    void collectBound(List<String> names) {}

    @Override
    void collectReferences(List<String> names) {
      names.add(name);
    }

    @Override
    Pattern resolve(Environment environment) {
      return new Literal(environment.lookup(name).get());
    }

    @Override
    public String toString() {
      return "=" + name;
    }
  }

  static final class Connective extends Pattern {
    private final Kind kind;
    private final List<Pattern> operands;

    private Connective(final Kind kind, final List<Pattern> operands) {
      this.kind = kind;
      this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
    }

    List<Pattern> getOperands() {
      return operands;
    }

    @Override
    public Kind getKind() {
      return kind;
    }

    @Override
    void collectBound(List<String> names) {
      // only conjunctions bind, disjunction and negation branches may not have succeeded
      if (kind == Kind.AND) {
        for (Pattern operand : operands) {
          operand.collectBound(names);
        }
      }
    }

    @Override
    void collectReferences(List<String> names) {
      for (Pattern operand : operands) {
        operand.collectReferences(names);
      }
    }

    @Override
    Pattern resolve(Environment environment) {
      final List<Pattern> resolved = new ArrayList<>(operands.size());
      for (Pattern operand : operands) {
        resolved.add(operand.resolve(environment));
      }
      return new Connective(kind, resolved);
    }

    @Override
    public String toString() {
      switch (kind) {
        case NOT:
          return "~" + operands.get(0);
        case AND:
          return operands.get(0) + " /\\ " + operands.get(1);
        default:
          return operands.get(0) + " \\/ " + operands.get(1);
      }
    }
  }
}
