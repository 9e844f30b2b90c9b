package com.github.processfsm;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Computes operators, methods and collection constructors over evaluated operands.
 */
final class Operations {
  private static final java.util.regex.Pattern PLACEHOLDER =
      java.util.regex.Pattern.compile("\\$\\{([^}]*)\\}");

  private Operations() {}

  static Value apply(final Operator operator, final String method, final List<Value> operands)
      throws EvaluationException {
    switch (operator) {
      case ADD:
      case SUB:
      case MULT:
      case DIV:
      case MOD:
        return arithmetic(operator, operands);
      case NEG:
        try {
          return Value.ofInt(Math.negateExact(integer(operands.get(0), operator)));
        } catch (ArithmeticException overflow) {
          throw new EvaluationException(ProcessFault.FaultKind.ARITHMETIC, "Integer overflow");
        }
      case EQ:
        return Value.ofBool(operands.get(0).equals(operands.get(1)));
      case NEQ:
        return Value.ofBool(!operands.get(0).equals(operands.get(1)));
      case LT:
        return Value.ofBool(compare(operator, operands) < 0);
      case LTE:
        return Value.ofBool(compare(operator, operands) <= 0);
      case GT:
        return Value.ofBool(compare(operator, operands) > 0);
      case GTE:
        return Value.ofBool(compare(operator, operands) >= 0);
      case NOT:
      case NEGATION:
        return Value.ofBool(!bool(operands.get(0), operator));
      case AND:
      case CONJUNCTION:
        return Value.ofBool(bool(operands.get(0), operator) & bool(operands.get(1), operator));
      case OR:
      case DISJUNCTION:
        return Value.ofBool(bool(operands.get(0), operator) | bool(operands.get(1), operator));
      case CONCAT:
        return concat(operands.get(0), operands.get(1));
      case DIFF:
        return diff(operands.get(0), operands.get(1));
      case INTERPOLATION:
        return interpolate(operands.get(0), operands.get(1));
      case METHOD:
        return invoke(method, operands.get(0), operands.subList(1, operands.size()));
      default:
        throw new EvaluationException(ProcessFault.FaultKind.TYPE_MISMATCH,
            "Unsupported operator " + operator);
    }
  }

  static Value collect(final CollectionKind kind, final List<Value> elements)
      throws EvaluationException {
    switch (kind) {
      case LIST:
        return Value.ofList(elements);
      case TUPLE:
        return Value.ofTuple(elements);
      case SET:
        return Value.ofSet(new LinkedHashSet<>(elements));
      default:
        if (elements.size() % 2 != 0) {
          throw new EvaluationException(ProcessFault.FaultKind.TYPE_MISMATCH,
              "Map constructor needs key value pairs");
        }
        final Map<Value, Value> entries = new LinkedHashMap<>();
        for (int i = 0; i < elements.size(); i += 2) {
          entries.put(elements.get(i), elements.get(i + 1));
        }
        return Value.ofMap(entries);
    }
  }

  private static Value arithmetic(final Operator operator, final List<Value> operands)
      throws EvaluationException {
    final long left = integer(operands.get(0), operator);
    final long right = integer(operands.get(1), operator);
    try {
      switch (operator) {
        case ADD:
          return Value.ofInt(Math.addExact(left, right));
        case SUB:
          return Value.ofInt(Math.subtractExact(left, right));
        case MULT:
          return Value.ofInt(Math.multiplyExact(left, right));
        case DIV:
          if (right == 0L) {
            throw new EvaluationException(ProcessFault.FaultKind.ARITHMETIC, "Division by zero");
          }
          if (left == Long.MIN_VALUE && right == -1L) {
            throw new EvaluationException(ProcessFault.FaultKind.ARITHMETIC, "Integer overflow");
          }
          return Value.ofInt(left / right);
        default:
          if (right == 0L) {
            throw new EvaluationException(ProcessFault.FaultKind.ARITHMETIC, "Modulo by zero");
          }
          return Value.ofInt(left % right);
      }
    } catch (ArithmeticException overflow) {
      throw new EvaluationException(ProcessFault.FaultKind.ARITHMETIC, "Integer overflow");
    }
  }

  private static int compare(final Operator operator, final List<Value> operands)
      throws EvaluationException {
    final Value left = operands.get(0);
    final Value right = operands.get(1);
    if (left.getKind() == Value.Kind.INT && right.getKind() == Value.Kind.INT) {
      return Long.compare(left.asInt(), right.asInt());
    }
    if (left.getKind() == Value.Kind.STRING && right.getKind() == Value.Kind.STRING) {
      return left.asString().compareTo(right.asString());
    }
    throw mismatch(operator, left, right);
  }

  private static Value concat(final Value left, final Value right) throws EvaluationException {
    if (left.getKind() != right.getKind()) {
      throw mismatch(Operator.CONCAT, left, right);
    }
    switch (left.getKind()) {
      case STRING:
        return Value.ofString(left.asString() + right.asString());
      case LIST: {
        final List<Value> joined = new ArrayList<>(left.asList());
        joined.addAll(right.asList());
        return Value.ofList(joined);
      }
      case SET: {
        final Set<Value> joined = new LinkedHashSet<>(left.asSet());
        joined.addAll(right.asSet());
        return Value.ofSet(joined);
      }
      case MAP: {
        final Map<Value, Value> joined = new LinkedHashMap<>(left.asMap());
        joined.putAll(right.asMap());
        return Value.ofMap(joined);
      }
      default:
        throw mismatch(Operator.CONCAT, left, right);
    }
  }

  private static Value diff(final Value left, final Value right) throws EvaluationException {
    if (left.getKind() != right.getKind()) {
      throw mismatch(Operator.DIFF, left, right);
    }
    switch (left.getKind()) {
      case SET: {
        final Set<Value> rest = new LinkedHashSet<>(left.asSet());
        rest.removeAll(right.asSet());
        return Value.ofSet(rest);
      }
      case MAP: {
        final Map<Value, Value> rest = new LinkedHashMap<>(left.asMap());
        for (Value key : right.asMap().keySet()) {
          rest.remove(key);
        }
        return Value.ofMap(rest);
      }
      case LIST: {
        final List<Value> rest = new ArrayList<>(left.asList());
        for (Value element : right.asList()) {
          rest.remove(element);
        }
        return Value.ofList(rest);
      }
      default:
        throw mismatch(Operator.DIFF, left, right);
    }
  }

  /**
   * Replaces every {@code ${key}} of the template with the map entry under the string key; missing
   * keys are left in place.
   */
  private static Value interpolate(final Value template, final Value arguments)
      throws EvaluationException {
    if (template.getKind() != Value.Kind.STRING || arguments.getKind() != Value.Kind.MAP) {
      throw mismatch(Operator.INTERPOLATION, template, arguments);
    }
    final Map<Value, Value> entries = arguments.asMap();
    final Matcher matcher = PLACEHOLDER.matcher(template.asString());
    final StringBuffer interpolated = new StringBuffer();
    while (matcher.find()) {
      final Value replacement = entries.get(Value.ofString(matcher.group(1)));
      final String text = replacement == null ? matcher.group() : render(replacement);
      matcher.appendReplacement(interpolated, Matcher.quoteReplacement(text));
    }
    matcher.appendTail(interpolated);
    return Value.ofString(interpolated.toString());
  }

  /**
   * Text form used by interpolation, toString() and the output sinks: strings and uris without
   * their quotes, everything else as printed.
   */
  static String render(final Value value) {
    if (value.getKind() == Value.Kind.STRING || value.getKind() == Value.Kind.URI) {
      return value.asString();
    }
    return value.toString();
  }

  private static Value invoke(final String method, final Value target, final List<Value> args)
      throws EvaluationException {
    switch (method) {
      case "length":
      case "size":
        arity(method, args, 0);
        return Value.ofInt(size(method, target));
      case "nth": {
        arity(method, args, 1);
        final List<Value> elements = sequence(method, target);
        final long index = integer(args.get(0), Operator.METHOD);
        if (index < 0 || index >= elements.size()) {
          throw new EvaluationException(ProcessFault.FaultKind.ARITHMETIC,
              "Index " + index + " out of bounds for length " + elements.size());
        }
        return elements.get((int) index);
      }
      case "get": {
        arity(method, args, 1);
        final Value found = map(method, target).get(args.get(0));
        return found == null ? Value.nil() : found;
      }
      case "contains":
        arity(method, args, 1);
        return Value.ofBool(contains(method, target, args.get(0)));
      case "keys":
        arity(method, args, 0);
        return Value.ofSet(new LinkedHashSet<>(map(method, target).keySet()));
      case "values":
        arity(method, args, 0);
        return Value.ofList(new ArrayList<>(map(method, target).values()));
      case "add": {
        arity(method, args, 1);
        if (target.getKind() != Value.Kind.SET) {
          throw unknown(method, target);
        }
        final Set<Value> added = new LinkedHashSet<>(target.asSet());
        added.add(args.get(0));
        return Value.ofSet(added);
      }
      case "delete":
        arity(method, args, 1);
        return delete(method, target, args.get(0));
      case "union":
        arity(method, args, 1);
        if (target.getKind() != Value.Kind.SET && target.getKind() != Value.Kind.MAP) {
          throw unknown(method, target);
        }
        return concat(target, args.get(0));
      case "slice":
        arity(method, args, 2);
        return slice(target, integer(args.get(0), Operator.METHOD),
            integer(args.get(1), Operator.METHOD));
      case "toList":
        arity(method, args, 0);
        return toList(method, target);
      case "toSet":
        arity(method, args, 0);
        if (target.getKind() == Value.Kind.SET) {
          return target;
        }
        return Value.ofSet(new LinkedHashSet<>(sequence(method, target)));
      case "toString":
        arity(method, args, 0);
        return Value.ofString(render(target));
      default:
        throw unknown(method, target);
    }
  }

  private static long size(final String method, final Value target) throws EvaluationException {
    switch (target.getKind()) {
      case STRING:
        return target.asString().length();
      case LIST:
      case TUPLE:
        return target.asList().size();
      case SET:
        return target.asSet().size();
      case MAP:
        return target.asMap().size();
      default:
        throw unknown(method, target);
    }
  }

  private static boolean contains(final String method, final Value target, final Value element)
      throws EvaluationException {
    switch (target.getKind()) {
      case STRING:
        if (element.getKind() != Value.Kind.STRING) {
          throw mismatch(Operator.METHOD, target, element);
        }
        return target.asString().contains(element.asString());
      case LIST:
      case TUPLE:
        return target.asList().contains(element);
      case SET:
        return target.asSet().contains(element);
      case MAP:
        return target.asMap().containsKey(element);
      default:
        throw unknown(method, target);
    }
  }

  private static Value delete(final String method, final Value target, final Value element)
      throws EvaluationException {
    switch (target.getKind()) {
      case SET: {
        final Set<Value> rest = new LinkedHashSet<>(target.asSet());
        rest.remove(element);
        return Value.ofSet(rest);
      }
      case MAP: {
        final Map<Value, Value> rest = new LinkedHashMap<>(target.asMap());
        rest.remove(element);
        return Value.ofMap(rest);
      }
      default:
        throw unknown(method, target);
    }
  }

  private static Value slice(final Value target, final long from, final long to)
      throws EvaluationException {
    final long length = size("slice", target);
    if (from < 0 || to < from || to > length) {
      throw new EvaluationException(ProcessFault.FaultKind.ARITHMETIC,
          "Slice [" + from + ", " + to + ") out of bounds for length " + length);
    }
    if (target.getKind() == Value.Kind.STRING) {
      return Value.ofString(target.asString().substring((int) from, (int) to));
    }
    final List<Value> elements = sequence("slice", target);
    return Value.ofList(new ArrayList<>(elements.subList((int) from, (int) to)));
  }

  private static Value toList(final String method, final Value target)
      throws EvaluationException {
    switch (target.getKind()) {
      case LIST:
        return target;
      case TUPLE:
        return Value.ofList(target.asList());
      case SET:
        return Value.ofList(new ArrayList<>(target.asSet()));
      case MAP: {
        final List<Value> pairs = new ArrayList<>();
        for (Map.Entry<Value, Value> entry : target.asMap().entrySet()) {
          pairs.add(Value.ofTuple(Arrays.asList(entry.getKey(), entry.getValue())));
        }
        return Value.ofList(pairs);
      }
      default:
        throw unknown(method, target);
    }
  }

  private static List<Value> sequence(final String method, final Value target)
      throws EvaluationException {
    if (target.getKind() == Value.Kind.LIST || target.getKind() == Value.Kind.TUPLE) {
      return target.asList();
    }
    throw unknown(method, target);
  }

  private static Map<Value, Value> map(final String method, final Value target)
      throws EvaluationException {
    if (target.getKind() == Value.Kind.MAP) {
      return target.asMap();
    }
    throw unknown(method, target);
  }

  private static void arity(final String method, final List<Value> args, final int expected)
      throws EvaluationException {
    if (args.size() != expected) {
      throw new EvaluationException(ProcessFault.FaultKind.UNKNOWN_METHOD, "Method " + method
          + " takes " + expected + " argument(s), got " + args.size());
    }
  }

  private static long integer(final Value value, final Operator operator)
      throws EvaluationException {
    if (value.getKind() != Value.Kind.INT) {
      throw new EvaluationException(ProcessFault.FaultKind.TYPE_MISMATCH,
          "Operator " + operator.getSymbol() + " expects an integer, got " + value);
    }
    return value.asInt();
  }

  static boolean bool(final Value value, final Operator operator) throws EvaluationException {
    if (value.getKind() != Value.Kind.BOOL) {
      throw new EvaluationException(ProcessFault.FaultKind.TYPE_MISMATCH,
          "Operator " + operator.getSymbol() + " expects a boolean, got " + value);
    }
    return value.asBool();
  }

  private static EvaluationException mismatch(final Operator operator, final Value left,
      final Value right) {
    return new EvaluationException(ProcessFault.FaultKind.TYPE_MISMATCH,
        "Operator " + operator.getSymbol() + " does not apply to " + left + " and " + right);
  }

  private static EvaluationException unknown(final String method, final Value target) {
    return new EvaluationException(ProcessFault.FaultKind.UNKNOWN_METHOD,
        "Unknown method " + method + " on " + target.getKind());
  }
}
