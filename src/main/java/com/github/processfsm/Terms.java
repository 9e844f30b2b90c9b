package com.github.processfsm;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Factory for process terms, the construction side of the engine's boundary with its parser.
 */
public final class Terms {

  public static Term nil() {
    return Term.Nil.INSTANCE;
  }

  public static Term literal(final Value value) {
    return new Term.Literal(value);
  }

  public static Term integer(final long value) {
    return literal(Value.ofInt(value));
  }

  public static Term bool(final boolean value) {
    return literal(Value.ofBool(value));
  }

  public static Term string(final String value) {
    return literal(Value.ofString(value));
  }

  public static Term var(final String name) {
    return new Term.Variable(name);
  }

  public static Term copy(final String name) {
    return new Term.Reference(ReferenceMode.COPY, name);
  }

  public static Term move(final String name) {
    return new Term.Reference(ReferenceMode.MOVE, name);
  }

  public static Term quote(final Term term) {
    return new Term.Unary(Term.Kind.QUOTE, term);
  }

  public static Term eval(final Term name) {
    return new Term.Unary(Term.Kind.EVAL, name);
  }

  /**
   * The public channel {@code @"name"}.
   */
  public static Term name(final String name) {
    return quote(string(name));
  }

  public static Term par(final Term... processes) {
    return new Term.Par(Arrays.asList(processes));
  }

  public static Term.NameDecl decl(final String name) {
    return new Term.NameDecl(name, null);
  }

  public static Term.NameDecl decl(final String name, final String uri) {
    return new Term.NameDecl(name, uri);
  }

  public static Term newScope(final List<Term.NameDecl> decls, final Term body) {
    return new Term.New(decls, body);
  }

  public static Term newNames(final Term body, final String... names) {
    final List<Term.NameDecl> decls = new ArrayList<>(names.length);
    for (String name : names) {
      decls.add(decl(name));
    }
    return newScope(decls, body);
  }

  public static Term send(final Term channel, final Term... arguments) {
    return new Term.Send(Term.Kind.SEND, channel, Arrays.asList(arguments), Persistence.ONCE,
        null);
  }

  public static Term sendPersistent(final Term channel, final Term... arguments) {
    return new Term.Send(Term.Kind.SEND, channel, Arrays.asList(arguments),
        Persistence.PERSISTENT, null);
  }

  /**
   * {@code channel!?(arguments); continuation}, the continuation may be null.
   */
  public static Term sendSync(final Term channel, final Term continuation,
      final Term... arguments) {
    return new Term.Send(Term.Kind.SEND_SYNC, channel, Arrays.asList(arguments), Persistence.ONCE,
        continuation);
  }

  /**
   * The formals of a receive: one pattern per message argument.
   */
  public static Pattern formals(final Pattern... patterns) {
    return Pattern.list(patterns);
  }

  public static Term.Bind bind(final Term channel, final Pattern formals) {
    return new Term.Bind(channel, formals, Term.Source.SIMPLE, Collections.<Term>emptyList());
  }

  public static Term.Bind bindReceiveSend(final Term channel, final Pattern formals) {
    if (formals.getKind() != Pattern.Kind.LIST) {
      throw new IllegalArgumentException("Receive-send formals must be a list pattern");
    }
    return new Term.Bind(channel, formals, Term.Source.RECEIVE_SEND,
        Collections.<Term>emptyList());
  }

  public static Term.Bind bindSendReceive(final Term channel, final Pattern formals,
      final Term... inputs) {
    return new Term.Bind(channel, formals, Term.Source.SEND_RECEIVE, Arrays.asList(inputs));
  }

  public static Term receive(final Term.Bind bind, final ReceiveMode mode, final Term body) {
    if (mode == ReceiveMode.RACE) {
      throw new IllegalArgumentException("RACE receives are built with select()");
    }
    return new Term.Receive(bind, mode, body);
  }

  /**
   * {@code for (formals <- channel) { body }}
   */
  public static Term receive(final Term channel, final Pattern formals, final Term body) {
    return receive(bind(channel, formals), ReceiveMode.ONE_SHOT, body);
  }

  /**
   * {@code for (formals <= channel) { body }}
   */
  public static Term receivePersistent(final Term channel, final Pattern formals,
      final Term body) {
    return receive(bind(channel, formals), ReceiveMode.PERSISTENT, body);
  }

  /**
   * {@code for (formals <<- channel) { body }}
   */
  public static Term peek(final Term channel, final Pattern formals, final Term body) {
    return receive(bind(channel, formals), ReceiveMode.PEEK, body);
  }

  /**
   * {@code contract channel(formals) = { body }}
   */
  public static Term contract(final Term channel, final Pattern formals, final Term body) {
    return receivePersistent(channel, formals, body);
  }

  public static Term ifThen(final Term condition, final Term ifTrue) {
    return new Term.Conditional(condition, ifTrue, null);
  }

  public static Term ifThenElse(final Term condition, final Term ifTrue, final Term ifFalse) {
    return new Term.Conditional(condition, ifTrue, ifFalse);
  }

  public static Term.Case matchCase(final Pattern pattern, final Term body) {
    return new Term.Case(pattern, body);
  }

  public static Term match(final Term expression, final Term.Case... cases) {
    return new Term.Match(expression, Arrays.asList(cases));
  }

  public static Term matches(final Term expression, final Pattern pattern) {
    return new Term.Matches(expression, pattern);
  }

  public static Term.Branch branch(final Term channel, final Pattern formals, final Term body) {
    return new Term.Branch(bind(channel, formals), body);
  }

  public static Term select(final Term.Branch... branches) {
    return new Term.Select(Arrays.asList(branches));
  }

  public static Term bundle(final BundleMode mode, final Term body) {
    return new Term.Bundle(mode, body);
  }

  public static Term.LetBinding letBinding(final Pattern pattern, final Term value) {
    return new Term.LetBinding(pattern, value);
  }

  public static Term let(final List<Term.LetBinding> bindings, final Term body) {
    return new Term.Let(bindings, body, false);
  }

  public static Term letConcurrent(final List<Term.LetBinding> bindings, final Term body) {
    return new Term.Let(bindings, body, true);
  }

  public static Term binary(final Operator operator, final Term left, final Term right) {
    if (operator.isUnary() || operator == Operator.METHOD) {
      throw new IllegalArgumentException(operator + " is not a binary operator");
    }
    return new Term.Operation(operator, Arrays.asList(left, right), null);
  }

  public static Term unary(final Operator operator, final Term operand) {
    if (!operator.isUnary()) {
      throw new IllegalArgumentException(operator + " is not a unary operator");
    }
    return new Term.Operation(operator, Collections.singletonList(operand), null);
  }

  public static Term add(final Term left, final Term right) {
    return binary(Operator.ADD, left, right);
  }

  public static Term and(final Term left, final Term right) {
    return binary(Operator.AND, left, right);
  }

  public static Term or(final Term left, final Term right) {
    return binary(Operator.OR, left, right);
  }

  public static Term method(final Term receiver, final String method, final Term... arguments) {
    final List<Term> operands = new ArrayList<>(arguments.length + 1);
    operands.add(receiver);
    operands.addAll(Arrays.asList(arguments));
    return new Term.Operation(Operator.METHOD, operands, method);
  }

  public static Term list(final Term... elements) {
    return new Term.Collection(CollectionKind.LIST, Arrays.asList(elements));
  }

  public static Term tuple(final Term... elements) {
    return new Term.Collection(CollectionKind.TUPLE, Arrays.asList(elements));
  }

  public static Term set(final Term... elements) {
    return new Term.Collection(CollectionKind.SET, Arrays.asList(elements));
  }

  /**
   * Map constructor from alternating keys and values.
   */
  public static Term map(final Term... keysAndValues) {
    if (keysAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Map constructor needs key/value pairs");
    }
    return new Term.Collection(CollectionKind.MAP, Arrays.asList(keysAndValues));
  }

  private Terms() {}
}
