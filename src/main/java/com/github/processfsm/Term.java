package com.github.processfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An immutable node of an already parsed process term. The set of variants is closed: the engine
 * never subclasses it, it dispatches on {@link #getKind()} in one transition function.
 */
public abstract class Term {
  public enum Kind {
    NIL, LITERAL, VARIABLE, REFERENCE, QUOTE, EVAL,
    PAR, NEW, SEND, SEND_SYNC, RECEIVE, CONDITIONAL, MATCH, MATCHES, SELECT, BUNDLE, LET,
    OPERATION, COLLECTION;
  }

  private Term() {}

  public abstract Kind getKind();

  /**
   * Direct sub-terms, in source order.
   */
  abstract List<Term> children();

  /**
   * Process forms are quoted as closures rather than evaluated.
   */
  public final boolean isProcessForm() {
    switch (getKind()) {
      case PAR:
      case NEW:
      case SEND:
      case SEND_SYNC:
      case RECEIVE:
      case SELECT:
      case BUNDLE:
        return true;
      default:
        return false;
    }
  }

  @Override
  public String toString() {
    return getKind().name();
  }

  private static List<Term> copy(final List<Term> terms) {
    return Collections.unmodifiableList(new ArrayList<>(terms));
  }

  private static List<Term> concat(final Term first, final List<Term> rest) {
    final List<Term> all = new ArrayList<>(rest.size() + 1);
    all.add(first);
    all.addAll(rest);
    return all;
  }

  static final class Nil extends Term {
    static final Nil INSTANCE = new Nil();

    @Override
    public Kind getKind() {
      return Kind.NIL;
    }

    @Override
    List<Term> children() {
      return Collections.emptyList();
    }
  }

  static final class Literal extends Term {
    private final Value value;

    Literal(final Value value) {
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
    List<Term> children() {
      return Collections.emptyList();
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }

  static final class Variable extends Term {
    private final String name;

    Variable(final String name) {
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
    List<Term> children() {
      return Collections.emptyList();
    }

    @Override
    public String toString() {
      return name;
    }
  }

  static final class Reference extends Term {
    private final ReferenceMode mode;
    private final String name;

    Reference(final ReferenceMode mode, final String name) {
      this.mode = Objects.requireNonNull(mode);
      this.name = Objects.requireNonNull(name);
    }

    ReferenceMode getMode() {
      return mode;
    }

    String getName() {
      return name;
    }

    @Override
    public Kind getKind() {
      return Kind.REFERENCE;
    }

    @Override
    List<Term> children() {
      return Collections.emptyList();
    }

    @Override
    public String toString() {
      return (mode == ReferenceMode.MOVE ? "move " : "=") + name;
    }
  }

  /**
   * {@code @P} and {@code *x}.
   */
  static final class Unary extends Term {
    private final Kind kind;
    private final Term operand;

    Unary(final Kind kind, final Term operand) {
      this.kind = kind;
      this.operand = Objects.requireNonNull(operand);
    }

    Term getOperand() {
      return operand;
    }

    @Override
    public Kind getKind() {
      return kind;
    }

    @Override
    List<Term> children() {
      return Collections.singletonList(operand);
    }

    @Override
    public String toString() {
      return (kind == Kind.QUOTE ? "@" : "*") + operand;
    }
  }

  static final class Par extends Term {
    private final List<Term> processes;

    Par(final List<Term> processes) {
      this.processes = copy(processes);
    }

    List<Term> getProcesses() {
      return processes;
    }

    @Override
    public Kind getKind() {
      return Kind.PAR;
    }

    @Override
    List<Term> children() {
      return processes;
    }
  }

  public static final class NameDecl {
    private final String name;
    private final String uri;

    NameDecl(final String name, final String uri) {
      this.name = Objects.requireNonNull(name);
      this.uri = uri;
    }

    public String getName() {
      return name;
    }

    public String getUri() {
      return uri;
    }

    @Override
    public String toString() {
      return uri == null ? name : name + "(`" + uri + "`)";
    }
  }

  static final class New extends Term {
    private final List<NameDecl> decls;
    private final Term body;

    New(final List<NameDecl> decls, final Term body) {
      this.decls = Collections.unmodifiableList(new ArrayList<>(decls));
      this.body = Objects.requireNonNull(body);
    }

    List<NameDecl> getDecls() {
      return decls;
    }

    Term getBody() {
      return body;
    }

    @Override
    public Kind getKind() {
      return Kind.NEW;
    }

    @Override
    List<Term> children() {
      return Collections.singletonList(body);
    }
  }

  /**
   * Asynchronous send ({@code c!(..)}, {@code c!!(..)}) and synchronous send
   * ({@code c!?(..); P}).
   */
  static final class Send extends Term {
    private final Kind kind;
    private final Term channel;
    private final List<Term> arguments;
    private final Persistence persistence;
    private final Term continuation;

    Send(final Kind kind, final Term channel, final List<Term> arguments,
        final Persistence persistence, final Term continuation) {
      this.kind = kind;
      this.channel = Objects.requireNonNull(channel);
      this.arguments = copy(arguments);
      this.persistence = Objects.requireNonNull(persistence);
      this.continuation = continuation;
    }

    Term getChannel() {
      return channel;
    }

    List<Term> getArguments() {
      return arguments;
    }

    Persistence getPersistence() {
      return persistence;
    }

    Term getContinuation() {
      return continuation;
    }

    @Override
    public Kind getKind() {
      return kind;
    }

    @Override
    List<Term> children() {
      final List<Term> all = concat(channel, arguments);
      if (continuation != null) {
        all.add(continuation);
      }
      return all;
    }

    @Override
    public String toString() {
      return channel + (kind == Kind.SEND_SYNC ? "!?"
          : persistence == Persistence.PERSISTENT ? "!!" : "!") + arguments;
    }
  }

  public enum Source {
    // x <- c
    SIMPLE,
    // x <- c?!
    RECEIVE_SEND,
    // x <- c!?(args)
    SEND_RECEIVE;
  }

  /**
   * A single bind {@code formals <- channel} of a receive or a select branch.
   */
  public static final class Bind {
    private final Term channel;
    private final Pattern formals;
    private final Source source;
    private final List<Term> inputs;

    Bind(final Term channel, final Pattern formals, final Source source, final List<Term> inputs) {
      this.channel = Objects.requireNonNull(channel);
      this.formals = Objects.requireNonNull(formals);
      this.source = Objects.requireNonNull(source);
      this.inputs = copy(inputs);
    }

    public Term getChannel() {
      return channel;
    }

    public Pattern getFormals() {
      return formals;
    }

    public Source getSource() {
      return source;
    }

    public List<Term> getInputs() {
      return inputs;
    }

    @Override
    public String toString() {
      return formals + " <- " + channel;
    }
  }

  static final class Receive extends Term {
    private final Bind bind;
    private final ReceiveMode mode;
    private final Term body;

    Receive(final Bind bind, final ReceiveMode mode, final Term body) {
      this.bind = Objects.requireNonNull(bind);
      this.mode = Objects.requireNonNull(mode);
      this.body = Objects.requireNonNull(body);
    }

    Bind getBind() {
      return bind;
    }

    ReceiveMode getMode() {
      return mode;
    }

    Term getBody() {
      return body;
    }

    @Override
    public Kind getKind() {
      return Kind.RECEIVE;
    }

    @Override
    List<Term> children() {
      final List<Term> all = concat(bind.getChannel(), bind.getInputs());
      all.add(body);
      return all;
    }

    @Override
    public String toString() {
      return "for(" + bind + ") " + mode;
    }
  }

  static final class Conditional extends Term {
    private final Term condition;
    private final Term ifTrue;
    private final Term ifFalse;

    Conditional(final Term condition, final Term ifTrue, final Term ifFalse) {
      this.condition = Objects.requireNonNull(condition);
      this.ifTrue = Objects.requireNonNull(ifTrue);
      this.ifFalse = ifFalse;
    }

    Term getCondition() {
      return condition;
    }

    Term getIfTrue() {
      return ifTrue;
    }

    Term getIfFalse() {
      return ifFalse;
    }

    @Override
    public Kind getKind() {
      return Kind.CONDITIONAL;
    }

    @Override
    List<Term> children() {
      final List<Term> all = new ArrayList<>(3);
      all.add(condition);
      all.add(ifTrue);
      if (ifFalse != null) {
        all.add(ifFalse);
      }
      return all;
    }
  }

  public static final class Case {
    private final Pattern pattern;
    private final Term body;

    Case(final Pattern pattern, final Term body) {
      this.pattern = Objects.requireNonNull(pattern);
      this.body = Objects.requireNonNull(body);
    }

    public Pattern getPattern() {
      return pattern;
    }

    public Term getBody() {
      return body;
    }
  }

  static final class Match extends Term {
    private final Term expression;
    private final List<Case> cases;

    Match(final Term expression, final List<Case> cases) {
      this.expression = Objects.requireNonNull(expression);
      this.cases = Collections.unmodifiableList(new ArrayList<>(cases));
    }

    Term getExpression() {
      return expression;
    }

    List<Case> getCases() {
      return cases;
    }

    @Override
    public Kind getKind() {
      return Kind.MATCH;
    }

    @Override
    List<Term> children() {
      final List<Term> all = new ArrayList<>();
      all.add(expression);
      for (Case matchCase : cases) {
        all.add(matchCase.getBody());
      }
      return all;
    }
  }

  static final class Matches extends Term {
    private final Term expression;
    private final Pattern pattern;

    Matches(final Term expression, final Pattern pattern) {
      this.expression = Objects.requireNonNull(expression);
      this.pattern = Objects.requireNonNull(pattern);
    }

    Term getExpression() {
      return expression;
    }

    Pattern getPattern() {
      return pattern;
    }

    @Override
    public Kind getKind() {
      return Kind.MATCHES;
    }

    @Override
    List<Term> children() {
      return Collections.singletonList(expression);
    }
  }

  public static final class Branch {
    private final Bind bind;
    private final Term body;

    Branch(final Bind bind, final Term body) {
      this.bind = Objects.requireNonNull(bind);
      this.body = Objects.requireNonNull(body);
    }

    public Bind getBind() {
      return bind;
    }

    public Term getBody() {
      return body;
    }
  }

  static final class Select extends Term {
    private final List<Branch> branches;

    Select(final List<Branch> branches) {
      this.branches = Collections.unmodifiableList(new ArrayList<>(branches));
    }

    List<Branch> getBranches() {
      return branches;
    }

    @Override
    public Kind getKind() {
      return Kind.SELECT;
    }

    @Override
    List<Term> children() {
      final List<Term> all = new ArrayList<>();
      for (Branch branch : branches) {
        all.add(branch.getBind().getChannel());
        all.add(branch.getBody());
      }
      return all;
    }
  }

  static final class Bundle extends Term {
    private final BundleMode mode;
    private final Term body;

    Bundle(final BundleMode mode, final Term body) {
      this.mode = Objects.requireNonNull(mode);
      this.body = Objects.requireNonNull(body);
    }

    BundleMode getMode() {
      return mode;
    }

    Term getBody() {
      return body;
    }

    @Override
    public Kind getKind() {
      return Kind.BUNDLE;
    }

    @Override
    List<Term> children() {
      return Collections.singletonList(body);
    }
  }

  public static final class LetBinding {
    private final Pattern pattern;
    private final Term value;

    LetBinding(final Pattern pattern, final Term value) {
      this.pattern = Objects.requireNonNull(pattern);
      this.value = Objects.requireNonNull(value);
    }

    public Pattern getPattern() {
      return pattern;
    }

    public Term getValue() {
      return value;
    }
  }

  static final class Let extends Term {
    private final List<LetBinding> bindings;
    private final Term body;
    private final boolean concurrent;

    Let(final List<LetBinding> bindings, final Term body, final boolean concurrent) {
      this.bindings = Collections.unmodifiableList(new ArrayList<>(bindings));
      this.body = Objects.requireNonNull(body);
      this.concurrent = concurrent;
    }

    List<LetBinding> getBindings() {
      return bindings;
    }

    Term getBody() {
      return body;
    }

    boolean isConcurrent() {
      return concurrent;
    }

    @Override
    public Kind getKind() {
      return Kind.LET;
    }

    @Override
    List<Term> children() {
      final List<Term> all = new ArrayList<>();
      for (LetBinding binding : bindings) {
        all.add(binding.getValue());
      }
      all.add(body);
      return all;
    }
  }

  /**
   * Unary, binary and method-call expressions. For {@link Operator#METHOD} the first operand is
   * the receiver and the rest are the arguments.
   */
  static final class Operation extends Term {
    private final Operator operator;
    private final List<Term> operands;
    private final String method;

    Operation(final Operator operator, final List<Term> operands, final String method) {
      this.operator = Objects.requireNonNull(operator);
      this.operands = copy(operands);
      this.method = method;
    }

    Operator getOperator() {
      return operator;
    }

    List<Term> getOperands() {
      return operands;
    }

    String getMethod() {
      return method;
    }

    @Override
    public Kind getKind() {
      return Kind.OPERATION;
    }

    @Override
    List<Term> children() {
      return operands;
    }

    @Override
    public String toString() {
      return operator == Operator.METHOD ? "." + method : operator.getSymbol();
    }
  }

  /**
   * Collection constructor. Map elements alternate key and value.
   */
  static final class Collection extends Term {
    private final CollectionKind collectionKind;
    private final List<Term> elements;

    Collection(final CollectionKind collectionKind, final List<Term> elements) {
      this.collectionKind = Objects.requireNonNull(collectionKind);
      this.elements = copy(elements);
    }

    CollectionKind getCollectionKind() {
      return collectionKind;
    }

    List<Term> getElements() {
      return elements;
    }

    @Override
    public Kind getKind() {
      return Kind.COLLECTION;
    }

    @Override
    List<Term> children() {
      return elements;
    }

    @Override
    public String toString() {
      return collectionKind.name();
    }
  }
}
