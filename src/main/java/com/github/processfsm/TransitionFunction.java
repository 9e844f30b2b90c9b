package com.github.processfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.processfsm.Event.Signal;
import com.github.processfsm.FsmInstance.Purpose;
import com.github.processfsm.ProcessFault.FaultKind;

/**
 * The transition function of the engine: given an instance and an event, decide what the instance
 * becomes and which effects follow. It never touches the scheduler or the channel store and keeps
 * no state of its own, so the same instance and event always produce the same outcome.
 *
 * <p>
 * Every construct follows the same outline: START moves the instance out of INITIAL, operands are
 * evaluated by OPERAND children one at a time, states that complete in one step are left through
 * a self-addressed CONTINUE, and bodies run in BODY children while the instance sits in JOINING.
 * Events a state does not accept are answered with {@link StepOutcome#notReady()}.
 */
final class TransitionFunction {
  // hidden leading formal of a receive-send bind
  static final String REPLY_BINDING = "$reply";

  StepOutcome step(final FsmInstance instance, final Event event) {
    if (instance.isTerminated()) {
      return StepOutcome.notReady();
    }
    final Step step = new Step(instance);
    switch (event.getType()) {
      case TIMEOUT:
        return step.fail(ProcessFault.of(FaultKind.TIMEOUT, instance.getId(),
            "Step limit reached in state " + instance.getState()));
      case ERROR:
        if (!instance.hasPendingChild(event.getSourceId())) {
          return step.stay();
        }
        step.children.remove(event.getSourceId());
        if (isReplicating(instance)) {
          // a failed invocation leaves the listener registered
          return step.stay();
        }
        return step.fail(ProcessFault.childFailed(instance.getId(), event.getFault()));
      default:
        break;
    }
    if (instance.getState().is(Phase.INITIAL) != event.is(Signal.START)) {
      return StepOutcome.notReady();
    }
    if (isChildNotification(event)) {
      if (!instance.hasPendingChild(event.getSourceId())) {
        return step.stay();
      }
      step.children.remove(event.getSourceId());
      if (event.getMovedName() != null) {
        step.environment = step.environment.unbind(event.getMovedName());
      }
    }

    final Term term = instance.getTerm();
    switch (term.getKind()) {
      case NIL:
        return step.finish(Value.nil());
      case LITERAL:
        return step.finish(((Term.Literal) term).getValue());
      case VARIABLE:
        return onVariable(step, (Term.Variable) term);
      case REFERENCE:
        return onReference(step, (Term.Reference) term, event);
      case QUOTE:
        return onQuote(step, (Term.Unary) term, event);
      case EVAL:
        return onEval(step, (Term.Unary) term, event);
      case PAR:
        return onPar(step, (Term.Par) term, event);
      case NEW:
        return onNew(step, (Term.New) term, event);
      case SEND:
      case SEND_SYNC:
        return onSend(step, (Term.Send) term, event);
      case RECEIVE:
        return onReceive(step, (Term.Receive) term, event);
      case SELECT:
        return onSelect(step, (Term.Select) term, event);
      case CONDITIONAL:
        return onConditional(step, (Term.Conditional) term, event);
      case MATCH:
        return onMatch(step, (Term.Match) term, event);
      case MATCHES:
        return onMatches(step, (Term.Matches) term, event);
      case BUNDLE:
        return onBundle(step, (Term.Bundle) term, event);
      case LET:
        return onLet(step, (Term.Let) term, event);
      case OPERATION:
        return onOperation(step, (Term.Operation) term, event);
      case COLLECTION:
        return onCollection(step, (Term.Collection) term, event);
      default:
        return StepOutcome.notReady();
    }
  }

  private static StepOutcome onVariable(final Step step, final Term.Variable term) {
    final Optional<Value> value = step.environment.lookup(term.getName());
    if (!value.isPresent()) {
      return step.fail(unbound(step, term.getName()));
    }
    return step.finish(value.get());
  }

  private static StepOutcome onReference(final Step step, final Term.Reference term,
      final Event event) {
    if (event.is(Signal.START)) {
      return step.to(State.referencing(term.getMode())).proceed();
    }
    if (event.is(Signal.CONTINUE) && step.state.is(Phase.REFERENCING)) {
      final Optional<Value> value = step.environment.lookup(term.getName());
      if (!value.isPresent()) {
        return step.fail(unbound(step, term.getName()));
      }
      if (term.getMode() == ReferenceMode.MOVE) {
        step.movedName = term.getName();
        step.environment = step.environment.unbind(term.getName());
      }
      return step.finish(value.get());
    }
    return StepOutcome.notReady();
  }

  private static StepOutcome onQuote(final Step step, final Term.Unary term, final Event event) {
    final Term operand = term.getOperand();
    if (event.is(Signal.START)) {
      if (operand.isProcessForm()) {
        return step.to(State.constructing(ConstructKind.PROCESS)).proceed();
      }
      return step.evaluate(operand);
    }
    if (evaluated(step, event)) {
      step.frame.subject = event.getValue();
      return step.to(State.constructing(ConstructKind.NAME)).proceed();
    }
    if (event.is(Signal.CONTINUE) && step.state.is(Phase.CONSTRUCTING)) {
      if (step.state.getQualifier() == ConstructKind.PROCESS) {
        return step.finish(Value.ofName(
            ChannelName.quoted(Value.ofProcess(operand, step.environment))));
      }
      final Value quoted = step.frame.subject;
      return step.finish(quoted.getKind() == Value.Kind.NAME ? quoted
          : Value.ofName(ChannelName.quoted(quoted)));
    }
    return StepOutcome.notReady();
  }

  private static StepOutcome onEval(final Step step, final Term.Unary term, final Event event) {
    if (event.is(Signal.START)) {
      return step.evaluate(term.getOperand());
    }
    if (evaluated(step, event)) {
      Value target = event.getValue();
      if (target.getKind() == Value.Kind.NAME
          && target.asName().getKind() == ChannelName.Kind.QUOTED) {
        target = target.asName().getQuoted();
      }
      if (target.getKind() != Value.Kind.PROCESS) {
        return step.finish(target);
      }
      final Value.Closure closure = target.asClosure();
      return step.join(closure.getTerm(), closure.getEnvironment());
    }
    return joined(step, event);
  }

  private static StepOutcome onPar(final Step step, final Term.Par term, final Event event) {
    if (event.is(Signal.START)) {
      return step.to(State.of(Phase.FORKING)).proceed();
    }
    if (event.is(Signal.CONTINUE) && step.state.is(Phase.FORKING)) {
      if (term.getProcesses().isEmpty()) {
        return step.finish(Value.nil());
      }
      for (Term process : term.getProcesses()) {
        step.spawn(process, step.environment, Purpose.BODY, step.restrictions);
      }
      return step.to(State.of(Phase.JOINING)).next();
    }
    if (event.is(Signal.CHILD_TERMINATED) && step.state.is(Phase.JOINING)) {
      return step.children.isEmpty() ? step.finish(Value.nil()) : step.next();
    }
    return StepOutcome.notReady();
  }

  private static StepOutcome onNew(final Step step, final Term.New term, final Event event) {
    final List<Term.NameDecl> decls = term.getDecls();
    if (event.is(Signal.START)) {
      if (decls.isEmpty()) {
        return step.join(term.getBody(), step.environment);
      }
      return step.to(State.binding(decls.get(0).getName())).proceed();
    }
    if (event.is(Signal.CONTINUE) && step.state.is(Phase.BINDING)) {
      final Term.NameDecl decl = decls.get(step.frame.cursor);
      final ChannelName name = decl.getUri() != null ? ChannelName.uri(decl.getUri())
          : ChannelName.unforgeable(step.id() + "#" + step.frame.minted++);
      step.environment = step.environment.bind(decl.getName(), Value.ofName(name));
      step.frame.cursor++;
      if (step.frame.cursor < decls.size()) {
        return step.to(State.binding(decls.get(step.frame.cursor).getName())).proceed();
      }
      return step.join(term.getBody(), step.environment);
    }
    return joined(step, event);
  }

  private static StepOutcome onSend(final Step step, final Term.Send term, final Event event) {
    final List<Term> arguments = term.getArguments();
    if (event.is(Signal.START)) {
      return step.evaluate(term.getChannel());
    }
    if (evaluated(step, event)) {
      if (step.frame.channel == null) {
        if (event.getValue().getKind() != Value.Kind.NAME) {
          return step.fail(notAName(step, event.getValue()));
        }
        step.frame.channel = event.getValue().asName();
      } else {
        step.frame.values.add(event.getValue());
      }
      if (step.frame.values.size() < arguments.size()) {
        return step.evaluate(arguments.get(step.frame.values.size()));
      }
      return step.to(State.of(Phase.SENDING)).proceed();
    }
    if (event.is(Signal.CONTINUE) && step.state.is(Phase.SENDING)) {
      final ProcessFault violation = capability(step, step.frame.channel, true);
      if (violation != null) {
        return step.fail(violation);
      }
      if (term.getKind() == Term.Kind.SEND_SYNC) {
        step.emit(Effect.publish(step.frame.channel, step.frame.values, term.getPersistence(),
            step.id()));
        return step.to(State.of(Phase.WAITING)).next();
      }
      step.emit(Effect.publish(step.frame.channel, step.frame.values, term.getPersistence(),
          null));
      return step.finish(Value.nil());
    }
    if (event.is(Signal.ACK) && step.state.is(Phase.WAITING)) {
      if (term.getContinuation() == null) {
        return step.finish(Value.nil());
      }
      return step.join(term.getContinuation(), step.environment);
    }
    return joined(step, event);
  }

  private static StepOutcome onReceive(final Step step, final Term.Receive term,
      final Event event) {
    final Term.Bind bind = term.getBind();
    final List<Term> inputs = bind.getInputs();
    if (event.is(Signal.START)) {
      return step.evaluate(bind.getChannel());
    }
    if (evaluated(step, event)) {
      if (step.frame.channel == null) {
        if (event.getValue().getKind() != Value.Kind.NAME) {
          return step.fail(notAName(step, event.getValue()));
        }
        step.frame.channel = event.getValue().asName();
      } else {
        step.frame.values.add(event.getValue());
      }
      if (bind.getSource() != Term.Source.SEND_RECEIVE) {
        return listen(step, term);
      }
      if (step.frame.values.size() < inputs.size()) {
        return step.evaluate(inputs.get(step.frame.values.size()));
      }
      return step.to(State.of(Phase.SENDING)).proceed();
    }
    if (event.is(Signal.CONTINUE) && step.state.is(Phase.SENDING)) {
      final ProcessFault violation = capability(step, step.frame.channel, true);
      if (violation != null) {
        return step.fail(violation);
      }
      final ChannelName reply = ChannelName.unforgeable(step.id() + "#" + step.frame.minted++);
      final List<Value> payload = new ArrayList<>();
      payload.add(Value.ofName(reply));
      payload.addAll(step.frame.values);
      step.emit(Effect.publish(step.frame.channel, payload, Persistence.ONCE, null));
      step.frame.channel = reply;
      return listen(step, term);
    }
    if (event.getType() == Event.Type.MESSAGE_AVAILABLE && step.state.is(Phase.RECEIVING)) {
      final Map<String, Value> bindings = new LinkedHashMap<>(event.getBindings());
      if (bind.getSource() == Term.Source.RECEIVE_SEND) {
        final Value reply = bindings.remove(REPLY_BINDING);
        step.frame.reply =
            reply != null && reply.getKind() == Value.Kind.NAME ? reply.asName() : null;
      }
      if (beginBinding(step, bindings)) {
        return received(step, term);
      }
      return step.next();
    }
    if (event.is(Signal.CONTINUE) && step.state.is(Phase.BINDING)) {
      return bindNext(step) ? received(step, term) : step.next();
    }
    if (event.is(Signal.CHILD_TERMINATED) && term.getMode() == ReceiveMode.PERSISTENT) {
      return step.next();
    }
    return joined(step, event);
  }

  /**
   * Registers the receive with the store, resolving {@code =x} references first.
   */
  private static StepOutcome listen(final Step step, final Term.Receive term) {
    final Term.Bind bind = term.getBind();
    if (bind.getSource() != Term.Source.SEND_RECEIVE) {
      final ProcessFault violation = capability(step, step.frame.channel, false);
      if (violation != null) {
        return step.fail(violation);
      }
    }
    final String unboundName = firstUnbound(bind.getFormals(), step.environment);
    if (unboundName != null) {
      return step.fail(unbound(step, unboundName));
    }
    Pattern formals = bind.getFormals().resolve(step.environment);
    if (bind.getSource() == Term.Source.RECEIVE_SEND) {
      final Pattern.Sequence sequence = (Pattern.Sequence) formals;
      final List<Pattern> elements = new ArrayList<>();
      elements.add(Pattern.var(REPLY_BINDING));
      elements.addAll(sequence.getElements());
      formals = Pattern.listWithRemainder(elements, sequence.getRemainder());
    }
    step.emit(Effect.request(step.frame.channel, formals, term.getMode(), step.id()));
    return step.to(State.receiving(term.getMode())).next();
  }

  private static StepOutcome received(final Step step, final Term.Receive term) {
    if (step.frame.reply != null) {
      step.emit(Effect.publish(step.frame.reply, Collections.singletonList(Value.nil()),
          Persistence.ONCE, null));
      step.frame.reply = null;
    }
    final Environment scope = step.frame.scope;
    step.frame.scope = null;
    step.spawn(term.getBody(), scope, Purpose.BODY, step.restrictions);
    if (term.getMode() == ReceiveMode.PERSISTENT) {
      return step.to(State.receiving(ReceiveMode.PERSISTENT)).next();
    }
    step.environment = scope;
    return step.to(State.of(Phase.JOINING)).next();
  }

  private static StepOutcome onSelect(final Step step, final Term.Select term,
      final Event event) {
    final List<Term.Branch> branches = term.getBranches();
    if (event.is(Signal.START)) {
      return step.evaluate(branches.get(0).getBind().getChannel());
    }
    if (evaluated(step, event)) {
      if (event.getValue().getKind() != Value.Kind.NAME) {
        return step.fail(notAName(step, event.getValue()));
      }
      step.frame.arms.add(event.getValue().asName());
      if (step.frame.arms.size() < branches.size()) {
        return step.evaluate(branches.get(step.frame.arms.size()).getBind().getChannel());
      }
      final List<ChannelStore.Arm> arms = new ArrayList<>(branches.size());
      for (int index = 0; index < branches.size(); index++) {
        final ChannelName channel = step.frame.arms.get(index);
        final ProcessFault violation = capability(step, channel, false);
        if (violation != null) {
          return step.fail(violation);
        }
        final Pattern formals = branches.get(index).getBind().getFormals();
        final String unboundName = firstUnbound(formals, step.environment);
        if (unboundName != null) {
          return step.fail(unbound(step, unboundName));
        }
        arms.add(new ChannelStore.Arm(channel, formals.resolve(step.environment), index));
      }
      step.emit(Effect.select(arms, step.id()));
      return step.to(State.receiving(ReceiveMode.RACE)).next();
    }
    if (event.getType() == Event.Type.MESSAGE_AVAILABLE && step.state.is(Phase.RECEIVING)) {
      step.frame.cursor = event.getArmIndex();
      if (beginBinding(step, event.getBindings())) {
        return selected(step, term);
      }
      return step.next();
    }
    if (event.is(Signal.CONTINUE) && step.state.is(Phase.BINDING)) {
      return bindNext(step) ? selected(step, term) : step.next();
    }
    return joined(step, event);
  }

  private static StepOutcome selected(final Step step, final Term.Select term) {
    final Environment scope = step.frame.scope;
    step.frame.scope = null;
    step.environment = scope;
    return step.join(term.getBranches().get(step.frame.cursor).getBody(), scope);
  }

  private static StepOutcome onConditional(final Step step, final Term.Conditional term,
      final Event event) {
    if (event.is(Signal.START)) {
      return step.evaluate(term.getCondition());
    }
    if (evaluated(step, event)) {
      if (event.getValue().getKind() != Value.Kind.BOOL) {
        return step.fail(ProcessFault.of(FaultKind.TYPE_MISMATCH, step.id(),
            "Condition must be a boolean, got " + event.getValue()));
      }
      step.to(State.of(Phase.BRANCHING));
      step.enqueue(Event.conditionMet(step.id(), event.getValue().asBool()));
      return step.next();
    }
    if (event.getType() == Event.Type.CONDITION_MET && step.state.is(Phase.BRANCHING)) {
      final Term chosen = event.getValue().asBool() ? term.getIfTrue() : term.getIfFalse();
      if (chosen == null) {
        return step.finish(Value.nil());
      }
      return step.join(chosen, step.environment);
    }
    return joined(step, event);
  }

  private static StepOutcome onMatch(final Step step, final Term.Match term,
      final Event event) {
    final List<Term.Case> cases = term.getCases();
    if (event.is(Signal.START)) {
      return step.evaluate(term.getExpression());
    }
    if (evaluated(step, event)) {
      step.frame.subject = event.getValue();
      step.frame.cursor = 0;
      if (cases.isEmpty()) {
        return step.fail(unmatched(step, step.frame.subject, Collections.<Pattern>emptyList()));
      }
      return step.to(State.matching(cases.get(0).getPattern())).proceed();
    }
    if (event.is(Signal.CONTINUE) && step.state.is(Phase.MATCHING)) {
      final Pattern pattern = cases.get(step.frame.cursor).getPattern();
      final String unboundName = firstUnbound(pattern, step.environment);
      if (unboundName != null) {
        return step.fail(unbound(step, unboundName));
      }
      final Optional<Map<String, Value>> bindings =
          PatternMatcher.match(pattern.resolve(step.environment), step.frame.subject);
      if (bindings.isPresent()) {
        step.enqueue(Event.patternMatched(step.id(), bindings.get()));
        return step.next();
      }
      step.frame.cursor++;
      if (step.frame.cursor < cases.size()) {
        return step.to(State.matching(cases.get(step.frame.cursor).getPattern())).proceed();
      }
      final List<Pattern> attempted = new ArrayList<>();
      for (Term.Case matchCase : cases) {
        attempted.add(matchCase.getPattern());
      }
      return step.fail(unmatched(step, step.frame.subject, attempted));
    }
    if (event.getType() == Event.Type.PATTERN_MATCHED && step.state.is(Phase.MATCHING)) {
      step.environment = step.environment.bindAll(event.getBindings());
      return step.join(cases.get(step.frame.cursor).getBody(), step.environment);
    }
    return joined(step, event);
  }

  private static StepOutcome onMatches(final Step step, final Term.Matches term,
      final Event event) {
    if (event.is(Signal.START)) {
      return step.evaluate(term.getExpression());
    }
    if (evaluated(step, event)) {
      step.frame.subject = event.getValue();
      return step.to(State.matching(term.getPattern())).proceed();
    }
    if (event.is(Signal.CONTINUE) && step.state.is(Phase.MATCHING)) {
      final String unboundName = firstUnbound(term.getPattern(), step.environment);
      if (unboundName != null) {
        return step.fail(unbound(step, unboundName));
      }
      return step.finish(Value.ofBool(
          PatternMatcher.match(term.getPattern().resolve(step.environment), step.frame.subject)
              .isPresent()));
    }
    return StepOutcome.notReady();
  }

  private static StepOutcome onBundle(final Step step, final Term.Bundle term,
      final Event event) {
    if (event.is(Signal.START)) {
      return step.to(State.bundling(term.getMode())).proceed();
    }
    if (event.is(Signal.CONTINUE) && step.state.is(Phase.BUNDLING)) {
      final List<Restriction> inherited = new ArrayList<>(step.restrictions);
      inherited.add(new Restriction(term.getMode(),
          restrictedChannels(term.getBody(), step.environment)));
      step.spawn(term.getBody(), step.environment, Purpose.BODY, inherited);
      return step.to(State.of(Phase.JOINING)).next();
    }
    return joined(step, event);
  }

  private static StepOutcome onLet(final Step step, final Term.Let term, final Event event) {
    final List<Term.LetBinding> bindings = term.getBindings();
    if (event.is(Signal.START)) {
      if (bindings.isEmpty()) {
        return step.join(term.getBody(), step.environment);
      }
      if (term.isConcurrent()) {
        return step.to(State.of(Phase.FORKING)).proceed();
      }
      step.frame.cursor = 0;
      return step.evaluate(bindings.get(0).getValue());
    }
    if (evaluated(step, event)) {
      step.frame.subject = event.getValue();
      return step.to(State.binding(bindings.get(step.frame.cursor).getPattern().toString()))
          .proceed();
    }
    if (event.is(Signal.CONTINUE) && step.state.is(Phase.FORKING)) {
      for (Term.LetBinding binding : bindings) {
        step.frame.forked
            .add(step.spawn(binding.getValue(), step.environment, Purpose.OPERAND,
                step.restrictions));
      }
      return step.to(State.of(Phase.JOINING)).next();
    }
    if (event.getType() == Event.Type.EXPRESSION_EVALUATED && step.state.is(Phase.JOINING)) {
      step.frame.joined.put(event.getSourceId(), event.getValue());
      if (step.frame.joined.size() < step.frame.forked.size()) {
        return step.next();
      }
      step.frame.cursor = 0;
      step.frame.subject = step.frame.joined.get(step.frame.forked.get(0));
      return step.to(State.binding(bindings.get(0).getPattern().toString())).proceed();
    }
    if (event.is(Signal.CONTINUE) && step.state.is(Phase.BINDING)) {
      final Pattern pattern = bindings.get(step.frame.cursor).getPattern();
      final String unboundName = firstUnbound(pattern, step.environment);
      if (unboundName != null) {
        return step.fail(unbound(step, unboundName));
      }
      final Optional<Map<String, Value>> matched =
          PatternMatcher.match(pattern.resolve(step.environment), step.frame.subject);
      if (!matched.isPresent()) {
        return step.fail(
            unmatched(step, step.frame.subject, Collections.singletonList(pattern)));
      }
      step.environment = step.environment.bindAll(matched.get());
      step.frame.cursor++;
      if (step.frame.cursor >= bindings.size()) {
        return step.join(term.getBody(), step.environment);
      }
      if (term.isConcurrent()) {
        step.frame.subject = step.frame.joined.get(step.frame.forked.get(step.frame.cursor));
        return step.to(State.binding(bindings.get(step.frame.cursor).getPattern().toString()))
            .proceed();
      }
      return step.evaluate(bindings.get(step.frame.cursor).getValue());
    }
    return joined(step, event);
  }

  private static StepOutcome onOperation(final Step step, final Term.Operation term,
      final Event event) {
    final Operator operator = term.getOperator();
    final List<Term> operands = term.getOperands();
    if (event.is(Signal.START)) {
      return step.evaluate(operands.get(0));
    }
    if (evaluated(step, event)) {
      step.frame.values.add(event.getValue());
      if ((operator == Operator.AND || operator == Operator.OR)
          && step.frame.values.size() == 1) {
        final boolean left;
        try {
          left = Operations.bool(event.getValue(), operator);
        } catch (EvaluationException mismatch) {
          return step.fail(ProcessFault.of(mismatch.getKind(), step.id(), mismatch.getMessage()));
        }
        if (left == (operator == Operator.OR)) {
          return step.to(State.operating(operator)).proceed();
        }
      }
      if (step.frame.values.size() < operands.size()) {
        return step.evaluate(operands.get(step.frame.values.size()));
      }
      return step.to(State.operating(operator)).proceed();
    }
    if (event.is(Signal.CONTINUE) && step.state.is(operator.getPhase())) {
      if (step.frame.values.size() < operands.size()) {
        // short-circuited
        return step.finish(step.frame.values.get(0));
      }
      try {
        return step.finish(Operations.apply(operator, term.getMethod(), step.frame.values));
      } catch (EvaluationException failure) {
        return step.fail(ProcessFault.of(failure.getKind(), step.id(), failure.getMessage()));
      }
    }
    return StepOutcome.notReady();
  }

  private static StepOutcome onCollection(final Step step, final Term.Collection term,
      final Event event) {
    final List<Term> elements = term.getElements();
    if (event.is(Signal.START)) {
      if (elements.isEmpty()) {
        return step.to(State.collecting(term.getCollectionKind())).proceed();
      }
      return step.evaluate(elements.get(0));
    }
    if (evaluated(step, event)) {
      step.frame.values.add(event.getValue());
      if (step.frame.values.size() < elements.size()) {
        return step.evaluate(elements.get(step.frame.values.size()));
      }
      return step.to(State.collecting(term.getCollectionKind())).proceed();
    }
    if (event.is(Signal.CONTINUE) && step.state.is(Phase.COLLECTING)) {
      try {
        return step.finish(Operations.collect(term.getCollectionKind(), step.frame.values));
      } catch (EvaluationException failure) {
        return step.fail(ProcessFault.of(failure.getKind(), step.id(), failure.getMessage()));
      }
    }
    return StepOutcome.notReady();
  }

  private static boolean isReplicating(final FsmInstance instance) {
    final Term term = instance.getTerm();
    return term.getKind() == Term.Kind.RECEIVE
        && ((Term.Receive) term).getMode() == ReceiveMode.PERSISTENT
        && (instance.getState().is(Phase.RECEIVING) || instance.getState().is(Phase.BINDING));
  }

  private static boolean isChildNotification(final Event event) {
    return event.getType() == Event.Type.EXPRESSION_EVALUATED
        || event.is(Signal.CHILD_TERMINATED);
  }

  private static boolean evaluated(final Step step, final Event event) {
    return event.getType() == Event.Type.EXPRESSION_EVALUATED
        && step.state.is(Phase.EVALUATING);
  }

  /**
   * The single body child of a construct terminated: the construct terminates with its value.
   */
  private static StepOutcome joined(final Step step, final Event event) {
    if (event.is(Signal.CHILD_TERMINATED) && step.state.is(Phase.JOINING)) {
      return step.finish(event.getValue());
    }
    return StepOutcome.notReady();
  }

  /**
   * @return true when there is nothing to bind
   */
  private static boolean beginBinding(final Step step, final Map<String, Value> bindings) {
    step.frame.pending.clear();
    step.frame.pending.putAll(bindings);
    step.frame.scope = step.environment;
    if (bindings.isEmpty()) {
      return true;
    }
    step.to(State.binding(bindings.keySet().iterator().next())).proceed();
    return false;
  }

  /**
   * Binds one pending binding into the scope under construction.
   *
   * @return true once every pending binding is bound
   */
  private static boolean bindNext(final Step step) {
    final Iterator<Map.Entry<String, Value>> iterator =
        step.frame.pending.entrySet().iterator();
    if (iterator.hasNext()) {
      final Map.Entry<String, Value> binding = iterator.next();
      step.frame.scope = step.frame.scope.bind(binding.getKey(), binding.getValue());
      iterator.remove();
    }
    if (step.frame.pending.isEmpty()) {
      return true;
    }
    step.to(State.binding(step.frame.pending.keySet().iterator().next())).proceed();
    return false;
  }

  private static ProcessFault capability(final Step step, final ChannelName channel,
      final boolean sending) {
    for (Restriction restriction : step.restrictions) {
      if (restriction.forbids(channel, sending)) {
        return ProcessFault.of(FaultKind.CAPABILITY_VIOLATION, step.id(),
            "Bundle " + restriction.getMode() + " forbids " + (sending ? "send on " : "receive on ")
                + channel);
      }
    }
    return null;
  }

  /**
   * Names that were obtained through a bundle body: values of the variables it refers to, and the
   * names it spells out literally.
   */
  static Set<ChannelName> restrictedChannels(final Term body, final Environment environment) {
    final Set<ChannelName> channels = new LinkedHashSet<>();
    collectChannels(body, environment, channels);
    return channels;
  }

  private static void collectChannels(final Term term, final Environment environment,
      final Set<ChannelName> channels) {
    switch (term.getKind()) {
      case VARIABLE:
        addName(environment.lookup(((Term.Variable) term).getName()), channels);
        return;
      case REFERENCE:
        addName(environment.lookup(((Term.Reference) term).getName()), channels);
        return;
      case LITERAL:
        addName(Optional.of(((Term.Literal) term).getValue()), channels);
        return;
      case QUOTE: {
        final Term operand = ((Term.Unary) term).getOperand();
        if (operand.getKind() == Term.Kind.LITERAL) {
          final Value quoted = ((Term.Literal) operand).getValue();
          channels.add(quoted.getKind() == Value.Kind.NAME ? quoted.asName()
              : ChannelName.quoted(quoted));
          return;
        }
        break;
      }
      default:
        break;
    }
    for (Term child : term.children()) {
      collectChannels(child, environment, channels);
    }
  }

  private static void addName(final Optional<Value> value, final Set<ChannelName> channels) {
    if (value.isPresent() && value.get().getKind() == Value.Kind.NAME) {
      channels.add(value.get().asName());
    }
  }

  private static String firstUnbound(final Pattern pattern, final Environment environment) {
    for (String reference : pattern.references()) {
      if (!environment.isBound(reference)) {
        return reference;
      }
    }
    return null;
  }

  private static ProcessFault unbound(final Step step, final String name) {
    return ProcessFault.of(FaultKind.UNBOUND_VARIABLE, step.id(), "Unbound variable " + name);
  }

  private static ProcessFault notAName(final Step step, final Value value) {
    return ProcessFault.of(FaultKind.TYPE_MISMATCH, step.id(),
        "Expected a name in channel position, got " + value);
  }

  private static ProcessFault unmatched(final Step step, final Value value,
      final List<Pattern> attempted) {
    final List<String> details = new ArrayList<>(attempted.size());
    for (Pattern pattern : attempted) {
      details.add(pattern.toString());
    }
    return new ProcessFault(FaultKind.UNMATCHED_VALUE, step.id(),
        "No pattern matched " + value, value, details, null);
  }

  /**
   * Scratch copy of an instance that one step works on.
   */
  private static final class Step {
    private final FsmInstance instance;
    private final Frame frame;
    private final Set<String> children;
    private final List<Effect> effects = new ArrayList<>();
    private State state;
    private Environment environment;
    private List<Restriction> restrictions;
    private String movedName;

    private Step(final FsmInstance instance) {
      this.instance = instance;
      this.frame = instance.getFrame().copy();
      this.children = new LinkedHashSet<>(instance.getPendingChildren());
      this.state = instance.getState();
      this.environment = instance.getEnvironment();
      this.restrictions = instance.getRestrictions();
    }

    private String id() {
      return instance.getId();
    }

    private Step to(final State next) {
      state = next;
      return this;
    }

    private void emit(final Effect effect) {
      effects.add(effect);
    }

    private void enqueue(final Event event) {
      emit(Effect.enqueue(event));
    }

    private StepOutcome proceed() {
      enqueue(Event.signal(Signal.CONTINUE, id(), id()));
      return next();
    }

    private String spawn(final Term term, final Environment scope, final Purpose purpose,
        final List<Restriction> inherited) {
      final String childId = id() + "." + frame.spawned++;
      final FsmInstance child =
          new FsmInstance(childId, id(), term, purpose, scope, inherited);
      emit(Effect.spawn(child));
      emit(Effect.enqueue(Event.signal(Signal.START, childId, id())));
      children.add(childId);
      return childId;
    }

    private StepOutcome evaluate(final Term operand) {
      spawn(operand, environment, Purpose.OPERAND, restrictions);
      return to(State.evaluating(operand)).next();
    }

    private StepOutcome join(final Term body, final Environment scope) {
      spawn(body, scope, Purpose.BODY, restrictions);
      return to(State.of(Phase.JOINING)).next();
    }

    private StepOutcome next() {
      return StepOutcome.progressed(state, environment, frame, children, null, null,
          restrictions, effects);
    }

    private StepOutcome stay() {
      return next();
    }

    private StepOutcome finish(final Value value) {
      state = State.terminated();
      stopListening();
      final String parentId = instance.getParentId();
      if (parentId != null) {
        if (instance.getPurpose() == Purpose.OPERAND) {
          enqueue(Event.expressionEvaluated(parentId, id(), value, movedName));
        } else {
          enqueue(Event.childTerminated(parentId, id(), value));
        }
      }
      return StepOutcome.progressed(state, environment, frame, children, value, null,
          restrictions, effects);
    }

    private StepOutcome fail(final ProcessFault fault) {
      state = State.terminated();
      stopListening();
      if (instance.getParentId() != null) {
        enqueue(Event.error(instance.getParentId(), id(), fault));
      }
      return StepOutcome.progressed(state, environment, frame, children, null, fault,
          restrictions, effects);
    }

    private void stopListening() {
      final Term.Kind kind = instance.getTerm().getKind();
      if (kind == Term.Kind.RECEIVE || kind == Term.Kind.SELECT) {
        emit(Effect.retract(id()));
      }
    }
  }
}
