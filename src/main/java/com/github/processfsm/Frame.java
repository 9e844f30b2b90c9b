package com.github.processfsm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Working registers of one FSM instance. A frame is copied at the start of every step and the copy
 * is what the step's outcome carries, so a frame is never mutated once an outcome holding it has
 * been applied.
 */
final class Frame {
  // operand, binding, case or arm index
  int cursor;
  // evaluated operands, in order
  final List<Value> values = new ArrayList<>();
  // resolved channel of a send or receive
  ChannelName channel;
  // resolved channels of a select, in arm order
  final List<ChannelName> arms = new ArrayList<>();
  // received or matched bindings still waiting for their BINDING state
  final Map<String, Value> pending = new LinkedHashMap<>();
  // environment being built for a body child
  Environment scope;
  // value under a match, a matches expression or a let binding
  Value subject;
  // reply name of a receive-send bind
  ChannelName reply;
  // children forked by a concurrent let, in spawn order, and what they evaluated to
  final List<String> forked = new ArrayList<>();
  final Map<String, Value> joined = new LinkedHashMap<>();
  // feed deterministic child ids and unforgeable names
  int spawned;
  int minted;

  Frame copy() {
    final Frame copy = new Frame();
    copy.cursor = cursor;
    copy.values.addAll(values);
    copy.channel = channel;
    copy.arms.addAll(arms);
    copy.pending.putAll(pending);
    copy.scope = scope;
    copy.subject = subject;
    copy.reply = reply;
    copy.forked.addAll(forked);
    copy.joined.putAll(joined);
    copy.spawned = spawned;
    copy.minted = minted;
    return copy;
  }
}
