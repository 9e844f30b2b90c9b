package com.github.processfsm;

/**
 * The way a pending receive request reacts to being matched.
 */
public enum ReceiveMode {
  // consumed by its first match
  ONE_SHOT,
  // survives every match, the replication of contracts and `<=`
  PERSISTENT,
  // reads without consuming the send entry, removed after its first match
  PEEK,
  // one registration spread over several channels, the first channel to match wins
  RACE;
}
