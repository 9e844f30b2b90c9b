package com.github.processfsm;

/**
 * Persistence of a pending send entry.
 */
public enum Persistence {
  // `!`, removed by its first match
  ONCE,
  // `!!`, survives matches
  PERSISTENT;
}
