package com.github.processfsm;

/**
 * What a CONSTRUCTING state builds.
 */
public enum ConstructKind {
  // a quoted name around an evaluated value
  NAME,
  // a quoted name around a process closure
  PROCESS;
}
