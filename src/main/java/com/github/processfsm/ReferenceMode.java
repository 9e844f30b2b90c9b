package com.github.processfsm;

public enum ReferenceMode {
  // read the binding, leave it in place
  COPY,
  // read the binding, the consuming instance drops it from its environment
  MOVE;
}
