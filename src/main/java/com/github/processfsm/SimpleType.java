package com.github.processfsm;

/**
 * Ground types usable in typed patterns.
 */
public enum SimpleType {
  BOOL, INT, STRING, URI, NAME;

  boolean accepts(final Value value) {
    switch (this) {
      case BOOL:
        return value.getKind() == Value.Kind.BOOL;
      case INT:
        return value.getKind() == Value.Kind.INT;
      case STRING:
        return value.getKind() == Value.Kind.STRING;
      case URI:
        return value.getKind() == Value.Kind.URI;
      case NAME:
        return value.getKind() == Value.Kind.NAME;
      default:
        return false;
    }
  }
}
