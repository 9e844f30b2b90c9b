package com.github.processfsm;

public enum CollectionKind {
  SET, MAP, LIST, TUPLE;
}
