package io.intellixity.relata.persistence.query;

public enum Operator {
  EQ,
  NE,
  GT,
  GE,
  LT,
  LE,

  IN,
  NIN,

  RANGE,
  LIKE
}
