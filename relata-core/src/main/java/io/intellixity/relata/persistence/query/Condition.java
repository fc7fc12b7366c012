package io.intellixity.relata.persistence.query;

import java.util.*;

/** Scalar predicate on one field. EQ/NE with a null value mean IS NULL / IS NOT NULL. */
public final class Condition implements QueryElement {
  private final String property;
  private final Operator operator;
  private final Object value;
  private final Object lower;
  private final Object upper;
  private final boolean not;

  public Condition(String property, Operator operator, Object value, Object lower, Object upper, boolean not) {
    this.property = Objects.requireNonNull(property, "property");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = value;
    this.lower = lower;
    this.upper = upper;
    this.not = not;
  }

  public String property() { return property; }
  public Operator operator() { return operator; }
  public Object value() { return value; }
  public Object lower() { return lower; }
  public Object upper() { return upper; }
  public boolean not() { return not; }

  public Condition withValue(Object value, Object lower, Object upper) {
    return new Condition(property, operator, value, lower, upper, not);
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  public static Condition of(String property, Operator operator, Object value) {
    return new Condition(property, operator, value, null, null, false);
  }

  public static Condition range(String property, Object lower, Object upper) {
    return new Condition(property, Operator.RANGE, null, lower, upper, false);
  }

  public static Condition isNull(String property) {
    return of(property, Operator.EQ, null);
  }

  public static Condition isNotNull(String property) {
    return of(property, Operator.NE, null);
  }

  /** Back-compat map form: {@code {property, operator, value|lower/upper|from/to, not}}. */
  public static Condition fromMap(Map<String, Object> m) {
    String property = String.valueOf(m.get("property"));
    Operator op = Operator.valueOf(String.valueOf(m.get("operator")).toUpperCase());
    boolean not = Boolean.parseBoolean(String.valueOf(m.getOrDefault("not", "false")));

    if (op == Operator.RANGE) {
      Object lower = QueryValues.fromWire(m.containsKey("lower") ? m.get("lower") : m.get("from"));
      Object upper = QueryValues.fromWire(m.containsKey("upper") ? m.get("upper") : m.get("to"));
      return new Condition(property, op, null, lower, upper, not);
    }
    return new Condition(property, op, QueryValues.fromWire(m.get("value")), null, null, not);
  }

  @Override
  public String toString() {
    String body = (operator == Operator.RANGE)
        ? property + " RANGE [" + lower + ", " + upper + "]"
        : property + " " + operator + " " + value;
    return not ? "NOT(" + body + ")" : body;
  }
}
