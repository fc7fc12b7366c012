package io.intellixity.relata.persistence.query;

import java.util.*;

public final class LogicalGroup implements QueryElement {
  private final Clause clause;
  private final List<QueryElement> elements;

  public LogicalGroup(Clause clause, List<QueryElement> elements) {
    this.clause = Objects.requireNonNull(clause, "clause");
    this.elements = List.copyOf(elements == null ? List.of() : elements);
  }

  public Clause clause() { return clause; }
  public List<QueryElement> elements() { return elements; }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  /** Back-compat map form: {@code {clause: AND|OR, elements: [...]}}; a missing or bad clause means AND. */
  @SuppressWarnings("unchecked")
  static LogicalGroup fromMap(Map<String, Object> m) {
    Object raw = m.get("clause");
    Clause clause = Clause.AND;
    if (raw != null && "OR".equalsIgnoreCase(String.valueOf(raw))) clause = Clause.OR;

    List<QueryElement> els = new ArrayList<>();
    Object list = m.get("elements");
    if (list instanceof List<?> l) {
      for (Object o : l) {
        if (!(o instanceof Map<?, ?> om)) throw new IllegalArgumentException("Unsupported group element: " + o);
        Map<String, Object> em = (Map<String, Object>) om;
        els.add(em.containsKey("clause") || em.containsKey("elements") ? fromMap(em) : Condition.fromMap(em));
      }
    }
    return new LogicalGroup(clause, els);
  }

  @Override
  public String toString() {
    return clause + " " + elements;
  }
}
