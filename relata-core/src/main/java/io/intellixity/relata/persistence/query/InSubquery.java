package io.intellixity.relata.persistence.query;

import java.util.List;
import java.util.Objects;

/**
 * Semi-join predicate: {@code (properties) [NOT] IN (SELECT selected FROM source WHERE where)}.
 * <p>
 * Produced by relation filter translation; {@code source} is either a model or a join table, and
 * {@code where} is expressed against that source.
 */
public record InSubquery(List<String> properties, Source source, List<String> selected,
                         QueryElement where, boolean not) implements QueryElement {

  public record Source(String name, boolean joinTable) {
    public Source {
      if (name == null || name.isBlank()) throw new IllegalArgumentException("subquery source is required");
    }

    public static Source model(String name) { return new Source(name, false); }
    public static Source joinTable(String name) { return new Source(name, true); }
  }

  public InSubquery {
    properties = List.copyOf(properties);
    selected = List.copyOf(selected);
    Objects.requireNonNull(source, "source");
    if (properties.isEmpty() || properties.size() != selected.size()) {
      throw new IllegalArgumentException("subquery arity mismatch: " + properties + " vs " + selected);
    }
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) {
    return visitor.visit(this);
  }
}
