package io.intellixity.relata.persistence.read;

import io.intellixity.relata.persistence.query.QueryElement;
import io.intellixity.relata.persistence.query.SortField;
import io.intellixity.relata.persistence.schema.RelationField;

import java.util.ArrayList;
import java.util.List;

/** Validated include tree of one model; filters are already translated against their target models. */
public record ReadPlan(String model, List<IncludePlan> includes) {
  public ReadPlan {
    includes = List.copyOf(includes);
  }

  public record IncludePlan(RelationField relation, QueryElement where, List<SortField> orderBy,
                            int offset, Integer limit, ReadPlan nested) {
    public IncludePlan {
      orderBy = List.copyOf(orderBy);
    }

    public String name() {
      return relation.name();
    }
  }

  /** Number of batched fetch levels below the root. */
  public int depth() {
    int d = 0;
    for (IncludePlan i : includes) d = Math.max(d, 1 + i.nested().depth());
    return d;
  }

  /** Relation paths, e.g. {@code [posts, posts.categories]}. */
  public List<String> paths() {
    List<String> out = new ArrayList<>();
    collect("", out);
    return out;
  }

  private void collect(String prefix, List<String> out) {
    for (IncludePlan i : includes) {
      String p = prefix + i.name();
      out.add(p);
      i.nested().collect(p + ".", out);
    }
  }
}
