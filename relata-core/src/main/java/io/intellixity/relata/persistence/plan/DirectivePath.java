package io.intellixity.relata.persistence.plan;

import java.util.ArrayList;
import java.util.List;

/**
 * Position of a directive in the submitted write tree, e.g. {@code User/posts[1]:create/categories[0]:connect}.
 */
public record DirectivePath(List<String> segments) {
  public DirectivePath {
    segments = List.copyOf(segments);
  }

  public static DirectivePath root(String model) {
    return new DirectivePath(List.of(model));
  }

  public DirectivePath child(String relation, int index, String kind) {
    List<String> next = new ArrayList<>(segments);
    next.add(relation + "[" + index + "]:" + kind);
    return new DirectivePath(next);
  }

  /** Relation field chain without indexes and kinds, e.g. {@code User.posts.categories}. */
  public String relationChain() {
    StringBuilder sb = new StringBuilder();
    for (String s : segments) {
      if (sb.length() > 0) sb.append('.');
      int bracket = s.indexOf('[');
      sb.append(bracket < 0 ? s : s.substring(0, bracket));
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return String.join("/", segments);
  }
}
