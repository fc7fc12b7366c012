package io.intellixity.relata.persistence.query;

import java.util.Map;

/** Named parameters inside filter values, resolved from {@link Query#params()} before rendering. */
public final class QueryValues {
  private QueryValues() {}

  public record Param(String name) {}

  public static Param param(String name) { return new Param(name); }

  /** Wire form: {@code {"param": "name"}} or {@code {"$param": "name"}}; anything else is a literal. */
  static Object fromWire(Object v) {
    if (!(v instanceof Map<?, ?> m)) return v;
    Object p = m.containsKey("param") ? m.get("param") : m.get("$param");
    return p == null ? v : new Param(String.valueOf(p));
  }

  /** Renderers see resolved values only; a param reaching them was never bound. */
  public static Object requireResolved(Object v, String property) {
    if (v instanceof Param p) {
      throw new IllegalArgumentException("Unresolved param '" + p.name() + "' for property '" + property + "'");
    }
    return v;
  }
}
