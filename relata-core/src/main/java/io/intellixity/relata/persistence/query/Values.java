package io.intellixity.relata.persistence.query;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/**
 * Value comparison shared by the planners and the in-memory engine.
 * <p>
 * Integral numbers compare by value regardless of boxed type (a JSON {@code 5} is an {@code Integer},
 * a generated key is usually a {@code Long}).
 */
public final class Values {
  private Values() {}

  public static Object normalize(Object v) {
    if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
      return ((Number) v).longValue();
    }
    if (v instanceof BigInteger bi && bi.bitLength() < 64) return bi.longValue();
    if (v instanceof BigDecimal bd) {
      try {
        return bd.longValueExact();
      } catch (ArithmeticException notIntegral) {
        return bd.doubleValue();
      }
    }
    if (v instanceof Float f) return f.doubleValue();
    return v;
  }

  public static boolean same(Object a, Object b) {
    return Objects.equals(normalize(a), normalize(b));
  }

  /** Normalized tuple of the given fields of a row; usable as a hash key. */
  public static List<Object> key(List<String> fields, Map<String, Object> row) {
    List<Object> out = new ArrayList<>(fields.size());
    for (String f : fields) out.add(normalize(row.get(f)));
    return out;
  }

  public static boolean hasNull(List<Object> key) {
    for (Object o : key) if (o == null) return true;
    return false;
  }

  /** Natural ordering with nulls first; numbers compare numerically. Used for sorting only. */
  @SuppressWarnings({"unchecked", "rawtypes"})
  public static int compare(Object a, Object b) {
    Object x = normalize(a);
    Object y = normalize(b);
    if (x == null || y == null) return (x == null ? 0 : 1) - (y == null ? 0 : 1);
    if (x instanceof Number nx && y instanceof Number ny) return Double.compare(nx.doubleValue(), ny.doubleValue());
    if (x instanceof Comparable cx && x.getClass().isInstance(y)) return cx.compareTo(y);
    return String.valueOf(x).compareTo(String.valueOf(y));
  }
}
