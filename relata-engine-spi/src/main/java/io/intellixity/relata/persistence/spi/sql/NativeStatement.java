package io.intellixity.relata.persistence.spi.sql;

/** Backend-native form of a primitive operation or select, produced by a {@link Dialect}. */
public interface NativeStatement {
  /** Short text for debug logs; never includes bind values. */
  default String describe() {
    return toString();
  }
}
