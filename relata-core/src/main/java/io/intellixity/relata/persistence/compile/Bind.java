package io.intellixity.relata.persistence.compile;

/** A value headed for storage together with the scalar type id it was declared with. */
public record Bind(Object value, String userTypeId) {
  public static Bind of(Object value, String userTypeId) {
    return new Bind(value, userTypeId);
  }
}
