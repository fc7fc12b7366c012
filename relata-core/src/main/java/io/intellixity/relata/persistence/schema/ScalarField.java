package io.intellixity.relata.persistence.schema;

/**
 * Scalar (column-backed) field of a model.
 *
 * @param name logical field name used by filters, payloads and selectors
 * @param userTypeId scalar type id (string, long, int, boolean, double, uuid, timestamp, json)
 * @param column storage column; defaults to {@code name}
 * @param optional nullable column
 * @param autoGenerated value assigned by storage on insert
 */
public record ScalarField(String name, String userTypeId, String column, boolean optional, boolean autoGenerated) {
  public ScalarField {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
    if (userTypeId == null || userTypeId.isBlank()) throw new IllegalArgumentException("userTypeId is required for field: " + name);
    column = (column == null || column.isBlank()) ? name : column;
  }

  public static ScalarField of(String name, String userTypeId) {
    return new ScalarField(name, userTypeId, null, false, false);
  }

  public static ScalarField optional(String name, String userTypeId) {
    return new ScalarField(name, userTypeId, null, true, false);
  }

  public static ScalarField generated(String name, String userTypeId) {
    return new ScalarField(name, userTypeId, null, false, true);
  }

  public ScalarField withColumn(String column) {
    return new ScalarField(name, userTypeId, column, optional, autoGenerated);
  }
}
