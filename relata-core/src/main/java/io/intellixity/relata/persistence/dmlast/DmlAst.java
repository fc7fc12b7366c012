package io.intellixity.relata.persistence.dmlast;

/**
 * Primitive storage operation handed to a {@code TransactionExecutor}.
 * <p>
 * Tables and columns are logical: model (or join table) names and field names. Dialects map them to
 * physical sources and columns through the schema.
 */
public interface DmlAst {
  String table();
}
