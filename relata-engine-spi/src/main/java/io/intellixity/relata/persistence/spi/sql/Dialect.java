package io.intellixity.relata.persistence.spi.sql;

import io.intellixity.relata.persistence.dmlast.DmlAst;
import io.intellixity.relata.persistence.dmlast.SelectAst;
import io.intellixity.relata.persistence.schema.SchemaRegistry;

/**
 * Backend-agnostic SPI: renders selects and primitive operations against the schema.
 * Logical names (models, join tables, fields) are mapped to physical sources and columns here.
 */
public interface Dialect<S extends NativeStatement> {
  String id();

  S renderSelect(SchemaRegistry schema, SelectAst select);

  S renderDml(SchemaRegistry schema, DmlAst dml);
}
