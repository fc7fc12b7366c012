package io.intellixity.relata.persistence.spi.exec;

import io.intellixity.relata.persistence.dmlast.DmlAst;
import io.intellixity.relata.persistence.dmlast.SelectAst;
import io.intellixity.relata.persistence.schema.SchemaRegistry;

/**
 * SPI hook to validate statements before dialect rendering.
 * <p>
 * Executors call this for every select and primitive operation; applications may plug in stricter rules.
 */
public interface QueryValidationStrategy {
  void validate(SchemaRegistry schema, SelectAst select);

  void validate(SchemaRegistry schema, DmlAst dml);
}
