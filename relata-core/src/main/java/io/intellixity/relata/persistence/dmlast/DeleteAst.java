package io.intellixity.relata.persistence.dmlast;

import io.intellixity.relata.persistence.query.QueryElement;

public record DeleteAst(
    String table,
    QueryElement where
) implements DmlAst {
}
