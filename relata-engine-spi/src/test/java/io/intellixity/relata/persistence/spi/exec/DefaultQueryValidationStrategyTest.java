package io.intellixity.relata.persistence.spi.exec;

import io.intellixity.relata.persistence.compile.Bind;
import io.intellixity.relata.persistence.dmlast.*;
import io.intellixity.relata.persistence.query.InSubquery;
import io.intellixity.relata.persistence.query.QueryFilters;
import io.intellixity.relata.persistence.query.QueryValidationException;
import io.intellixity.relata.persistence.query.SortField;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultQueryValidationStrategyTest {
  private static final SchemaRegistry SCHEMA = TestSchema.orders();

  private final DefaultQueryValidationStrategy v = new DefaultQueryValidationStrategy();

  @Test
  void throwsOnUnknownFilterProperty() {
    SelectAst select = SelectAst.of("Order", QueryFilters.eq("status", "CREATED"));

    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> v.validate(SCHEMA, select));
    assertTrue(ex.getMessage().contains("status"));
  }

  @Test
  void acceptsKnownFilterAndSort() {
    SelectAst select = new SelectAst("Order", false, QueryFilters.eq("paymentStatus", "PAID"),
        List.of(SortField.desc("id")), null);

    assertDoesNotThrow(() -> v.validate(SCHEMA, select));
  }

  @Test
  void throwsOnUnknownSortField() {
    SelectAst select = new SelectAst("Order", false, null, List.of(SortField.asc("createdAt")), null);

    assertThrows(QueryValidationException.class, () -> v.validate(SCHEMA, select));
  }

  @Test
  void validatesSubqueriesAgainstTheirOwnSource() {
    InSubquery good = new InSubquery(List.of("customerId"), InSubquery.Source.model("Customer"), List.of("id"),
        QueryFilters.eq("email", "a@x.io"), false);
    InSubquery wrongSide = new InSubquery(List.of("customerId"), InSubquery.Source.model("Customer"), List.of("id"),
        QueryFilters.eq("paymentStatus", "PAID"), false);
    InSubquery joinRows = new InSubquery(List.of("id"), InSubquery.Source.joinTable("order_tags"), List.of("orderId"),
        QueryFilters.eq("tagId", 3L), true);

    assertDoesNotThrow(() -> v.validate(SCHEMA, SelectAst.of("Order", good)));
    assertThrows(QueryValidationException.class, () -> v.validate(SCHEMA, SelectAst.of("Order", wrongSide)));
    assertDoesNotThrow(() -> v.validate(SCHEMA, SelectAst.of("Order", joinRows)));
  }

  @Test
  void untranslatedRelationFilter_isRejected() {
    SelectAst select = SelectAst.of("Order", QueryFilters.is("customer", null));

    assertThrows(QueryValidationException.class, () -> v.validate(SCHEMA, select));
  }

  @Test
  void joinTableRows_knowOnlyTheirTwoColumns() {
    assertDoesNotThrow(() -> v.validate(SCHEMA, SelectAst.joinRows("order_tags", QueryFilters.eq("orderId", 1L))));
    assertThrows(QueryValidationException.class,
        () -> v.validate(SCHEMA, SelectAst.joinRows("order_tags", QueryFilters.eq("id", 1L))));
    assertThrows(QueryValidationException.class, () -> v.validate(SCHEMA, SelectAst.joinRows("order_labels", null)));
  }

  @Test
  void validatesDmlColumns() {
    InsertAst insert = new InsertAst("Order", List.of(new ColumnBind("paymentStatus", Bind.of("NEW", "string"))), List.of("id"));
    InsertAst badReturning = new InsertAst("Order", List.of(), List.of("rowid"));
    UpdateAst emptyUpdate = new UpdateAst("Order", List.of(), QueryFilters.eq("id", 1L));
    DeleteAst join = new DeleteAst("order_tags", QueryFilters.eq("tagId", 2L));

    assertDoesNotThrow(() -> v.validate(SCHEMA, insert));
    assertThrows(QueryValidationException.class, () -> v.validate(SCHEMA, badReturning));
    assertThrows(QueryValidationException.class, () -> v.validate(SCHEMA, emptyUpdate));
    assertDoesNotThrow(() -> v.validate(SCHEMA, join));
    assertThrows(QueryValidationException.class, () -> v.validate(SCHEMA, new DeleteAst("Invoice", null)));
  }
}
