package io.intellixity.relata.persistence.dmlast;

import io.intellixity.relata.persistence.compile.Bind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DmlAstTest {

  @Test
  void joinRow_bindsBothKeysAndReturnsNothing() {
    InsertAst ins = InsertAst.joinRow("post_categories",
        new ColumnBind("post_id", Bind.of(1L, "long")),
        new ColumnBind("category_id", Bind.of(2L, "long")));

    assertEquals(List.of("post_id", "category_id"), ins.columns().stream().map(ColumnBind::column).toList());
    assertTrue(ins.returningColumns().isEmpty());
  }

  @Test
  void sameColumnTwice_isRejected() {
    ColumnBind a = new ColumnBind("email", Bind.of("a@x.io", "string"));
    ColumnBind b = new ColumnBind("email", Bind.of("b@x.io", "string"));

    assertThrows(IllegalArgumentException.class, () -> new InsertAst("User", List.of(a, b), null));
    assertThrows(IllegalArgumentException.class, () -> new UpdateAst("User", List.of(a, b), null));
  }

  @Test
  void nullListsBecomeEmpty() {
    UpdateAst upd = new UpdateAst("User", null, null);

    assertTrue(upd.sets().isEmpty());
    assertThrows(NullPointerException.class, () -> new InsertAst(null, List.of(), List.of()));
  }
}
