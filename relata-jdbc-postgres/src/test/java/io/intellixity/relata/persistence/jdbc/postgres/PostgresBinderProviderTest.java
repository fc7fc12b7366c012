package io.intellixity.relata.persistence.jdbc.postgres;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.relata.persistence.compile.Bind;
import org.junit.jupiter.api.Test;
import org.postgresql.util.PGobject;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresBinderProviderTest {
  private final PostgresBinderProvider binders = new PostgresBinderProvider(new ObjectMapper());

  @Test
  void jsonValues_areSentAsJsonb() throws SQLException {
    PGobject obj = binders.jsonb(Map.of("tags", List.of("a", "b")));

    assertEquals("jsonb", obj.getType());
    assertEquals("{\"tags\":[\"a\",\"b\"]}", obj.getValue());
    assertEquals("[1]", binders.jsonb("[1]").getValue());
  }

  @Test
  void jsonColumns_selectTheJsonbBinder() {
    assertEquals("PostgresJsonbBinder", binders.binderFor(Bind.of(Map.of(), "json"), Map.of()).getClass().getSimpleName());
    assertEquals("PostgresOtherNullBinder", binders.binderFor(Bind.of(null, "uuid"), null).getClass().getSimpleName());
  }

  @Test
  void decode_parsesJsonAndKeepsTimestampsAsInstants() throws SQLException {
    PGobject raw = new PGobject();
    raw.setType("jsonb");
    raw.setValue("{\"n\":1,\"ok\":true}");
    Instant at = Instant.parse("2024-01-02T03:04:05Z");

    assertEquals(Map.of("n", 1, "ok", true), binders.decode(raw));
    assertEquals(at, binders.decode(Timestamp.from(at)));
    assertEquals("x", binders.decode("x"));
  }
}
