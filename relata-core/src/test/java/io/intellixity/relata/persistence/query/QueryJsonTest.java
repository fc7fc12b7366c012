package io.intellixity.relata.persistence.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class QueryJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void parsesNotNode() throws Exception {
    String s = """
        {
          "filter": {
            "not": { "eq": { "field": "email", "value": "a@x.io" } }
          }
        }
        """;
    Query q = JSON.readValue(s, Query.class);
    assertNotNull(q.filter());
    assertTrue(q.filter() instanceof NotElement);
    NotElement n = (NotElement) q.filter();
    assertTrue(n.element() instanceof Condition);
    Condition c = (Condition) n.element();
    assertEquals("email", c.property());
    assertEquals(Operator.EQ, c.operator());
    assertEquals("a@x.io", c.value());
  }

  @Test
  void backCompatGroupMissingClauseDefaultsToAnd() throws Exception {
    String s = """
        {
          "filter": {
            "elements": [
              { "operator": "EQ", "property": "email", "value": "a@x.io" }
            ]
          }
        }
        """;
    Query q = JSON.readValue(s, Query.class);
    assertTrue(q.filter() instanceof LogicalGroup);
    LogicalGroup g = (LogicalGroup) q.filter();
    assertEquals(Clause.AND, g.clause());
    assertEquals(1, g.elements().size());
  }

  @Test
  void parsesNestedRelationFilters() throws Exception {
    String s = """
        {
          "filter": {
            "some": {
              "relation": "posts",
              "where": { "is": { "relation": "author", "where": { "eq": { "field": "name", "value": "One" } } } }
            }
          }
        }
        """;
    Query q = JSON.readValue(s, Query.class);

    RelationFilter posts = (RelationFilter) q.filter();
    assertEquals("posts", posts.relation());
    assertEquals(RelationFilter.Quantifier.SOME, posts.quantifier());
    RelationFilter author = (RelationFilter) posts.where();
    assertEquals(RelationFilter.Quantifier.IS, author.quantifier());
    assertEquals("name", ((Condition) author.where()).property());
  }

  @Test
  void relationFilterWithoutWhere_keepsNullWhere() throws Exception {
    Query q = JSON.readValue("{\"filter\":{\"isNot\":{\"relation\":\"profile\"}}}", Query.class);

    RelationFilter f = (RelationFilter) q.filter();
    assertEquals(RelationFilter.Quantifier.IS_NOT, f.quantifier());
    assertNull(f.where());
  }

  @Test
  void parsesInRangeParamsPageAndSort() throws Exception {
    String s = """
        {
          "filter": {
            "or": [
              { "in": { "field": "id", "values": [1, 2] } },
              { "range": { "field": "id", "lower": { "param": "lo" }, "upper": 10 } }
            ]
          },
          "params": { "lo": 5 },
          "page": { "offset": 20, "limit": 10 },
          "sort": [ { "field": "title", "dir": "desc" }, { "field": "id" } ]
        }
        """;
    Query q = JSON.readValue(s, Query.class);

    LogicalGroup g = (LogicalGroup) q.filter();
    assertEquals(Clause.OR, g.clause());
    assertEquals(List.of(1, 2), ((Condition) g.elements().get(0)).value());
    Condition range = (Condition) g.elements().get(1);
    assertEquals(QueryValues.param("lo"), range.lower());
    assertEquals(10, range.upper());
    assertEquals(5, q.param("lo"));
    assertEquals(new OffsetPage(20, 10), q.page());
    assertEquals(List.of(SortField.desc("title"), SortField.asc("id")), q.sort());
  }

  @Test
  void missingParam_isReported() {
    Query q = new Query();

    assertThrows(IllegalArgumentException.class, () -> q.param("absent"));
  }

  @Test
  void pageDefaultsAndAdvances() throws Exception {
    Query q = JSON.readValue("{\"page\": {\"offset\": 40}}", Query.class);

    assertEquals(new OffsetPage(40, OffsetPage.DEFAULT_LIMIT), q.page());
    assertEquals(new OffsetPage(10, 10), OffsetPage.first(10).next());
    assertThrows(QueryValidationException.class, () -> new OffsetPage(0, 0));
  }

  @Test
  void sortDirection_isCaseInsensitiveAndDefaultsToAscending() {
    assertEquals(SortField.Direction.DESC, SortField.Direction.parse("DESC"));
    assertEquals(SortField.Direction.ASC, SortField.Direction.parse(null));
    assertThrows(QueryValidationException.class, () -> SortField.Direction.parse("up"));
  }

  @Test
  void groupRendersClauseAndMembers() {
    LogicalGroup g = new LogicalGroup(Clause.OR, List.of(Condition.of("a", Operator.EQ, 1), Condition.of("b", Operator.EQ, 2)));

    assertEquals("OR [a EQ 1, b EQ 2]", g.toString());
  }
}
