package io.intellixity.snowgate.spi.exec;

import io.intellixity.snowgate.dmlast.UpdateAst;
import io.intellixity.snowgate.dmlast.UpsertAst;
import io.intellixity.snowgate.query.*;
import io.intellixity.snowgate.sql.TableRef;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static io.intellixity.snowgate.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class DefaultQueryValidationStrategyTest {
  private final DefaultQueryValidationStrategy v = new DefaultQueryValidationStrategy();

  @Test
  void selectWithoutTableNeedsRawColumns() {
    assertThrows(QueryValidationException.class, () -> v.validateSelect(new SelectQuery()));
    assertThrows(QueryValidationException.class, () -> v.validateSelect(new SelectQuery().withColumns("a")));
    assertDoesNotThrow(() -> v.validateSelect(new SelectQuery().withColumnRaw("1")));
  }

  @Test
  void throwsOnEmptyGroupInWhere() {
    SelectQuery q = SelectQuery.from("orders").withWhere(new LogicalGroup(Clause.OR, List.of()));
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> v.validateSelect(q));
    assertTrue(ex.getMessage().contains("Empty OR group in where"));
  }

  @Test
  void throwsOnOpenRange() {
    SelectQuery q = SelectQuery.from("orders").where(not(range("amount", 1, null)));
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> v.validateSelect(q));
    assertTrue(ex.getMessage().contains("amount"));
  }

  @Test
  void validatesUnionBranchesAndJoins() {
    SelectQuery badBranch = new SelectQuery().withColumns("x");
    assertThrows(QueryValidationException.class,
        () -> v.validateSelect(SelectQuery.from("a").withUnion(badBranch)));

    SelectQuery badJoin = SelectQuery.from("a")
        .withJoin(JoinType.INNER, "b", new LogicalGroup(Clause.AND, List.of()));
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> v.validateSelect(badJoin));
    assertTrue(ex.getMessage().contains("join on b"));
  }

  @Test
  void rejectsUnknownElementType() {
    QueryElement custom = new QueryElement() {
      @Override public <Q> Q accept(QueryVisitor<Q> visitor) { throw new UnsupportedOperationException(); }
    };
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> v.validateSelect(SelectQuery.from("a").withWhere(custom)));
    assertTrue(ex.getMessage().startsWith("Unsupported QueryElement"));
  }

  @Test
  void acceptsRawAndColumnPredicates() {
    SelectQuery q = SelectQuery.from("a")
        .where(raw("x > ?", 1))
        .where(columnsEq("a.id", "a.parent_id"))
        .where(in("status", List.of()));
    assertDoesNotThrow(() -> v.validateSelect(q));
  }

  @Test
  void updateNeedsAssignments() {
    UpdateAst empty = new UpdateAst(TableRef.of("users"), List.of(), null);
    assertThrows(QueryValidationException.class, () -> v.validateUpdate(empty));
    assertDoesNotThrow(() -> v.validateUpdate(UpdateAst.of("users", Map.of("a", 1), eq("id", 1))));
  }

  @Test
  void upsertNeedsUniqueBy() {
    List<?> rows = List.of(Map.of("id", 1));
    assertThrows(QueryValidationException.class,
        () -> v.validateUpsert(UpsertAst.of("users", rows, List.of(), List.of())));
    assertThrows(QueryValidationException.class,
        () -> v.validateUpsert(UpsertAst.of("users", rows, Arrays.asList(" "), List.of())));
    assertDoesNotThrow(() -> v.validateUpsert(UpsertAst.of("users", rows, List.of("id"), List.of())));
  }
}
