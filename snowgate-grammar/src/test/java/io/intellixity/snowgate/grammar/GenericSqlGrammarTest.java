package io.intellixity.snowgate.grammar;

import io.intellixity.snowgate.config.GrammarConfig;
import io.intellixity.snowgate.dmlast.*;
import io.intellixity.snowgate.query.*;
import io.intellixity.snowgate.query.aggregation.Aggregate;
import io.intellixity.snowgate.spi.sql.SqlStatement;
import io.intellixity.snowgate.sql.ColumnRef;
import io.intellixity.snowgate.sql.RawExpression;
import io.intellixity.snowgate.sql.TableRef;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.snowgate.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class GenericSqlGrammarTest {
  private final GenericSqlDialect dialect = new GenericSqlDialect();

  /** Overrides two hooks; the shared grammar must pick both up. */
  private static final class FetchFirstDialect extends GenericSqlDialect {
    @Override public String compileLimit(Number limit) { return "fetch first " + limit.longValue() + " rows only"; }
    @Override public String wrapTable(TableRef table) { return "[" + table + "]"; }
  }

  private static Map<String, Object> row(Object... kv) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
    return m;
  }

  @Test
  void compilesBasicSelect() {
    SqlStatement st = dialect.compileSelect(SelectQuery.from("users")
        .withColumns("id", "name")
        .where(eq("status", "active"))
        .withOrderBy(SortField.asc("name"))
        .withLimit(10)
        .withOffset(20));

    assertEquals("select \"id\", \"name\" from \"users\" where \"status\" = ? order by \"name\" asc limit 10 offset 20",
        st.sql());
    assertEquals(List.of("active"), st.bindings());
  }

  @Test
  void prefixGoesOnLastTableSegmentAndAliasIsKept() {
    GenericSqlDialect d = new GenericSqlDialect(GrammarConfig.defaults().withTablePrefix("app_"));
    assertEquals("select * from \"sales\".\"app_orders\" as \"o\"",
        d.compileSelect(SelectQuery.from("sales.orders as o")).sql());
  }

  @Test
  void wrapsIdentifiers() {
    assertEquals("\"u\".\"name\"", dialect.wrap("u.name"));
    assertEquals("\"name\" as \"n\"", dialect.wrap("name AS n"));
    assertEquals("\"u\".*", dialect.wrap("u.*"));
    assertEquals("*", dialect.wrap("*"));
    assertEquals("\"we\"\"ird\"", dialect.wrapTable(TableRef.of("we\"ird")));
    assertEquals("my_fn(x)", dialect.wrapTable(TableRef.raw("my_fn(x)")));
    assertEquals("count(*)", dialect.wrapColumn(ColumnRef.raw("count(*)")));
  }

  @Test
  void compilesJoinsAndPredicateTree() {
    SqlStatement st = dialect.compileSelect(SelectQuery.from("users as u")
        .withJoin(JoinType.LEFT, "orders as o", columnsEq("u.id", "o.user_id"))
        .where(in("u.role", List.of("a", "b")))
        .where(isNull("o.id"))
        .where(or(eq("x", 1), eq("y", 2)))
        .where(range("age", 18, 65)));

    assertEquals("select * from \"users\" as \"u\" left join \"orders\" as \"o\" on \"u\".\"id\" = \"o\".\"user_id\""
            + " where \"u\".\"role\" in (?, ?) and \"o\".\"id\" is null and (\"x\" = ? or \"y\" = ?)"
            + " and \"age\" between ? and ?",
        st.sql());
    assertEquals(List.of("a", "b", 1, 2, 18, 65), st.bindings());
  }

  @Test
  void emptyInListsAreConstantPredicates() {
    assertEquals("select * from \"t\" where 0 = 1",
        dialect.compileSelect(SelectQuery.from("t").where(in("id", List.of()))).sql());
    assertEquals("select * from \"t\" where 1 = 1",
        dialect.compileSelect(SelectQuery.from("t").where(nin("id", List.of()))).sql());
  }

  @Test
  void negationAndNotNull() {
    SqlStatement st = dialect.compileSelect(SelectQuery.from("t")
        .where(eq("a", 1).negate())
        .where(not(like("b", "x%")))
        .where(isNotNull("c")));
    assertEquals("select * from \"t\" where not (\"a\" = ?) and not (\"b\" like ?) and \"c\" is not null", st.sql());
    assertEquals(List.of(1, "x%"), st.bindings());
  }

  @Test
  void rawPredicateBindingsFollowTextOrder() {
    SqlStatement st = dialect.compileSelect(SelectQuery.from("t")
        .where(eq("a", 1))
        .where(raw("b > ?", 2))
        .where(eq("c", 3)));
    assertEquals("select * from \"t\" where \"a\" = ? and b > ? and \"c\" = ?", st.sql());
    assertEquals(List.of(1, 2, 3), st.bindings());
  }

  @Test
  void rawValuesAreInlined() {
    SqlStatement st = dialect.compileSelect(SelectQuery.from("t")
        .where(gt("created_at", RawExpression.of("current_date()"))));
    assertEquals("select * from \"t\" where \"created_at\" > current_date()", st.sql());
    assertTrue(st.bindings().isEmpty());
  }

  @Test
  void compilesAggregates() {
    assertEquals("select count(*) as aggregate from \"orders\"",
        dialect.compileSelect(SelectQuery.from("orders").withAggregate(Aggregate.count())).sql());
    assertEquals("select count(distinct \"email\") as aggregate from \"orders\"",
        dialect.compileSelect(SelectQuery.from("orders")
            .withDistinct(true)
            .withAggregate(Aggregate.of("count", "email"))).sql());
  }

  @Test
  void compilesGroupsAndHavings() {
    SqlStatement st = dialect.compileSelect(SelectQuery.from("orders")
        .withColumns("status")
        .withColumnRaw("count(*) as n")
        .withGroupBy("status")
        .withHaving(raw("count(*) > ?", 5)));
    assertEquals("select \"status\", count(*) as n from \"orders\" group by \"status\" having count(*) > ?", st.sql());
    assertEquals(List.of(5), st.bindings());
  }

  @Test
  void compilesLocksAndDistinct() {
    assertEquals("select * from \"t\" for update",
        dialect.compileSelect(SelectQuery.from("t").withLock(LockMode.FOR_UPDATE)).sql());
    assertEquals("select distinct \"a\" from \"t\" for share",
        dialect.compileSelect(SelectQuery.from("t").withDistinct(true).withColumns("a").withLock(LockMode.SHARED)).sql());
  }

  @Test
  void compilesUnionsWithTheirBindings() {
    SqlStatement st = dialect.compileSelect(SelectQuery.from("a")
        .where(eq("x", 1))
        .withUnionAll(SelectQuery.from("b").where(eq("y", 2)))
        .withUnionOrderBy(SortField.desc("x"))
        .withUnionLimit(5));
    assertEquals("(select * from \"a\" where \"x\" = ?) union all (select * from \"b\" where \"y\" = ?)"
        + " order by \"x\" desc limit 5", st.sql());
    assertEquals(List.of(1, 2), st.bindings());
  }

  @Test
  void selectWithoutTable() {
    assertEquals("select 1", dialect.compileSelect(new SelectQuery().withColumnRaw("1")).sql());
    assertThrows(QueryValidationException.class, () -> dialect.compileSelect(new SelectQuery()));
  }

  @Test
  void overriddenHooksApplyThroughout() {
    FetchFirstDialect d = new FetchFirstDialect();
    SqlStatement st = d.compileSelect(SelectQuery.from("t").withColumns("t.a").withLimit(3));
    assertEquals("select [t].\"a\" from [t] fetch first 3 rows only", st.sql());
  }

  @Test
  void compilesInserts() {
    SqlStatement st = dialect.compileInsert(InsertAst.of("users", List.of(
        row("name", "a", "age", 1),
        row("name", "b"))));
    assertEquals("insert into \"users\" (\"name\", \"age\") values (?, ?), (?, ?)", st.sql());
    assertEquals(Arrays.asList("a", 1, "b", null), st.bindings());

    SqlStatement positional = dialect.compileInsert(InsertAst.of("t", List.of(List.of(1, 2))));
    assertEquals("insert into \"t\" values (?, ?)", positional.sql());

    assertEquals("insert into \"t\" default values", dialect.compileInsert(InsertAst.of("t", List.of())).sql());
  }

  @Test
  void insertWithColumnsReordersNamedRows() {
    SqlStatement st = dialect.compileInsertWithColumns(TableRef.of("t"), ColumnRef.of("b", "a"),
        Row.all(List.of(row("a", 1, "b", 2))));
    assertEquals("insert into \"t\" (\"b\", \"a\") values (?, ?)", st.sql());
    assertEquals(List.of(2, 1), st.bindings());
  }

  @Test
  void compilesUpdateDeleteTruncate() {
    SqlStatement upd = dialect.compileUpdate(new UpdateAst(TableRef.of("users"),
        List.of(ColumnValue.of("name", "x"), ColumnValue.of("n", RawExpression.of("\"n\" + 1"))),
        eq("id", 5)));
    assertEquals("update \"users\" set \"name\" = ?, \"n\" = \"n\" + 1 where \"id\" = ?", upd.sql());
    assertEquals(List.of("x", 5), upd.bindings());

    assertEquals("delete from \"users\" where \"id\" = ?", dialect.compileDelete(DeleteAst.of("users", eq("id", 1))).sql());
    assertEquals("delete from \"users\"", dialect.compileDelete(DeleteAst.of("users", null)).sql());
    assertEquals("truncate table \"users\"", dialect.compileTruncate(TruncateAst.of("users")).sql());
  }

  @Test
  void updateWithoutAssignmentsIsRejected() {
    assertThrows(QueryValidationException.class,
        () -> dialect.compileUpdate(new UpdateAst(TableRef.of("t"), List.of(), null)));
  }

  @Test
  void upsertAndInsertOrIgnoreAreUnsupported() {
    assertThrows(UnsupportedOperationException.class,
        () -> dialect.compileUpsert(UpsertAst.of("t", List.of(row("id", 1)), List.of("id"), List.of())));
    assertThrows(UnsupportedOperationException.class,
        () -> dialect.compileInsertOrIgnore(InsertAst.of("t", List.of(row("id", 1)))));
  }

  @Test
  void compileDmlDispatchesOnType() {
    assertEquals("truncate table \"t\"", dialect.compileDml(TruncateAst.of("t")).sql());
    assertEquals("delete from \"t\"", dialect.compileDml(DeleteAst.of("t", null)).sql());
  }

  @Test
  void valuesForPadsAndOrders() {
    List<ColumnRef> cols = ColumnRef.of("a", "b", "c");
    assertEquals(Arrays.asList(1, 2, null), GenericSqlGrammar.valuesFor(Row.positional(1, 2), cols));
    assertEquals(Arrays.asList(null, 2, null), GenericSqlGrammar.valuesFor(Row.of(row("b", 2)), cols));
    assertEquals(Arrays.asList("s", null, null), GenericSqlGrammar.valuesFor(Row.of("s"), cols));
  }

  @Test
  void splitAliasIsCaseInsensitive() {
    assertArrayEquals(new String[]{"users", "u"}, GenericSqlGrammar.splitAlias("users AS u"));
    assertNull(GenericSqlGrammar.splitAlias("users"));
  }
}
