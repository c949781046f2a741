package io.intellixity.snowgate.query;

import io.intellixity.snowgate.sql.ColumnRef;

import java.util.Collection;
import java.util.List;

public final class QueryFilters {
  private QueryFilters() {}

  public static Condition eq(String column, Object value) { return Condition.of(column, Operator.EQ, value); }
  public static Condition ne(String column, Object value) { return Condition.of(column, Operator.NE, value); }
  public static Condition gt(String column, Object value) { return Condition.of(column, Operator.GT, value); }
  public static Condition ge(String column, Object value) { return Condition.of(column, Operator.GE, value); }
  public static Condition lt(String column, Object value) { return Condition.of(column, Operator.LT, value); }
  public static Condition le(String column, Object value) { return Condition.of(column, Operator.LE, value); }

  public static Condition in(String column, Collection<?> values) { return Condition.of(column, Operator.IN, values); }
  public static Condition nin(String column, Collection<?> values) { return Condition.of(column, Operator.NIN, values); }

  public static Condition range(String column, Object lower, Object upper) { return Condition.range(column, lower, upper); }

  public static Condition like(String column, Object value) { return Condition.of(column, Operator.LIKE, value); }
  public static Condition ilike(String column, Object value) { return Condition.of(column, Operator.ILIKE, value); }

  public static Condition isNull(String column) { return Condition.of(column, Operator.EQ, null); }
  public static Condition isNotNull(String column) { return Condition.of(column, Operator.NE, null); }

  /** Column-to-column comparison (join keys, {@code whereColumn}). */
  public static ColumnComparison columns(String first, Operator operator, String second) {
    return new ColumnComparison(ColumnRef.of(first), operator, ColumnRef.of(second));
  }

  public static ColumnComparison columnsEq(String first, String second) {
    return columns(first, Operator.EQ, second);
  }

  public static RawPredicate raw(String sql, Object... bindings) {
    return RawPredicate.of(sql, bindings);
  }

  public static LogicalGroup and(QueryElement... elements) {
    return new LogicalGroup(Clause.AND, List.of(elements));
  }

  public static LogicalGroup or(QueryElement... elements) {
    return new LogicalGroup(Clause.OR, List.of(elements));
  }

  public static NotElement not(QueryElement element) {
    return new NotElement(element);
  }
}
