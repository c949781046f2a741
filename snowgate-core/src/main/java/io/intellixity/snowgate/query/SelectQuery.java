package io.intellixity.snowgate.query;

import io.intellixity.snowgate.query.aggregation.Aggregate;
import io.intellixity.snowgate.sql.ColumnRef;
import io.intellixity.snowgate.sql.RawExpression;
import io.intellixity.snowgate.sql.TableRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Abstract select statement read by the grammars.
 * <p>
 * Built fluently by the caller; compilers only read it.
 */
public final class SelectQuery {
  private TableRef table;
  private boolean distinct;
  private List<ColumnRef> columns = new ArrayList<>();
  private Aggregate aggregate;
  private final List<Join> joins = new ArrayList<>();
  private QueryElement where;
  private final List<ColumnRef> groups = new ArrayList<>();
  private QueryElement having;
  private final List<SortField> orders = new ArrayList<>();
  private Number limit;
  private Number offset;
  private LockMode lock;
  private final List<Union> unions = new ArrayList<>();
  private final List<SortField> unionOrders = new ArrayList<>();
  private Number unionLimit;
  private Number unionOffset;

  public SelectQuery() {}

  public static SelectQuery from(String table) {
    return new SelectQuery().withTable(TableRef.of(table));
  }

  public static SelectQuery from(TableRef table) {
    return new SelectQuery().withTable(table);
  }

  public TableRef table() { return table; }
  public boolean distinct() { return distinct; }
  public List<ColumnRef> columns() { return Collections.unmodifiableList(columns); }
  public Aggregate aggregate() { return aggregate; }
  public List<Join> joins() { return Collections.unmodifiableList(joins); }
  public QueryElement where() { return where; }
  public List<ColumnRef> groups() { return Collections.unmodifiableList(groups); }
  public QueryElement having() { return having; }
  public List<SortField> orders() { return Collections.unmodifiableList(orders); }
  public Number limit() { return limit; }
  public Number offset() { return offset; }
  public LockMode lock() { return lock; }
  public List<Union> unions() { return Collections.unmodifiableList(unions); }
  public List<SortField> unionOrders() { return Collections.unmodifiableList(unionOrders); }
  public Number unionLimit() { return unionLimit; }
  public Number unionOffset() { return unionOffset; }

  public SelectQuery withTable(TableRef table) { this.table = table; return this; }
  public SelectQuery withDistinct(boolean distinct) { this.distinct = distinct; return this; }
  public SelectQuery withColumns(List<ColumnRef> columns) { this.columns = new ArrayList<>(columns == null ? List.of() : columns); return this; }
  public SelectQuery withColumns(String... columns) { return withColumns(ColumnRef.of(columns)); }
  public SelectQuery withColumnRaw(String sql) { this.columns.add(new RawExpression(sql)); return this; }
  public SelectQuery withAggregate(Aggregate aggregate) { this.aggregate = aggregate; return this; }
  public SelectQuery withJoin(Join join) { this.joins.add(join); return this; }

  public SelectQuery withJoin(JoinType type, String table, QueryElement on) {
    return withJoin(new Join(type, TableRef.of(table), on));
  }

  /** Replaces the where tree. */
  public SelectQuery withWhere(QueryElement where) { this.where = where; return this; }

  /** Adds a predicate joined to the existing where tree with AND. */
  public SelectQuery where(QueryElement element) {
    this.where = combine(this.where, element, Clause.AND);
    return this;
  }

  /** Adds a predicate joined to the existing where tree with OR. */
  public SelectQuery orWhere(QueryElement element) {
    this.where = combine(this.where, element, Clause.OR);
    return this;
  }

  public SelectQuery withGroupBy(String... columns) { this.groups.addAll(ColumnRef.of(columns)); return this; }
  public SelectQuery withGroupBy(List<ColumnRef> columns) { if (columns != null) this.groups.addAll(columns); return this; }
  public SelectQuery withHaving(QueryElement having) { this.having = having; return this; }
  public SelectQuery withOrderBy(SortField sort) { this.orders.add(sort); return this; }
  public SelectQuery withLimit(Number limit) { this.limit = limit; return this; }
  public SelectQuery withOffset(Number offset) { this.offset = offset; return this; }
  public SelectQuery withLock(LockMode lock) { this.lock = lock; return this; }
  public SelectQuery withUnion(SelectQuery query) { this.unions.add(new Union(query, false)); return this; }
  public SelectQuery withUnionAll(SelectQuery query) { this.unions.add(new Union(query, true)); return this; }
  public SelectQuery withUnionOrderBy(SortField sort) { this.unionOrders.add(sort); return this; }
  public SelectQuery withUnionLimit(Number limit) { this.unionLimit = limit; return this; }
  public SelectQuery withUnionOffset(Number offset) { this.unionOffset = offset; return this; }

  private static QueryElement combine(QueryElement current, QueryElement next, Clause clause) {
    if (next == null) return current;
    if (current == null) return next;
    if (current instanceof LogicalGroup g && g.clause() == clause) {
      List<QueryElement> els = new ArrayList<>(g.elements());
      els.add(next);
      return new LogicalGroup(clause, els);
    }
    return new LogicalGroup(clause, List.of(current, next));
  }
}
