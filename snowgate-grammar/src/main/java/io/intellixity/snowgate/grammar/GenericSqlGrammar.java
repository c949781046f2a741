package io.intellixity.snowgate.grammar;

import io.intellixity.snowgate.config.GrammarConfig;
import io.intellixity.snowgate.dmlast.*;
import io.intellixity.snowgate.query.*;
import io.intellixity.snowgate.query.aggregation.Aggregate;
import io.intellixity.snowgate.spi.exec.DefaultQueryValidationStrategy;
import io.intellixity.snowgate.spi.exec.QueryValidationStrategy;
import io.intellixity.snowgate.spi.sql.SqlDialect;
import io.intellixity.snowgate.spi.sql.SqlStatement;
import io.intellixity.snowgate.sql.ColumnRef;
import io.intellixity.snowgate.sql.RawExpression;
import io.intellixity.snowgate.sql.TableRef;

import java.util.*;

/**
 * Generic relational SQL assembly.\n
 *
 * Provides common rendering for:\n
 * - select: aggregate, columns, from, joins, wheres, groups, havings, orders, limit, offset, lock, unions\n
 * - DML: insert/update/delete/truncate with {@code ?} placeholders\n
 *
 * Every identifier, literal and clause hook is called through the {@link SqlDialect} given at construction,
 * so a dialect that owns a grammar gets its own overrides applied throughout.
 */
public final class GenericSqlGrammar {
  /** Collects positional bindings while rendering. */
  static final class RenderCtx {
    private final List<Object> bindings = new ArrayList<>();

    String add(Object value) {
      if (value instanceof RawExpression raw) return raw.sql();
      bindings.add(value);
      return "?";
    }

    void addAll(List<Object> values) {
      bindings.addAll(values);
    }

    List<Object> bindings() { return bindings; }
  }

  private final GrammarConfig config;
  private final SqlDialect hooks;
  private final QueryValidationStrategy validation;

  public GenericSqlGrammar(GrammarConfig config, SqlDialect hooks) {
    this(config, hooks, new DefaultQueryValidationStrategy());
  }

  public GenericSqlGrammar(GrammarConfig config, SqlDialect hooks, QueryValidationStrategy validation) {
    this.config = (config == null) ? GrammarConfig.defaults() : config;
    this.hooks = Objects.requireNonNull(hooks, "hooks");
    this.validation = (validation == null) ? new DefaultQueryValidationStrategy() : validation;
  }

  public GrammarConfig config() { return config; }

  public QueryValidationStrategy validation() { return validation; }

  // --- identifiers ---

  /** ANSI table wrapping: each dotted segment double-quoted, prefix on the last segment. */
  public String wrapTable(TableRef table) {
    if (table instanceof RawExpression raw) return raw.sql();
    String name = ((TableRef.Named) table).name().trim();
    String[] alias = splitAlias(name);
    if (alias != null) {
      return wrapTable(TableRef.of(alias[0])) + " as " + quoteIdent(alias[1]);
    }
    String[] segments = name.split("\\.");
    List<String> out = new ArrayList<>(segments.length);
    for (int i = 0; i < segments.length; i++) {
      String seg = (i == segments.length - 1) ? config.tablePrefix() + segments[i] : segments[i];
      out.add(quoteIdent(seg));
    }
    return String.join(".", out);
  }

  /** ANSI column wrapping: each segment double-quoted, {@code *} untouched. */
  public String wrapColumn(ColumnRef column) {
    if (column instanceof RawExpression raw) return raw.sql();
    return hooks.wrap(((ColumnRef.Named) column).name());
  }

  /** Dotted path: first segment as a table when there are several, the rest as columns. */
  public String wrap(String value) {
    String v = value.trim();
    String[] alias = splitAlias(v);
    if (alias != null) {
      return hooks.wrap(alias[0]) + " as " + hooks.wrap(alias[1]);
    }
    String[] segments = v.split("\\.");
    if (segments.length == 1) return "*".equals(v) ? v : quoteIdent(v);
    List<String> out = new ArrayList<>(segments.length);
    out.add(hooks.wrapTable(TableRef.of(segments[0])));
    for (int i = 1; i < segments.length; i++) {
      out.add("*".equals(segments[i]) ? "*" : quoteIdent(segments[i]));
    }
    return String.join(".", out);
  }

  public String columnize(List<ColumnRef> columns) {
    List<String> out = new ArrayList<>(columns.size());
    for (ColumnRef c : columns) out.add(hooks.wrapColumn(c));
    return String.join(", ", out);
  }

  /** {@code name as alias} (case-insensitive keyword) split into its two sides, or null. */
  public static String[] splitAlias(String value) {
    String lower = value.toLowerCase(Locale.ROOT);
    int at = lower.indexOf(" as ");
    if (at < 0) return null;
    return new String[]{value.substring(0, at).trim(), value.substring(at + 4).trim()};
  }

  private static String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  // --- select ---

  public SqlStatement compileSelect(SelectQuery q) {
    validation.validateSelect(q);
    RenderCtx ctx = new RenderCtx();

    List<String> parts = new ArrayList<>();
    parts.add(q.aggregate() != null ? compileAggregate(q, q.aggregate()) : compileColumns(q));
    if (q.table() != null) parts.add("from " + hooks.wrapTable(q.table()));
    for (Join j : q.joins()) parts.add(compileJoin(j, ctx));
    parts.add(clause("where", q.where(), ctx));
    if (!q.groups().isEmpty()) parts.add("group by " + hooks.columnize(q.groups()));
    parts.add(clause("having", q.having(), ctx));
    if (!q.orders().isEmpty()) parts.add(compileOrders(q.orders()));
    if (q.limit() != null) parts.add(hooks.compileLimit(q.limit()));
    if (q.offset() != null) parts.add(hooks.compileOffset(q.offset()));
    if (q.lock() != null) parts.add(hooks.compileLock(q.lock()));

    String sql = joinParts(parts);
    if (!q.unions().isEmpty()) sql = hooks.wrapUnion(sql) + " " + compileUnions(q, ctx);
    return new SqlStatement(sql, ctx.bindings());
  }

  private String compileColumns(SelectQuery q) {
    String select = q.distinct() ? "select distinct " : "select ";
    return select + (q.columns().isEmpty() ? "*" : hooks.columnize(q.columns()));
  }

  private String compileAggregate(SelectQuery q, Aggregate agg) {
    String cols = hooks.columnize(agg.columns());
    if (q.distinct() && !"*".equals(cols)) cols = "distinct " + cols;
    return "select " + agg.function() + "(" + cols + ") as aggregate";
  }

  private String compileJoin(Join j, RenderCtx ctx) {
    String sql = j.type().sql() + " " + hooks.wrapTable(j.table());
    String on = clause("on", j.on(), ctx);
    return on.isEmpty() ? sql : sql + " " + on;
  }

  private String compileOrders(List<SortField> orders) {
    List<String> out = new ArrayList<>(orders.size());
    for (SortField sf : orders) {
      out.add(hooks.wrapColumn(sf.column()) + (sf.direction() == SortField.Direction.DESC ? " desc" : " asc"));
    }
    return "order by " + String.join(", ", out);
  }

  private String compileUnions(SelectQuery q, RenderCtx ctx) {
    List<String> parts = new ArrayList<>();
    for (Union u : q.unions()) {
      SqlStatement branch = hooks.compileSelect(u.query());
      ctx.addAll(branch.bindings());
      parts.add((u.all() ? "union all " : "union ") + hooks.wrapUnion(branch.sql()));
    }
    if (!q.unionOrders().isEmpty()) parts.add(compileOrders(q.unionOrders()));
    if (q.unionLimit() != null) parts.add(hooks.compileLimit(q.unionLimit()));
    if (q.unionOffset() != null) parts.add(hooks.compileOffset(q.unionOffset()));
    return joinParts(parts);
  }

  public String compileLimit(Number limit) {
    return (limit == null) ? "" : "limit " + limit.longValue();
  }

  public String compileOffset(Number offset) {
    return (offset == null) ? "" : "offset " + offset.longValue();
  }

  public String compileLock(LockMode lock) {
    if (lock == null) return "";
    return (lock == LockMode.SHARED) ? "for share" : "for update";
  }

  public String wrapUnion(String sql) {
    return "(" + sql + ")";
  }

  // --- predicates ---

  /** Renders a predicate tree; the top level is not parenthesised. */
  String renderPredicate(QueryElement el, RenderCtx ctx) {
    return el.accept(new PredicateRenderer(hooks, ctx));
  }

  private String clause(String keyword, QueryElement el, RenderCtx ctx) {
    if (el == null) return "";
    String sql = renderPredicate(el, ctx);
    return sql.isBlank() ? "" : keyword + " " + sql;
  }

  /** Standalone predicate rendering, for dialects assembling their own statements. */
  public SqlStatement compilePredicate(QueryElement el) {
    if (el == null) return SqlStatement.empty();
    RenderCtx ctx = new RenderCtx();
    return new SqlStatement(renderPredicate(el, ctx), ctx.bindings());
  }

  // --- writes ---

  public SqlStatement compileInsert(InsertAst ins) {
    String table = hooks.wrapTable(ins.table());
    if (ins.rows().isEmpty()) return new SqlStatement("insert into " + table + " default values");

    RenderCtx ctx = new RenderCtx();
    Row first = ins.rows().get(0);
    List<ColumnRef> columns = !ins.columns().isEmpty()
        ? ins.columns()
        : (first instanceof Row.Named && !first.positional()) ? ColumnRef.ofAll(first.keys()) : List.of();

    List<String> tuples = new ArrayList<>(ins.rows().size());
    for (Row r : ins.rows()) {
      List<Object> values = columns.isEmpty() ? r.orderedValues() : valuesFor(r, columns);
      List<String> ph = new ArrayList<>(values.size());
      for (Object v : values) ph.add(ctx.add(v));
      tuples.add("(" + String.join(", ", ph) + ")");
    }

    String cols = columns.isEmpty() ? "" : " (" + hooks.columnize(columns) + ")";
    return new SqlStatement("insert into " + table + cols + " values " + String.join(", ", tuples), ctx.bindings());
  }

  public SqlStatement compileInsertWithColumns(TableRef table, List<ColumnRef> columns, List<Row> rows) {
    return hooks.compileInsert(new InsertAst(table, columns, rows));
  }

  public SqlStatement compileInsertOrIgnore(InsertAst ins) {
    throw new UnsupportedOperationException("insert-or-ignore is not supported by dialect: " + hooks.id());
  }

  public SqlStatement compileUpsert(UpsertAst ups) {
    throw new UnsupportedOperationException("upsert is not supported by dialect: " + hooks.id());
  }

  public SqlStatement compileUpdate(UpdateAst upd) {
    validation.validateUpdate(upd);
    RenderCtx ctx = new RenderCtx();
    List<String> sets = new ArrayList<>(upd.sets().size());
    for (ColumnValue cv : upd.sets()) {
      sets.add(hooks.wrapColumn(cv.column()) + " = " + ctx.add(cv.value()));
    }
    String sql = "update " + hooks.wrapTable(upd.table()) + " set " + String.join(", ", sets);
    String where = clause("where", upd.where(), ctx);
    if (!where.isEmpty()) sql += " " + where;
    return new SqlStatement(sql, ctx.bindings());
  }

  public SqlStatement compileDelete(DeleteAst del) {
    RenderCtx ctx = new RenderCtx();
    String sql = "delete from " + hooks.wrapTable(del.table());
    String where = clause("where", del.where(), ctx);
    if (!where.isEmpty()) sql += " " + where;
    return new SqlStatement(sql, ctx.bindings());
  }

  public SqlStatement compileTruncate(TruncateAst t) {
    return new SqlStatement("truncate table " + hooks.wrapTable(t.table()));
  }

  /**
   * Values of {@code row} in the order of {@code columns}.\n
   *
   * Named rows are looked up by column key; positional rows are matched by index; a scalar fills the
   * first column. Missing values become null, so the result always has one value per column.
   */
  public static List<Object> valuesFor(Row row, List<ColumnRef> columns) {
    List<Object> out = new ArrayList<>(columns.size());
    if (row instanceof Row.Named && !row.positional()) {
      for (ColumnRef c : columns) out.add(row.get(c.key()));
      return out;
    }
    List<Object> source = row.orderedValues();
    for (int i = 0; i < columns.size(); i++) out.add(i < source.size() ? source.get(i) : null);
    return out;
  }

  private static String joinParts(List<String> parts) {
    StringBuilder sb = new StringBuilder();
    for (String p : parts) {
      if (p == null || p.isBlank()) continue;
      if (sb.length() > 0) sb.append(' ');
      sb.append(p);
    }
    return sb.toString();
  }
}
