package io.intellixity.snowgate.snowflake;

import io.intellixity.snowgate.config.GrammarConfig;
import io.intellixity.snowgate.dmlast.*;
import io.intellixity.snowgate.grammar.GenericSqlGrammar;
import io.intellixity.snowgate.grammar.SqlLiterals;
import io.intellixity.snowgate.query.LockMode;
import io.intellixity.snowgate.query.SelectQuery;
import io.intellixity.snowgate.spi.exec.QueryValidationStrategy;
import io.intellixity.snowgate.spi.sql.SqlDialect;
import io.intellixity.snowgate.spi.sql.SqlStatement;
import io.intellixity.snowgate.sql.ColumnRef;
import io.intellixity.snowgate.sql.TableRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Snowflake dialect.
 *
 * Keeps only Snowflake-specific hooks; generic clause assembly lives in {@link GenericSqlGrammar}, which this
 * dialect owns and which calls back into it.\n
 *
 * Divergences from the generic grammar:\n
 * - tables upper-cased and quoted, columns left bare ({@link SnowflakeIdentifierWrapper})\n
 * - no row locking: lock clauses render empty\n
 * - union sides wrapped as {@code select * from (...)}\n
 * - inserts and merges inline literal values instead of placeholders\n
 * - backslashes in string literals are doubled\n
 * - insert-or-ignore is a plain insert and does NOT ignore duplicates\n
 * - upsert is a {@code merge into ... using (select ... from values ...)}\n
 */
public final class SnowflakeDialect implements SqlDialect {
  private static final Logger log = LoggerFactory.getLogger(SnowflakeDialect.class);

  public static final String ID = "snowflake";
  public static final String UPSERT_SOURCE = "upsert_source";

  private final GrammarConfig config;
  private final SnowflakeIdentifierWrapper identifiers;
  private final GenericSqlGrammar grammar;

  public SnowflakeDialect() {
    this(GrammarConfig.defaults());
  }

  public SnowflakeDialect(GrammarConfig config) {
    this(config, null);
  }

  public SnowflakeDialect(GrammarConfig config, QueryValidationStrategy validation) {
    this.config = (config == null) ? GrammarConfig.defaults() : config;
    this.identifiers = new SnowflakeIdentifierWrapper(this.config);
    this.grammar = new GenericSqlGrammar(this.config, this, validation);
  }

  @Override public String id() { return ID; }
  @Override public GrammarConfig config() { return config; }

  @Override public String wrapTable(TableRef table) { return identifiers.wrapTable(table); }
  @Override public String wrapColumn(ColumnRef column) { return identifiers.wrapColumn(column); }
  @Override public String wrap(String value) { return identifiers.wrap(value); }
  @Override public String columnize(List<ColumnRef> columns) { return grammar.columnize(columns); }
  @Override public String parameter(Object value) { return SqlLiterals.render(value, SnowflakeDialect::quote); }

  /** Backslash is an escape in Snowflake string constants: doubled first, then single quotes. */
  static String quote(String text) {
    return "'" + text.replace("\\", "\\\\").replace("'", "''") + "'";
  }

  // --- select ---

  @Override
  public SqlStatement compileSelect(SelectQuery query) {
    return traced("select", grammar.compileSelect(query));
  }

  @Override
  public String compileLimit(Number limit) {
    return (limit == null) ? "" : "limit " + limit.longValue();
  }

  @Override
  public String compileOffset(Number offset) {
    return (offset == null) ? "" : "offset " + offset.longValue();
  }

  /** Snowflake has no {@code for update}/{@code for share}; the lock is dropped. */
  @Override
  public String compileLock(LockMode lock) {
    if (lock != null && debug()) log.debug("snowgate.sql dialect={} op=lock ignored={}", ID, lock);
    return "";
  }

  @Override
  public String wrapUnion(String sql) {
    return "select * from (" + sql + ")";
  }

  // --- inserts ---

  @Override
  public SqlStatement compileInsert(InsertAst ins) {
    String table = wrapTable(ins.table());
    if (ins.rows().isEmpty()) return traced("insert", new SqlStatement("insert into " + table + " default values"));

    List<ColumnRef> columns = insertColumns(ins.columns(), ins.rows().get(0));
    List<String> tuples = new ArrayList<>(ins.rows().size());
    for (Row r : ins.rows()) tuples.add(insertTuple(r, columns));

    String sql = "insert into " + table + " (" + columnize(columns) + ") values " + String.join(", ", tuples);
    return traced("insert", new SqlStatement(sql));
  }

  /** Declared columns, else {@code col_<i>} for positional rows, else the row's own keys. */
  private static List<ColumnRef> insertColumns(List<ColumnRef> declared, Row first) {
    if (!declared.isEmpty()) return declared;
    if (first instanceof Row.Scalar) return List.of(ColumnRef.of("value"));
    if (first.positional()) {
      List<ColumnRef> out = new ArrayList<>();
      for (String k : first.keys()) out.add(ColumnRef.of("col_" + k));
      return out;
    }
    return ColumnRef.ofAll(first.keys());
  }

  private String insertTuple(Row r, List<ColumnRef> columns) {
    if (r instanceof Row.Scalar s) return "(" + parameter(s.value()) + ")";
    List<Object> values = r.positional() ? r.orderedValues() : GenericSqlGrammar.valuesFor(r, columns);
    return tuple(values);
  }

  private String tuple(List<Object> values) {
    List<String> out = new ArrayList<>(values.size());
    for (Object v : values) out.add(parameter(v));
    return "(" + String.join(", ", out) + ")";
  }

  @Override
  public SqlStatement compileInsertWithColumns(TableRef table, List<ColumnRef> columns, List<Row> rows) {
    if (columns == null || columns.isEmpty()) return compileInsert(new InsertAst(table, List.of(), rows));
    String wrapped = wrapTable(table);
    if (rows == null || rows.isEmpty()) {
      return traced("insert", new SqlStatement("insert into " + wrapped + " default values"));
    }

    List<String> tuples = new ArrayList<>(rows.size());
    for (Row r : rows) tuples.add(tuple(GenericSqlGrammar.valuesFor(r, columns)));

    String sql = "insert into " + wrapped + " (" + columnize(columns) + ") values " + String.join(", ", tuples);
    return traced("insert", new SqlStatement(sql));
  }

  /** Plain insert: Snowflake has no ignore-duplicates syntax, so duplicates are NOT ignored. */
  @Override
  public SqlStatement compileInsertOrIgnore(InsertAst ins) {
    if (debug()) log.debug("snowgate.sql dialect={} op=insertOrIgnore fallback=insert table={}", ID, ins.table());
    return compileInsert(ins);
  }

  // --- merge ---

  @Override
  public SqlStatement compileUpsert(UpsertAst ups) {
    if (ups.rows().isEmpty()) return SqlStatement.empty();
    grammar.validation().validateUpsert(ups);

    String table = wrapTable(ups.table());
    String target = identifiers.qualifier(ups.table());
    List<ColumnRef> columns = insertColumns(List.of(), ups.rows().get(0));
    String cols = columnize(columns);

    List<String> tuples = new ArrayList<>(ups.rows().size());
    for (Row r : ups.rows()) tuples.add(tuple(GenericSqlGrammar.valuesFor(r, columns)));

    List<String> on = new ArrayList<>(ups.uniqueBy().size());
    for (String key : ups.uniqueBy()) {
      String k = wrap(key);
      on.add(target + "." + k + " = " + UPSERT_SOURCE + "." + k);
    }

    List<UpdateAssignment> update = ups.update();
    if (update.isEmpty()) {
      update = new ArrayList<>(columns.size());
      for (ColumnRef c : columns) update.add(UpdateAssignment.fromSource(c.key()));
    }
    List<String> sets = new ArrayList<>(update.size());
    for (UpdateAssignment a : update) {
      String k = wrap(a.column());
      String value = a.fromSource() ? UPSERT_SOURCE + "." + k : a.expression().sql();
      sets.add(target + "." + k + " = " + value);
    }

    List<String> sourceCols = new ArrayList<>(columns.size());
    for (ColumnRef c : columns) sourceCols.add(UPSERT_SOURCE + "." + wrapColumn(c));

    String sql = "merge into " + table
        + " using (select " + cols + " from values " + String.join(", ", tuples)
        + " as " + UPSERT_SOURCE + " (" + cols + ")) as " + UPSERT_SOURCE
        + " on (" + String.join(" and ", on) + ")"
        + " when matched then update set " + String.join(", ", sets)
        + " when not matched then insert (" + cols + ") values (" + String.join(", ", sourceCols) + ")";
    return traced("upsert", new SqlStatement(sql));
  }

  // --- update / delete / truncate ---

  @Override
  public SqlStatement compileUpdate(UpdateAst update) {
    return traced("update", grammar.compileUpdate(update));
  }

  @Override
  public SqlStatement compileDelete(DeleteAst delete) {
    return traced("delete", grammar.compileDelete(delete));
  }

  @Override
  public SqlStatement compileTruncate(TruncateAst truncate) {
    return traced("truncate", new SqlStatement("truncate table " + wrapTable(truncate.table())));
  }

  private boolean debug() {
    return config.debugLogging() && log.isDebugEnabled();
  }

  private SqlStatement traced(String op, SqlStatement st) {
    if (debug()) {
      log.debug("snowgate.sql dialect={} op={} bindingCount={} sql={}", ID, op, st.bindings().size(), st.sql());
    }
    return st;
  }
}
