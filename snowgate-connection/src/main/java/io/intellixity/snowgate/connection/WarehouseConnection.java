package io.intellixity.snowgate.connection;

import io.intellixity.snowgate.dmlast.*;
import io.intellixity.snowgate.exec.Propagation;
import io.intellixity.snowgate.grammar.bind.BindingSubstitution;
import io.intellixity.snowgate.query.SelectQuery;
import io.intellixity.snowgate.spi.exec.QueryResult;
import io.intellixity.snowgate.spi.exec.QueryService;
import io.intellixity.snowgate.spi.exec.WarehouseException;
import io.intellixity.snowgate.spi.sql.SqlDialect;
import io.intellixity.snowgate.spi.sql.SqlStatement;
import io.intellixity.snowgate.sql.ColumnRef;
import io.intellixity.snowgate.sql.TableRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.*;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Connection facade over a remote {@link QueryService}.\n
 *
 * Every call compiles with the dialect, inlines bindings ({@link BindingSubstitution}) and sends exactly one
 * literal SQL statement to the service.\n
 *
 * Transactions are simulated: the service has no transaction primitive, so begin/commit/rollback only move a
 * nesting counter and notify {@link TransactionListener}s. Nothing is atomic and nothing is rolled back on the
 * warehouse. Not thread-safe; use one connection per request/thread.
 */
public final class WarehouseConnection {
  private static final Logger log = LoggerFactory.getLogger(WarehouseConnection.class);

  private final String name;
  private final SqlDialect dialect;
  private final QueryService service;
  private final BindingSubstitution substitution;
  private final List<TransactionListener> listeners = new ArrayList<>();

  private int transactions;
  private List<String> pretended;

  public WarehouseConnection(String name, SqlDialect dialect, QueryService service) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.name = (name == null || name.isBlank()) ? dialect.id() : name;
    this.service = Objects.requireNonNull(service, "service");
    this.substitution = new BindingSubstitution(dialect);
  }

  public String name() { return name; }
  public SqlDialect dialect() { return dialect; }

  // --- reads ---

  public List<Map<String, Object>> select(SelectQuery query) {
    SqlStatement st = dialect.compileSelect(query);
    return select(st.sql(), st.bindings());
  }

  public List<Map<String, Object>> select(String sql, List<?> bindings) {
    return ResultRows.toMaps(run("select", sql, bindings));
  }

  public Optional<Map<String, Object>> selectOne(SelectQuery query) {
    SqlStatement st = dialect.compileSelect(query);
    return selectOne(st.sql(), st.bindings());
  }

  public Optional<Map<String, Object>> selectOne(String sql, List<?> bindings) {
    List<Map<String, Object>> rows = select(sql, bindings);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  // --- statements ---

  /** Runs a statement; true once the service accepted it. */
  public boolean statement(String sql, List<?> bindings) {
    QueryResult r = run("statement", sql, bindings);
    return r.count() >= 0;
  }

  /**
   * Runs a statement and reports the affected row count: the sum of the {@code number of rows ...} columns of
   * the first result row when the warehouse returns them, the number of result rows otherwise.
   */
  public long affectingStatement(String sql, List<?> bindings) {
    return affectedRows(run("affectingStatement", sql, bindings));
  }

  public boolean insert(InsertAst insert) {
    return execute("insert", dialect.compileInsert(insert));
  }

  /** Insert with declared columns; rows are reordered to them. No rows: nothing is sent. */
  public boolean insertWithColumns(String table, List<String> columns, List<?> rows) {
    return insertWithColumns(TableRef.of(table), ColumnRef.ofAll(columns), Row.all(rows));
  }

  public boolean insertWithColumns(TableRef table, List<ColumnRef> columns, List<Row> rows) {
    if (rows == null || rows.isEmpty()) {
      if (log.isDebugEnabled()) log.debug("snowgate.conn name={} op=insertWithColumns rows=0 skipped=true", name);
      return true;
    }
    return execute("insertWithColumns", dialect.compileInsertWithColumns(table, columns, rows));
  }

  /** Dialect permitting, duplicates are skipped; Snowflake inserts them anyway. */
  public long insertOrIgnore(InsertAst insert) {
    SqlStatement st = dialect.compileInsertOrIgnore(insert);
    return affectedRows(run("insertOrIgnore", st.sql(), st.bindings()));
  }

  /**
   * Inserts, then reads {@code max(idColumn)} back. Numeric ids are returned as {@link Long}.
   * Concurrent writers can make the returned id someone else's.
   */
  public Object insertGetId(InsertAst insert, String idColumn) {
    String id = (idColumn == null || idColumn.isBlank()) ? "id" : idColumn;
    insert(insert);
    String col = dialect.wrap(id);
    SelectQuery max = SelectQuery.from(insert.table()).withColumnRaw("max(" + col + ") as " + col);
    Object value = selectOne(max).map(r -> column(r, id)).orElse(null);
    if (value instanceof Number n && !(n instanceof Double || n instanceof Float)) return n.longValue();
    if (value instanceof String s && s.matches("-?\\d{1,18}")) return Long.parseLong(s);
    return value;
  }

  /** Merge; an upsert without rows compiles to nothing and is not sent. */
  public long upsert(UpsertAst upsert) {
    SqlStatement st = dialect.compileUpsert(upsert);
    if (st.isEmpty()) return 0;
    return affectedRows(run("upsert", st.sql(), st.bindings()));
  }

  public long update(UpdateAst update) {
    SqlStatement st = dialect.compileUpdate(update);
    return affectedRows(run("update", st.sql(), st.bindings()));
  }

  public long delete(DeleteAst delete) {
    SqlStatement st = dialect.compileDelete(delete);
    return affectedRows(run("delete", st.sql(), st.bindings()));
  }

  public boolean truncate(String table) {
    return execute("truncate", dialect.compileTruncate(TruncateAst.of(table)));
  }

  // --- pretend ---

  /** Runs {@code work} without contacting the service and returns the SQL it would have sent, in order. */
  public List<String> pretend(Runnable work) {
    List<String> outer = pretended;
    List<String> captured = new ArrayList<>();
    pretended = captured;
    try {
      work.run();
    } finally {
      pretended = outer;
    }
    return List.copyOf(captured);
  }

  public boolean pretending() { return pretended != null; }

  // --- simulated transactions ---

  public void addTransactionListener(TransactionListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeTransactionListener(TransactionListener listener) {
    listeners.remove(listener);
  }

  public void beginTransaction() {
    transactions++;
    if (log.isDebugEnabled()) log.debug("snowgate.tx name={} op=begin level={}", name, transactions);
    fire(TransactionEvent.BEGAN, transactions);
  }

  public void commit() {
    if (transactions == 1) fire(TransactionEvent.COMMITTING, transactions);
    transactions = Math.max(0, transactions - 1);
    if (log.isDebugEnabled()) log.debug("snowgate.tx name={} op=commit level={}", name, transactions);
    fire(TransactionEvent.COMMITTED, transactions);
  }

  public void rollBack() {
    rollBack(transactions - 1);
  }

  /** Unwinds to {@code toLevel}; levels outside {@code [0, transactionLevel())} are ignored. */
  public void rollBack(int toLevel) {
    if (toLevel < 0 || toLevel >= transactions) return;
    if (log.isDebugEnabled()) log.debug("snowgate.tx name={} op=rollback from={} to={}", name, transactions, toLevel);
    transactions = toLevel;
    fire(TransactionEvent.ROLLING_BACK, transactions);
  }

  public int transactionLevel() { return transactions; }

  public boolean inTransaction() { return transactions > 0; }

  /** Commits on success; on failure rolls one level back and rethrows. */
  public <T> T transaction(Function<WarehouseConnection, T> work) {
    Objects.requireNonNull(work, "work");
    beginTransaction();
    T result;
    try {
      result = work.apply(this);
    } catch (RuntimeException | Error e) {
      rollBack();
      throw e;
    }
    commit();
    return result;
  }

  public <T> T inTx(Propagation propagation, Supplier<T> work) {
    Objects.requireNonNull(propagation, "propagation");
    Objects.requireNonNull(work, "work");
    return switch (propagation) {
      case REQUIRED -> inTransaction() ? work.get() : transaction(c -> work.get());
      case SUPPORTS -> work.get();
      case MANDATORY -> {
        if (!inTransaction()) throw new IllegalStateException("No existing transaction for propagation=MANDATORY");
        yield work.get();
      }
      case REQUIRES_NEW, NESTED -> transaction(c -> work.get());
      case NEVER -> {
        if (inTransaction()) throw new IllegalStateException("Existing transaction found for propagation=NEVER");
        yield work.get();
      }
    };
  }

  private void fire(TransactionEvent event, int level) {
    for (TransactionListener l : List.copyOf(listeners)) l.onTransaction(event, level);
  }

  // --- execution ---

  private boolean execute(String op, SqlStatement st) {
    QueryResult r = run(op, st.sql(), st.bindings());
    return r.count() >= 0;
  }

  private QueryResult run(String op, String sql, List<?> bindings) {
    String prepared = substitution.apply(sql, bindings);
    if (pretended != null) {
      pretended.add(prepared);
      if (log.isDebugEnabled()) log.debug("snowgate.conn name={} op={} pretend=true sql={}", name, op, prepared);
      return QueryResult.empty();
    }

    debugSql(op, prepared, bindings);
    long start = System.nanoTime();
    QueryResult result;
    try {
      result = service.executeQuery(prepared);
    } catch (WarehouseException e) {
      log.error("snowgate.conn name={} op={} code={} error={}", name, op, e.code(), e.getMessage());
      throw e;
    } catch (RuntimeException e) {
      log.error("snowgate.conn name={} op={} error={}", name, op, e.toString());
      throw new WarehouseException("Query failed on connection '" + name + "': " + e.getMessage(), 0,
          Map.of("connection", name, "op", op), e);
    }
    if (result == null) result = QueryResult.empty();
    debugDone(op, result, System.nanoTime() - start);
    return result;
  }

  private void debugSql(String op, String sql, List<?> bindings) {
    if (!log.isDebugEnabled()) return;
    log.debug("snowgate.conn name={} op={} bindingCount={} txLevel={} sql={}",
        name, op, bindings == null ? 0 : bindings.size(), transactions, sql);

    // TRACE: binding summary only (no raw values)
    if (log.isTraceEnabled() && bindings != null && !bindings.isEmpty()) {
      int idx = 1;
      for (Object v : bindings) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("snowgate.conn bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private void debugDone(String op, QueryResult result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("snowgate.conn_done name={} op={} durationMs={} executed={} rows={} statementHandle={}",
        name, op, durationNanos / 1_000_000.0, result.executed(), result.count(), result.statementHandle());
  }

  // unquoted aliases come back upper-cased
  private static Object column(Map<String, Object> row, String name) {
    if (row.containsKey(name)) return row.get(name);
    for (var e : row.entrySet()) {
      if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
    }
    return null;
  }

  static long affectedRows(QueryResult r) {
    if (r.isEmpty()) return 0;
    List<QueryResult.ResultColumn> cols = r.columns();
    List<Object> first = r.data().get(0);
    boolean found = false;
    long sum = 0;
    for (int i = 0; i < cols.size() && i < first.size(); i++) {
      String n = cols.get(i).name();
      if (n == null || !n.toLowerCase(Locale.ROOT).startsWith("number of rows")) continue;
      found = true;
      sum += toLong(first.get(i));
    }
    return found ? sum : r.count();
  }

  private static long toLong(Object v) {
    if (v instanceof Number n) return n.longValue();
    if (v instanceof String s && !s.isBlank()) {
      try {
        return new BigDecimal(s.trim()).longValue();
      } catch (NumberFormatException e) {
        return 0;
      }
    }
    return 0;
  }
}
