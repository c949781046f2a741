package io.intellixity.snowgate.spi.sql;

import io.intellixity.snowgate.config.GrammarConfig;
import io.intellixity.snowgate.dmlast.*;
import io.intellixity.snowgate.query.LockMode;
import io.intellixity.snowgate.query.SelectQuery;
import io.intellixity.snowgate.sql.ColumnRef;
import io.intellixity.snowgate.sql.TableRef;

import java.util.List;

/**
 * Capability interface of a SQL dialect: identifier wrapping, literal rendering and statement compilation.
 * <p>
 * Generic clause assembly lives in a grammar that calls back into these hooks, so a dialect replaces
 * individual hooks by delegation instead of subclassing.
 */
public interface SqlDialect {
  String id();

  GrammarConfig config();

  // --- identifiers / literals ---

  String wrapTable(TableRef table);

  String wrapColumn(ColumnRef column);

  /** Wraps a dotted {@code table.column} path: the first segment as a table only when there are several. */
  String wrap(String value);

  /** Comma-joined wrapped columns. */
  String columnize(List<ColumnRef> columns);

  /** Renders one value as literal SQL text. */
  String parameter(Object value);

  // --- select ---

  SqlStatement compileSelect(SelectQuery query);

  String compileLimit(Number limit);

  String compileOffset(Number offset);

  String compileLock(LockMode lock);

  /** Wraps one side of a union. */
  String wrapUnion(String sql);

  // --- writes ---

  SqlStatement compileInsert(InsertAst insert);

  SqlStatement compileInsertWithColumns(TableRef table, List<ColumnRef> columns, List<Row> rows);

  SqlStatement compileInsertOrIgnore(InsertAst insert);

  SqlStatement compileUpsert(UpsertAst upsert);

  SqlStatement compileUpdate(UpdateAst update);

  SqlStatement compileDelete(DeleteAst delete);

  SqlStatement compileTruncate(TruncateAst truncate);

  default SqlStatement compileDml(DmlAst dml) {
    if (dml instanceof InsertAst i) return compileInsert(i);
    if (dml instanceof UpsertAst u) return compileUpsert(u);
    if (dml instanceof UpdateAst u) return compileUpdate(u);
    if (dml instanceof DeleteAst d) return compileDelete(d);
    if (dml instanceof TruncateAst t) return compileTruncate(t);
    throw new IllegalArgumentException("Unsupported DML: " + (dml == null ? "null" : dml.getClass().getName()));
  }
}
