package io.intellixity.snowgate.grammar;

import io.intellixity.snowgate.config.GrammarConfig;
import io.intellixity.snowgate.dmlast.*;
import io.intellixity.snowgate.query.LockMode;
import io.intellixity.snowgate.query.SelectQuery;
import io.intellixity.snowgate.spi.exec.QueryValidationStrategy;
import io.intellixity.snowgate.spi.sql.SqlDialect;
import io.intellixity.snowgate.spi.sql.SqlStatement;
import io.intellixity.snowgate.sql.ColumnRef;
import io.intellixity.snowgate.sql.TableRef;

import java.util.List;

/** ANSI dialect: every hook is the generic grammar's default. */
public class GenericSqlDialect implements SqlDialect {
  public static final String ID = "generic";

  private final GrammarConfig config;
  private final GenericSqlGrammar grammar;

  public GenericSqlDialect() {
    this(GrammarConfig.defaults());
  }

  public GenericSqlDialect(GrammarConfig config) {
    this(config, null);
  }

  public GenericSqlDialect(GrammarConfig config, QueryValidationStrategy validation) {
    this.config = (config == null) ? GrammarConfig.defaults() : config;
    this.grammar = new GenericSqlGrammar(this.config, this, validation);
  }

  protected final GenericSqlGrammar grammar() { return grammar; }

  @Override public String id() { return ID; }
  @Override public GrammarConfig config() { return config; }

  @Override public String wrapTable(TableRef table) { return grammar.wrapTable(table); }
  @Override public String wrapColumn(ColumnRef column) { return grammar.wrapColumn(column); }
  @Override public String wrap(String value) { return grammar.wrap(value); }
  @Override public String columnize(List<ColumnRef> columns) { return grammar.columnize(columns); }
  @Override public String parameter(Object value) { return SqlLiterals.render(value); }

  @Override public SqlStatement compileSelect(SelectQuery query) { return grammar.compileSelect(query); }
  @Override public String compileLimit(Number limit) { return grammar.compileLimit(limit); }
  @Override public String compileOffset(Number offset) { return grammar.compileOffset(offset); }
  @Override public String compileLock(LockMode lock) { return grammar.compileLock(lock); }
  @Override public String wrapUnion(String sql) { return grammar.wrapUnion(sql); }

  @Override public SqlStatement compileInsert(InsertAst insert) { return grammar.compileInsert(insert); }

  @Override
  public SqlStatement compileInsertWithColumns(TableRef table, List<ColumnRef> columns, List<Row> rows) {
    return grammar.compileInsertWithColumns(table, columns, rows);
  }

  @Override public SqlStatement compileInsertOrIgnore(InsertAst insert) { return grammar.compileInsertOrIgnore(insert); }
  @Override public SqlStatement compileUpsert(UpsertAst upsert) { return grammar.compileUpsert(upsert); }
  @Override public SqlStatement compileUpdate(UpdateAst update) { return grammar.compileUpdate(update); }
  @Override public SqlStatement compileDelete(DeleteAst delete) { return grammar.compileDelete(delete); }
  @Override public SqlStatement compileTruncate(TruncateAst truncate) { return grammar.compileTruncate(truncate); }
}
