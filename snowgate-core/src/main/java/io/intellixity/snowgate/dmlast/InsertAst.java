package io.intellixity.snowgate.dmlast;

import io.intellixity.snowgate.sql.ColumnRef;
import io.intellixity.snowgate.sql.TableRef;

import java.util.List;
import java.util.Objects;

/**
 * Multi-row insert.
 * <p>
 * {@code columns} may be empty, in which case dialects infer them from the first row.
 */
public record InsertAst(
    TableRef table,
    List<ColumnRef> columns,
    List<Row> rows
) implements DmlAst {
  public InsertAst {
    Objects.requireNonNull(table, "table");
    columns = columns == null ? List.of() : List.copyOf(columns);
    rows = rows == null ? List.of() : List.copyOf(rows);
  }

  public static InsertAst of(String table, List<?> rows) {
    return new InsertAst(TableRef.of(table), List.of(), Row.all(rows));
  }

  public static InsertAst of(String table, List<String> columns, List<?> rows) {
    return new InsertAst(TableRef.of(table), ColumnRef.ofAll(columns), Row.all(rows));
  }
}
