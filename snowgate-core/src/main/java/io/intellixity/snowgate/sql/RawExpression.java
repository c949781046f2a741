package io.intellixity.snowgate.sql;

import java.util.Objects;

/**
 * Caller-supplied SQL emitted verbatim.
 * <p>
 * Usable wherever a table, a column or a value is expected; wrapping and quoting never touch it.
 */
public record RawExpression(String sql) implements TableRef, ColumnRef, Literal {
  public RawExpression {
    Objects.requireNonNull(sql, "sql");
  }

  public static RawExpression of(String sql) {
    return new RawExpression(sql);
  }

  @Override
  public String toString() { return sql; }
}
