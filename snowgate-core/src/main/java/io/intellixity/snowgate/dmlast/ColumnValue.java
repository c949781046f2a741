package io.intellixity.snowgate.dmlast;

import io.intellixity.snowgate.sql.ColumnRef;

import java.util.Objects;

/** One {@code column = value} assignment of an update. */
public record ColumnValue(ColumnRef column, Object value) {
  public ColumnValue {
    Objects.requireNonNull(column, "column");
  }

  public static ColumnValue of(String column, Object value) {
    return new ColumnValue(ColumnRef.of(column), value);
  }
}
