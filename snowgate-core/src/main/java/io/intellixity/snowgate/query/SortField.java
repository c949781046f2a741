package io.intellixity.snowgate.query;

import io.intellixity.snowgate.sql.ColumnRef;

import java.util.Objects;

public record SortField(ColumnRef column, Direction direction) {
  public SortField {
    Objects.requireNonNull(column, "column");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static SortField asc(String column) { return new SortField(ColumnRef.of(column), Direction.ASC); }
  public static SortField desc(String column) { return new SortField(ColumnRef.of(column), Direction.DESC); }

  public enum Direction { ASC, DESC }
}
