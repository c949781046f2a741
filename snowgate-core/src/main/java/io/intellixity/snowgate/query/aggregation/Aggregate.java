package io.intellixity.snowgate.query.aggregation;

import io.intellixity.snowgate.sql.ColumnRef;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Aggregate select, e.g. {@code count(*)} or {@code max(amount)}; its result column is {@code aggregate}. */
public record Aggregate(String function, List<ColumnRef> columns) {
  public Aggregate {
    Objects.requireNonNull(function, "function");
    if (function.isBlank()) throw new IllegalArgumentException("aggregate function must not be blank");
    function = function.toLowerCase(Locale.ROOT);
    columns = (columns == null || columns.isEmpty()) ? List.of(ColumnRef.of("*")) : List.copyOf(columns);
  }

  public static Aggregate count() { return new Aggregate("count", List.of()); }
  public static Aggregate of(String function, String column) { return new Aggregate(function, List.of(ColumnRef.of(column))); }
}
