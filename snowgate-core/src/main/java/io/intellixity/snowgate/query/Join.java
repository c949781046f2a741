package io.intellixity.snowgate.query;

import io.intellixity.snowgate.sql.TableRef;

import java.util.Objects;

/** Join clause. {@code on} is required for every type but {@link JoinType#CROSS}. */
public record Join(JoinType type, TableRef table, QueryElement on) {
  public Join {
    Objects.requireNonNull(table, "table");
    type = (type == null) ? JoinType.INNER : type;
    if (type != JoinType.CROSS && on == null) {
      throw new IllegalArgumentException(type + " join on " + table + " requires a condition");
    }
  }
}
