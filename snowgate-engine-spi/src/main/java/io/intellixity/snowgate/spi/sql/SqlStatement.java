package io.intellixity.snowgate.spi.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Compiled SQL text plus the positional bindings for its {@code ?} markers.
 * <p>
 * Bindings may contain {@code null}. An empty {@code sql} is a no-op statement.
 */
public record SqlStatement(String sql, List<Object> bindings) {
  private static final SqlStatement EMPTY = new SqlStatement("", List.of());

  public SqlStatement {
    sql = (sql == null) ? "" : sql;
    bindings = (bindings == null || bindings.isEmpty())
        ? List.of()
        : Collections.unmodifiableList(new ArrayList<>(bindings));
  }

  public SqlStatement(String sql) {
    this(sql, List.of());
  }

  public static SqlStatement empty() { return EMPTY; }

  public boolean isEmpty() { return sql.isBlank(); }
}
