package io.intellixity.snowgate.dmlast;

import io.intellixity.snowgate.sql.RawExpression;

import java.util.Objects;

/**
 * Upsert "when matched" assignment: either the incoming source value for {@code column} or a raw expression.
 */
public record UpdateAssignment(String column, RawExpression expression) {
  public UpdateAssignment {
    Objects.requireNonNull(column, "column");
  }

  public static UpdateAssignment fromSource(String column) {
    return new UpdateAssignment(column, null);
  }

  public static UpdateAssignment raw(String column, String sql) {
    return new UpdateAssignment(column, new RawExpression(sql));
  }

  public boolean fromSource() {
    return expression == null;
  }
}
