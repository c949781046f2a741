package io.intellixity.snowgate.query;

import io.intellixity.snowgate.sql.ColumnRef;

import java.util.Objects;

/** Column compared to another column, e.g. a join condition {@code users.id = orders.user_id}. */
public record ColumnComparison(ColumnRef first, Operator operator, ColumnRef second) implements QueryElement {
  public ColumnComparison {
    Objects.requireNonNull(first, "first");
    Objects.requireNonNull(second, "second");
    operator = (operator == null) ? Operator.EQ : operator;
    if (operator == Operator.IN || operator == Operator.NIN || operator == Operator.RANGE) {
      throw new IllegalArgumentException("Operator " + operator + " cannot compare two columns");
    }
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }
}
