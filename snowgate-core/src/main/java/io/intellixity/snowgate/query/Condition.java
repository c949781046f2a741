package io.intellixity.snowgate.query;

import io.intellixity.snowgate.sql.ColumnRef;

import java.util.Objects;

/** Column compared to a value (or to a lower/upper pair for {@link Operator#RANGE}). */
public final class Condition implements QueryElement {
  private final ColumnRef column;
  private final Operator operator;
  private final Object value;
  private final Object lower;
  private final Object upper;
  private final boolean not;

  public Condition(ColumnRef column, Operator operator, Object value, Object lower, Object upper, boolean not) {
    this.column = Objects.requireNonNull(column, "column");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = value;
    this.lower = lower;
    this.upper = upper;
    this.not = not;
  }

  public ColumnRef column() { return column; }
  public Operator operator() { return operator; }
  public Object value() { return value; }
  public Object lower() { return lower; }
  public Object upper() { return upper; }
  public boolean not() { return not; }

  public Condition negate() {
    return new Condition(column, operator, value, lower, upper, !not);
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  public static Condition of(String column, Operator operator, Object value) {
    return new Condition(ColumnRef.of(column), operator, value, null, null, false);
  }

  public static Condition of(ColumnRef column, Operator operator, Object value) {
    return new Condition(column, operator, value, null, null, false);
  }

  public static Condition range(String column, Object lower, Object upper) {
    return new Condition(ColumnRef.of(column), Operator.RANGE, null, lower, upper, false);
  }
}
