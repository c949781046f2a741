package io.intellixity.snowgate.query;

public enum Operator {
  EQ("="),
  NE("<>"),
  GT(">"),
  GE(">="),
  LT("<"),
  LE("<="),

  IN("in"),
  NIN("not in"),

  RANGE("between"),
  LIKE("like"),
  // Case-insensitive LIKE (warehouse extension)
  ILIKE("ilike");

  private final String sql;

  Operator(String sql) {
    this.sql = sql;
  }

  /** SQL keyword or symbol for this operator. */
  public String sql() {
    return sql;
  }
}
