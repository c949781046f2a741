package io.intellixity.snowgate.query;

public enum JoinType {
  INNER("inner join"),
  LEFT("left join"),
  RIGHT("right join"),
  CROSS("cross join");

  private final String sql;

  JoinType(String sql) {
    this.sql = sql;
  }

  public String sql() {
    return sql;
  }
}
