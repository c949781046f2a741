package io.intellixity.snowgate.query;

public enum Clause {
  AND, OR
}
