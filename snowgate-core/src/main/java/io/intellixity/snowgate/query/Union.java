package io.intellixity.snowgate.query;

import java.util.Objects;

public record Union(SelectQuery query, boolean all) {
  public Union {
    Objects.requireNonNull(query, "query");
  }
}
