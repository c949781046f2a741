package io.intellixity.snowgate.query;

import io.intellixity.snowgate.sql.RawExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Verbatim predicate SQL with its own positional bindings for any {@code ?} it contains. */
public record RawPredicate(RawExpression sql, List<Object> bindings) implements QueryElement {
  public RawPredicate {
    Objects.requireNonNull(sql, "sql");
    bindings = (bindings == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(bindings));
  }

  public static RawPredicate of(String sql, Object... bindings) {
    List<Object> b = new ArrayList<>(bindings.length);
    Collections.addAll(b, bindings);
    return new RawPredicate(new RawExpression(sql), b);
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }
}
