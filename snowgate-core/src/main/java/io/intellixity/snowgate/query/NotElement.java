package io.intellixity.snowgate.query;

import java.util.Objects;

/** Unary NOT for a predicate subtree. */
public final class NotElement implements QueryElement {
  private final QueryElement element;

  public NotElement(QueryElement element) {
    this.element = Objects.requireNonNull(element, "element");
  }

  public QueryElement element() { return element; }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) {
    return visitor.visit(this);
  }
}
