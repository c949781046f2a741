package io.intellixity.snowgate.query;

/** A node of a predicate tree (where / having / join conditions). */
public interface QueryElement {
  <Q> Q accept(QueryVisitor<Q> visitor);
}
