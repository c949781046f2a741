package io.intellixity.snowgate.query;

public interface QueryVisitor<Q> {
  Q visit(Condition condition);
  Q visit(ColumnComparison comparison);
  Q visit(RawPredicate raw);
  Q visit(LogicalGroup group);
  Q visit(NotElement not);
}
