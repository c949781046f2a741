package io.intellixity.snowgate.grammar;

import io.intellixity.snowgate.query.*;
import io.intellixity.snowgate.spi.sql.SqlDialect;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Renders a predicate tree to SQL with {@code ?} placeholders.
 * <p>
 * Nested groups are parenthesised; the outermost group is not.
 */
final class PredicateRenderer implements QueryVisitor<String> {
  private final SqlDialect hooks;
  private final GenericSqlGrammar.RenderCtx ctx;

  PredicateRenderer(SqlDialect hooks, GenericSqlGrammar.RenderCtx ctx) {
    this.hooks = hooks;
    this.ctx = ctx;
  }

  @Override
  public String visit(Condition c) {
    String col = hooks.wrapColumn(c.column());
    Object value = c.value();

    String sql = switch (c.operator()) {
      case EQ -> (value == null) ? col + " is null" : col + " = " + ctx.add(value);
      case NE -> (value == null) ? col + " is not null" : col + " <> " + ctx.add(value);
      case IN, NIN -> listSql(col, c.operator(), toList(value));
      case RANGE -> col + " between " + ctx.add(c.lower()) + " and " + ctx.add(c.upper());
      default -> col + " " + c.operator().sql() + " " + ctx.add(value);
    };
    return c.not() ? "not (" + sql + ")" : sql;
  }

  @Override
  public String visit(ColumnComparison cmp) {
    return hooks.wrapColumn(cmp.first()) + " " + cmp.operator().sql() + " " + hooks.wrapColumn(cmp.second());
  }

  @Override
  public String visit(RawPredicate raw) {
    ctx.addAll(raw.bindings());
    return raw.sql().sql();
  }

  @Override
  public String visit(LogicalGroup g) {
    List<String> parts = new ArrayList<>(g.elements().size());
    for (QueryElement child : g.elements()) {
      String s = child.accept(this);
      if (s == null || s.isBlank()) continue;
      boolean nested = child instanceof LogicalGroup lg && lg.elements().size() > 1;
      parts.add(nested ? "(" + s + ")" : s);
    }
    String sep = (g.clause() == Clause.OR) ? " or " : " and ";
    return String.join(sep, parts);
  }

  @Override
  public String visit(NotElement n) {
    String inner = n.element().accept(this);
    return inner.isBlank() ? "" : "not (" + inner + ")";
  }

  private String listSql(String col, Operator op, List<Object> values) {
    // empty "in" matches nothing, empty "not in" matches everything
    if (values.isEmpty()) return (op == Operator.IN) ? "0 = 1" : "1 = 1";
    List<String> ph = new ArrayList<>(values.size());
    for (Object v : values) ph.add(ctx.add(v));
    return col + " " + op.sql() + " (" + String.join(", ", ph) + ")";
  }

  private static List<Object> toList(Object v) {
    if (v == null) return List.of();
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    if (v instanceof Object[] arr) return Arrays.asList(arr);
    List<Object> single = new ArrayList<>(1);
    single.add(v);
    return single;
  }
}
