package io.intellixity.snowgate.spi.exec;

import io.intellixity.snowgate.dmlast.UpdateAst;
import io.intellixity.snowgate.dmlast.UpsertAst;
import io.intellixity.snowgate.query.*;
import io.intellixity.snowgate.sql.ColumnRef;
import io.intellixity.snowgate.sql.RawExpression;

import java.util.List;

/**
 * Default structural validation.
 * <p>
 * Validates:
 * <ul>
 *   <li>a select has a table, unless it selects raw expressions only ({@code select 1})</li>
 *   <li>union branches are valid selects themselves</li>
 *   <li>predicate trees contain no empty groups</li>
 *   <li>an update assigns at least one column</li>
 *   <li>an upsert names the columns it matches on</li>
 * </ul>
 */
public final class DefaultQueryValidationStrategy implements QueryValidationStrategy {
  @Override
  public void validateSelect(SelectQuery query) {
    if (query == null) throw new QueryValidationException("Select query is null");
    if (query.table() == null && !rawOnly(query.columns())) {
      throw new QueryValidationException("Select without a table may only select raw expressions");
    }
    validateElement(query.where(), "where");
    validateElement(query.having(), "having");
    for (Join j : query.joins()) validateElement(j.on(), "join on " + j.table());
    for (Union u : query.unions()) validateSelect(u.query());
  }

  @Override
  public void validateUpdate(UpdateAst update) {
    if (update.sets().isEmpty()) {
      throw new QueryValidationException("Update of " + update.table() + " assigns no columns");
    }
    validateElement(update.where(), "where");
  }

  @Override
  public void validateUpsert(UpsertAst upsert) {
    if (upsert.uniqueBy().isEmpty()) {
      throw new QueryValidationException("Upsert into " + upsert.table() + " requires at least one unique-by column");
    }
    for (String c : upsert.uniqueBy()) {
      if (c == null || c.isBlank()) {
        throw new QueryValidationException("Blank unique-by column in upsert into " + upsert.table());
      }
    }
  }

  private static boolean rawOnly(List<ColumnRef> columns) {
    if (columns.isEmpty()) return false;
    for (ColumnRef c : columns) {
      if (!(c instanceof RawExpression)) return false;
    }
    return true;
  }

  private static void validateElement(QueryElement el, String usage) {
    if (el == null) return;
    if (el instanceof NotElement n) {
      validateElement(n.element(), usage);
      return;
    }
    if (el instanceof LogicalGroup g) {
      if (g.elements().isEmpty()) {
        throw new QueryValidationException("Empty " + g.clause() + " group in " + usage);
      }
      for (QueryElement c : g.elements()) validateElement(c, usage);
      return;
    }
    if (el instanceof Condition c) {
      if (c.operator() == Operator.RANGE && (c.lower() == null || c.upper() == null)) {
        throw new QueryValidationException("Range on " + c.column().key() + " in " + usage + " needs both bounds");
      }
      return;
    }
    if (el instanceof ColumnComparison || el instanceof RawPredicate) return;

    throw new QueryValidationException("Unsupported QueryElement: " + el.getClass().getName());
  }
}
