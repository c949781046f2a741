package io.intellixity.snowgate.spi.exec;

import io.intellixity.snowgate.dmlast.UpdateAst;
import io.intellixity.snowgate.dmlast.UpsertAst;
import io.intellixity.snowgate.query.SelectQuery;

/**
 * Hook to validate statements before compilation.
 * <p>
 * Grammars call this before rendering; dialects may plug in stricter rules.
 * Failures raise {@link io.intellixity.snowgate.query.QueryValidationException}.
 */
public interface QueryValidationStrategy {
  void validateSelect(SelectQuery query);

  void validateUpdate(UpdateAst update);

  void validateUpsert(UpsertAst upsert);
}
