package io.intellixity.snowgate.grammar;

import io.intellixity.snowgate.config.GrammarConfig;
import io.intellixity.snowgate.spi.sql.SqlDialect;
import io.intellixity.snowgate.spi.sql.SqlDialectProvider;

public final class GenericSqlDialectProvider implements SqlDialectProvider {
  @Override
  public String id() { return GenericSqlDialect.ID; }

  @Override
  public SqlDialect create(GrammarConfig config) {
    return new GenericSqlDialect(config);
  }
}
