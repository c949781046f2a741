package io.intellixity.snowgate.snowflake;

import io.intellixity.snowgate.config.GrammarConfig;
import io.intellixity.snowgate.spi.sql.SqlDialect;
import io.intellixity.snowgate.spi.sql.SqlDialectProvider;

public final class SnowflakeDialectProvider implements SqlDialectProvider {
  @Override
  public String id() { return SnowflakeDialect.ID; }

  @Override
  public SqlDialect create(GrammarConfig config) {
    return new SnowflakeDialect(config);
  }
}
