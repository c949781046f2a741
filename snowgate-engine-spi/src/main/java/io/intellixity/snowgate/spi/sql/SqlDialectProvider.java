package io.intellixity.snowgate.spi.sql;

import io.intellixity.snowgate.config.GrammarConfig;

/** Registered in {@code META-INF/snowgate.factories}; creates dialects by id. */
public interface SqlDialectProvider {
  String id();

  SqlDialect create(GrammarConfig config);
}
