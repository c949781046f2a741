package io.intellixity.snowgate.spi.sql;

import io.intellixity.snowgate.config.GrammarConfig;
import io.intellixity.snowgate.util.SnowgateFactoriesLoader;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Looks dialects up among the discovered {@link SqlDialectProvider}s. */
public final class Dialects {
  private Dialects() {}

  public static SqlDialect create(String id, GrammarConfig config) {
    return create(id, config, Thread.currentThread().getContextClassLoader());
  }

  public static SqlDialect create(String id, GrammarConfig config, ClassLoader cl) {
    Objects.requireNonNull(id, "id");
    GrammarConfig cfg = (config == null) ? GrammarConfig.defaults() : config;
    List<SqlDialectProvider> providers = SnowgateFactoriesLoader.load(SqlDialectProvider.class, cl);
    List<String> known = new ArrayList<>(providers.size());
    for (SqlDialectProvider p : providers) {
      if (p.id().equalsIgnoreCase(id)) return p.create(cfg);
      known.add(p.id());
    }
    throw new IllegalArgumentException("No SqlDialectProvider for id '" + id + "' (available: " + known + ")");
  }
}
