package io.intellixity.snowgate.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Compiler settings, fixed at construction time.
 *
 * @param caseSensitive keep identifier case as given; otherwise table identifiers are upper-cased
 * @param tablePrefix   prepended to every table name (never null)
 * @param debugLogging  emit compiler debug logs
 */
public record GrammarConfig(boolean caseSensitive, String tablePrefix, boolean debugLogging) {
  public static final String RESOURCE = "snowgate.properties";

  public static final String PROP_CASE_SENSITIVE = "snowgate.columns.case-sensitive";
  public static final String PROP_TABLE_PREFIX = "snowgate.table-prefix";
  public static final String PROP_DEBUG_LOGGING = "snowgate.debug-logging";

  public static final String ENV_CASE_SENSITIVE = "SNOWFLAKE_COLUMNS_CASE_SENSITIVE";
  public static final String ENV_TABLE_PREFIX = "SNOWFLAKE_TABLE_PREFIX";
  public static final String ENV_DEBUG_LOGGING = "SNOWFLAKE_DEBUG_LOGGING";

  public GrammarConfig {
    tablePrefix = (tablePrefix == null) ? "" : tablePrefix;
  }

  public static GrammarConfig defaults() {
    return new GrammarConfig(false, "", false);
  }

  public GrammarConfig withCaseSensitive(boolean v) { return new GrammarConfig(v, tablePrefix, debugLogging); }
  public GrammarConfig withTablePrefix(String v) { return new GrammarConfig(caseSensitive, v, debugLogging); }
  public GrammarConfig withDebugLogging(boolean v) { return new GrammarConfig(caseSensitive, tablePrefix, v); }

  public static GrammarConfig fromProperties(Properties p) {
    return overlay(defaults(), p == null ? Map.of() : toMap(p), PROP_CASE_SENSITIVE, PROP_TABLE_PREFIX, PROP_DEBUG_LOGGING);
  }

  public static GrammarConfig fromEnvironment(Map<String, String> env) {
    return overlay(defaults(), env, ENV_CASE_SENSITIVE, ENV_TABLE_PREFIX, ENV_DEBUG_LOGGING);
  }

  /** Classpath {@value #RESOURCE} (if any), overridden by the process environment. */
  public static GrammarConfig load() {
    return load(Thread.currentThread().getContextClassLoader(), System.getenv());
  }

  public static GrammarConfig load(ClassLoader cl, Map<String, String> env) {
    if (cl == null) cl = GrammarConfig.class.getClassLoader();
    GrammarConfig base = defaults();
    try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
      if (in != null) {
        Properties p = new Properties();
        p.load(in);
        base = fromProperties(p);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load " + RESOURCE, e);
    }
    return overlay(base, env, ENV_CASE_SENSITIVE, ENV_TABLE_PREFIX, ENV_DEBUG_LOGGING);
  }

  private static GrammarConfig overlay(GrammarConfig base, Map<String, String> values,
                                       String caseKey, String prefixKey, String debugKey) {
    if (values == null || values.isEmpty()) return base;
    boolean cs = values.containsKey(caseKey) ? parseBoolean(values.get(caseKey)) : base.caseSensitive();
    String prefix = values.containsKey(prefixKey) ? values.get(prefixKey).trim() : base.tablePrefix();
    boolean debug = values.containsKey(debugKey) ? parseBoolean(values.get(debugKey)) : base.debugLogging();
    return new GrammarConfig(cs, prefix, debug);
  }

  static boolean parseBoolean(String raw) {
    if (raw == null) return false;
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "1", "yes", "on" -> true;
      default -> false;
    };
  }

  private static Map<String, String> toMap(Properties p) {
    Map<String, String> out = new java.util.HashMap<>();
    for (String name : p.stringPropertyNames()) out.put(name, p.getProperty(name));
    return out;
  }
}
