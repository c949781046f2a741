package io.intellixity.snowgate.config;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

final class GrammarConfigTest {

  @Test
  void defaultsAreCaseInsensitiveWithoutPrefix() {
    GrammarConfig c = GrammarConfig.defaults();
    assertFalse(c.caseSensitive());
    assertEquals("", c.tablePrefix());
    assertFalse(c.debugLogging());
    assertEquals("", new GrammarConfig(true, null, false).tablePrefix());
  }

  @Test
  void readsEnvironment() {
    GrammarConfig c = GrammarConfig.fromEnvironment(Map.of(
        GrammarConfig.ENV_CASE_SENSITIVE, "TRUE",
        GrammarConfig.ENV_TABLE_PREFIX, " app_ ",
        GrammarConfig.ENV_DEBUG_LOGGING, "1"));
    assertEquals(new GrammarConfig(true, "app_", true), c);
  }

  @Test
  void unknownBooleanTextIsFalse() {
    assertTrue(GrammarConfig.parseBoolean("on"));
    assertTrue(GrammarConfig.parseBoolean("yes"));
    assertFalse(GrammarConfig.parseBoolean("enabled"));
    assertFalse(GrammarConfig.parseBoolean(null));
  }

  @Test
  void readsProperties() {
    Properties p = new Properties();
    p.setProperty(GrammarConfig.PROP_TABLE_PREFIX, "stg_");
    GrammarConfig c = GrammarConfig.fromProperties(p);
    assertEquals("stg_", c.tablePrefix());
    assertFalse(c.caseSensitive());
  }

  @Test
  void loadOverlaysEnvironmentOnClasspathResource() {
    ClassLoader cl = getClass().getClassLoader();

    GrammarConfig fromFile = GrammarConfig.load(cl, Map.of());
    assertEquals("res_", fromFile.tablePrefix());
    assertTrue(fromFile.debugLogging());
    assertFalse(fromFile.caseSensitive());

    GrammarConfig overridden = GrammarConfig.load(cl, Map.of(
        GrammarConfig.ENV_TABLE_PREFIX, "env_",
        GrammarConfig.ENV_CASE_SENSITIVE, "true"));
    assertEquals(new GrammarConfig(true, "env_", true), overridden);
  }

  @Test
  void withersCopy() {
    GrammarConfig c = GrammarConfig.defaults().withTablePrefix("p_").withCaseSensitive(true);
    assertEquals(new GrammarConfig(true, "p_", false), c);
    assertEquals(GrammarConfig.defaults(), GrammarConfig.defaults().withDebugLogging(false));
  }
}
