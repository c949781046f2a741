package io.intellixity.snowgate.grammar.bind;

import io.intellixity.snowgate.grammar.GenericSqlDialect;
import io.intellixity.snowgate.spi.sql.SqlStatement;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class BindingSubstitutionTest {

  @Test
  void substitutesInOrder() {
    String sql = BindingSubstitution.substitute("select * from t where a = ? and b = ?", Arrays.asList("x", null));
    assertEquals("select * from t where a = 'x' and b = null", sql);
  }

  @Test
  void rendersByType() {
    String sql = BindingSubstitution.substitute("values (?, ?, ?, ?)", List.of(1, 2.5, true, "it's"));
    assertEquals("values (1, 2.5, true, 'it''s')", sql);
  }

  @Test
  void missingBindingsBecomeEmpty() {
    assertEquals("select 1, ", BindingSubstitution.substitute("select ?, ?", List.of(1)));
  }

  @Test
  void surplusBindingsAreIgnored() {
    assertEquals("select 1", BindingSubstitution.substitute("select ?", List.of(1, 2)));
  }

  @Test
  void noBindingsLeavesTemplateUntouched() {
    assertEquals("select ?", BindingSubstitution.substitute("select ?", List.of()));
    assertEquals("", BindingSubstitution.substitute(null, List.of(1)));
  }

  @Test
  void markersInsideQuotesAreStillMarkers() {
    assertEquals("select 'a1'", BindingSubstitution.substitute("select 'a?'", List.of(1)));
  }

  @Test
  void keepsSupplementaryCharacters() {
    String sql = BindingSubstitution.substitute("select '😀', ?", List.of("🚀"));
    assertEquals("select '😀', '🚀'", sql);
  }

  @Test
  void usesDialectParameterRendering() {
    BindingSubstitution sub = new BindingSubstitution(new GenericSqlDialect());
    assertEquals("select * from t where id in (1, 2)",
        sub.apply(new SqlStatement("select * from t where id in (?)", List.of(List.of(1, 2)))));
  }

  @Test
  void customRenderer() {
    BindingSubstitution sub = new BindingSubstitution(v -> "<" + v + ">");
    assertEquals("a = <1>", sub.apply("a = ?", List.of(1)));
  }
}
