package io.intellixity.snowgate.grammar;

import io.intellixity.snowgate.sql.Literal;
import io.intellixity.snowgate.sql.RawExpression;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SqlLiteralsTest {

  @Test
  void rendersScalars() {
    assertEquals("null", SqlLiterals.render((Object) null));
    assertEquals("true", SqlLiterals.render(true));
    assertEquals("false", SqlLiterals.render(false));
    assertEquals("42", SqlLiterals.render(42));
    assertEquals("-7", SqlLiterals.render(-7L));
    assertEquals("12345678901234567890", SqlLiterals.render(new BigInteger("12345678901234567890")));
  }

  @Test
  void decimalsNeverUseExponents() {
    assertEquals("1.5", SqlLiterals.render(1.5d));
    assertEquals("0.1", SqlLiterals.render(0.1f));
    assertEquals("100000000000000000000", SqlLiterals.render(1e20));
    assertEquals("1.50", SqlLiterals.render(new BigDecimal("1.50")));
    assertEquals("7", SqlLiterals.render(Literal.numeric("7")));
  }

  @Test
  void nonFiniteDoublesAreQuoted() {
    assertEquals("'NaN'", SqlLiterals.render(Double.NaN));
    assertEquals("'Infinity'", SqlLiterals.render(Double.POSITIVE_INFINITY));
  }

  @Test
  void textIsQuotedWithQuotesDoubled() {
    assertEquals("'O''Brien'", SqlLiterals.render("O'Brien"));
    assertEquals("'123'", SqlLiterals.render("123"));
    assertEquals("''", SqlLiterals.render(""));
    assertEquals("'2024-03-01'", SqlLiterals.render(LocalDate.of(2024, 3, 1)));
  }

  @Test
  void rawIsVerbatim() {
    assertEquals("current_timestamp()", SqlLiterals.render(RawExpression.of("current_timestamp()")));
  }

  @Test
  void collectionsRenderAsTupleBody() {
    assertEquals("1, 'a', null", SqlLiterals.render(Arrays.asList(1, "a", null)));
    assertEquals("'x', 'y'", SqlLiterals.render(new String[]{"x", "y"}));
    assertEquals("", SqlLiterals.render(List.of()));
  }
}
