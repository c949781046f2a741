package io.intellixity.snowgate.grammar;

import io.intellixity.snowgate.sql.Literal;
import io.intellixity.snowgate.sql.RawExpression;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Renders values as SQL literal text.
 * <p>
 * Every value that is not null, boolean, numeric or raw is single-quoted with embedded quotes doubled.
 * Dialects whose string constants give other characters a meaning pass their own quoter.
 */
public final class SqlLiterals {
  public static final String NULL = "null";
  public static final String TRUE = "true";
  public static final String FALSE = "false";

  private SqlLiterals() {}

  /**
   * Renders one value. Collections and arrays render their elements comma-separated (a tuple body,
   * without parentheses).
   */
  public static String render(Object value) {
    return render(value, SqlLiterals::quote);
  }

  public static String render(Object value, UnaryOperator<String> quoter) {
    if (value instanceof Collection<?> c) return renderAll(c, quoter);
    if (value instanceof Object[] arr) return renderAll(Arrays.asList(arr), quoter);
    return render(Literal.of(value), quoter);
  }

  public static String render(Literal literal) {
    return render(literal, SqlLiterals::quote);
  }

  public static String render(Literal literal, UnaryOperator<String> quoter) {
    if (literal instanceof RawExpression raw) return raw.sql();
    if (literal instanceof Literal.Bool b) return b.value() ? TRUE : FALSE;
    if (literal instanceof Literal.Numeric n) return number(n.value());
    if (literal instanceof Literal.Text t) return quoter.apply(t.value());
    return NULL;
  }

  public static String renderAll(Collection<?> values) {
    return renderAll(values, SqlLiterals::quote);
  }

  public static String renderAll(Collection<?> values, UnaryOperator<String> quoter) {
    List<String> parts = new ArrayList<>(values.size());
    for (Object v : values) parts.add(render(v, quoter));
    return String.join(", ", parts);
  }

  /** Single-quotes {@code text}, doubling embedded single quotes. */
  public static String quote(String text) {
    return "'" + text.replace("'", "''") + "'";
  }

  static String number(Number n) {
    if (n instanceof BigDecimal bd) return bd.toPlainString();
    if (n instanceof BigInteger || n instanceof Long || n instanceof Integer
        || n instanceof Short || n instanceof Byte) {
      return n.toString();
    }
    if (n instanceof Double || n instanceof Float) {
      double d = n.doubleValue();
      // NaN / Infinity have no numeric literal
      if (Double.isNaN(d) || Double.isInfinite(d)) return quote(n.toString());
      return new BigDecimal(n.toString()).toPlainString();
    }
    try {
      return new BigDecimal(n.toString()).toPlainString();
    } catch (NumberFormatException e) {
      return quote(n.toString());
    }
  }
}
