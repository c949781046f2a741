package io.intellixity.snowgate.sql;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Objects;

/**
 * A value to be rendered as SQL literal text. Exactly one kind applies to any value.
 * <p>
 * Kind is decided by the Java type: a {@link String} is always {@link Text}, even when it looks numeric.
 * Use {@link #numeric(String)} to tag numeric text explicitly.
 */
public sealed interface Literal permits Literal.Null, Literal.Bool, Literal.Numeric, Literal.Text, RawExpression {
  DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
  DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss.SSSSSS");
  DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");
  DateTimeFormatter TIMESTAMP_TZ = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS xxx");

  enum Null implements Literal { INSTANCE }

  record Bool(boolean value) implements Literal {}

  record Numeric(Number value) implements Literal {
    public Numeric {
      Objects.requireNonNull(value, "value");
    }
  }

  record Text(String value) implements Literal {
    public Text {
      Objects.requireNonNull(value, "value");
    }
  }

  static Literal of(Object value) {
    if (value == null) return Null.INSTANCE;
    if (value instanceof Literal l) return l;
    if (value instanceof Boolean b) return new Bool(b);
    if (value instanceof Number n) return new Numeric(n);
    if (value instanceof TemporalAccessor t) return new Text(formatTemporal(t));
    if (value instanceof Enum<?> e) return new Text(e.name());
    return new Text(String.valueOf(value));
  }

  static Literal numeric(String text) {
    return new Numeric(new BigDecimal(text.trim()));
  }

  private static String formatTemporal(TemporalAccessor t) {
    if (t instanceof LocalDate d) return DATE.format(d);
    if (t instanceof LocalTime lt) return TIME.format(lt);
    if (t instanceof LocalDateTime ldt) return TIMESTAMP.format(ldt);
    if (t instanceof OffsetDateTime odt) return TIMESTAMP_TZ.format(odt);
    if (t instanceof Instant i) return TIMESTAMP.format(i.atOffset(ZoneOffset.UTC));
    return t.toString();
  }
}
