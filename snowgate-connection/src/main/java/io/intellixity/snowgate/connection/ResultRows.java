package io.intellixity.snowgate.connection;

import io.intellixity.snowgate.spi.exec.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts raw result rows to maps keyed by column name, with cells typed from the column metadata.
 * <p>
 * Unnamed columns are keyed {@code column_<index>}. A cell wrapped as {@code {"Item": v}} is unwrapped.
 * Temporal cells that fail to parse are returned unchanged.
 */
public final class ResultRows {
  private static final Logger log = LoggerFactory.getLogger(ResultRows.class);

  private static final Set<String> INTEGER_TYPES = Set.of(
      "FIXED", "NUMBER", "INTEGER", "INT", "BIGINT", "SMALLINT", "TINYINT", "BYTEINT");
  private static final Set<String> FLOAT_TYPES = Set.of(
      "REAL", "FLOAT", "FLOAT4", "FLOAT8", "DOUBLE", "DOUBLE PRECISION", "DECIMAL", "NUMERIC");
  private static final Set<String> TIMESTAMP_TYPES = Set.of(
      "TIMESTAMP", "TIMESTAMP_NTZ", "TIMESTAMP_LTZ", "DATETIME");

  private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
  private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
  // epoch seconds with optional fraction, optionally followed by a TZ offset in minutes + 1440
  private static final Pattern EPOCH = Pattern.compile("(-?\\d+)(\\.(\\d{1,9}))?(\\s+(\\d+))?");

  private static final DateTimeFormatter LOCAL_DATE_TIME = new DateTimeFormatterBuilder()
      .appendPattern("yyyy-MM-dd")
      .optionalStart().appendLiteral(' ').optionalEnd()
      .optionalStart().appendLiteral('T').optionalEnd()
      .appendPattern("HH:mm")
      .optionalStart().appendPattern(":ss").optionalEnd()
      .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
      .toFormatter(Locale.ROOT);

  private static final DateTimeFormatter OFFSET_DATE_TIME = new DateTimeFormatterBuilder()
      .append(LOCAL_DATE_TIME)
      .optionalStart().appendLiteral(' ').optionalEnd()
      .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
      .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
      .toFormatter(Locale.ROOT);

  private ResultRows() {}

  public static List<Map<String, Object>> toMaps(QueryResult result) {
    if (result == null || result.isEmpty()) return List.of();
    List<QueryResult.ResultColumn> columns = result.columns();
    List<String> names = new ArrayList<>(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      String n = columns.get(i).name();
      names.add((n == null || n.isEmpty()) ? "column_" + i : n);
    }

    List<Map<String, Object>> out = new ArrayList<>(result.count());
    for (List<Object> row : result.data()) {
      Map<String, Object> m = new LinkedHashMap<>();
      for (int i = 0; i < columns.size(); i++) {
        Object raw = (i < row.size()) ? unwrap(row.get(i)) : null;
        m.put(names.get(i), convert(raw, columns.get(i)));
      }
      out.add(m);
    }
    return out;
  }

  private static Object unwrap(Object v) {
    if (v instanceof Map<?, ?> m && m.size() == 1 && m.containsKey("Item")) return m.get("Item");
    return v;
  }

  static Object convert(Object value, QueryResult.ResultColumn column) {
    return convert(value, column.type(), column.scale());
  }

  /** Converts one cell; non-text cells are returned as they are. */
  public static Object convert(Object value, String type, Integer scale) {
    if (!(value instanceof String s)) return value;
    String t = (type == null) ? "" : type.trim().toUpperCase(Locale.ROOT);

    if (t.equals("BOOLEAN") || s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false")) {
      return parseBoolean(s);
    }

    try {
      switch (t) {
        case "DATE":
          return parseDate(s);
        case "TIME":
          return parseTime(s);
        case "TIMESTAMP_TZ":
          return parseTimestampTz(s);
        default:
          if (TIMESTAMP_TYPES.contains(t)) return parseTimestamp(s);
      }
    } catch (DateTimeException | ArithmeticException | NumberFormatException e) {
      log.warn("snowgate.result unparseable temporal type={} valueLen={} error={}", t, s.length(), e.getMessage());
      return s;
    }

    if (!NUMBER.matcher(s.trim()).matches()) return s;
    String n = s.trim();
    if (INTEGER_TYPES.contains(t)) {
      if ((scale != null && scale > 0) || !INTEGER.matcher(n).matches()) return new BigDecimal(n);
      return integer(n);
    }
    if (FLOAT_TYPES.contains(t)) return Double.parseDouble(n);
    if (t.isEmpty()) return INTEGER.matcher(n).matches() ? integer(n) : (Object) Double.parseDouble(n);
    return s;
  }

  private static boolean parseBoolean(String s) {
    return switch (s.trim().toLowerCase(Locale.ROOT)) {
      case "true", "1", "yes", "on" -> true;
      default -> false;
    };
  }

  private static Object integer(String n) {
    try {
      return Long.parseLong(n.startsWith("+") ? n.substring(1) : n);
    } catch (NumberFormatException e) {
      return new BigDecimal(n);
    }
  }

  // The SQL API returns DATE as days since epoch; ISO text is accepted too.
  private static LocalDate parseDate(String s) {
    if (INTEGER.matcher(s).matches()) return LocalDate.ofEpochDay(Long.parseLong(s));
    return LocalDate.parse(s.trim());
  }

  // seconds since midnight, or HH:mm[:ss[.fff]]
  private static LocalTime parseTime(String s) {
    var m = EPOCH.matcher(s.trim());
    if (m.matches() && m.group(4) == null) {
      long nanos = Math.addExact(Math.multiplyExact(Long.parseLong(m.group(1)), 1_000_000_000L), fraction(m.group(3)));
      return LocalTime.ofNanoOfDay(nanos);
    }
    return LocalTime.parse(s.trim());
  }

  private static LocalDateTime parseTimestamp(String s) {
    var m = EPOCH.matcher(s.trim());
    if (m.matches()) {
      return LocalDateTime.ofInstant(epochInstant(m), ZoneOffset.UTC);
    }
    try {
      return LocalDateTime.parse(s.trim(), LOCAL_DATE_TIME);
    } catch (DateTimeParseException e) {
      // LTZ values may carry an offset; keep the wall clock time
      return OffsetDateTime.parse(s.trim(), OFFSET_DATE_TIME).toLocalDateTime();
    }
  }

  private static Object parseTimestampTz(String s) {
    var m = EPOCH.matcher(s.trim());
    if (m.matches()) {
      Instant at = epochInstant(m);
      int offsetMinutes = (m.group(5) == null) ? 0 : Integer.parseInt(m.group(5)) - 1440;
      return at.atOffset(ZoneOffset.ofTotalSeconds(offsetMinutes * 60));
    }
    try {
      return OffsetDateTime.parse(s.trim(), OFFSET_DATE_TIME);
    } catch (DateTimeParseException e) {
      return LocalDateTime.parse(s.trim(), LOCAL_DATE_TIME);
    }
  }

  // floor, so the nanos stay positive before 1970: -1.5 is -2s + 0.5s
  private static Instant epochInstant(Matcher m) {
    BigDecimal secs = new BigDecimal(m.group(2) == null ? m.group(1) : m.group(1) + m.group(2));
    BigDecimal whole = secs.setScale(0, RoundingMode.FLOOR);
    int nanos = secs.subtract(whole).movePointRight(9).intValueExact();
    return Instant.ofEpochSecond(whole.longValueExact(), nanos);
  }

  private static long fraction(String digits) {
    if (digits == null || digits.isEmpty()) return 0;
    StringBuilder sb = new StringBuilder(digits);
    while (sb.length() < 9) sb.append('0');
    return Long.parseLong(sb.toString());
  }
}
