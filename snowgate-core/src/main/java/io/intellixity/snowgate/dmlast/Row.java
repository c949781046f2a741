package io.intellixity.snowgate.dmlast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * One input record of a write.
 * <p>
 * {@link Positional} rows carry values in column order, {@link Named} rows map column name to value,
 * and {@link Scalar} holds a single bare value (input that was not a record at all).
 * Values may be {@code null}.
 */
public sealed interface Row permits Row.Positional, Row.Named, Row.Scalar {
  Pattern NUMERIC_KEY = Pattern.compile("-?\\d+(\\.\\d+)?");

  record Positional(List<Object> values) implements Row {
    public Positional {
      values = Collections.unmodifiableList(new ArrayList<>(values == null ? List.of() : values));
    }
  }

  record Named(Map<String, Object> values) implements Row {
    public Named {
      values = Collections.unmodifiableMap(new LinkedHashMap<>(values == null ? Map.of() : values));
    }
  }

  record Scalar(Object value) implements Row {}

  /** Tags a raw record: Map → named, List/array → positional, anything else → scalar. */
  static Row of(Object raw) {
    if (raw instanceof Row r) return r;
    if (raw instanceof Map<?, ?> m) {
      Map<String, Object> values = new LinkedHashMap<>();
      for (var e : m.entrySet()) values.put(String.valueOf(e.getKey()), e.getValue());
      return new Named(values);
    }
    if (raw instanceof Collection<?> c) return new Positional(new ArrayList<>(c));
    if (raw instanceof Object[] arr) return new Positional(Arrays.asList(arr));
    return new Scalar(raw);
  }

  static List<Row> all(Collection<?> raws) {
    List<Row> out = new ArrayList<>(raws == null ? 0 : raws.size());
    if (raws != null) for (Object r : raws) out.add(of(r));
    return out;
  }

  static Row named(Map<String, ?> values) {
    return new Named(new LinkedHashMap<>(values));
  }

  static Row positional(Object... values) {
    return new Positional(Arrays.asList(values));
  }

  /** True when values are addressed by position (a named row whose keys are all numeric counts too). */
  default boolean positional() {
    if (this instanceof Positional) return true;
    if (this instanceof Named n) {
      for (String k : n.values().keySet()) {
        if (!NUMERIC_KEY.matcher(k).matches()) return false;
      }
      return true;
    }
    return false;
  }

  /** Keys in input order: indexes for positional rows, names for named rows, empty for scalars. */
  default List<String> keys() {
    if (this instanceof Named n) return new ArrayList<>(n.values().keySet());
    if (this instanceof Positional p) {
      List<String> out = new ArrayList<>(p.values().size());
      for (int i = 0; i < p.values().size(); i++) out.add(String.valueOf(i));
      return out;
    }
    return List.of();
  }

  /** Values in input order. */
  default List<Object> orderedValues() {
    if (this instanceof Positional p) return p.values();
    if (this instanceof Named n) return new ArrayList<>(n.values().values());
    List<Object> single = new ArrayList<>(1);
    single.add(((Scalar) this).value());
    return single;
  }

  /** Value stored under {@code key}; {@code null} when absent. */
  default Object get(String key) {
    if (this instanceof Named n) return n.values().get(key);
    if (this instanceof Positional p && key.matches("\\d{1,9}")) {
      int i = Integer.parseInt(key);
      return (i >= 0 && i < p.values().size()) ? p.values().get(i) : null;
    }
    return null;
  }
}
