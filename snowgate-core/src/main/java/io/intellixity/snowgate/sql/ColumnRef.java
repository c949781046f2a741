package io.intellixity.snowgate.sql;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/** A column reference: a plain or {@code table.column} name, {@code *}, or a raw expression. */
public sealed interface ColumnRef permits ColumnRef.Named, RawExpression {

  record Named(String name) implements ColumnRef {
    public Named {
      Objects.requireNonNull(name, "name");
    }
  }

  static ColumnRef of(String name) {
    return new Named(name);
  }

  static ColumnRef raw(String sql) {
    return new RawExpression(sql);
  }

  static List<ColumnRef> of(String... names) {
    List<ColumnRef> out = new ArrayList<>(names.length);
    for (String n : names) out.add(new Named(n));
    return out;
  }

  static List<ColumnRef> ofAll(Collection<String> names) {
    List<ColumnRef> out = new ArrayList<>(names == null ? 0 : names.size());
    if (names != null) for (String n : names) out.add(new Named(n));
    return out;
  }

  /** Key used to look a column up in an associative row. */
  default String key() {
    if (this instanceof Named n) return n.name();
    return ((RawExpression) this).sql();
  }
}
