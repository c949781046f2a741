package io.intellixity.snowgate.sql;

import java.util.Objects;

/** A table reference: a plain (optionally schema-qualified / aliased) name, or a raw expression. */
public sealed interface TableRef permits TableRef.Named, RawExpression {

  record Named(String name) implements TableRef {
    public Named {
      Objects.requireNonNull(name, "name");
      if (name.isBlank()) throw new IllegalArgumentException("table name must not be blank");
    }

    @Override
    public String toString() { return name; }
  }

  static TableRef of(String name) {
    return new Named(name);
  }

  static TableRef raw(String sql) {
    return new RawExpression(sql);
  }
}
