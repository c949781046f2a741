package io.intellixity.snowgate.dmlast;

import io.intellixity.snowgate.sql.TableRef;

import java.util.Objects;

public record TruncateAst(TableRef table) implements DmlAst {
  public TruncateAst {
    Objects.requireNonNull(table, "table");
  }

  public static TruncateAst of(String table) {
    return new TruncateAst(TableRef.of(table));
  }
}
