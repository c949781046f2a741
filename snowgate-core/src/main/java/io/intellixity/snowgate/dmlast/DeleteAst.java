package io.intellixity.snowgate.dmlast;

import io.intellixity.snowgate.query.QueryElement;
import io.intellixity.snowgate.sql.TableRef;

import java.util.Objects;

public record DeleteAst(TableRef table, QueryElement where) implements DmlAst {
  public DeleteAst {
    Objects.requireNonNull(table, "table");
  }

  public static DeleteAst of(String table, QueryElement where) {
    return new DeleteAst(TableRef.of(table), where);
  }
}
