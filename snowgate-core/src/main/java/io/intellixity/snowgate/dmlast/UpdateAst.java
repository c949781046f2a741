package io.intellixity.snowgate.dmlast;

import io.intellixity.snowgate.query.QueryElement;
import io.intellixity.snowgate.sql.TableRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record UpdateAst(
    TableRef table,
    List<ColumnValue> sets,
    QueryElement where
) implements DmlAst {
  public UpdateAst {
    Objects.requireNonNull(table, "table");
    sets = sets == null ? List.of() : List.copyOf(sets);
  }

  public static UpdateAst of(String table, Map<String, ?> values, QueryElement where) {
    List<ColumnValue> sets = new ArrayList<>();
    for (var e : values.entrySet()) sets.add(ColumnValue.of(e.getKey(), e.getValue()));
    return new UpdateAst(TableRef.of(table), sets, where);
  }
}
