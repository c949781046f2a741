package io.intellixity.snowgate.dmlast;

import io.intellixity.snowgate.sql.TableRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Insert-or-update keyed on {@code uniqueBy}.
 * <p>
 * An empty {@code update} list means every inserted column is refreshed on match.
 */
public record UpsertAst(
    TableRef table,
    List<Row> rows,
    List<String> uniqueBy,
    List<UpdateAssignment> update
) implements DmlAst {
  public UpsertAst {
    Objects.requireNonNull(table, "table");
    rows = rows == null ? List.of() : List.copyOf(rows);
    uniqueBy = uniqueBy == null ? List.of() : List.copyOf(uniqueBy);
    update = update == null ? List.of() : List.copyOf(update);
  }

  /** Upsert whose update list copies the named columns from the incoming rows. */
  public static UpsertAst of(String table, List<?> rows, List<String> uniqueBy, List<String> update) {
    List<UpdateAssignment> assignments = new ArrayList<>();
    if (update != null) for (String c : update) assignments.add(UpdateAssignment.fromSource(c));
    return new UpsertAst(TableRef.of(table), Row.all(rows), uniqueBy, assignments);
  }
}
