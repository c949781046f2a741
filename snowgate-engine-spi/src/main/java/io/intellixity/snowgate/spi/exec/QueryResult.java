package io.intellixity.snowgate.spi.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw result set as returned by the warehouse: column metadata plus rows of unconverted cell values.
 * <p>
 * Cells may be {@code null}. A result that is not {@code executed} is still running on the warehouse side.
 */
public record QueryResult(
    String statementHandle,
    boolean executed,
    List<ResultColumn> columns,
    List<List<Object>> data
) {
  public QueryResult {
    columns = (columns == null) ? List.of() : List.copyOf(columns);
    data = copyRows(data);
  }

  public static QueryResult empty() {
    return new QueryResult(null, true, List.of(), List.of());
  }

  public static QueryResult pending(String statementHandle) {
    return new QueryResult(statementHandle, false, List.of(), List.of());
  }

  public int count() { return data.size(); }

  public boolean isEmpty() { return data.isEmpty(); }

  /** Appends rows of a further result page. */
  public QueryResult withPage(List<List<Object>> page) {
    if (page == null || page.isEmpty()) return this;
    List<List<Object>> all = new ArrayList<>(data.size() + page.size());
    all.addAll(data);
    all.addAll(page);
    return new QueryResult(statementHandle, executed, columns, all);
  }

  private static List<List<Object>> copyRows(List<List<Object>> rows) {
    if (rows == null || rows.isEmpty()) return List.of();
    List<List<Object>> out = new ArrayList<>(rows.size());
    for (List<Object> r : rows) {
      out.add(r == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(r)));
    }
    return Collections.unmodifiableList(out);
  }

  /**
   * One column of the result set metadata; {@code type} is the warehouse type name, e.g. {@code fixed}.
   * {@code name} and {@code type} may be null when the service omits them.
   */
  public record ResultColumn(String name, String type, Integer scale, boolean nullable) {
    public ResultColumn(String name, String type) {
      this(name, type, null, true);
    }
  }
}
