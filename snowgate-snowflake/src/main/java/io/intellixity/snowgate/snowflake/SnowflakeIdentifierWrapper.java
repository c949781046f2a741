package io.intellixity.snowgate.snowflake;

import io.intellixity.snowgate.config.GrammarConfig;
import io.intellixity.snowgate.grammar.GenericSqlGrammar;
import io.intellixity.snowgate.sql.ColumnRef;
import io.intellixity.snowgate.sql.RawExpression;
import io.intellixity.snowgate.sql.TableRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Snowflake identifier wrapping.
 * <p>
 * Tables are upper-cased (unless case-sensitive) and double-quoted per segment. Columns are NOT quoted:
 * only embedded double quotes are stripped, single quotes survive, so PIVOT output columns such as
 * {@code 'Q1'} keep their literal quotes.
 */
public final class SnowflakeIdentifierWrapper {
  private final GrammarConfig config;

  public SnowflakeIdentifierWrapper(GrammarConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  public String wrapTable(TableRef table) {
    if (table instanceof RawExpression raw) return raw.sql();
    String name = ((TableRef.Named) table).name().replace("\"", "").trim();

    String[] alias = GenericSqlGrammar.splitAlias(name);
    if (alias != null) {
      return wrapTable(TableRef.of(alias[0])) + " as " + tableSegment(alias[1]);
    }

    String[] segments = name.split("\\.");
    List<String> out = new ArrayList<>(segments.length);
    for (int i = 0; i < segments.length; i++) {
      String seg = (i == segments.length - 1) ? config.tablePrefix() + segments[i] : segments[i];
      out.add(tableSegment(seg));
    }
    return String.join(".", out);
  }

  /** The name columns of {@code table} are qualified with: its wrapped alias when it has one. */
  public String qualifier(TableRef table) {
    if (table instanceof TableRef.Named named) {
      String[] alias = GenericSqlGrammar.splitAlias(named.name().replace("\"", "").trim());
      if (alias != null) return tableSegment(alias[1]);
    }
    return wrapTable(table);
  }

  public String wrapColumn(ColumnRef column) {
    if (column instanceof RawExpression raw) return raw.sql();
    return wrap(((ColumnRef.Named) column).name());
  }

  /** {@code table.column} paths and {@code name as alias}; a sole segment is a column. */
  public String wrap(String value) {
    String[] alias = GenericSqlGrammar.splitAlias(value);
    if (alias != null) return wrap(alias[0]) + " as " + columnSegment(alias[1]);

    String[] segments = value.split("\\.");
    if (segments.length == 1) return columnSegment(value);

    List<String> out = new ArrayList<>(segments.length);
    out.add(wrapTable(TableRef.of(segments[0])));
    for (int i = 1; i < segments.length; i++) out.add(columnSegment(segments[i]));
    return String.join(".", out);
  }

  private String tableSegment(String segment) {
    String s = config.caseSensitive() ? segment : segment.toUpperCase(Locale.ROOT);
    return "\"" + s + "\"";
  }

  private static String columnSegment(String segment) {
    if ("*".equals(segment)) return segment;
    return segment.replace("\"", "");
  }
}
