package io.intellixity.snowgate.grammar.bind;

import io.intellixity.snowgate.grammar.SqlLiterals;
import io.intellixity.snowgate.spi.sql.SqlDialect;
import io.intellixity.snowgate.spi.sql.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Inlines positional bindings into a SQL template, for services that accept literal SQL only.
 * <p>
 * Rules:
 * <ul>
 *   <li>every {@code ?} is a marker, wherever it appears, and there is no escape for it</li>
 *   <li>the Nth marker takes the Nth binding, rendered by the dialect's literal rules</li>
 *   <li>a marker without a binding becomes the empty string (logged at WARN)</li>
 *   <li>surplus bindings are ignored (logged at DEBUG)</li>
 * </ul>
 * Scanning is by code point, so supplementary characters are never split.
 */
public final class BindingSubstitution {
  private static final Logger log = LoggerFactory.getLogger(BindingSubstitution.class);
  private static final int MARKER = '?';

  private final Function<Object, String> renderer;

  public BindingSubstitution(SqlDialect dialect) {
    this(Objects.requireNonNull(dialect, "dialect")::parameter);
  }

  public BindingSubstitution(Function<Object, String> renderer) {
    this.renderer = Objects.requireNonNull(renderer, "renderer");
  }

  /** Substitution with the generic literal rules. */
  public static String substitute(String template, List<?> bindings) {
    return new BindingSubstitution(SqlLiterals::render).apply(template, bindings);
  }

  public String apply(SqlStatement statement) {
    return apply(statement.sql(), statement.bindings());
  }

  public String apply(String template, List<?> bindings) {
    if (template == null) return "";
    if (bindings == null || bindings.isEmpty()) return template;

    StringBuilder out = new StringBuilder(template.length() + bindings.size() * 8);
    int used = 0;
    int missing = 0;
    int i = 0;
    while (i < template.length()) {
      int cp = template.codePointAt(i);
      i += Character.charCount(cp);
      if (cp != MARKER) {
        out.appendCodePoint(cp);
        continue;
      }
      if (used < bindings.size()) {
        out.append(renderer.apply(bindings.get(used++)));
      } else {
        missing++;
      }
    }

    if (missing > 0) {
      log.warn("snowgate.bind missing bindings placeholders={} bindings={} substitutedEmpty={}",
          used + missing, bindings.size(), missing);
    } else if (used < bindings.size() && log.isDebugEnabled()) {
      log.debug("snowgate.bind surplus bindings placeholders={} bindings={} ignored={}",
          used, bindings.size(), bindings.size() - used);
    }
    return out.toString();
  }
}
