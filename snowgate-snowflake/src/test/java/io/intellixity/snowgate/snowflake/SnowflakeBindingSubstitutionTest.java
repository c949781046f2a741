package io.intellixity.snowgate.snowflake;

import io.intellixity.snowgate.grammar.bind.BindingSubstitution;
import io.intellixity.snowgate.query.SelectQuery;
import io.intellixity.snowgate.spi.sql.SqlStatement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.snowgate.query.QueryFilters.eq;
import static org.junit.jupiter.api.Assertions.*;

final class SnowflakeBindingSubstitutionTest {
  private final SnowflakeDialect dialect = new SnowflakeDialect();
  private final BindingSubstitution substitution = new BindingSubstitution(dialect);

  @Test
  void trailingBackslashCannotCloseTheLiteral() {
    SqlStatement st = dialect.compileSelect(SelectQuery.from("users").where(eq("name", "x\\' or 1=1 --")));
    assertEquals("select * from \"USERS\" where name = 'x\\\\'' or 1=1 --'", substitution.apply(st));
  }

  @Test
  void backslashesSurviveVerbatim() {
    assertEquals("select 'C:\\\\new', 'it''s'",
        substitution.apply("select ?, ?", List.of("C:\\new", "it's")));
  }
}
