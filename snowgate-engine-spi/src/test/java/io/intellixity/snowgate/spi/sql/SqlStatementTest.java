package io.intellixity.snowgate.spi.sql;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SqlStatementTest {

  @Test
  void nullSqlIsEmpty() {
    SqlStatement st = new SqlStatement(null, null);
    assertEquals("", st.sql());
    assertTrue(st.isEmpty());
    assertTrue(SqlStatement.empty().isEmpty());
  }

  @Test
  void bindingsKeepNullsAndOrder() {
    SqlStatement st = new SqlStatement("select ?, ?", Arrays.asList(null, 1));
    assertFalse(st.isEmpty());
    assertEquals(Arrays.asList(null, 1), st.bindings());
    assertThrows(UnsupportedOperationException.class, () -> st.bindings().add(2));
    assertEquals(List.of(), new SqlStatement("select 1").bindings());
  }
}
