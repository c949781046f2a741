package io.intellixity.snowgate.spi.exec;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class QueryResultTest {

  @Test
  void pendingHasHandleAndNoRows() {
    QueryResult r = QueryResult.pending("01b2-handle");
    assertFalse(r.executed());
    assertEquals("01b2-handle", r.statementHandle());
    assertTrue(r.isEmpty());
  }

  @Test
  void rowsAreCopiedAndMayHoldNulls() {
    List<Object> row = new ArrayList<>(Arrays.asList("1", null));
    List<List<Object>> data = new ArrayList<>();
    data.add(row);
    QueryResult r = new QueryResult("h", true, List.of(new QueryResult.ResultColumn("ID", "fixed")), data);

    row.set(0, "changed");
    data.add(List.of("2"));
    assertEquals(1, r.count());
    assertEquals(Arrays.asList("1", null), r.data().get(0));
    assertThrows(UnsupportedOperationException.class, () -> r.data().get(0).set(0, "x"));
  }

  @Test
  void withPageAppends() {
    QueryResult r = new QueryResult("h", true, List.of(), List.of(List.of("a")));
    QueryResult paged = r.withPage(List.of(List.of("b"), List.of("c")));
    assertEquals(3, paged.count());
    assertEquals("h", paged.statementHandle());
    assertSame(r, r.withPage(List.of()));
  }

  @Test
  void columnDefaultsToNullable() {
    QueryResult.ResultColumn c = new QueryResult.ResultColumn(null, null);
    assertNull(c.name());
    assertNull(c.scale());
    assertTrue(c.nullable());
  }

  @Test
  void warehouseExceptionCarriesCodeAndContext() {
    WarehouseException e = new WarehouseException("boom", 422, java.util.Map.of("code", "002003"));
    assertEquals(422, e.code());
    assertEquals("002003", e.context().get("code"));
    assertEquals(0, new WarehouseException("x").code());
  }
}
