package io.intellixity.snowgate.connection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.snowgate.spi.exec.QueryResult;
import io.intellixity.snowgate.spi.exec.WarehouseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads SQL API statement responses into {@link QueryResult}s.\n
 *
 * Response codes:\n
 * - {@value #CODE_SUCCESS}: executed, metadata and first partition present\n
 * - {@value #CODE_ASYNC}: still running, only the statement handle is meaningful\n
 * - anything else: {@link WarehouseException} with status 422\n
 */
public final class StatementResponseParser {
  private static final Logger log = LoggerFactory.getLogger(StatementResponseParser.class);

  public static final String CODE_SUCCESS = "090001";
  public static final String CODE_ASYNC = "333334";

  private static final List<String> REQUIRED_TOP = List.of("resultSetMetaData", "data");
  private static final List<String> REQUIRED_META = List.of("numRows", "partitionInfo", "rowType");

  private final ObjectMapper json;

  public StatementResponseParser() {
    this(new ObjectMapper());
  }

  public StatementResponseParser(ObjectMapper json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  public QueryResult parse(String body) {
    return parse(read(body));
  }

  public QueryResult parse(JsonNode root) {
    if (root == null || !root.isObject() || !root.has("code") || !root.has("message")) {
      throw new WarehouseException("Unacceptable result", 406);
    }
    String code = root.get("code").asText();
    String message = root.get("message").asText();
    String handle = textOrNull(root, "statementHandle");

    if (CODE_ASYNC.equals(code)) return QueryResult.pending(handle);
    if (!CODE_SUCCESS.equals(code)) {
      Map<String, Object> ctx = new LinkedHashMap<>();
      ctx.put("code", code);
      if (handle != null) ctx.put("statementHandle", handle);
      String sqlState = textOrNull(root, "sqlState");
      if (sqlState != null) ctx.put("sqlState", sqlState);
      log.error("snowgate.response unexpected code={} sqlState={} message={}", code, sqlState, message);
      throw new WarehouseException(message + " (" + code + ")", 422, ctx);
    }

    requireFields(root, REQUIRED_TOP, "");
    JsonNode meta = root.get("resultSetMetaData");
    requireFields(meta, REQUIRED_META, " in \"resultSetMetaData\"");

    List<QueryResult.ResultColumn> columns = new ArrayList<>();
    for (JsonNode c : meta.get("rowType")) {
      columns.add(new QueryResult.ResultColumn(
          textOrNull(c, "name"),
          textOrNull(c, "type"),
          c.hasNonNull("scale") ? c.get("scale").asInt() : null,
          !c.has("nullable") || c.get("nullable").asBoolean(true)
      ));
    }

    QueryResult result = new QueryResult(handle, true, columns, rows(root.get("data")));
    if (log.isDebugEnabled()) {
      log.debug("snowgate.response code={} statementHandle={} numRows={} partitions={} columns={} rows={}",
          code, handle, meta.get("numRows").asLong(), meta.get("partitionInfo").size(),
          columns.size(), result.count());
    }
    return result;
  }

  /** Rows of a further partition response (a body with a {@code data} array only). */
  public List<List<Object>> parsePartition(String body) {
    JsonNode root = read(body);
    if (root == null || !root.has("data")) {
      throw new WarehouseException("Objects \"data\" not found", 422);
    }
    return rows(root.get("data"));
  }

  private JsonNode read(String body) {
    if (body == null || body.isBlank()) throw new WarehouseException("Empty response body", 422);
    try {
      return json.readTree(body);
    } catch (JsonProcessingException e) {
      throw new WarehouseException("Malformed response: " + e.getOriginalMessage(), 422, Map.of(), e);
    }
  }

  private static void requireFields(JsonNode node, List<String> fields, String where) {
    List<String> missing = new ArrayList<>();
    for (String f : fields) {
      if (!node.has(f)) missing.add(f);
    }
    if (!missing.isEmpty()) {
      throw new WarehouseException("Objects \"" + String.join(", ", missing) + "\"" + where + " not found", 422);
    }
  }

  private List<List<Object>> rows(JsonNode data) {
    if (data == null || data.isNull()) return List.of();
    List<List<Object>> out = new ArrayList<>(data.size());
    for (JsonNode row : data) {
      List<Object> cells = new ArrayList<>(row.size());
      for (JsonNode cell : row) cells.add(cell(cell));
      out.add(cells);
    }
    return out;
  }

  private Object cell(JsonNode cell) {
    if (cell == null || cell.isNull()) return null;
    if (cell.isTextual()) return cell.asText();
    if (cell.isBoolean()) return cell.booleanValue();
    if (cell.isNumber()) return cell.numberValue();
    return json.convertValue(cell, Object.class);
  }

  private static String textOrNull(JsonNode node, String field) {
    JsonNode v = node.get(field);
    return (v == null || v.isNull()) ? null : v.asText();
  }
}
