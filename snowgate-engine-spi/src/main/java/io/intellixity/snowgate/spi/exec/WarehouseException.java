package io.intellixity.snowgate.spi.exec;

import java.util.Map;

/**
 * Failure reported by the warehouse query service or while reading its responses.
 * <p>
 * {@code code} follows HTTP status semantics where the service provides one (422 for statement errors),
 * 0 when unknown.
 */
public class WarehouseException extends RuntimeException {
  private final int code;
  private final Map<String, Object> context;

  public WarehouseException(String message) {
    this(message, 0, Map.of(), null);
  }

  public WarehouseException(String message, int code) {
    this(message, code, Map.of(), null);
  }

  public WarehouseException(String message, int code, Map<String, Object> context) {
    this(message, code, context, null);
  }

  public WarehouseException(String message, int code, Map<String, Object> context, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.context = (context == null) ? Map.of() : Map.copyOf(context);
  }

  public int code() { return code; }

  public Map<String, Object> context() { return context; }
}
