package io.intellixity.snowgate.query;

/**
 * Raised when a query or DML statement is structurally invalid (missing table, no unique-by keys, ...).
 * <p>
 * Routine input variance never raises this; only shapes that cannot be compiled into valid SQL do.
 */
public final class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
