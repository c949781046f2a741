package io.intellixity.snowgate.spi.exec;

/**
 * Remote execution collaborator: runs one complete, literal-valued SQL statement.
 * <p>
 * Transport, authentication and polling are the implementation's business. Failures are reported as
 * {@link WarehouseException}.
 */
@FunctionalInterface
public interface QueryService {
  QueryResult executeQuery(String sql);
}
