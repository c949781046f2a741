package io.intellixity.snowgate.connection;

@FunctionalInterface
public interface TransactionListener {
  /**
   * @param level transaction level after the event was applied (for COMMITTING, the level being committed)
   */
  void onTransaction(TransactionEvent event, int level);
}
