package io.intellixity.snowgate.connection;

/** Lifecycle events of the simulated transaction counter. */
public enum TransactionEvent {
  BEGAN,
  /** Fired only when the outermost level commits. */
  COMMITTING,
  COMMITTED,
  ROLLING_BACK
}
