package io.intellixity.snowgate.exec;

/**
 * Transaction propagation for {@code inTx(Propagation, Supplier)}.
 * <p>
 * Modelled on Spring's propagation names. Against a simulated transaction (a nesting counter) "new" and
 * "nested" transactions only add a level; nothing is isolated.
 */
public enum Propagation {
  /** Join the current transaction, begin one if none exists. */
  REQUIRED,

  /** Join the current transaction, run without one if none exists. */
  SUPPORTS,

  /** Join the current transaction, fail if none exists. */
  MANDATORY,

  /** Always begin a new level for the work. */
  REQUIRES_NEW,

  /** Run without a transaction, fail if one exists. */
  NEVER,

  /** Begin a new level inside the current transaction, or a new transaction if none exists. */
  NESTED
}
