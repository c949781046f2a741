package io.intellixity.snowgate.query;

/** Requested row lock. Dialects without row locking drop it. */
public enum LockMode {
  SHARED,
  FOR_UPDATE
}
