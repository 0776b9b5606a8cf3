package com.uavradar.processor.sink;

/** Result of handing one flight document to a {@link PersistenceSink}. */
public enum SaveOutcome {
  STORED,
  /** A document with the same idempotency key was stored by an earlier batch. */
  ALREADY_STORED,
  FAILED
}
