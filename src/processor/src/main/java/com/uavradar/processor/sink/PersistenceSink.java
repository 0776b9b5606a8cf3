package com.uavradar.processor.sink;

/** Destination for accepted flight records. */
public interface PersistenceSink {
  /**
   * Stores a flight document.
   *
   * <p>Implementations own cross-batch idempotency, keyed by
   * {@link FlightDocument#idempotencyKey()}.
   *
   * @param document document to store
   * @return outcome; failures are reported as {@link SaveOutcome#FAILED} rather than thrown
   */
  SaveOutcome save(FlightDocument document);
}
