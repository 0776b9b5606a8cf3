package com.uavradar.processor.model;

/** Movement telegram kinds recognised at the start of a message. */
public enum MessageType {
  /** Filed flight plan. */
  FPL,
  /** Departure. */
  DEP,
  /** Arrival. */
  ARR,
  /** Flight plan change. */
  CHG,
  /** Flight plan cancellation. */
  CNL,
  /** Delay. */
  DLA,
  /** Supplementary flight plan request. */
  RQS,
  /** Flight plan request. */
  RQP
}
