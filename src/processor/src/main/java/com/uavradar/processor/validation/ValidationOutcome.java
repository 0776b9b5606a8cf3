package com.uavradar.processor.validation;

import com.uavradar.processor.model.RecordPatch;
import java.util.List;

/**
 * Result of validating one parsed record.
 *
 * <p>The patch is meant to be applied only when {@link #isValid()} is {@code true}.
 */
public final class ValidationOutcome {
  private final List<String> errors;
  private final List<String> warnings;
  private final RecordPatch patch;

  ValidationOutcome(List<String> errors, List<String> warnings, RecordPatch patch) {
    this.errors = List.copyOf(errors);
    this.warnings = List.copyOf(warnings);
    this.patch = patch;
  }

  /** Returns {@code true} when no sub-check produced a blocking error. */
  public boolean isValid() {
    return errors.isEmpty();
  }

  public List<String> errors() {
    return errors;
  }

  public List<String> warnings() {
    return warnings;
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }

  public RecordPatch patch() {
    return patch;
  }
}
