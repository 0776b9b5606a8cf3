package com.uavradar.ingester.inbox;

/** Raised when a telegram file cannot be accepted for ingestion. */
public class InvalidTelegramFileException extends RuntimeException {
  public InvalidTelegramFileException(String message) {
    super(message);
  }

  public InvalidTelegramFileException(String message, Throwable cause) {
    super(message, cause);
  }
}
