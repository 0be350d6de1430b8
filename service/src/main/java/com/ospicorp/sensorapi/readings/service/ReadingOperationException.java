package com.ospicorp.sensorapi.readings.service;

public class ReadingOperationException extends RuntimeException {
  private final ReadingOperation operation;

  public ReadingOperationException(ReadingOperation operation, Throwable cause) {
    super("Failed to " + operation.label(), cause);
    this.operation = operation;
  }

  public ReadingOperation operation() {
    return operation;
  }
}
