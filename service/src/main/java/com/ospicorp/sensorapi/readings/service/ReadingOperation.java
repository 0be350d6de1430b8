package com.ospicorp.sensorapi.readings.service;

/** Handler operations, each with the fixed text returned to callers when the backend fails. */
public enum ReadingOperation {
  LIST("list readings", "Error retrieving data"),
  LIST_BY_DATE("list readings by date", "Error retrieving data"),
  FIND("find reading", "Error retrieving data"),
  CREATE("add sensor reading", "Error adding data"),
  UPDATE("update sensor reading", "Error updating data"),
  DELETE("delete sensor reading", "Error deleting data");

  private final String label;
  private final String failureMessage;

  ReadingOperation(String label, String failureMessage) {
    this.label = label;
    this.failureMessage = failureMessage;
  }

  public String label() {
    return label;
  }

  public String failureMessage() {
    return failureMessage;
  }
}
