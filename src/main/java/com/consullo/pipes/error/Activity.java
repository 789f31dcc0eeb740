package com.consullo.pipes.error;

/**
 * What was being done to a handle when an I/O error occurred.
 *
 * @since 1.0
 */
public enum Activity {
  READING("reading from"),
  WRITING("writing to"),
  CLOSING("closing the handle associated with");

  private final String description;

  Activity(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
