package com.consullo.pipes.error;

/**
 * Names a standard stream from the child's point of view; {@link #INPUT} is the child's standard input.
 *
 * @since 1.0
 */
public enum StreamRole {
  INPUT("standard input"),
  OUTPUT("standard output"),
  ERROR("standard error");

  private final String description;

  StreamRole(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
