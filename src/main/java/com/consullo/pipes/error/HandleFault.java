package com.consullo.pipes.error;

import org.apache.commons.lang3.Validate;

/**
 * Locates an I/O error on one of the child's standard streams.
 *
 * @param activity what was being done
 * @param role which stream it was done to
 * @since 1.0
 */
public record HandleFault(Activity activity, StreamRole role) {

  public HandleFault {
    Validate.notNull(activity, "activity must not be null");
    Validate.notNull(role, "role must not be null");
  }

  public static HandleFault reading(final StreamRole role) {
    return new HandleFault(Activity.READING, role);
  }

  public static HandleFault writing(final StreamRole role) {
    return new HandleFault(Activity.WRITING, role);
  }

  public static HandleFault closing(final StreamRole role) {
    return new HandleFault(Activity.CLOSING, role);
  }

  /**
   * Renders as {@code when <activity> standard <stream>}.
   */
  public String describe() {
    return "when " + activity.description() + " " + role.description();
  }
}
