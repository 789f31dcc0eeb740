package com.consullo.pipes.scope;

/**
 * Handle to a cleanup action registered with a {@link ResourceScope}.
 *
 * @since 1.0
 */
public interface Registration {

  /**
   * Runs the cleanup now instead of at scope teardown. The action runs at most once across this call and teardown.
   *
   * @throws Exception if the cleanup fails
   */
  void release() throws Exception;

  /**
   * Returns true once the cleanup has run (or started running).
   */
  boolean isReleased();

  /**
   * Name given at registration, for diagnostics.
   */
  String name();
}
