package com.consullo.pipes.error;

/**
 * Receives I/O errors that a pipeline degrades around instead of failing.
 *
 * <p>Handlers are called synchronously on the thread that detected the error, frequently a pump thread whose
 * shutdown waits for the handler to return, so implementations must not block indefinitely. Several pumps may call
 * the same handler concurrently; see {@link ErrorHandlers#serialized(ErrorHandler)}.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ErrorHandler {

  /**
   * Handles one error.
   *
   * @param context what went wrong and where
   */
  void handle(ErrorContext context);
}
