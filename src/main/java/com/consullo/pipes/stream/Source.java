package com.consullo.pipes.stream;

/**
 * A pipeline stage that yields elements, one {@link #poll()} at a time.
 *
 * <p>Sources are single-pass and single-consumer. Closing a source tells whatever feeds it that no more elements
 * will be taken; upstream producers observe this as a refused offer and shut down.
 *
 * @param <T> element type
 * @since 1.0
 */
@FunctionalInterface
public interface Source<T> extends AutoCloseable {

  /**
   * Returns the next element, blocking if necessary.
   *
   * @return next element, or {@code null} once the source is drained
   * @throws Exception if the element cannot be produced
   */
  T poll() throws Exception;

  /**
   * Stops this source. Further polls return {@code null}.
   *
   * @implNote The default implementation does nothing.
   */
  @Override
  default void close() throws Exception {
  }
}
