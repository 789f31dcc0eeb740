package com.consullo.pipes.stream;

/**
 * A pipeline stage that accepts elements, one {@link #offer(Object)} at a time.
 *
 * @param <T> element type
 * @since 1.0
 */
@FunctionalInterface
public interface Sink<T> extends AutoCloseable {

  /**
   * Hands one element to this sink, blocking while the sink cannot take it yet.
   *
   * @param item element, never {@code null}
   * @return {@code false} if the sink no longer accepts elements; the element was dropped
   * @throws Exception if the element cannot be delivered
   */
  boolean offer(T item) throws Exception;

  /**
   * Signals that no more elements will be offered.
   *
   * @implNote The default implementation does nothing.
   */
  default void complete() throws Exception {
  }

  /**
   * Same as {@link #complete()}.
   */
  @Override
  default void close() throws Exception {
    complete();
  }
}
