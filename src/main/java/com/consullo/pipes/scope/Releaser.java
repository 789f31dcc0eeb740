package com.consullo.pipes.scope;

/**
 * Releases a resource acquired through {@link ResourceScope#acquire(Acquirer, Releaser)}.
 *
 * <p>Releasers that deal with OS handles or processes report their own I/O errors to the owning process's
 * {@link com.consullo.pipes.error.ErrorHandler}; anything they throw is treated by the scope as a teardown failure.
 *
 * @param <T> resource type
 * @since 1.0
 */
@FunctionalInterface
public interface Releaser<T> {

  void release(T resource) throws Exception;
}
