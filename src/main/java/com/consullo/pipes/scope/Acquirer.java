package com.consullo.pipes.scope;

/**
 * Acquires a resource.
 *
 * @param <T> resource type
 * @param <E> checked exception the acquisition may throw
 * @since 1.0
 */
@FunctionalInterface
public interface Acquirer<T, E extends Exception> {

  T acquire() throws E;
}
