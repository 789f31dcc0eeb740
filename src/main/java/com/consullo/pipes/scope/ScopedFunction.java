package com.consullo.pipes.scope;

/**
 * Body run inside a fresh {@link ResourceScope} by {@link ResourceScope#run(ScopedFunction)}.
 *
 * @param <R> result type
 * @since 1.0
 */
@FunctionalInterface
public interface ScopedFunction<R> {

  R apply(ResourceScope scope) throws Exception;
}
