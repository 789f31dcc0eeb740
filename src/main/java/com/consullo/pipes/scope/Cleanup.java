package com.consullo.pipes.scope;

/**
 * A teardown action registered with a {@link ResourceScope}.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface Cleanup {

  void run() throws Exception;
}
