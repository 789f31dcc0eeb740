package com.consullo.pipes.process;

import org.apache.commons.lang3.Validate;

/**
 * Stream endpoints of a spawned process together with the process itself.
 *
 * @param streams the endpoint (or group of endpoints) requested
 * @param process the child process
 * @param <T> endpoint type
 * @since 1.0
 */
public record Piped<T>(T streams, Subprocess process) {

  public Piped {
    Validate.notNull(streams, "streams must not be null");
    Validate.notNull(process, "process must not be null");
  }
}
