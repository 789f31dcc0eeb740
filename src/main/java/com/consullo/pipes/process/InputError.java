package com.consullo.pipes.process;

import com.consullo.pipes.stream.Sink;
import com.consullo.pipes.stream.Source;

/**
 * Endpoints for a child's standard input and standard error.
 *
 * @since 1.0
 */
public record InputError(Sink<byte[]> input, Source<byte[]> error) {
}
