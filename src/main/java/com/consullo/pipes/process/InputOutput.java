package com.consullo.pipes.process;

import com.consullo.pipes.stream.Sink;
import com.consullo.pipes.stream.Source;

/**
 * Endpoints for a child's standard input and standard output.
 *
 * @since 1.0
 */
public record InputOutput(Sink<byte[]> input, Source<byte[]> output) {
}
