package com.consullo.pipes.process;

import com.consullo.pipes.stream.Sink;
import com.consullo.pipes.stream.Source;

/**
 * Endpoints for all three standard streams of a child.
 *
 * @since 1.0
 */
public record InputOutputError(Sink<byte[]> input, Source<byte[]> output, Source<byte[]> error) {
}
