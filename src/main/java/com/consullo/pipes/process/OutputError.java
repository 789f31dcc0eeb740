package com.consullo.pipes.process;

import com.consullo.pipes.stream.Source;

/**
 * Endpoints for a child's standard output and standard error.
 *
 * @since 1.0
 */
public record OutputError(Source<byte[]> output, Source<byte[]> error) {
}
