package com.consullo.pipes.process;

import java.io.IOException;

/**
 * The OS spawn primitive.
 *
 * <p>Implementations start the process described by the request and return it; for every stream requested as a
 * pipe the returned {@link Process} exposes the parent's end of that pipe. Failures (executable not found,
 * permission denied) are thrown, never reported to an error handler.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ProcessLauncher {

  Process launch(LaunchRequest request) throws IOException;
}
