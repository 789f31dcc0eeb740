package com.consullo.pipes.process;

import java.io.IOException;
import java.util.Map;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProcessLauncher} on top of {@link ProcessBuilder}.
 *
 * <p>The JDK closes every descriptor other than the standard three in the child and offers no process-group or
 * Ctrl-C delegation controls, so those flags of a {@link LaunchRequest} are logged but cannot change behaviour.
 *
 * @since 1.0
 */
public final class ProcessBuilderLauncher implements ProcessLauncher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessBuilderLauncher.class);

  @Override
  public Process launch(final LaunchRequest request) throws IOException {
    Validate.notNull(request, "request must not be null");

    final ProcessBuilder builder = new ProcessBuilder(request.command().toArgv());
    if (request.workingDirectory() != null) {
      builder.directory(request.workingDirectory().toFile());
    }
    if (request.environment() != null) {
      final Map<String, String> env = builder.environment();
      env.clear();
      env.putAll(request.environment());
    }
    builder.redirectInput(request.stdin());
    builder.redirectOutput(request.stdout());
    builder.redirectError(request.stderr());

    if (!request.closeFds()) {
      LOGGER.debug("closeFds=false requested for {}; the JDK always closes inherited descriptors",
          request.command());
    }
    if (request.createGroup() || request.delegateCtrlC()) {
      LOGGER.debug("createGroup={} delegateCtrlC={} requested for {}; not supported by ProcessBuilder",
          request.createGroup(), request.delegateCtrlC(), request.command());
    }

    LOGGER.debug("Launching {} (stdin={}, stdout={}, stderr={})",
        request.command(), request.stdin(), request.stdout(), request.stderr());
    return builder.start();
  }
}
