package com.consullo.pipes.process;

import java.nio.file.Path;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Input to the spawn primitive. A stream whose redirect is {@link ProcessBuilder.Redirect#PIPE} gets a fresh pipe.
 *
 * @param command what to run
 * @param workingDirectory working directory, or {@code null} for the parent's
 * @param environment complete environment, or {@code null} for the parent's
 * @param stdin standard input connection
 * @param stdout standard output connection
 * @param stderr standard error connection
 * @param closeFds close descriptors other than the standard three in the child
 * @param createGroup start the child in a new process group
 * @param delegateCtrlC let the child handle Ctrl-C
 * @since 1.0
 */
public record LaunchRequest(
    CommandSpec command,
    Path workingDirectory,
    Map<String, String> environment,
    ProcessBuilder.Redirect stdin,
    ProcessBuilder.Redirect stdout,
    ProcessBuilder.Redirect stderr,
    boolean closeFds,
    boolean createGroup,
    boolean delegateCtrlC) {

  public LaunchRequest {
    Validate.notNull(command, "command must not be null");
    Validate.notNull(stdin, "stdin must not be null");
    Validate.notNull(stdout, "stdout must not be null");
    Validate.notNull(stderr, "stderr must not be null");
  }

  public boolean pipesInput() {
    return stdin == ProcessBuilder.Redirect.PIPE;
  }

  public boolean pipesOutput() {
    return stdout == ProcessBuilder.Redirect.PIPE;
  }

  public boolean pipesError() {
    return stderr == ProcessBuilder.Redirect.PIPE;
  }
}
