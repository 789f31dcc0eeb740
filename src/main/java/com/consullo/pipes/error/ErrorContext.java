package com.consullo.pipes.error;

import com.consullo.pipes.process.CommandSpec;
import java.io.IOException;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * An I/O error caught while running a subprocess, together with where it happened.
 *
 * <p>If {@link #handleFault()} is empty the error arose while terminating the process rather than while dealing with
 * one of its standard streams. Only {@link IOException}s are ever captured this way; errors raised while spawning the
 * process, and exceptions of any other type, propagate to the caller.
 *
 * @since 1.0
 */
public final class ErrorContext {

  private final HandleFault handleFault;
  private final CommandSpec command;
  private final IOException cause;

  public ErrorContext(HandleFault handleFault, CommandSpec command, IOException cause) {
    Validate.notNull(command, "command must not be null");
    Validate.notNull(cause, "cause must not be null");
    this.handleFault = handleFault;
    this.command = command;
    this.cause = cause;
  }

  public Optional<HandleFault> handleFault() {
    return Optional.ofNullable(handleFault);
  }

  public CommandSpec command() {
    return command;
  }

  public IOException cause() {
    return cause;
  }

  /**
   * True when the error arose while terminating the process.
   */
  public boolean isTermination() {
    return handleFault == null;
  }

  /**
   * Formats this context as a one-line warning.
   *
   * @param programName name of the running program
   * @return {@code <program>: warning: when running command <cmd>: <where>: <error>}
   */
  public String render(final String programName) {
    final String where = handleFault == null ? "when terminating process" : handleFault.describe();
    return programName + ": warning: when running command " + command.render() + ": " + where + ": " + cause;
  }

  @Override
  public String toString() {
    return "ErrorContext{" + (handleFault == null ? "terminating" : handleFault) + ", " + command.render()
        + ", " + cause + "}";
  }
}
