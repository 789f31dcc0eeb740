package com.consullo.pipes.error;

import com.consullo.pipes.process.CommandSpec;
import java.io.Closeable;
import java.io.IOException;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds an {@link ErrorHandler} to the command it reports for and turns caught {@link IOException}s into
 * {@link ErrorContext}s.
 *
 * <p>One reporter exists per spawned process and is shared by its pumps and its termination cleanup.
 *
 * @since 1.0
 */
public final class FaultReporter {

  private static final Logger LOGGER = LoggerFactory.getLogger(FaultReporter.class);

  /**
   * An action that may fail with an {@link IOException}.
   */
  @FunctionalInterface
  public interface IoAction {
    void run() throws IOException;
  }

  private final ErrorHandler handler;
  private final CommandSpec command;

  public FaultReporter(final ErrorHandler handler, final CommandSpec command) {
    Validate.notNull(handler, "handler must not be null");
    Validate.notNull(command, "command must not be null");
    this.handler = handler;
    this.command = command;
  }

  public CommandSpec command() {
    return command;
  }

  /**
   * Hands one error to the handler, synchronously, exactly once.
   *
   * @param fault where the error happened, or {@code null} for process termination
   * @param cause the error
   */
  public void report(final HandleFault fault, final IOException cause) {
    final ErrorContext context = new ErrorContext(fault, command, cause);
    LOGGER.debug("Reporting {}", context);
    handler.handle(context);
  }

  /**
   * Runs the action, reporting an {@link IOException} instead of throwing it. Other exceptions propagate.
   *
   * @param fault where a failure would be located, or {@code null} for process termination
   * @param action the action
   * @return true if the action completed without an {@link IOException}
   */
  public boolean runReporting(final HandleFault fault, final IoAction action) {
    try {
      action.run();
      return true;
    } catch (final IOException e) {
      report(fault, e);
      return false;
    }
  }

  /**
   * Reports a teardown action of the process that failed outside its own I/O reporting, as a termination fault.
   *
   * @param cause the failure; anything other than an {@link IOException} is wrapped in one
   */
  public void reportTeardown(final Exception cause) {
    Validate.notNull(cause, "cause must not be null");
    final IOException io = cause instanceof IOException
        ? (IOException) cause
        : new IOException("teardown failed: " + cause, cause);
    report(null, io);
  }

  /**
   * Closes a handle, reporting a failure as {@link Activity#CLOSING} on the given stream.
   *
   * @param handle the handle
   * @param role stream the handle belongs to
   */
  public void closeReporting(final Closeable handle, final StreamRole role) {
    runReporting(HandleFault.closing(role), handle::close);
  }
}
