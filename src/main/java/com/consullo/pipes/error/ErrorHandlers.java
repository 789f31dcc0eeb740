package com.consullo.pipes.error;

import com.consullo.pipes.config.PipesConfig;
import java.io.PrintStream;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;

/**
 * Stock {@link ErrorHandler}s.
 *
 * @since 1.0
 */
public final class ErrorHandlers {

  private static final ErrorHandler DISCARD = context -> {
  };

  private ErrorHandlers() {
  }

  /**
   * Prints each error to the current {@link System#err}, prefixed by the configured program name.
   *
   * @return default handler
   */
  public static ErrorHandler standardError() {
    final String programName = defaultProgramName();
    return context -> print(System.err, context.render(programName));
  }

  /**
   * Program name from the configuration on the classpath, read on first use only.
   */
  static String defaultProgramName() {
    return DefaultProgramName.VALUE;
  }

  /**
   * Prints each error to the given stream.
   *
   * @param programName name printed at the start of each line
   * @param out destination
   * @return handler
   */
  public static ErrorHandler standardError(final String programName, final PrintStream out) {
    Validate.notBlank(programName, "programName must not be blank");
    Validate.notNull(out, "out must not be null");
    return context -> print(out, context.render(programName));
  }

  /**
   * Ignores every error. Useful where broken pipes are expected, e.g. a downstream consumer that stops early.
   *
   * @return handler that does nothing
   */
  public static ErrorHandler discard() {
    return DISCARD;
  }

  /**
   * Logs each error as a warning.
   *
   * @param logger destination logger
   * @return handler
   */
  public static ErrorHandler logging(final Logger logger) {
    Validate.notNull(logger, "logger must not be null");
    return context -> logger.warn("when running command {}: {}",
        context.command().render(),
        context.handleFault().map(HandleFault::describe).orElse("when terminating process"),
        context.cause());
  }

  /**
   * Funnels concurrent calls through one lock so that reports from several pumps never interleave.
   *
   * @param delegate handler to protect
   * @return serializing handler
   */
  public static ErrorHandler serialized(final ErrorHandler delegate) {
    Validate.notNull(delegate, "delegate must not be null");
    final ReentrantLock lock = new ReentrantLock();
    return context -> {
      lock.lock();
      try {
        delegate.handle(context);
      } finally {
        lock.unlock();
      }
    };
  }

  private static void print(PrintStream out, String line) {
    // One println per report; PrintStream locks internally so lines from different pumps stay whole.
    out.println(line);
    out.flush();
  }

  private static final class DefaultProgramName {

    private static final String VALUE = PipesConfig.load().programName();
  }
}
