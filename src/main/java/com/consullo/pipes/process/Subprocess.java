package com.consullo.pipes.process;

import com.consullo.pipes.error.FaultReporter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A spawned child process.
 *
 * <p>The {@link com.consullo.pipes.scope.ResourceScope} that spawned it terminates and awaits it on teardown, so no
 * child outlives its scope as an orphan or a zombie. Callers may wait for it, or terminate it, earlier.
 *
 * @since 1.0
 */
public final class Subprocess {

  private static final Logger LOGGER = LoggerFactory.getLogger(Subprocess.class);

  private final Process process;
  private final FaultReporter reporter;
  private final long terminateGraceMillis;
  private final AtomicBoolean terminated = new AtomicBoolean();

  Subprocess(final Process process, final FaultReporter reporter, final long terminateGraceMillis) {
    Validate.notNull(process, "process must not be null");
    Validate.notNull(reporter, "reporter must not be null");
    this.process = process;
    this.reporter = reporter;
    this.terminateGraceMillis = terminateGraceMillis;
  }

  public CommandSpec command() {
    return reporter.command();
  }

  public long pid() {
    return process.pid();
  }

  public boolean isAlive() {
    return process.isAlive();
  }

  /**
   * Waits for the process to exit.
   *
   * @return exit code
   * @throws InterruptedException if interrupted while waiting
   */
  public int waitFor() throws InterruptedException {
    return process.waitFor();
  }

  /**
   * Waits up to {@code timeout} for the process to exit.
   *
   * @param timeout maximum wait
   * @return true if the process has exited
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean waitFor(final Duration timeout) throws InterruptedException {
    Validate.notNull(timeout, "timeout must not be null");
    return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * Exit code of a finished process.
   *
   * @throws IllegalThreadStateException if the process is still running
   */
  public int exitValue() {
    return process.exitValue();
  }

  /**
   * Completes with the exit code once the process exits.
   */
  public CompletableFuture<Integer> onExit() {
    return process.onExit().thenApply(Process::exitValue);
  }

  /**
   * Asks the OS to stop the process, then waits for it to exit. A process still alive after the grace period is
   * destroyed forcibly. The wait itself is not cut short by interrupts; the interrupt status is restored afterwards.
   * I/O errors go to the error handler as termination faults. Only the first call does anything.
   */
  public void terminate() {
    if (!terminated.compareAndSet(false, true)) {
      return;
    }
    LOGGER.debug("Terminating pid {} ({})", pid(), command());
    reporter.runReporting(null, this::requestStop);
    reporter.runReporting(null, this::awaitExit);
  }

  Process process() {
    return process;
  }

  private void requestStop() throws IOException {
    try {
      if (process.isAlive()) {
        process.destroy();
      }
    } catch (final UncheckedIOException e) {
      throw e.getCause();
    }
  }

  private void awaitExit() throws IOException {
    boolean interrupted = false;
    try {
      boolean exited = false;
      try {
        exited = process.waitFor(terminateGraceMillis, TimeUnit.MILLISECONDS);
      } catch (final InterruptedException e) {
        interrupted = true;
      }
      if (!exited && process.isAlive()) {
        LOGGER.debug("pid {} still alive after {} ms, destroying forcibly", pid(), terminateGraceMillis);
        process.destroyForcibly();
      }
      while (true) {
        try {
          final int code = process.waitFor();
          LOGGER.debug("pid {} exited with {}", pid(), code);
          return;
        } catch (final InterruptedException e) {
          interrupted = true;
        }
      }
    } catch (final UncheckedIOException e) {
      throw e.getCause();
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  @Override
  public String toString() {
    return "Subprocess{pid=" + pid() + ", " + command() + "}";
  }
}
