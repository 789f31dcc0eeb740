package com.consullo.pipes.pump;

import com.consullo.pipes.error.Activity;
import com.consullo.pipes.error.FaultReporter;
import com.consullo.pipes.error.HandleFault;
import com.consullo.pipes.error.StreamRole;
import com.consullo.pipes.mailbox.Mailbox;
import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background worker that moves byte chunks between one OS stream handle and one {@link Mailbox}.
 *
 * <p>The pump owns its handle: only the pump thread reads, writes or closes it. Whatever ends the pump (end of
 * data, a sealed mailbox, an I/O fault or a stop request) the handle is closed and the mailbox sealed exactly once
 * on the way out. I/O faults are reported through the process's {@link FaultReporter}, never thrown.
 *
 * @since 1.0
 */
public abstract class HandlePump implements Runnable {

  private static final Logger LOGGER = LoggerFactory.getLogger(HandlePump.class);

  private final StreamRole role;
  private final Closeable handle;
  private final Mailbox<byte[]> mailbox;
  private final FaultReporter reporter;

  private final AtomicReference<PumpState> state = new AtomicReference<>(PumpState.CREATED);
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean handleClosed = new AtomicBoolean();
  private final CountDownLatch finished = new CountDownLatch(1);
  private volatile boolean stopRequested;
  private volatile Thread thread;

  protected HandlePump(StreamRole role, Closeable handle, Mailbox<byte[]> mailbox, FaultReporter reporter) {
    Validate.notNull(role, "role must not be null");
    Validate.notNull(handle, "handle must not be null");
    Validate.notNull(mailbox, "mailbox must not be null");
    Validate.notNull(reporter, "reporter must not be null");
    this.role = role;
    this.handle = handle;
    this.mailbox = mailbox;
    this.reporter = reporter;
  }

  /**
   * Moves bytes until the stream, the mailbox or a fault says to stop.
   *
   * @throws InterruptedException if interrupted while waiting on the mailbox
   */
  protected abstract void pump() throws InterruptedException;

  /**
   * Starts the pump on a new daemon thread.
   *
   * @param threadName thread name
   * @return this pump
   */
  public HandlePump start(final String threadName) {
    Validate.validState(started.compareAndSet(false, true), "pump already started");
    final Thread t = new Thread(this, threadName);
    t.setDaemon(true);
    this.thread = t;
    t.start();
    return this;
  }

  @Override
  public final void run() {
    started.set(true);
    if (!state.compareAndSet(PumpState.CREATED, PumpState.PIPING)) {
      throw new IllegalStateException("pump for " + role.description() + " already ran");
    }
    LOGGER.debug("Pump for {} of {} started", role.description(), reporter.command());
    try {
      pump();
    } catch (final InterruptedException e) {
      LOGGER.debug("Pump for {} interrupted", role.description());
    } finally {
      state.set(PumpState.DRAINING);
      try {
        mailbox.seal();
        closeHandle();
      } finally {
        state.set(PumpState.CLOSED);
        finished.countDown();
        LOGGER.debug("Pump for {} of {} closed", role.description(), reporter.command());
      }
    }
  }

  /**
   * Asks the pump to stop at its next suspension point: seals the mailbox and interrupts the pump thread.
   */
  public void requestStop() {
    stopRequested = true;
    mailbox.seal();
    final Thread t = thread;
    if (t != null) {
      t.interrupt();
    }
  }

  /**
   * Waits for the pump to finish. A pump that was never started counts as finished; one whose thread has been
   * started but not yet scheduled does not.
   *
   * @param millis maximum wait
   * @return true if the pump has finished
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitStopped(final long millis) throws InterruptedException {
    if (!started.get()) {
      return true;
    }
    return finished.await(millis, TimeUnit.MILLISECONDS);
  }

  /**
   * Closes the handle from the calling thread if the pump has not closed it yet. Used only when a pump is stuck in
   * an uninterruptible read or write after its process has been terminated.
   */
  public void forceClose() {
    mailbox.seal();
    closeHandle();
  }

  /**
   * @return true once {@link #start(String)} or {@link #run()} has been called
   */
  public boolean isStarted() {
    return started.get();
  }

  public PumpState state() {
    return state.get();
  }

  public StreamRole role() {
    return role;
  }

  public boolean isHandleClosed() {
    return handleClosed.get();
  }

  protected Mailbox<byte[]> mailbox() {
    return mailbox;
  }

  protected boolean isStopRequested() {
    return stopRequested;
  }

  /**
   * Marks the transition from moving bytes to shutting down.
   */
  protected void draining() {
    state.compareAndSet(PumpState.PIPING, PumpState.DRAINING);
  }

  /**
   * Reports a read or write failure, unless it is a side effect of a requested stop.
   */
  protected void fault(final Activity activity, final IOException e) {
    draining();
    if (stopRequested) {
      LOGGER.debug("Ignoring {} failure on {} after stop request: {}", activity, role, e.toString());
      return;
    }
    reporter.report(new HandleFault(activity, role), e);
  }

  private void closeHandle() {
    if (handleClosed.compareAndSet(false, true)) {
      reporter.closeReporting(handle, role);
    }
  }
}
