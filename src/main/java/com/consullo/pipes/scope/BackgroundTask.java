package com.consullo.pipes.scope;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A unit of work running on its own daemon thread on behalf of a {@link ResourceScope}.
 *
 * <p>Created by {@link ResourceScope#background(String, BackgroundTask.Body)}; the scope cancels the task when it
 * closes if it has not finished by then.
 *
 * @since 1.0
 */
public final class BackgroundTask {

  private static final Logger LOGGER = LoggerFactory.getLogger(BackgroundTask.class);

  /**
   * Work performed by a background task.
   */
  @FunctionalInterface
  public interface Body {
    void run() throws Exception;
  }

  private final String name;
  private final Thread thread;
  private final CompletableFuture<Void> completion = new CompletableFuture<>();
  private volatile boolean cancelled;

  private BackgroundTask(String name, Body body) {
    this.name = name;
    this.thread = new Thread(() -> runBody(body), name);
    this.thread.setDaemon(true);
  }

  static BackgroundTask start(final String name, final Body body) {
    Validate.notBlank(name, "name must not be blank");
    Validate.notNull(body, "body must not be null");
    final BackgroundTask task = new BackgroundTask(name, body);
    task.thread.start();
    return task;
  }

  private void runBody(Body body) {
    try {
      body.run();
      completion.complete(null);
    } catch (final Throwable t) {
      if (cancelled) {
        LOGGER.debug("Background task {} ended after cancellation: {}", name, t.toString());
      } else {
        LOGGER.warn("Background task {} failed: {}", name, t.getMessage(), t);
      }
      completion.completeExceptionally(t);
    }
  }

  public String name() {
    return name;
  }

  public boolean isDone() {
    return completion.isDone();
  }

  /**
   * Waits for the task to finish.
   *
   * @throws InterruptedException if interrupted while waiting
   * @throws ExecutionException wrapping whatever the task threw
   */
  public void await() throws InterruptedException, ExecutionException {
    completion.get();
  }

  /**
   * Waits up to {@code timeout} for the task to finish.
   *
   * @param timeout maximum wait
   * @return true if the task finished in time
   * @throws InterruptedException if interrupted while waiting
   * @throws ExecutionException wrapping whatever the task threw
   */
  public boolean await(final Duration timeout) throws InterruptedException, ExecutionException {
    Validate.notNull(timeout, "timeout must not be null");
    try {
      completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return true;
    } catch (final TimeoutException e) {
      return false;
    }
  }

  /**
   * Interrupts the task's thread and waits up to {@code joinMillis} for it to exit.
   */
  void cancel(final long joinMillis) throws InterruptedException {
    if (completion.isDone()) {
      return;
    }
    cancelled = true;
    thread.interrupt();
    thread.join(Math.max(1L, joinMillis));
    if (thread.isAlive()) {
      LOGGER.warn("Background task {} still running {} ms after cancellation", name, joinMillis);
    }
  }
}
