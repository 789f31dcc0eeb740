package com.consullo.pipes.scope;

import com.consullo.pipes.config.PipesConfig;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stack-disciplined registry of cleanup actions.
 *
 * <p>Every resource acquired through a scope is released when the scope closes, in reverse order of acquisition,
 * exactly once, whether the owning code finished normally, returned early or threw. A failing cleanup never stops
 * the remaining ones. A cleanup registered with an error sink has its failures forwarded to that sink and swallowed;
 * for the others the first failure is rethrown once teardown has finished, later ones are attached to it as
 * suppressed exceptions. Closing a scope twice, or from inside one of its own cleanups, does nothing.
 *
 * <p>Registration is thread-safe; background workers may register into the scope that owns them.
 *
 * @since 1.0
 */
public final class ResourceScope implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResourceScope.class);

  private final String name;
  private final long joinMillis;

  private final Object lock = new Object();
  private final Deque<Entry> entries = new ArrayDeque<>();
  private boolean closed;

  public ResourceScope() {
    this("scope", PipesConfig.DEFAULT_PUMP_JOIN_MILLIS);
  }

  /**
   * Creates a scope.
   *
   * @param name name used in log messages
   * @param joinMillis how long teardown waits for each cancelled background task
   */
  public ResourceScope(final String name, final long joinMillis) {
    Validate.notBlank(name, "name must not be blank");
    Validate.isTrue(joinMillis >= 0, "joinMillis must not be negative");
    this.name = name;
    this.joinMillis = joinMillis;
  }

  /**
   * Runs {@code body} in a fresh scope and closes the scope afterwards, however the body ends.
   *
   * @param body code to run
   * @param <R> result type
   * @return what the body returned
   * @throws Exception whatever the body or the teardown threw
   */
  public static <R> R run(final ScopedFunction<R> body) throws Exception {
    Validate.notNull(body, "body must not be null");
    try (ResourceScope scope = new ResourceScope()) {
      return body.apply(scope);
    }
  }

  public String name() {
    return name;
  }

  public boolean isClosed() {
    synchronized (lock) {
      return closed;
    }
  }

  /**
   * Acquires a resource and registers its release.
   *
   * <p>If the scope is closed by another thread while the acquirer runs, the fresh resource is released at once and
   * {@link IllegalStateException} is thrown, so nothing acquired here can escape teardown.
   *
   * @param acquirer acquires the resource
   * @param releaser releases it at teardown
   * @param <T> resource type
   * @param <E> exception the acquirer may throw
   * @return the resource
   * @throws E if acquisition fails; nothing is registered in that case
   */
  public <T, E extends Exception> T acquire(final Acquirer<T, E> acquirer, final Releaser<? super T> releaser)
      throws E {
    return acquire("resource", acquirer, releaser);
  }

  /**
   * Named variant of {@link #acquire(Acquirer, Releaser)}.
   */
  public <T, E extends Exception> T acquire(
      final String resourceName, final Acquirer<T, E> acquirer, final Releaser<? super T> releaser) throws E {
    return acquire(resourceName, acquirer, releaser, null);
  }

  /**
   * Variant of {@link #acquire(String, Acquirer, Releaser)} whose release failures go to {@code errorSink} instead of
   * out of {@link #close()}.
   *
   * @param errorSink receives release failures, or {@code null} to rethrow them from {@link #close()}
   */
  public <T, E extends Exception> T acquire(final String resourceName, final Acquirer<T, E> acquirer,
      final Releaser<? super T> releaser, final Consumer<? super Exception> errorSink) throws E {
    Validate.notNull(acquirer, "acquirer must not be null");
    Validate.notNull(releaser, "releaser must not be null");
    ensureOpen();

    final T resource = acquirer.acquire();
    final Entry entry = new Entry(resourceName, () -> releaser.release(resource), errorSink);
    synchronized (lock) {
      if (!closed) {
        entries.push(entry);
        LOGGER.debug("Scope {}: acquired {}", name, resourceName);
        return resource;
      }
    }

    LOGGER.debug("Scope {}: closed while acquiring {}, releasing it", name, resourceName);
    try {
      entry.release();
    } catch (final Exception e) {
      final Throwable unhandled = entry.forward(e);
      if (unhandled != null) {
        LOGGER.warn("Scope {}: releasing {} failed: {}", name, resourceName, unhandled.getMessage(), unhandled);
      }
    }
    throw new IllegalStateException("Scope " + name + " is closed");
  }

  /**
   * Registers a cleanup action.
   *
   * @param actionName name used in log messages
   * @param cleanup the action
   * @return registration that allows running the action early
   */
  public Registration register(final String actionName, final Cleanup cleanup) {
    return register(actionName, cleanup, null);
  }

  /**
   * Registers a cleanup action whose teardown failures go to {@code errorSink}.
   *
   * @param actionName name used in log messages
   * @param cleanup the action
   * @param errorSink receives the action's failures at teardown, or {@code null} to rethrow them from
   *     {@link #close()}
   * @return registration that allows running the action early
   */
  public Registration register(final String actionName, final Cleanup cleanup,
      final Consumer<? super Exception> errorSink) {
    Validate.notNull(cleanup, "cleanup must not be null");
    final Entry entry = new Entry(actionName, cleanup, errorSink);
    synchronized (lock) {
      if (closed) {
        throw new IllegalStateException("Scope " + name + " is closed");
      }
      entries.push(entry);
    }
    return entry;
  }

  /**
   * Runs {@code body} on a new daemon thread that is cancelled (interrupted, then joined for a bounded time) when
   * this scope closes.
   *
   * @param taskName thread name
   * @param body work to run
   * @return handle for waiting on the task
   */
  public BackgroundTask background(final String taskName, final BackgroundTask.Body body) {
    return acquire(taskName, () -> BackgroundTask.start(taskName, body), task -> task.cancel(joinMillis));
  }

  /**
   * Runs every pending cleanup in reverse registration order.
   *
   * <p>The calling thread's interrupt status is cleared for the duration of teardown, so that waiting for workers and
   * processes is not cut short, and restored afterwards.
   *
   * @throws Exception the first failure of a cleanup without an error sink, with later ones suppressed
   */
  @Override
  public void close() throws Exception {
    final List<Entry> pending;
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
      // push() adds to the head, so head-first iteration is newest-first.
      pending = new ArrayList<>(entries);
      entries.clear();
    }

    LOGGER.debug("Scope {}: tearing down {} registrations", name, pending.size());
    final boolean wasInterrupted = Thread.interrupted();
    Throwable failure = null;
    try {
      for (Entry entry : pending) {
        try {
          entry.release();
        } catch (final Throwable t) {
          if (t instanceof InterruptedException) {
            Thread.interrupted();
          }
          final Throwable unhandled = entry.forward(t);
          if (unhandled == null) {
            continue;
          }
          LOGGER.warn("Scope {}: cleanup {} failed: {}", name, entry.name(), unhandled.getMessage(), unhandled);
          if (failure == null) {
            failure = unhandled;
          } else {
            failure.addSuppressed(unhandled);
          }
        }
      }
    } finally {
      if (wasInterrupted) {
        Thread.currentThread().interrupt();
      }
    }

    if (failure instanceof Exception) {
      throw (Exception) failure;
    }
    if (failure instanceof Error) {
      throw (Error) failure;
    }
  }

  private void ensureOpen() {
    synchronized (lock) {
      if (closed) {
        throw new IllegalStateException("Scope " + name + " is closed");
      }
    }
  }

  private final class Entry implements Registration {

    private final String entryName;
    private final Cleanup cleanup;
    private final Consumer<? super Exception> errorSink;
    private final AtomicBoolean released = new AtomicBoolean();

    private Entry(String entryName, Cleanup cleanup, Consumer<? super Exception> errorSink) {
      this.entryName = entryName == null ? "cleanup" : entryName;
      this.cleanup = cleanup;
      this.errorSink = errorSink;
    }

    /**
     * Hands a teardown failure to the error sink.
     *
     * @return what is left for the caller to handle: {@code null} if the sink took it, the failure itself if there is
     *     no sink or it is an {@link Error}, or whatever the sink threw
     */
    private Throwable forward(final Throwable failure) {
      if (errorSink == null || !(failure instanceof Exception)) {
        return failure;
      }
      LOGGER.debug("Scope {}: forwarding failure of {} to its error sink", name, entryName);
      try {
        errorSink.accept((Exception) failure);
        return null;
      } catch (final RuntimeException e) {
        e.addSuppressed(failure);
        return e;
      }
    }

    @Override
    public void release() throws Exception {
      if (!released.compareAndSet(false, true)) {
        return;
      }
      synchronized (lock) {
        entries.remove(this);
      }
      LOGGER.debug("Scope {}: releasing {}", name, entryName);
      cleanup.run();
    }

    @Override
    public boolean isReleased() {
      return released.get();
    }

    @Override
    public String name() {
      return entryName;
    }
  }
}
