package com.consullo.pipes.process;

import com.consullo.pipes.config.PipesConfig;
import com.consullo.pipes.error.FaultReporter;
import com.consullo.pipes.error.StreamRole;
import com.consullo.pipes.mailbox.Mailbox;
import com.consullo.pipes.pump.HandlePump;
import com.consullo.pipes.pump.InputPump;
import com.consullo.pipes.pump.OutputPump;
import com.consullo.pipes.scope.ResourceScope;
import com.consullo.pipes.stream.Sink;
import com.consullo.pipes.stream.Source;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Spawns subprocesses and connects their standard streams to in-process {@link Source}s and {@link Sink}s.
 *
 * <p>Each operation spawns one process inside the caller's {@link ResourceScope}. Streams requested as pipes get a
 * {@link Mailbox} and a {@link HandlePump} on a background thread; the other streams follow the given
 * {@link StreamDisposition}. When the scope closes, teardown runs in this order:
 * <ol>
 * <li>every pump is asked to stop (mailbox sealed, thread interrupted)</li>
 * <li>the process is terminated and awaited</li>
 * <li>each pump is given a bounded time to close its handle; a handle still open after that is closed from the
 * teardown thread</li>
 * </ol>
 *
 * <p>Spawn failures are thrown as {@link IOException}. I/O errors after the spawn go to the {@link ProcessSpec}'s
 * error handler, and so do failures of the process's teardown actions.
 *
 * @since 1.0
 */
public final class SubprocessEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubprocessEngine.class);

  private final PipesConfig config;
  private final ProcessLauncher launcher;

  /**
   * Engine with configuration from the classpath and the {@link ProcessBuilder} launcher.
   */
  public SubprocessEngine() {
    this(PipesConfig.load());
  }

  public SubprocessEngine(final PipesConfig config) {
    this(config, new ProcessBuilderLauncher());
  }

  public SubprocessEngine(final PipesConfig config, final ProcessLauncher launcher) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(launcher, "launcher must not be null");
    this.config = config;
    this.launcher = launcher;
  }

  public PipesConfig config() {
    return config;
  }

  /**
   * Spawns a process without piping any of its streams.
   *
   * @param scope owning scope
   * @param in standard input
   * @param out standard output
   * @param err standard error
   * @param spec what to run
   * @return the process
   * @throws IOException if the process cannot be started
   */
  public Subprocess pipeNone(
      final ResourceScope scope,
      final StreamDisposition in,
      final StreamDisposition out,
      final StreamDisposition err,
      final ProcessSpec spec) throws IOException {
    Validate.notNull(in, "in must not be null");
    Validate.notNull(out, "out must not be null");
    Validate.notNull(err, "err must not be null");
    return spawn(scope, in, out, err, spec).process;
  }

  /**
   * Spawns a process and returns a sink feeding its standard input. Completing the sink closes the child's input
   * once everything offered has been written.
   */
  public Piped<Sink<byte[]>> pipeInput(
      final ResourceScope scope,
      final StreamDisposition out,
      final StreamDisposition err,
      final ProcessSpec spec) throws IOException {
    Validate.notNull(out, "out must not be null");
    Validate.notNull(err, "err must not be null");
    final Spawned s = spawn(scope, null, out, err, spec);
    return new Piped<>(s.input, s.process);
  }

  /**
   * Spawns a process and returns a source yielding its standard output.
   */
  public Piped<Source<byte[]>> pipeOutput(
      final ResourceScope scope,
      final StreamDisposition in,
      final StreamDisposition err,
      final ProcessSpec spec) throws IOException {
    Validate.notNull(in, "in must not be null");
    Validate.notNull(err, "err must not be null");
    final Spawned s = spawn(scope, in, null, err, spec);
    return new Piped<>(s.output, s.process);
  }

  /**
   * Spawns a process and returns a source yielding its standard error.
   */
  public Piped<Source<byte[]>> pipeError(
      final ResourceScope scope,
      final StreamDisposition in,
      final StreamDisposition out,
      final ProcessSpec spec) throws IOException {
    Validate.notNull(in, "in must not be null");
    Validate.notNull(out, "out must not be null");
    final Spawned s = spawn(scope, in, out, null, spec);
    return new Piped<>(s.error, s.process);
  }

  public Piped<InputOutput> pipeInputOutput(
      final ResourceScope scope,
      final StreamDisposition err,
      final ProcessSpec spec) throws IOException {
    Validate.notNull(err, "err must not be null");
    final Spawned s = spawn(scope, null, null, err, spec);
    return new Piped<>(new InputOutput(s.input, s.output), s.process);
  }

  public Piped<InputError> pipeInputError(
      final ResourceScope scope,
      final StreamDisposition out,
      final ProcessSpec spec) throws IOException {
    Validate.notNull(out, "out must not be null");
    final Spawned s = spawn(scope, null, out, null, spec);
    return new Piped<>(new InputError(s.input, s.error), s.process);
  }

  public Piped<OutputError> pipeOutputError(
      final ResourceScope scope,
      final StreamDisposition in,
      final ProcessSpec spec) throws IOException {
    Validate.notNull(in, "in must not be null");
    final Spawned s = spawn(scope, in, null, null, spec);
    return new Piped<>(new OutputError(s.output, s.error), s.process);
  }

  public Piped<InputOutputError> pipeInputOutputError(
      final ResourceScope scope,
      final ProcessSpec spec) throws IOException {
    final Spawned s = spawn(scope, null, null, null, spec);
    return new Piped<>(new InputOutputError(s.input, s.output, s.error), s.process);
  }

  /**
   * Spawns the process; a {@code null} disposition means "create a pipe".
   */
  private Spawned spawn(
      final ResourceScope scope,
      final StreamDisposition in,
      final StreamDisposition out,
      final StreamDisposition err,
      final ProcessSpec spec) throws IOException {
    Validate.notNull(scope, "scope must not be null");
    Validate.notNull(spec, "spec must not be null");
    spec.claim();

    final FaultReporter reporter = new FaultReporter(spec.handler(), spec.command());
    final LaunchRequest request = new LaunchRequest(
        spec.command(),
        spec.workingDirectory().orElse(null),
        spec.environment().orElse(null),
        redirectOf(in),
        redirectOf(out),
        redirectOf(err),
        spec.closeFds(),
        spec.createGroup(),
        spec.delegateCtrlC());

    // Registered before the process so that it runs after termination.
    final List<HandlePump> pumps = new ArrayList<>(3);
    scope.register("handles of " + spec.command(), () -> reap(pumps), reporter::reportTeardown);

    final Subprocess process = scope.acquire("process " + spec.command(),
        () -> new Subprocess(launcher.launch(request), reporter, config.terminateGraceMillis()),
        Subprocess::terminate, reporter::reportTeardown);
    LOGGER.debug("Spawned pid {} for {}", process.pid(), spec.command());
    spec.processSlot().ifPresent(slot -> slot.complete(process));

    final Process raw = process.process();
    final Mailbox<byte[]> inBox = request.pipesInput() ? newMailbox() : null;
    final Mailbox<byte[]> outBox = request.pipesOutput() ? newMailbox() : null;
    final Mailbox<byte[]> errBox = request.pipesError() ? newMailbox() : null;

    // Every pipe handle belongs to a pump from here on, so the reaper can always close it.
    synchronized (pumps) {
      if (inBox != null) {
        pumps.add(new InputPump(raw.getOutputStream(), inBox, reporter));
      }
      if (outBox != null) {
        pumps.add(new OutputPump(StreamRole.OUTPUT, raw.getInputStream(), outBox, reporter,
            config.readChunkSize()));
      }
      if (errBox != null) {
        pumps.add(new OutputPump(StreamRole.ERROR, raw.getErrorStream(), errBox, reporter,
            config.readChunkSize()));
      }
    }
    for (HandlePump pump : pumpsSnapshot(pumps)) {
      final String threadName = "pipes-" + shortName(pump.role()) + "-" + process.pid();
      scope.acquire(threadName, () -> pump.start(threadName), HandlePump::requestStop, reporter::reportTeardown);
    }

    return new Spawned(
        process,
        inBox == null ? null : inBox.sink(),
        outBox == null ? null : outBox.source(),
        errBox == null ? null : errBox.source());
  }

  private Mailbox<byte[]> newMailbox() {
    return new Mailbox<>(config.mailboxCapacity());
  }

  private void reap(final List<HandlePump> pumps) {
    boolean interrupted = false;
    for (HandlePump pump : pumpsSnapshot(pumps)) {
      try {
        if (pump.isStarted() && !pump.awaitStopped(config.pumpJoinMillis())) {
          LOGGER.warn("Pump for {} did not stop within {} ms; closing its handle", pump.role().description(),
              config.pumpJoinMillis());
        }
      } catch (final InterruptedException e) {
        LOGGER.debug("Interrupted while waiting for the pump for {}; closing its handle", pump.role().description());
        interrupted = true;
      }
      pump.forceClose();
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private static List<HandlePump> pumpsSnapshot(final List<HandlePump> pumps) {
    synchronized (pumps) {
      return new ArrayList<>(pumps);
    }
  }

  private static ProcessBuilder.Redirect redirectOf(final StreamDisposition disposition) {
    return disposition == null ? ProcessBuilder.Redirect.PIPE : disposition.redirect();
  }

  private static String shortName(final StreamRole role) {
    switch (role) {
      case INPUT:
        return "stdin";
      case OUTPUT:
        return "stdout";
      default:
        return "stderr";
    }
  }

  private static final class Spawned {

    private final Subprocess process;
    private final Sink<byte[]> input;
    private final Source<byte[]> output;
    private final Source<byte[]> error;

    private Spawned(Subprocess process, Sink<byte[]> input, Source<byte[]> output, Source<byte[]> error) {
      this.process = process;
      this.input = input;
      this.output = output;
      this.error = error;
    }
  }
}
