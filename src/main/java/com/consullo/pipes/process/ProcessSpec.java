package com.consullo.pipes.process;

import com.consullo.pipes.error.ErrorHandler;
import com.consullo.pipes.error.ErrorHandlers;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.lang3.Validate;

/**
 * Everything needed to launch one subprocess: what to run, where, with which environment, and who hears about I/O
 * errors while it runs.
 *
 * <p>A spec is consumed by exactly one spawn; use {@link #toBuilder()} to derive a spec for another launch.
 *
 * @since 1.0
 */
public final class ProcessSpec {

  private final CommandSpec command;
  private final Path workingDirectory;
  private final Map<String, String> environment;
  private final boolean closeFds;
  private final boolean createGroup;
  private final boolean delegateCtrlC;
  private final CompletableFuture<Subprocess> processSlot;
  private final ErrorHandler handler;

  private final AtomicBoolean consumed = new AtomicBoolean();

  private ProcessSpec(Builder b) {
    this.command = b.command;
    this.workingDirectory = b.workingDirectory;
    this.environment = b.environment == null ? null : Map.copyOf(b.environment);
    this.closeFds = b.closeFds;
    this.createGroup = b.createGroup;
    this.delegateCtrlC = b.delegateCtrlC;
    this.processSlot = b.processSlot;
    this.handler = b.handler;
  }

  /**
   * Starts a spec for a program run without a shell. Defaults: parent's working directory and environment, no new
   * process group, no Ctrl-C delegation, no process slot, {@link ErrorHandlers#standardError()} as handler.
   *
   * @param program executable name or path
   * @param arguments command line arguments
   * @return builder
   */
  public static Builder builder(final String program, final String... arguments) {
    Validate.notNull(arguments, "arguments must not be null");
    return builder(program, Arrays.asList(arguments));
  }

  public static Builder builder(final String program, final List<String> arguments) {
    return new Builder(CommandSpec.raw(program, arguments));
  }

  /**
   * Starts a spec for a command line interpreted by the platform shell, with the same defaults as
   * {@link #builder(String, String...)}.
   *
   * @param commandLine shell command
   * @return builder
   */
  public static Builder shellBuilder(final String commandLine) {
    return new Builder(CommandSpec.shell(commandLine));
  }

  /**
   * Shorthand for {@code builder(program, arguments).build()}.
   */
  public static ProcessSpec of(final String program, final String... arguments) {
    return builder(program, arguments).build();
  }

  public CommandSpec command() {
    return command;
  }

  public Optional<Path> workingDirectory() {
    return Optional.ofNullable(workingDirectory);
  }

  /**
   * The complete environment of the child, or empty to inherit the parent's.
   */
  public Optional<Map<String, String>> environment() {
    return Optional.ofNullable(environment);
  }

  public boolean closeFds() {
    return closeFds;
  }

  public boolean createGroup() {
    return createGroup;
  }

  public boolean delegateCtrlC() {
    return delegateCtrlC;
  }

  public Optional<CompletableFuture<Subprocess>> processSlot() {
    return Optional.ofNullable(processSlot);
  }

  public ErrorHandler handler() {
    return handler;
  }

  /**
   * Marks this spec as used by a spawn.
   *
   * @throws IllegalStateException if the spec was already used
   */
  void claim() {
    Validate.validState(consumed.compareAndSet(false, true),
        "process spec for %s was already used; derive a new one with toBuilder()", command);
  }

  /**
   * Returns a builder preset with this spec's values, except the process slot, which is single-use.
   */
  public Builder toBuilder() {
    final Builder b = new Builder(command)
        .closeFds(closeFds)
        .createGroup(createGroup)
        .delegateCtrlC(delegateCtrlC)
        .handler(handler);
    b.workingDirectory = workingDirectory;
    b.environment = environment == null ? null : new LinkedHashMap<>(environment);
    return b;
  }

  @Override
  public String toString() {
    return "ProcessSpec{" + command.render() + "}";
  }

  public static final class Builder {

    private final CommandSpec command;
    private Path workingDirectory;
    private Map<String, String> environment;
    private boolean closeFds;
    private boolean createGroup;
    private boolean delegateCtrlC;
    private CompletableFuture<Subprocess> processSlot;
    private ErrorHandler handler;

    private Builder(CommandSpec command) {
      this.command = command;
    }

    public Builder workingDirectory(Path dir) {
      this.workingDirectory = dir;
      return this;
    }

    /**
     * Replaces the child's environment entirely; {@code null} inherits the parent's.
     */
    public Builder environment(Map<String, String> env) {
      this.environment = env == null ? null : new LinkedHashMap<>(env);
      return this;
    }

    public Builder closeFds(boolean closeFds) {
      this.closeFds = closeFds;
      return this;
    }

    public Builder createGroup(boolean createGroup) {
      this.createGroup = createGroup;
      return this;
    }

    public Builder delegateCtrlC(boolean delegateCtrlC) {
      this.delegateCtrlC = delegateCtrlC;
      return this;
    }

    /**
     * Future completed with the {@link Subprocess} shortly after it is spawned, for callers that want to wait for
     * its exit status or terminate it themselves.
     */
    public Builder storeProcess(CompletableFuture<Subprocess> slot) {
      this.processSlot = slot;
      return this;
    }

    public Builder handler(ErrorHandler handler) {
      this.handler = handler;
      return this;
    }

    public ProcessSpec build() {
      if (handler == null) {
        handler = ErrorHandlers.standardError();
      }
      if (environment != null) {
        for (Map.Entry<String, String> e : environment.entrySet()) {
          Validate.notNull(e.getKey(), "environment keys must not be null");
          Validate.notNull(e.getValue(), "environment value for %s must not be null", e.getKey());
        }
      }
      return new ProcessSpec(this);
    }
  }
}
