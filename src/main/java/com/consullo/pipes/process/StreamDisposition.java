package com.consullo.pipes.process;

import java.nio.file.Path;
import org.apache.commons.lang3.Validate;

/**
 * How a standard stream of the child is connected when no pipe is requested for it.
 *
 * <p>Both variants leave ownership with the caller: an inherited stream belongs to this JVM, and a redirect target
 * (file, {@link ProcessBuilder.Redirect#DISCARD}) is opened and closed by the JDK launcher, never by the engine. A
 * pipe is never expressed here; it is selected by asking the engine for an endpoint on that stream.
 *
 * @since 1.0
 */
public final class StreamDisposition {

  public enum Kind {
    INHERIT,
    USE_HANDLE
  }

  private static final StreamDisposition INHERIT = new StreamDisposition(Kind.INHERIT, ProcessBuilder.Redirect.INHERIT);

  private final Kind kind;
  private final ProcessBuilder.Redirect redirect;

  private StreamDisposition(Kind kind, ProcessBuilder.Redirect redirect) {
    this.kind = kind;
    this.redirect = redirect;
  }

  /**
   * Use whatever stream the parent has.
   */
  public static StreamDisposition inherit() {
    return INHERIT;
  }

  /**
   * Connect the stream to an externally supplied handle.
   *
   * @param redirect handle description; {@link ProcessBuilder.Redirect#PIPE} is rejected
   * @return disposition
   */
  public static StreamDisposition useHandle(final ProcessBuilder.Redirect redirect) {
    Validate.notNull(redirect, "redirect must not be null");
    Validate.isTrue(redirect != ProcessBuilder.Redirect.PIPE,
        "pipes are created by requesting an endpoint, not through a disposition");
    if (redirect == ProcessBuilder.Redirect.INHERIT) {
      return INHERIT;
    }
    return new StreamDisposition(Kind.USE_HANDLE, redirect);
  }

  public static StreamDisposition readFrom(final Path file) {
    Validate.notNull(file, "file must not be null");
    return useHandle(ProcessBuilder.Redirect.from(file.toFile()));
  }

  public static StreamDisposition writeTo(final Path file) {
    Validate.notNull(file, "file must not be null");
    return useHandle(ProcessBuilder.Redirect.to(file.toFile()));
  }

  public static StreamDisposition appendTo(final Path file) {
    Validate.notNull(file, "file must not be null");
    return useHandle(ProcessBuilder.Redirect.appendTo(file.toFile()));
  }

  public static StreamDisposition discard() {
    return useHandle(ProcessBuilder.Redirect.DISCARD);
  }

  public Kind kind() {
    return kind;
  }

  public ProcessBuilder.Redirect redirect() {
    return redirect;
  }

  @Override
  public String toString() {
    return kind == Kind.INHERIT ? "inherit" : "handle " + redirect;
  }
}
