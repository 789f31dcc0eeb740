package com.consullo.pipes.process;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.apache.commons.lang3.Validate;

/**
 * What to execute: either a command line handed to the platform shell, or a program with an explicit argument list.
 *
 * <p>Instances are immutable and are used both to spawn the process and to describe it in diagnostics.
 *
 * @since 1.0
 */
public final class CommandSpec {

  public enum Kind {
    SHELL,
    RAW
  }

  private final Kind kind;
  private final String shellCommand;
  private final String program;
  private final List<String> arguments;

  private CommandSpec(Kind kind, String shellCommand, String program, List<String> arguments) {
    this.kind = kind;
    this.shellCommand = shellCommand;
    this.program = program;
    this.arguments = arguments;
  }

  /**
   * A command line interpreted by {@code /bin/sh -c} ({@code cmd.exe /c} on Windows).
   *
   * @param command shell command line
   * @return command spec
   */
  public static CommandSpec shell(final String command) {
    Validate.notBlank(command, "command must not be blank");
    return new CommandSpec(Kind.SHELL, command, null, List.of());
  }

  /**
   * A program run directly, without a shell.
   *
   * @param program executable name or path
   * @param arguments command line arguments, not including the program itself
   * @return command spec
   */
  public static CommandSpec raw(final String program, final List<String> arguments) {
    Validate.notBlank(program, "program must not be blank");
    Validate.noNullElements(arguments, "arguments must not contain null");
    return new CommandSpec(Kind.RAW, null, program, List.copyOf(arguments));
  }

  public Kind kind() {
    return kind;
  }

  /**
   * Returns the shell command line, or {@code null} for a raw command.
   */
  public String shellCommand() {
    return shellCommand;
  }

  /**
   * Returns the program, or {@code null} for a shell command.
   */
  public String program() {
    return program;
  }

  public List<String> arguments() {
    return arguments;
  }

  /**
   * Returns the argument vector handed to the OS.
   *
   * @return program followed by its arguments
   */
  public List<String> toArgv() {
    final List<String> argv = new ArrayList<>(arguments.size() + 3);
    if (kind == Kind.SHELL) {
      if (isWindows(System.getProperty("os.name", ""))) {
        argv.add("cmd.exe");
        argv.add("/c");
      } else {
        argv.add("/bin/sh");
        argv.add("-c");
      }
      argv.add(shellCommand);
    } else {
      argv.add(program);
      argv.addAll(arguments);
    }
    return argv;
  }

  /**
   * Renders the command for diagnostics: a shell command as one quoted string, a raw command as quoted words.
   *
   * @return printable command
   */
  public String render() {
    if (kind == Kind.SHELL) {
      return quote(shellCommand);
    }
    final StringBuilder sb = new StringBuilder(quote(program));
    for (String arg : arguments) {
      sb.append(' ').append(quote(arg));
    }
    return sb.toString();
  }

  private static String quote(String s) {
    final StringBuilder sb = new StringBuilder(s.length() + 2);
    sb.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          sb.append(c);
      }
    }
    sb.append('"');
    return sb.toString();
  }

  static boolean isWindows(final String osName) {
    return osName.toLowerCase(Locale.ROOT).startsWith("windows");
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CommandSpec)) {
      return false;
    }
    CommandSpec other = (CommandSpec) o;
    return kind == other.kind
        && Objects.equals(shellCommand, other.shellCommand)
        && Objects.equals(program, other.program)
        && arguments.equals(other.arguments);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, shellCommand, program, arguments);
  }

  @Override
  public String toString() {
    return render();
  }
}
