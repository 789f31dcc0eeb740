package com.consullo.pipes.error;

import com.consullo.pipes.config.PipesConfig;
import com.consullo.pipes.process.CommandSpec;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for the stock error handlers and the fault reporter.
 *
 * @since 1.0
 */
public class ErrorHandlersTest {

  private static final CommandSpec TR = CommandSpec.raw("tr", List.of("a", "b"));

  @Test
  @DisplayName("Should resolve the default program name once and print it to standard error")
  void standardError_Default_UsesConfiguredProgramNameOnce() {
    final String first = ErrorHandlers.defaultProgramName();

    assertThat(ErrorHandlers.defaultProgramName()).isSameAs(first);
    assertThat(first).isEqualTo(PipesConfig.load().programName());

    final PrintStream original = System.err;
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    System.setErr(new PrintStream(bytes, true, StandardCharsets.UTF_8));
    try {
      ErrorHandlers.standardError()
          .handle(new ErrorContext(HandleFault.reading(StreamRole.OUTPUT), TR, new IOException("EOF")));
    } finally {
      System.setErr(original);
    }
    assertThat(bytes.toString(StandardCharsets.UTF_8)).startsWith(first + ": warning: when running command ");
  }

  @Test
  @DisplayName("Should print one line per error to the given stream")
  void standardError_Report_PrintsRenderedLine() {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    final PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
    final ErrorHandler handler = ErrorHandlers.standardError("demo", out);

    handler.handle(new ErrorContext(HandleFault.writing(StreamRole.INPUT), TR, new IOException("Broken pipe")));

    assertThat(bytes.toString(StandardCharsets.UTF_8)).isEqualTo(
        "demo: warning: when running command \"tr\" \"a\" \"b\": when writing to standard input: "
            + "java.io.IOException: Broken pipe" + System.lineSeparator());
  }

  @Test
  @DisplayName("Should log errors as warnings")
  void logging_Report_WarnsThroughLogger() {
    final Logger logger = mock(Logger.class);
    final IOException cause = new IOException("boom");

    ErrorHandlers.logging(logger).handle(new ErrorContext(null, TR, cause));

    verify(logger).warn(anyString(), eq("\"tr\" \"a\" \"b\""), eq("when terminating process"), any(Object.class));
  }

  @Test
  @DisplayName("Should pass every report through a serialized handler")
  void serialized_Report_ReachesDelegate() {
    final List<ErrorContext> seen = new ArrayList<>();
    final ErrorHandler handler = ErrorHandlers.serialized(seen::add);
    final ErrorContext context = new ErrorContext(HandleFault.reading(StreamRole.ERROR), TR, new IOException("x"));

    handler.handle(context);

    assertThat(seen).containsExactly(context);
  }

  @Test
  @DisplayName("Should report an IOException from an action and keep going")
  void runReporting_IoFailure_ReportsOnce() {
    final List<ErrorContext> seen = new ArrayList<>();
    final FaultReporter reporter = new FaultReporter(seen::add, TR);

    final boolean ok = reporter.runReporting(HandleFault.reading(StreamRole.OUTPUT), () -> {
      throw new IOException("read failed");
    });

    assertThat(ok).isFalse();
    assertThat(seen).hasSize(1);
    assertThat(seen.get(0).handleFault()).contains(HandleFault.reading(StreamRole.OUTPUT));
    assertThat(seen.get(0).command()).isEqualTo(TR);
    assertThat(seen.get(0).cause()).hasMessage("read failed");
  }

  @Test
  @DisplayName("Should let non-IO exceptions propagate past the reporter")
  void runReporting_RuntimeFailure_Propagates() {
    final List<ErrorContext> seen = new ArrayList<>();
    final FaultReporter reporter = new FaultReporter(seen::add, TR);

    assertThatThrownBy(() -> reporter.runReporting(null, () -> {
      throw new IllegalStateException("bug");
    })).isInstanceOf(IllegalStateException.class);
    assertThat(seen).isEmpty();
  }

  @Test
  @DisplayName("Should report close failures as closing faults")
  void closeReporting_FailingClose_ReportsClosing() {
    final List<ErrorContext> seen = new ArrayList<>();
    final FaultReporter reporter = new FaultReporter(seen::add, TR);

    reporter.closeReporting(() -> {
      throw new IOException("close failed");
    }, StreamRole.ERROR);

    assertThat(seen).singleElement()
        .satisfies(c -> assertThat(c.handleFault()).contains(HandleFault.closing(StreamRole.ERROR)));
  }

  @Test
  @DisplayName("Should ignore everything with the discard handler")
  void discard_Report_DoesNothing() {
    ErrorHandlers.discard().handle(new ErrorContext(null, TR, new IOException("ignored")));

    assertThat(ErrorHandlers.discard()).isSameAs(ErrorHandlers.discard());
  }
}
