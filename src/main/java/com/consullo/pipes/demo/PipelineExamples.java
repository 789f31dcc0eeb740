package com.consullo.pipes.demo;

import com.consullo.pipes.error.ErrorHandlers;
import com.consullo.pipes.process.InputOutput;
import com.consullo.pipes.process.InputOutputError;
import com.consullo.pipes.process.Piped;
import com.consullo.pipes.process.ProcessSpec;
import com.consullo.pipes.process.StreamDisposition;
import com.consullo.pipes.process.Subprocess;
import com.consullo.pipes.process.SubprocessEngine;
import com.consullo.pipes.scope.BackgroundTask;
import com.consullo.pipes.scope.ResourceScope;
import com.consullo.pipes.stream.Pipelines;
import com.consullo.pipes.stream.Sink;
import com.consullo.pipes.stream.Source;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Small pipelines of standard Unix tools showing how the engine is meant to be used.
 *
 * <p>In each example at most one pipeline runs in the foreground; the others are conveyors owned by the scope. Once
 * the foreground part finishes, the scope closes and takes every conveyor, pump and child process down with it, so
 * examples that must wait for a background stage to finish wait on that stage's process explicitly.
 *
 * @since 1.0
 */
public final class PipelineExamples {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineExamples.class);

  private PipelineExamples() {
  }

  /**
   * Endless stream of {@code "0\n"}, {@code "1\n"}, {@code "2\n"} and so on.
   */
  public static Source<byte[]> numbers() {
    return Pipelines.encodeLines(
        Pipelines.map(Pipelines.iterate(0L, n -> n + 1), String::valueOf),
        StandardCharsets.US_ASCII);
  }

  /**
   * Sends the first {@code count} numbers through {@code tr} (digits to letters) and collects the result.
   *
   * @param engine engine
   * @param count how many numbers
   * @return everything {@code tr} wrote
   * @throws Exception if the pipeline fails
   */
  public static byte[] alphaNumbersBytes(final SubprocessEngine engine, final int count) throws Exception {
    return ResourceScope.run(scope -> {
      final Piped<InputOutput> tr = engine.pipeInputOutput(scope, StreamDisposition.inherit(),
          ProcessSpec.of("tr", "0-9", "a-j"));
      Pipelines.conveyor(scope, "numbers-to-tr", Pipelines.take(numbers(), count), tr.streams().input());
      return Pipelines.concat(tr.streams().output());
    });
  }

  /**
   * Feeds an endless stream of numbers to {@code cat} and reads back only the first {@code count} lines. Closing
   * the output early makes {@code cat} die of a broken pipe, which in turn stops the producer; the discard handler
   * keeps the resulting broken-pipe faults quiet.
   *
   * @param engine engine
   * @param count how many lines to keep
   * @return the lines read
   * @throws Exception if the pipeline fails
   */
  public static List<String> firstLines(final SubprocessEngine engine, final int count) throws Exception {
    return ResourceScope.run(scope -> {
      final Piped<InputOutput> cat = engine.pipeInputOutput(scope, StreamDisposition.inherit(),
          ProcessSpec.builder("cat").handler(ErrorHandlers.discard()).build());
      Pipelines.conveyor(scope, "numbers-to-cat", numbers(), cat.streams().input());
      final Source<String> lines =
          Pipelines.take(Pipelines.lines(cat.streams().output(), StandardCharsets.US_ASCII), count);
      return Pipelines.fold(lines, new ArrayList<String>(), (acc, line) -> {
        acc.add(line);
        return acc;
      });
    });
  }

  /**
   * Runs both stages in the background: {@code count} numbers into {@code tr}, and {@code tr} into {@code cat}.
   * The foreground waits for {@code cat}'s exit code, taken from the process slot.
   *
   * @param engine engine
   * @param count how many numbers
   * @param catOutput where {@code cat} writes
   * @return exit code of {@code cat}
   * @throws Exception if the pipeline fails
   */
  public static int limitedAlphaNumbers(
      final SubprocessEngine engine, final int count, final StreamDisposition catOutput) throws Exception {
    return ResourceScope.run(scope -> {
      final Piped<InputOutput> tr = engine.pipeInputOutput(scope, StreamDisposition.inherit(),
          ProcessSpec.of("tr", "0-9", "a-j"));
      final CompletableFuture<Subprocess> catSlot = new CompletableFuture<>();
      final Sink<byte[]> toCat = engine.pipeInput(scope, catOutput, StreamDisposition.inherit(),
          ProcessSpec.builder("cat").storeProcess(catSlot).build()).streams();
      final BackgroundTask first =
          Pipelines.conveyor(scope, "numbers-to-tr", Pipelines.take(numbers(), count), tr.streams().input());
      final BackgroundTask second = Pipelines.conveyor(scope, "tr-to-cat", tr.streams().output(), toCat);
      final int code = catSlot.get().waitFor();
      LOGGER.debug("conveyors done: {} {}", first.isDone(), second.isDone());
      return code;
    });
  }

  /**
   * Sends {@code count} numbers through {@code tr} and then through {@code sh}, which copies every line to both its
   * standard output and standard error. Standard output goes on to {@code cat}; standard error is collected and
   * returned.
   *
   * @param engine engine
   * @param count how many numbers
   * @param catOutput where {@code cat} writes
   * @return everything {@code sh} wrote to standard error
   * @throws Exception if the pipeline fails
   */
  public static byte[] standardOutputAndError(
      final SubprocessEngine engine, final int count, final StreamDisposition catOutput) throws Exception {
    return ResourceScope.run(scope -> {
      final Piped<InputOutput> tr = engine.pipeInputOutput(scope, StreamDisposition.inherit(),
          ProcessSpec.of("tr", "0-9", "a-j"));
      final Piped<InputOutputError> sh = engine.pipeInputOutputError(scope,
          ProcessSpec.of("sh", "-c", "while read line; do echo $line; echo $line 1>&2; done"));
      final Sink<byte[]> toCat = engine.pipeInput(scope, catOutput, StreamDisposition.inherit(),
          ProcessSpec.of("cat")).streams();
      Pipelines.conveyor(scope, "numbers-to-tr", Pipelines.take(numbers(), count), tr.streams().input());
      Pipelines.conveyor(scope, "tr-to-sh", tr.streams().output(), sh.streams().input());
      Pipelines.conveyor(scope, "sh-to-cat", sh.streams().output(), toCat);
      return Pipelines.concat(sh.streams().error());
    });
  }

  /**
   * Runs every example and prints what it produced.
   *
   * @param args ignored
   * @throws Exception if an example fails
   */
  public static void main(final String[] args) throws Exception {
    final SubprocessEngine engine = new SubprocessEngine();

    final byte[] alpha = alphaNumbersBytes(engine, 300);
    System.out.println("=== tr output: " + alpha.length + " bytes ===");

    final List<String> first = firstLines(engine, 300);
    System.out.println("=== first lines: " + first.get(0) + " .. " + first.get(first.size() - 1) + " ===");

    final int code = limitedAlphaNumbers(engine, 300, StreamDisposition.discard());
    System.out.println("=== cat exit code: " + code + " ===");

    final byte[] err = standardOutputAndError(engine, 300, StreamDisposition.discard());
    System.out.println("=== sh standard error: " + err.length + " bytes ===");
    LOGGER.info("Examples completed");
  }
}
