package com.consullo.pipes.stream;

import com.consullo.pipes.mailbox.Mailbox;
import com.consullo.pipes.scope.BackgroundTask;
import com.consullo.pipes.scope.ResourceScope;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for in-process pipeline stages.
 *
 * @since 1.0
 */
public class PipelinesTest {

  @Test
  @DisplayName("Should split lines across chunk boundaries and keep an unterminated last line")
  void lines_ChunkedInput_SplitsCorrectly() throws Exception {
    final Source<byte[]> chunks = Pipelines.each(List.of(
        bytes("al"), bytes("pha\nbe"), bytes("ta\r\n\ngam"), bytes("ma")));

    final List<String> lines = toList(Pipelines.lines(chunks, StandardCharsets.UTF_8));

    assertThat(lines).containsExactly("alpha", "beta", "", "gamma");
  }

  @Test
  @DisplayName("Should stop an endless source after the limit and close it")
  void take_EndlessSource_YieldsLimit() throws Exception {
    final AtomicBoolean closed = new AtomicBoolean();
    final Source<Long> numbers = Pipelines.iterate(0L, n -> n + 1);
    final Source<Long> tracked = new Source<>() {
      @Override
      public Long poll() throws Exception {
        return numbers.poll();
      }

      @Override
      public void close() throws Exception {
        closed.set(true);
        numbers.close();
      }
    };

    final List<Long> taken = toList(Pipelines.take(tracked, 5));

    assertThat(taken).containsExactly(0L, 1L, 2L, 3L, 4L);
    assertThat(closed).isTrue();
  }

  @Test
  @DisplayName("Should encode lines and concatenate chunks")
  void encodeLinesAndConcat_Strings_JoinWithNewlines() throws Exception {
    final byte[] all = Pipelines.concat(
        Pipelines.encodeLines(Pipelines.each(List.of("a", "b", "c")), StandardCharsets.US_ASCII));

    assertThat(new String(all, StandardCharsets.US_ASCII)).isEqualTo("a\nb\nc\n");
  }

  @Test
  @DisplayName("Should fold every element")
  void fold_Numbers_Sums() throws Exception {
    final Source<Long> tens = Pipelines.map(Pipelines.each(List.of(1, 2, 3, 4)), n -> n * 10L);

    final long sum = Pipelines.fold(tens, 0L, Long::sum);

    assertThat(sum).isEqualTo(100L);
  }

  @Test
  @DisplayName("Should close the source when the sink stops accepting")
  void drain_SinkRefuses_ClosesSourceAndReturnsFalse() throws Exception {
    final AtomicBoolean sourceClosed = new AtomicBoolean();
    final AtomicBoolean sinkCompleted = new AtomicBoolean();
    final List<Long> received = new ArrayList<>();
    final Source<Long> numbers = Pipelines.iterate(0L, n -> n + 1);
    final Source<Long> source = new Source<>() {
      @Override
      public Long poll() throws Exception {
        return numbers.poll();
      }

      @Override
      public void close() {
        sourceClosed.set(true);
      }
    };
    final Sink<Long> sink = new Sink<>() {
      @Override
      public boolean offer(Long item) {
        if (received.size() == 3) {
          return false;
        }
        received.add(item);
        return true;
      }

      @Override
      public void complete() {
        sinkCompleted.set(true);
      }
    };

    assertThat(Pipelines.drain(source, sink)).isFalse();
    assertThat(received).containsExactly(0L, 1L, 2L);
    assertThat(sourceClosed).isTrue();
    assertThat(sinkCompleted).isTrue();
  }

  @Test
  @DisplayName("Should move elements between threads through a conveyor and a mailbox")
  void conveyor_IntoMailbox_DeliversEverything() throws Exception {
    final Mailbox<String> mailbox = new Mailbox<>();
    final List<String> received;
    try (ResourceScope scope = new ResourceScope()) {
      final BackgroundTask task =
          Pipelines.conveyor(scope, "letters", Pipelines.each(List.of("x", "y", "z")), mailbox.sink());
      received = toList(mailbox.source());
      assertThat(task.await(Duration.ofSeconds(5))).isTrue();
    }

    assertThat(received).containsExactly("x", "y", "z");
  }

  @Test
  @DisplayName("Should write chunks to an output stream")
  void toOutputStream_Chunks_AreWritten() throws Exception {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();

    Pipelines.drain(Pipelines.each(List.of(bytes("ab"), bytes("c"))), Pipelines.toOutputStream(out));

    assertThat(out.toString(StandardCharsets.US_ASCII)).isEqualTo("abc");
  }

  private static byte[] bytes(final String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  private static <T> List<T> toList(final Source<T> source) throws Exception {
    return Pipelines.fold(source, new ArrayList<T>(), (acc, item) -> {
      acc.add(item);
      return acc;
    });
  }
}
