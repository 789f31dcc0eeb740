package com.consullo.pipes.mailbox;

import com.consullo.pipes.stream.Sink;
import com.consullo.pipes.stream.Source;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

/**
 * Unit tests for the bounded sealable mailbox.
 *
 * @since 1.0
 */
public class MailboxTest {

  @Test
  @DisplayName("Should deliver items in order")
  void receive_AfterSends_ReturnsItemsInOrder() throws Exception {
    final Mailbox<String> mailbox = new Mailbox<>(3);
    assertThat(mailbox.send("a")).isTrue();
    assertThat(mailbox.send("b")).isTrue();
    assertThat(mailbox.send("c")).isTrue();

    assertThat(mailbox.receive()).isEqualTo("a");
    assertThat(mailbox.receive()).isEqualTo("b");
    assertThat(mailbox.receive()).isEqualTo("c");
  }

  @Test
  @DisplayName("Should block a sender while a capacity-1 mailbox is full")
  void send_FullMailbox_BlocksUntilReceive() throws Exception {
    final Mailbox<String> mailbox = new Mailbox<>();
    assertThat(mailbox.send("first")).isTrue();

    final CountDownLatch started = new CountDownLatch(1);
    final CompletableFuture<Boolean> second = CompletableFuture.supplyAsync(() -> {
      started.countDown();
      try {
        return mailbox.send("second");
      } catch (InterruptedException e) {
        throw new IllegalStateException(e);
      }
    });
    started.await();

    Thread.sleep(100);
    assertThat(second).isNotDone();
    assertThat(mailbox.size()).isEqualTo(1);

    assertThat(mailbox.receive()).isEqualTo("first");
    assertThat(second.get(5, TimeUnit.SECONDS)).isTrue();
    assertThat(mailbox.receive()).isEqualTo("second");
  }

  @Test
  @DisplayName("Should hand out buffered items after sealing, then end-of-stream")
  void receive_SealedWithBufferedItem_DrainsThenReturnsNull() throws Exception {
    final Mailbox<String> mailbox = new Mailbox<>(2);
    mailbox.send("x");
    mailbox.seal();

    assertThat(mailbox.receive()).isEqualTo("x");
    assertThat(mailbox.receive()).isNull();
    assertThat(mailbox.receive()).isNull();
  }

  @Test
  @DisplayName("Should refuse items once sealed")
  void send_Sealed_ReturnsFalse() throws Exception {
    final Mailbox<String> mailbox = new Mailbox<>();
    mailbox.seal();

    assertThat(mailbox.send("late")).isFalse();
    assertThat(mailbox.size()).isZero();
  }

  @Test
  @DisplayName("Should treat repeated seals from either end as one")
  void seal_CalledTwice_IsIdempotent() {
    final Mailbox<String> mailbox = new Mailbox<>();

    assertThat(mailbox.seal()).isTrue();
    assertThat(mailbox.seal()).isFalse();
    assertThat(mailbox.isSealed()).isTrue();
  }

  @Test
  @DisplayName("Should wake a blocked sender when the mailbox is sealed")
  void seal_BlockedSender_ReturnsFalse() {
    final Mailbox<String> mailbox = new Mailbox<>();
    assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
      mailbox.send("fills");
      final CompletableFuture<Boolean> blocked = CompletableFuture.supplyAsync(() -> {
        try {
          return mailbox.send("blocked");
        } catch (InterruptedException e) {
          throw new IllegalStateException(e);
        }
      });
      Thread.sleep(100);
      mailbox.seal();
      assertThat(blocked.get()).isFalse();
    });
  }

  @Test
  @DisplayName("Should wake a blocked receiver when the mailbox is sealed")
  void seal_BlockedReceiver_ReturnsNull() {
    final Mailbox<String> mailbox = new Mailbox<>();
    assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
      final AtomicBoolean returned = new AtomicBoolean();
      final Thread receiver = new Thread(() -> {
        try {
          returned.set(mailbox.receive() == null);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      });
      receiver.start();
      Thread.sleep(100);
      mailbox.seal();
      receiver.join();
      assertThat(returned).isTrue();
    });
  }

  @Test
  @DisplayName("Should seal when either caller-facing end is closed")
  void sinkAndSource_Closed_SealMailbox() throws Exception {
    final Mailbox<String> a = new Mailbox<>();
    final Sink<String> sink = a.sink();
    assertThat(sink.offer("one")).isTrue();
    sink.close();
    assertThat(a.isSealed()).isTrue();
    assertThat(a.source().poll()).isEqualTo("one");

    final Mailbox<String> b = new Mailbox<>();
    final Source<String> source = b.source();
    source.close();
    assertThat(b.sink().offer("refused")).isFalse();
  }

  @Test
  @DisplayName("Should reject a capacity below one")
  void constructor_ZeroCapacity_Throws() {
    assertThatThrownBy(() -> new Mailbox<String>(0)).isInstanceOf(IllegalArgumentException.class);
  }
}
