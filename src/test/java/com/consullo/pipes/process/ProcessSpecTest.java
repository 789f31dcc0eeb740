package com.consullo.pipes.process;

import com.consullo.pipes.error.ErrorHandlers;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for process specifications and stream dispositions.
 *
 * @since 1.0
 */
public class ProcessSpecTest {

  @Test
  @DisplayName("Should apply defaults when only a program is given")
  void builder_ProgramOnly_UsesDefaults() {
    final ProcessSpec spec = ProcessSpec.of("cat");

    assertThat(spec.command()).isEqualTo(CommandSpec.raw("cat", List.of()));
    assertThat(spec.workingDirectory()).isEmpty();
    assertThat(spec.environment()).isEmpty();
    assertThat(spec.processSlot()).isEmpty();
    assertThat(spec.createGroup()).isFalse();
    assertThat(spec.delegateCtrlC()).isFalse();
    assertThat(spec.handler()).isNotNull();
  }

  @Test
  @DisplayName("Should carry every option set on the builder")
  void builder_AllOptions_AreKept() {
    final CompletableFuture<Subprocess> slot = new CompletableFuture<>();
    final ProcessSpec spec = ProcessSpec.shellBuilder("env")
        .workingDirectory(Path.of("/tmp"))
        .environment(Map.of("A", "1"))
        .closeFds(true)
        .createGroup(true)
        .delegateCtrlC(true)
        .storeProcess(slot)
        .handler(ErrorHandlers.discard())
        .build();

    assertThat(spec.workingDirectory()).contains(Path.of("/tmp"));
    assertThat(spec.environment()).contains(Map.of("A", "1"));
    assertThat(spec.closeFds()).isTrue();
    assertThat(spec.createGroup()).isTrue();
    assertThat(spec.delegateCtrlC()).isTrue();
    assertThat(spec.processSlot()).containsSame(slot);
    assertThat(spec.handler()).isSameAs(ErrorHandlers.discard());
  }

  @Test
  @DisplayName("Should refuse to be used by a second spawn")
  void claim_SecondTime_Throws() {
    final ProcessSpec spec = ProcessSpec.of("cat");
    spec.claim();

    assertThatThrownBy(spec::claim).isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("Should derive a fresh spec without the process slot")
  void toBuilder_UsedSpec_GivesUnclaimedCopy() {
    final ProcessSpec spec = ProcessSpec.builder("cat")
        .environment(Map.of("K", "V"))
        .storeProcess(new CompletableFuture<>())
        .build();
    spec.claim();

    final ProcessSpec copy = spec.toBuilder().build();
    copy.claim();

    assertThat(copy.command()).isEqualTo(spec.command());
    assertThat(copy.environment()).isEqualTo(spec.environment());
    assertThat(copy.processSlot()).isEmpty();
  }

  @Test
  @DisplayName("Should refuse a pipe as a disposition")
  void useHandle_Pipe_Throws() {
    assertThatThrownBy(() -> StreamDisposition.useHandle(ProcessBuilder.Redirect.PIPE))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(StreamDisposition.useHandle(ProcessBuilder.Redirect.INHERIT)).isSameAs(StreamDisposition.inherit());
    assertThat(StreamDisposition.discard().kind()).isEqualTo(StreamDisposition.Kind.USE_HANDLE);
  }
}
