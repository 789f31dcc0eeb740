package com.consullo.pipes.process;

import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for command rendering and argument vectors.
 *
 * @since 1.0
 */
public class CommandSpecTest {

  @Test
  @DisplayName("Should quote every word of a raw command")
  void render_RawCommand_QuotesEachWord() {
    final CommandSpec spec = CommandSpec.raw("sh", List.of("-c", "echo \"hi\""));

    assertThat(spec.render()).isEqualTo("\"sh\" \"-c\" \"echo \\\"hi\\\"\"");
    assertThat(spec.toArgv()).containsExactly("sh", "-c", "echo \"hi\"");
  }

  @Test
  @DisplayName("Should render a shell command as one quoted string")
  void render_ShellCommand_QuotesWholeLine() {
    final CommandSpec spec = CommandSpec.shell("ls | wc -l");

    assertThat(spec.render()).isEqualTo("\"ls | wc -l\"");
    assertThat(spec.kind()).isEqualTo(CommandSpec.Kind.SHELL);
    assertThat(spec.program()).isNull();
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  @DisplayName("Should run shell commands through /bin/sh")
  void toArgv_ShellCommandOnUnix_UsesBinSh() {
    assertThat(CommandSpec.shell("true").toArgv()).containsExactly("/bin/sh", "-c", "true");
  }

  @Test
  @DisplayName("Should recognise Windows whatever the default locale")
  void isWindows_TurkishDefaultLocale_StillMatches() {
    final Locale original = Locale.getDefault();
    Locale.setDefault(new Locale("tr", "TR"));
    try {
      assertThat(CommandSpec.isWindows("WINDOWS 11")).isTrue();
      assertThat(CommandSpec.isWindows("Windows Server 2022")).isTrue();
      assertThat(CommandSpec.isWindows("Linux")).isFalse();
    } finally {
      Locale.setDefault(original);
    }
  }

  @Test
  @DisplayName("Should compare by content")
  void equals_SameContent_AreEqual() {
    assertThat(CommandSpec.raw("cat", List.of())).isEqualTo(CommandSpec.raw("cat", List.of()))
        .hasSameHashCodeAs(CommandSpec.raw("cat", List.of()));
    assertThat(CommandSpec.raw("cat", List.of())).isNotEqualTo(CommandSpec.shell("cat"));
  }

  @Test
  @DisplayName("Should reject a blank program")
  void raw_BlankProgram_Throws() {
    assertThatThrownBy(() -> CommandSpec.raw(" ", List.of())).isInstanceOf(IllegalArgumentException.class);
  }
}
