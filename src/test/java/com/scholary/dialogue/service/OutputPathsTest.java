package com.scholary.dialogue.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OutputPathsTest {

  @TempDir Path tempDir;

  @Test
  void resolveWithin_shouldAcceptNamesInsideDirectory() {
    assertThat(OutputPaths.resolveWithin(tempDir, "Ep.1_final.jsonl"))
        .isEqualTo(tempDir.resolve("Ep.1_final.jsonl"));
    assertThat(OutputPaths.resolveWithin(tempDir, "merged/train.jsonl"))
        .isEqualTo(tempDir.resolve("merged/train.jsonl"));
  }

  @Test
  void resolveWithin_shouldAcceptRelativeDirectory() {
    assertThat(OutputPaths.resolveWithin(Path.of("output"), "train.jsonl"))
        .isEqualTo(Path.of("output", "train.jsonl"));
  }

  @Test
  void resolveWithin_shouldRejectParentTraversal() {
    assertThatThrownBy(() -> OutputPaths.resolveWithin(tempDir, "../../escaped.jsonl"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("../../escaped.jsonl");
    assertThatThrownBy(() -> OutputPaths.resolveWithin(tempDir, "sub/../../escaped.jsonl"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void resolveWithin_shouldRejectAbsolutePathElsewhere() {
    String elsewhere = tempDir.resolveSibling("elsewhere.jsonl").toAbsolutePath().toString();

    assertThatThrownBy(() -> OutputPaths.resolveWithin(tempDir, elsewhere))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void resolveWithin_shouldRejectDirectoryItself() {
    assertThatThrownBy(() -> OutputPaths.resolveWithin(tempDir, "."))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
