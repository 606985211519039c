package com.scholary.dialogue.whisper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.dialogue.segment.TranscriptFormatException;
import com.scholary.dialogue.segment.TranscriptSegment;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CachingTranscriptionProviderTest {

  @Mock private TranscriptionProvider delegate;

  @TempDir Path tempDir;

  private Path audioFile;
  private CachingTranscriptionProvider provider;

  @BeforeEach
  void setUp() {
    audioFile = tempDir.resolve("audio/Ep.1.mp3");
    provider = new CachingTranscriptionProvider(delegate, tempDir.resolve("output"));
  }

  @Test
  void cacheFileFor_shouldReplaceExtension() {
    assertThat(provider.cacheFileFor(audioFile))
        .isEqualTo(tempDir.resolve("output/Ep.1_whisper.txt"));
  }

  @Test
  void transcribe_shouldCallDelegateOnceAndReuseCache() {
    List<TranscriptSegment> segments =
        List.of(
            new TranscriptSegment(0.0, 6.14, "Welcome back."),
            new TranscriptSegment(65.5, 70.25, "How was the week?"));
    when(delegate.transcribe(audioFile)).thenReturn(segments);

    List<TranscriptSegment> first = provider.transcribe(audioFile);
    List<TranscriptSegment> second = provider.transcribe(audioFile);

    assertThat(first).isEqualTo(segments);
    assertThat(second).isEqualTo(segments);
    assertThat(tempDir.resolve("output/Ep.1_whisper.txt")).exists();
    verify(delegate, times(1)).transcribe(audioFile);
  }

  @Test
  void transcribe_shouldReadHandEditedCache() throws Exception {
    Path cacheFile = Files.createDirectories(tempDir.resolve("output")).resolve("Ep.1_whisper.txt");
    Files.writeString(cacheFile, "[00:00.000 --> 00:02.500]  Corrected by hand.\n");

    assertThat(provider.transcribe(audioFile))
        .containsExactly(new TranscriptSegment(0.0, 2.5, "Corrected by hand."));
    verifyNoInteractions(delegate);
  }

  @Test
  void transcribe_shouldRejectCorruptCache() throws Exception {
    Path cacheFile = Files.createDirectories(tempDir.resolve("output")).resolve("Ep.1_whisper.txt");
    Files.writeString(cacheFile, "[00:xx.000 --> 00:02.500]  Broken.\n");

    assertThatThrownBy(() -> provider.transcribe(audioFile))
        .isInstanceOf(TranscriptionException.class)
        .hasCauseInstanceOf(TranscriptFormatException.class);
  }

  @Test
  void transcribe_shouldNotCacheWhenDelegateFails() {
    when(delegate.transcribe(audioFile)).thenThrow(new TranscriptionException("unavailable"));

    assertThatThrownBy(() -> provider.transcribe(audioFile))
        .isInstanceOf(TranscriptionException.class)
        .hasMessage("unavailable");
    assertThat(tempDir.resolve("output/Ep.1_whisper.txt")).doesNotExist();
  }
}
