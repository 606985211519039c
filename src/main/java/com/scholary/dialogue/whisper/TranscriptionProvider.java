package com.scholary.dialogue.whisper;

import com.scholary.dialogue.segment.TranscriptSegment;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for speech-to-text providers.
 *
 * <p>This abstraction allows us to swap transcription providers or put a cache in front of one
 * without changing the alignment pipeline.
 */
public interface TranscriptionProvider {

  /**
   * Transcribe a whole recording.
   *
   * @param audioFile the recording
   * @return segments in chronological order
   * @throws TranscriptionException if transcription fails
   */
  List<TranscriptSegment> transcribe(Path audioFile);
}
