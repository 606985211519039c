package com.scholary.dialogue.diarization;

import com.scholary.dialogue.segment.SpeakerSegment;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for speaker diarization providers.
 *
 * <p>Diarization runs independently of transcription, so its segment boundaries have no relation
 * to the transcript's.
 */
public interface DiarizationProvider {

  /**
   * Find who speaks when in a recording.
   *
   * @param audioFile the recording
   * @return speaker segments, in no particular order
   * @throws DiarizationException if diarization fails
   */
  List<SpeakerSegment> diarize(Path audioFile);
}
