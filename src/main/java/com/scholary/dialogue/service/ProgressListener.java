package com.scholary.dialogue.service;

/** Receives batch progress after each recording. */
@FunctionalInterface
public interface ProgressListener {

  void onProgress(int processed, int total);
}
