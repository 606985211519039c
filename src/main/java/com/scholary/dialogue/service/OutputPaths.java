package com.scholary.dialogue.service;

import java.nio.file.Path;

/** Resolves caller-supplied file names against a working directory. */
public final class OutputPaths {

  private OutputPaths() {}

  /**
   * Resolve {@code name} against {@code dir}, refusing anything that lands outside it.
   *
   * @throws IllegalArgumentException for absolute names and names that climb out with {@code ..}
   */
  public static Path resolveWithin(Path dir, String name) {
    Path resolved = dir.resolve(name);
    Path root = dir.toAbsolutePath().normalize();
    Path target = resolved.toAbsolutePath().normalize();
    if (!target.startsWith(root) || target.equals(root)) {
      throw new IllegalArgumentException("Path escapes " + dir + ": " + name);
    }
    return resolved;
  }
}
