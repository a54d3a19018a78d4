package com.scholary.djset.audio;

import java.io.IOException;
import java.nio.file.Path;

/** Cuts and tags audio. Implementations must be safe to call from several threads at once. */
public interface AudioEngine {

  /**
   * Extract the embedded cover image of {@code input} into {@code output}.
   *
   * @throws IOException if the input has no cover or extraction fails
   */
  void extractCoverArt(Path input, Path output) throws IOException;

  /**
   * Cut one track out of the input file.
   *
   * @return the path of the written file, including its extension
   */
  String split(SplitParams params) throws IOException;
}
