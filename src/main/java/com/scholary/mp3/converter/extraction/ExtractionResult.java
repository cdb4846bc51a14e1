package com.scholary.mp3.converter.extraction;

import java.nio.file.Path;
import java.util.List;

/**
 * A successful extraction.
 *
 * @param file the downloaded artifact in the scratch directory
 * @param persona the persona that produced it
 * @param attempts every attempt made, in order, the last one successful
 */
public record ExtractionResult(Path file, Persona persona, List<ExtractionAttempt> attempts) {

  public ExtractionResult {
    attempts = List.copyOf(attempts);
  }

  public boolean isMp3() {
    return file.getFileName().toString().endsWith(".mp3");
  }
}
