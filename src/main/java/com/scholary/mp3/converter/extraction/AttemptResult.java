package com.scholary.mp3.converter.extraction;

import java.nio.file.Path;
import java.util.List;

/** What the engine should do after one attempt. */
public interface AttemptResult {

  /** The attempt produced an artifact. */
  record Success(Path file, ExtractionAttempt attempt) implements AttemptResult {}

  /** The attempt failed in a recognisable way; re-run the same persona with these arguments. */
  record Retry(List<String> correctedArgs, CorrectiveRetry correction, ExtractionAttempt failed)
      implements AttemptResult {}

  /** The attempt failed; move on to the next persona. */
  record NextPersona(ExtractionAttempt failed) implements AttemptResult {}
}
