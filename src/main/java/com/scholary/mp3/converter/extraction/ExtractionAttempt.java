package com.scholary.mp3.converter.extraction;

import java.time.Instant;

/**
 * Record of one run of the extraction tool.
 *
 * @param persona persona name
 * @param startedAt when the attempt started
 * @param outcome how it ended
 * @param capturedStderr tail of stderr, empty on success
 * @param capturedExitCode exit code, -1 if the tool timed out
 * @param correction corrective retry applied to this attempt's arguments, or null
 */
public record ExtractionAttempt(
    String persona,
    Instant startedAt,
    Outcome outcome,
    String capturedStderr,
    int capturedExitCode,
    CorrectiveRetry correction) {

  /** How an attempt ended. */
  public enum Outcome {
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    NO_ARTIFACT
  }

  public boolean succeeded() {
    return outcome == Outcome.SUCCEEDED;
  }
}
