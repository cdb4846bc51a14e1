package com.scholary.mp3.converter.extraction;

import com.scholary.mp3.converter.classify.ClassifiedError;
import java.util.List;

/** Exception thrown when no persona could extract the media. */
public class ExtractionException extends RuntimeException {

  private final ClassifiedError error;
  private final List<ExtractionAttempt> attempts;

  public ExtractionException(ClassifiedError error, List<ExtractionAttempt> attempts) {
    super(error.toString());
    this.error = error;
    this.attempts = List.copyOf(attempts);
  }

  public ExtractionException(
      ClassifiedError error, List<ExtractionAttempt> attempts, Throwable cause) {
    super(error.toString(), cause);
    this.error = error;
    this.attempts = List.copyOf(attempts);
  }

  public ClassifiedError error() {
    return error;
  }

  public List<ExtractionAttempt> attempts() {
    return attempts;
  }
}
