package com.scholary.mp3.converter.pipe;

/** Exception thrown when a streaming session fails. Callers fall back to the discrete flow. */
public class PipeException extends RuntimeException {

  public PipeException(String message) {
    super(message);
  }

  public PipeException(String message, Throwable cause) {
    super(message, cause);
  }
}
