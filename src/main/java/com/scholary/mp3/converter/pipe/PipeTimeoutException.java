package com.scholary.mp3.converter.pipe;

/** Exception thrown when a streaming session was killed by its inactivity or total timer. */
public class PipeTimeoutException extends PipeException {

  private final String reason;

  public PipeTimeoutException(String reason, long elapsedMs) {
    super(String.format("Pipe killed after %dms (%s)", elapsedMs, reason));
    this.reason = reason;
  }

  /** Which timer fired: {@code inactivity} or {@code total}. */
  public String reason() {
    return reason;
  }
}
