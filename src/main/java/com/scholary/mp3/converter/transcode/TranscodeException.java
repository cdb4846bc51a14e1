package com.scholary.mp3.converter.transcode;

/**
 * Exception thrown when ffmpeg fails to produce a usable MP3.
 *
 * <p>Covers non-zero exits, timeouts and undersized output. Not retried automatically.
 */
public class TranscodeException extends RuntimeException {

  public TranscodeException(String message) {
    super(message);
  }

  public TranscodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
