package com.scholary.mp3.converter.download;

/** Exception thrown when a direct media URL could not be downloaded. */
public class DirectDownloadException extends RuntimeException {

  public DirectDownloadException(String message) {
    super(message);
  }

  public DirectDownloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
