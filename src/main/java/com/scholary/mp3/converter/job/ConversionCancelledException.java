package com.scholary.mp3.converter.job;

/** Exception thrown when a conversion is interrupted while waiting or working. */
public class ConversionCancelledException extends RuntimeException {

  public ConversionCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
