package com.scholary.mp3.converter.service;

/** Exception thrown when a request is rejected up front. No subprocess work has been done. */
public class InvalidInputException extends RuntimeException {

  private final InputErrorCode code;

  public InvalidInputException(InputErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public InvalidInputException(InputErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public InputErrorCode code() {
    return code;
  }
}
