package com.scholary.mp3.converter.classify;

/**
 * Result of classifying raw tool output.
 *
 * @param kind the failure kind
 * @param userMessage message suitable for the end user
 */
public record ClassifiedError(ErrorKind kind, String userMessage) {

  public static ClassifiedError of(ErrorKind kind) {
    return new ClassifiedError(kind, kind.userMessage());
  }

  /** Renders as {@code CODE: message}, the shape clients split on. */
  @Override
  public String toString() {
    return kind.code() + ": " + userMessage;
  }
}
