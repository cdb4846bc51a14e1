package com.scholary.mp3.converter.cache;

/** Exception thrown when a result could not be written to the cache. */
public class CacheWriteException extends RuntimeException {

  public CacheWriteException(String message) {
    super(message);
  }

  public CacheWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
