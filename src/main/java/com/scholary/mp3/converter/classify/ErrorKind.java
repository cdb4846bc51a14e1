package com.scholary.mp3.converter.classify;

/**
 * User-facing failure kinds for extraction errors.
 *
 * <p>The codes are stable and safe to hand to clients; the messages are what we show a user.
 */
public enum ErrorKind {
  VIDEO_RATE_LIMITED(
      "The platform is rate limiting requests from this server. Please try a different video or"
          + " try again in a few minutes."),
  VIDEO_REQUIRES_AUTH(
      "This video requires authentication on its platform. Please try a different platform."),
  VIDEO_PRIVATE("This video is private and cannot be downloaded."),
  VIDEO_AGE_RESTRICTED("This video is age-restricted and requires authentication."),
  VIDEO_MEMBERS_ONLY("This video is for channel members only."),
  VIDEO_COPYRIGHT("This video is blocked due to copyright restrictions."),
  RATE_LIMITED("Too many requests. Please try again in a few minutes."),
  VIDEO_UNAVAILABLE(
      "Unable to download this video. It may be unavailable, deleted, or region-restricted.");

  private final String userMessage;

  ErrorKind(String userMessage) {
    this.userMessage = userMessage;
  }

  public String code() {
    return name();
  }

  public String userMessage() {
    return userMessage;
  }
}
