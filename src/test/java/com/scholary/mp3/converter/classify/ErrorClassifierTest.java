package com.scholary.mp3.converter.classify;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ErrorClassifierTest {

  private final ErrorClassifier classifier = new ErrorClassifier();

  @Test
  void classify_shouldDetectBotCheck() {
    ClassifiedError error =
        classifier.classify("ERROR: [youtube] abc: Sign in to confirm you're not a bot");

    assertThat(error.kind()).isEqualTo(ErrorKind.VIDEO_RATE_LIMITED);
    assertThat(error.userMessage()).isEqualTo(ErrorKind.VIDEO_RATE_LIMITED.userMessage());
  }

  @Test
  void classify_shouldDetectVimeoAuthentication() {
    assertThat(kindOf("ERROR: [vimeo] 123: This video is only available for logged-in users"))
        .isEqualTo(ErrorKind.VIDEO_REQUIRES_AUTH);
  }

  @Test
  void classify_shouldTreatBrokenCookieStoreAsUnavailable() {
    assertThat(kindOf("sqlite3.OperationalError: unable to open database"))
        .isEqualTo(ErrorKind.VIDEO_UNAVAILABLE);
  }

  @Test
  void classify_shouldDetectContentRestrictions() {
    assertThat(kindOf("ERROR: Private video. Sign in if you've been granted access"))
        .isEqualTo(ErrorKind.VIDEO_PRIVATE);
    assertThat(kindOf("ERROR: This video is private")).isEqualTo(ErrorKind.VIDEO_PRIVATE);
    assertThat(kindOf("age-restricted video, confirm your age"))
        .isEqualTo(ErrorKind.VIDEO_AGE_RESTRICTED);
    assertThat(kindOf("Join this channel to get access to members-only content"))
        .isEqualTo(ErrorKind.VIDEO_MEMBERS_ONLY);
    assertThat(kindOf("video has been blocked on copyright grounds"))
        .isEqualTo(ErrorKind.VIDEO_COPYRIGHT);
  }

  @Test
  void classify_shouldDetectGenericRateLimit() {
    assertThat(kindOf("ERROR: unable to download: HTTP Error 429: Too Many Requests"))
        .isEqualTo(ErrorKind.RATE_LIMITED);
  }

  @Test
  void classify_shouldKeepFirstMatchWhenRulesOverlap() {
    // Both the private and the age rule match; private comes first
    assertThat(kindOf("This video is private (age restricted)"))
        .isEqualTo(ErrorKind.VIDEO_PRIVATE);
  }

  @Test
  void classify_shouldFallBackToUnavailable() {
    assertThat(kindOf("something nobody has seen before")).isEqualTo(ErrorKind.VIDEO_UNAVAILABLE);
    assertThat(kindOf(null)).isEqualTo(ErrorKind.VIDEO_UNAVAILABLE);
    assertThat(kindOf("")).isEqualTo(ErrorKind.VIDEO_UNAVAILABLE);
  }

  @Test
  void toString_shouldUseCodeAndMessage() {
    assertThat(ClassifiedError.of(ErrorKind.VIDEO_PRIVATE).toString())
        .startsWith("VIDEO_PRIVATE: ");
  }

  private ErrorKind kindOf(String stderr) {
    return classifier.classify(stderr).kind();
  }
}
