package com.scholary.mp3.converter.classify;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

/**
 * Maps free-form extraction tool output to a {@link ClassifiedError}.
 *
 * <p>A linear table of substring predicates, first match wins. The tool's diagnostics change
 * between releases, so this is best effort: anything we don't recognise falls through to {@link
 * ErrorKind#VIDEO_UNAVAILABLE}. Rules overlap in places (an age-gate message also contains
 * "restricted"); order decides.
 */
@Component
public class ErrorClassifier {

  private record Rule(ErrorKind kind, Predicate<String> matches) {}

  private static final List<Rule> RULES =
      List.of(
          new Rule(
              ErrorKind.VIDEO_RATE_LIMITED,
              s ->
                  s.contains("Sign in to confirm")
                      || (s.contains("Sign in") && s.contains("bot"))),
          new Rule(
              ErrorKind.VIDEO_REQUIRES_AUTH,
              s ->
                  s.toLowerCase(Locale.ROOT).contains("vimeo")
                      && (s.contains("logged-in")
                          || s.contains("authentication")
                          || s.contains("Use --cookies"))),
          // Broken cookie store on our side, not the video's fault
          new Rule(
              ErrorKind.VIDEO_UNAVAILABLE,
              s ->
                  s.contains("sqlite3")
                      || s.contains("Cookies.sqlite")
                      || (s.contains("cookie") && s.contains("database"))),
          new Rule(
              ErrorKind.VIDEO_PRIVATE,
              s -> s.contains("This video is private") || s.contains("Private video")),
          new Rule(
              ErrorKind.VIDEO_AGE_RESTRICTED,
              s ->
                  s.contains("age")
                      && (s.contains("restricted") || s.contains("confirm your age"))),
          new Rule(
              ErrorKind.VIDEO_MEMBERS_ONLY,
              s -> s.contains("members-only") || s.contains("Join this channel")),
          new Rule(
              ErrorKind.VIDEO_COPYRIGHT, s -> s.contains("copyright") && s.contains("blocked")),
          new Rule(ErrorKind.RATE_LIMITED, s -> s.contains("HTTP Error 429")));

  /**
   * Classify raw diagnostic output.
   *
   * @param rawOutput captured stderr (may be null)
   * @return the first matching classification, or the catch-all
   */
  public ClassifiedError classify(String rawOutput) {
    if (rawOutput == null || rawOutput.isEmpty()) {
      return ClassifiedError.of(ErrorKind.VIDEO_UNAVAILABLE);
    }
    for (Rule rule : RULES) {
      if (rule.matches().test(rawOutput)) {
        return ClassifiedError.of(rule.kind());
      }
    }
    return ClassifiedError.of(ErrorKind.VIDEO_UNAVAILABLE);
  }
}
