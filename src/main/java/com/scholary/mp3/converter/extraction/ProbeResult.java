package com.scholary.mp3.converter.extraction;

/**
 * Metadata from a probe.
 *
 * @param durationSeconds media duration, or -1 if the platform didn't report one
 * @param title media title, may be null
 */
public record ProbeResult(double durationSeconds, String title) {

  public boolean hasDuration() {
    return durationSeconds >= 0;
  }

  public boolean isShorterThan(int seconds) {
    return hasDuration() && durationSeconds <= seconds;
  }
}
