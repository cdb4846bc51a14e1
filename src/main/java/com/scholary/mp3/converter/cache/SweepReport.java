package com.scholary.mp3.converter.cache;

/**
 * Outcome of one eviction sweep.
 *
 * @param deleted files removed for being older than the max age
 * @param kept files young enough to stay
 * @param errors files that could not be inspected or removed
 */
public record SweepReport(int deleted, int kept, int errors) {

  static SweepReport empty() {
    return new SweepReport(0, 0, 0);
  }
}
