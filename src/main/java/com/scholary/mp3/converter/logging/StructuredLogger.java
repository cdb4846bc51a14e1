package com.scholary.mp3.converter.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method puts its event fields into the MDC for the duration of one log call, so a log
 * shipper can index them, then removes them again. The job context (jobId, tier, reference) is
 * longer-lived and managed with {@link #setJobContext} / {@link #clearJobContext}.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a caller queued for an admission slot. */
  public void logAdmissionQueued(String tier, String priority, int active, int queued) {
    try {
      MDC.put("event_type", "admission_queued");
      MDC.put("priority", priority);
      MDC.put("active", String.valueOf(active));
      MDC.put("queued", String.valueOf(queued));

      logger.info(
          "Admission queued: tier={}, priority={}, active={}, queued={}",
          tier,
          priority,
          active,
          queued);
    } finally {
      clearEventFields();
    }
  }

  /** Log an admission slot granted. */
  public void logAdmissionGranted(String tier, long waitedMs, int active) {
    try {
      MDC.put("event_type", "admission_granted");
      MDC.put("waitedMs", String.valueOf(waitedMs));
      MDC.put("active", String.valueOf(active));

      logger.debug("Admission granted: tier={}, waited={}ms, active={}", tier, waitedMs, active);
    } finally {
      clearEventFields();
    }
  }

  /** Log an extraction attempt starting. */
  public void logPersonaAttempt(String persona, int attempt, String correction) {
    try {
      MDC.put("event_type", "persona_attempt");
      MDC.put("persona", persona);
      MDC.put("attempt", String.valueOf(attempt));
      if (correction != null) {
        MDC.put("correction", correction);
      }

      logger.info(
          "Extraction attempt: persona={}, attempt={}, correction={}",
          persona,
          attempt,
          correction == null ? "none" : correction);
    } finally {
      clearEventFields();
    }
  }

  /** Log an extraction attempt failing. */
  public void logPersonaFailed(String persona, int attempt, int exitCode, String message) {
    try {
      MDC.put("event_type", "persona_failed");
      MDC.put("persona", persona);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("exitCode", String.valueOf(exitCode));

      logger.warn(
          "Extraction failed: persona={}, attempt={}, exitCode={}, message={}",
          persona,
          attempt,
          exitCode,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a corrective retry being scheduled for a persona. */
  public void logCorrectiveRetry(String persona, String correction) {
    try {
      MDC.put("event_type", "corrective_retry");
      MDC.put("persona", persona);
      MDC.put("correction", correction);

      logger.info("Corrective retry: persona={}, correction={}", persona, correction);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcoder progress from the streaming pipe. */
  public void logPipeProgress(long outTimeMs, String speed) {
    try {
      MDC.put("event_type", "pipe_progress");
      MDC.put("outTimeMs", String.valueOf(outTimeMs));

      logger.debug("Pipe progress: outTime={}ms, speed={}", outTimeMs, speed);
    } finally {
      clearEventFields();
    }
  }

  /** Log a watchdog firing on a pipe session. */
  public void logPipeTimeout(String reason, long elapsedMs) {
    try {
      MDC.put("event_type", "pipe_timeout");
      MDC.put("reason", reason);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.warn("Pipe timeout: reason={}, elapsed={}ms", reason, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a cache populate (or a skipped one when another writer won). */
  public void logCachePopulated(String key, long sizeBytes, boolean skipped) {
    try {
      MDC.put("event_type", "cache_populated");
      MDC.put("cacheKey", key);
      MDC.put("sizeBytes", String.valueOf(sizeBytes));
      MDC.put("skipped", String.valueOf(skipped));

      logger.info("Cache populate: key={}, size={} bytes, skipped={}", key, sizeBytes, skipped);
    } finally {
      clearEventFields();
    }
  }

  /** Log a finished eviction sweep. */
  public void logCacheSweep(int deleted, int kept, int errors) {
    try {
      MDC.put("event_type", "cache_sweep");
      MDC.put("deleted", String.valueOf(deleted));
      MDC.put("kept", String.valueOf(kept));
      MDC.put("errors", String.valueOf(errors));

      logger.info("Cache sweep: {} deleted, {} kept, {} errors", deleted, kept, errors);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String tier, String reference) {
    MDC.put("jobId", jobId);
    MDC.put("tier", tier);
    if (reference != null) {
      MDC.put("reference", reference);
    }
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("tier");
    MDC.remove("reference");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("priority");
    MDC.remove("active");
    MDC.remove("queued");
    MDC.remove("waitedMs");
    MDC.remove("persona");
    MDC.remove("attempt");
    MDC.remove("correction");
    MDC.remove("exitCode");
    MDC.remove("outTimeMs");
    MDC.remove("reason");
    MDC.remove("elapsedMs");
    MDC.remove("cacheKey");
    MDC.remove("sizeBytes");
    MDC.remove("skipped");
    MDC.remove("deleted");
    MDC.remove("kept");
    MDC.remove("errors");
  }
}
