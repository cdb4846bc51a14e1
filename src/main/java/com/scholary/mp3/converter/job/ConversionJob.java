package com.scholary.mp3.converter.job;

import com.scholary.mp3.converter.admission.Tier;
import com.scholary.mp3.converter.transcode.AudioQuality;

/**
 * One conversion of one source reference.
 *
 * <p>Created per request and owned by the thread handling it. The jobId doubles as the prefix of
 * every scratch file the job writes, which is how the extraction engine finds its own output.
 *
 * @param jobId unique id (UUID)
 * @param sourceReference the reference as the caller gave it
 * @param normalizedReference canonical form of the reference
 * @param host lower-case host of the normalized reference, empty if none
 * @param tier caller tier
 * @param quality effective output quality
 * @param shortForm whether the reference is short-form content
 * @param cacheKey content-addressable key of the result
 */
public record ConversionJob(
    String jobId,
    String sourceReference,
    String normalizedReference,
    String host,
    Tier tier,
    AudioQuality quality,
    boolean shortForm,
    String cacheKey) {

  /** Filename prefix for everything the extraction tool writes for this job. */
  public String extractionPrefix() {
    return "ytdlp_" + jobId + ".";
  }
}
