package com.scholary.mp3.converter.service;

import com.scholary.mp3.converter.admission.Priority;
import com.scholary.mp3.converter.admission.Tier;
import com.scholary.mp3.converter.transcode.AudioQuality;
import java.nio.file.Path;

/**
 * A conversion request as handed over by the HTTP layer.
 *
 * <p>Exactly one of sourceReference and uploadedFilePath must be set; the service rejects
 * anything else.
 *
 * @param sourceReference platform URL, direct media URL or bare platform id
 * @param uploadedFilePath path of an upload the HTTP layer has already stored
 * @param uploadedFileName client-side name of the upload, used for the output filename
 * @param tier caller tier, null for standard
 * @param quality requested quality, null for the tier's default
 * @param priority admission priority, null for normal
 */
public record ConversionRequest(
    String sourceReference,
    Path uploadedFilePath,
    String uploadedFileName,
    Tier tier,
    AudioQuality quality,
    Priority priority) {

  public static ConversionRequest forReference(String sourceReference, Tier tier) {
    return new ConversionRequest(sourceReference, null, null, tier, null, null);
  }

  public static ConversionRequest forUpload(Path uploadedFilePath, String fileName, Tier tier) {
    return new ConversionRequest(null, uploadedFilePath, fileName, tier, null, null);
  }

  public boolean hasReference() {
    return sourceReference != null && !sourceReference.isBlank();
  }

  public boolean hasUpload() {
    return uploadedFilePath != null;
  }

  public Tier effectiveTier() {
    return tier == null ? Tier.STANDARD : tier;
  }

  public Priority effectivePriority() {
    return priority == null ? Priority.NORMAL : priority;
  }
}
