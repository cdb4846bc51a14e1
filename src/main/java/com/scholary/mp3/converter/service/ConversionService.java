package com.scholary.mp3.converter.service;

import com.scholary.mp3.converter.admission.AdmissionController;
import com.scholary.mp3.converter.admission.AdmissionSlot;
import com.scholary.mp3.converter.admission.Priority;
import com.scholary.mp3.converter.admission.Tier;
import com.scholary.mp3.converter.cache.CacheEntry;
import com.scholary.mp3.converter.cache.CacheWriteException;
import com.scholary.mp3.converter.cache.ResultCache;
import com.scholary.mp3.converter.config.ConversionProperties;
import com.scholary.mp3.converter.download.DirectDownloader;
import com.scholary.mp3.converter.extraction.ExtractionEngine;
import com.scholary.mp3.converter.extraction.ExtractionResult;
import com.scholary.mp3.converter.job.ConversionCancelledException;
import com.scholary.mp3.converter.job.ConversionJob;
import com.scholary.mp3.converter.logging.StructuredLogger;
import com.scholary.mp3.converter.normalize.ReferenceKind;
import com.scholary.mp3.converter.normalize.UrlNormalizer;
import com.scholary.mp3.converter.pipe.PipeException;
import com.scholary.mp3.converter.pipe.StreamingTranscodePipe;
import com.scholary.mp3.converter.transcode.AudioQuality;
import com.scholary.mp3.converter.transcode.FfmpegTranscoder;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Turns a conversion request into an MP3.
 *
 * <p>For a reference: normalize, check the cache, take an admission slot, then produce the MP3
 * (streaming fast path first for platform references, extract-then-transcode as fallback), and
 * publish it to the cache. Uploads are transcoded under a slot but never cached.
 *
 * <p>Scratch files are named by job id and removed when the job ends. The admission slot is
 * released on every path out of the job.
 */
@Service
public class ConversionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConversionService.class);

  private final ConversionProperties properties;
  private final UrlNormalizer normalizer;
  private final AdmissionController admission;
  private final ResultCache cache;
  private final ExtractionEngine extractionEngine;
  private final StreamingTranscodePipe pipe;
  private final FfmpegTranscoder transcoder;
  private final DirectDownloader directDownloader;
  private final Executor executor;
  private final Path tempDir;

  public ConversionService(
      ConversionProperties properties,
      UrlNormalizer normalizer,
      AdmissionController admission,
      ResultCache cache,
      ExtractionEngine extractionEngine,
      StreamingTranscodePipe pipe,
      FfmpegTranscoder transcoder,
      DirectDownloader directDownloader,
      @Qualifier("conversionExecutor") Executor executor) {
    this.properties = properties;
    this.normalizer = normalizer;
    this.admission = admission;
    this.cache = cache;
    this.extractionEngine = extractionEngine;
    this.pipe = pipe;
    this.transcoder = transcoder;
    this.directDownloader = directDownloader;
    this.executor = executor;
    this.tempDir = Paths.get(properties.tempDir());

    try {
      Files.createDirectories(this.tempDir);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create temp directory: " + tempDir, e);
    }
  }

  /**
   * Convert a request, blocking until done.
   *
   * @param request the request
   * @return the result
   * @throws InvalidInputException if the request is malformed
   * @throws com.scholary.mp3.converter.extraction.ExtractionException if no persona succeeded
   * @throws com.scholary.mp3.converter.transcode.TranscodeException if transcoding failed
   * @throws com.scholary.mp3.converter.download.DirectDownloadException if a direct URL failed
   * @throws ConversionCancelledException if interrupted while waiting for a slot or extracting
   */
  public ConversionResult convert(ConversionRequest request) {
    long start = System.nanoTime();
    validate(request);

    String jobId = UUID.randomUUID().toString();
    Tier tier = request.effectiveTier();
    AudioQuality quality = AudioQuality.resolve(request.quality(), tier);
    StructuredLogger.setJobContext(
        jobId,
        tier.name(),
        request.hasReference() ? request.sourceReference() : request.uploadedFileName());

    try {
      LOGGER.info("Starting conversion: tier={}, quality={}", tier, quality);
      return request.hasUpload()
          ? convertUpload(request, jobId, tier, quality, start)
          : convertReference(request, jobId, tier, quality, start);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  /** Convert on the conversion executor. */
  public CompletableFuture<ConversionResult> convertAsync(ConversionRequest request) {
    return CompletableFuture.supplyAsync(() -> convert(request), executor);
  }

  /**
   * Delete a temporary artifact once the caller is done with it. Cached artifacts are left alone.
   */
  public void discard(ConversionResult result) {
    if (result.temporary()) {
      deleteQuietly(result.artifact());
    }
  }

  private ConversionResult convertUpload(
      ConversionRequest request, String jobId, Tier tier, AudioQuality quality, long start) {
    Path input = request.uploadedFilePath();
    long size;
    try {
      if (!Files.isRegularFile(input)) {
        throw new InvalidInputException(
            InputErrorCode.UPLOAD_NOT_FOUND, "Uploaded file not found: " + input.getFileName());
      }
      size = Files.size(input);
    } catch (IOException e) {
      throw new InvalidInputException(
          InputErrorCode.UPLOAD_NOT_FOUND, "Uploaded file unreadable: " + e.getMessage(), e);
    }
    if (size > properties.maxUploadBytes()) {
      throw new InvalidInputException(
          InputErrorCode.FILE_TOO_LARGE,
          String.format(
              "File size exceeds %dMB limit.", properties.maxUploadBytes() / 1024 / 1024));
    }

    Path output = tempDir.resolve("converted_" + jobId + ".mp3");
    try (AdmissionSlot slot = acquire(tier, request.effectivePriority())) {
      transcoder.transcode(input, output, quality);
    } catch (RuntimeException e) {
      deleteQuietly(output);
      throw e;
    }

    return freshResult(output, uploadFilename(request.uploadedFileName()), start, true, tier);
  }

  private ConversionResult convertReference(
      ConversionRequest request, String jobId, Tier tier, AudioQuality quality, long start) {
    String reference = request.sourceReference().trim();
    String normalized = normalizer.normalize(reference);
    ReferenceKind kind = normalizer.classify(normalized);
    if (kind == ReferenceKind.UNSUPPORTED) {
      throw new InvalidInputException(
          InputErrorCode.UNSUPPORTED_REFERENCE, "Unsupported reference: " + reference);
    }

    ConversionJob job =
        new ConversionJob(
            jobId,
            reference,
            normalized,
            normalizer.hostOf(normalized),
            tier,
            quality,
            normalizer.isShortForm(reference),
            ResultCache.generateKey(normalized, quality));
    LOGGER.info("Normalized {} to {} ({})", reference, normalized, kind);

    Optional<CacheEntry> hit = cache.lookup(job.cacheKey());
    if (hit.isPresent()) {
      return cachedResult(hit.get(), jobId, start, tier);
    }

    List<Path> scratch = new ArrayList<>();
    try (AdmissionSlot slot = acquire(tier, request.effectivePriority())) {
      // Another job may have published while we were queued
      hit = cache.lookup(job.cacheKey());
      if (hit.isPresent()) {
        return cachedResult(hit.get(), jobId, start, tier);
      }

      Path produced =
          kind == ReferenceKind.PLATFORM
              ? producePlatform(job, scratch)
              : produceDirect(job, scratch);
      return publish(job, produced, scratch, start);
    } finally {
      scratch.forEach(ConversionService::deleteQuietly);
    }
  }

  private Path producePlatform(ConversionJob job, List<Path> scratch) {
    Path output = tempDir.resolve("converted_" + job.jobId() + ".mp3");
    scratch.add(output);

    if (properties.streamingEnabled()) {
      try {
        return pipe.streamConvert(job, extractionEngine.primaryPersona(job), output);
      } catch (PipeException e) {
        LOGGER.warn("Streaming failed, falling back to extract-then-transcode: {}", e.getMessage());
      }
    }

    ExtractionResult extracted = extractionEngine.extract(job, tempDir);
    scratch.add(extracted.file());
    if (extracted.isMp3()) {
      LOGGER.info("Extracted artifact is already MP3, skipping transcode");
      return extracted.file();
    }
    transcoder.transcode(extracted.file(), output, job.quality());
    return output;
  }

  private Path produceDirect(ConversionJob job, List<Path> scratch) {
    Path download = tempDir.resolve("direct_" + job.jobId() + ".video");
    scratch.add(download);
    directDownloader.download(job.normalizedReference(), download);

    Path output = tempDir.resolve("converted_" + job.jobId() + ".mp3");
    scratch.add(output);
    transcoder.transcode(download, output, job.quality());
    return output;
  }

  private ConversionResult publish(
      ConversionJob job, Path produced, List<Path> scratch, long start) {
    String filename = "audio_" + job.jobId() + ".mp3";
    try {
      CacheEntry entry = cache.populate(job.cacheKey(), produced);
      return new ConversionResult(
          entry.filePath(), filename, entry.sizeBytes(), elapsed(start), false, false, job.tier());
    } catch (CacheWriteException e) {
      LOGGER.warn("Cache write failed, returning uncached result: {}", e.getMessage());
      scratch.remove(produced);
      return freshResult(produced, filename, start, true, job.tier());
    }
  }

  private AdmissionSlot acquire(Tier tier, Priority priority) {
    try {
      return admission.acquire(tier, priority);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConversionCancelledException("Interrupted while waiting for admission", e);
    }
  }

  private static void validate(ConversionRequest request) {
    if (request == null || (!request.hasReference() && !request.hasUpload())) {
      throw new InvalidInputException(InputErrorCode.NO_INPUT, "No video file or URL");
    }
    if (request.hasReference() && request.hasUpload()) {
      throw new InvalidInputException(
          InputErrorCode.AMBIGUOUS_INPUT, "Provide either a video file or a URL, not both");
    }
  }

  private ConversionResult cachedResult(CacheEntry entry, String jobId, long start, Tier tier) {
    LOGGER.info("Serving cached result {}", entry.key());
    return new ConversionResult(
        entry.filePath(),
        "audio_" + jobId + ".mp3",
        entry.sizeBytes(),
        elapsed(start),
        true,
        false,
        tier);
  }

  private ConversionResult freshResult(
      Path artifact, String filename, long start, boolean temporary, Tier tier) {
    long size;
    try {
      size = Files.size(artifact);
    } catch (IOException e) {
      size = -1;
      LOGGER.warn("Could not stat {}: {}", artifact, e.getMessage());
    }
    double elapsed = elapsed(start);
    LOGGER.info("Conversion done in {}s: {} bytes", String.format("%.1f", elapsed), size);
    return new ConversionResult(artifact, filename, size, elapsed, false, temporary, tier);
  }

  static String uploadFilename(String originalName) {
    if (originalName == null || originalName.isBlank()) {
      return "audio.mp3";
    }
    String name =
        originalName.substring(
            Math.max(originalName.lastIndexOf('/'), originalName.lastIndexOf('\\')) + 1);
    int dot = name.indexOf('.');
    String base = dot > 0 ? name.substring(0, dot) : name;
    return (base.isBlank() ? "audio" : base) + ".mp3";
  }

  private static double elapsed(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000_000.0;
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Could not delete scratch file {}: {}", file, e.getMessage());
    }
  }
}
