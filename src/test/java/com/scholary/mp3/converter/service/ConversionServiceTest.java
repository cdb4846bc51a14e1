package com.scholary.mp3.converter.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.mp3.converter.admission.AdmissionController;
import com.scholary.mp3.converter.admission.AdmissionProperties;
import com.scholary.mp3.converter.admission.AdmissionSlot;
import com.scholary.mp3.converter.admission.Tier;
import com.scholary.mp3.converter.cache.CacheEntry;
import com.scholary.mp3.converter.cache.CacheProperties;
import com.scholary.mp3.converter.cache.CacheWriteException;
import com.scholary.mp3.converter.cache.FileSystemResultCache;
import com.scholary.mp3.converter.cache.ResultCache;
import com.scholary.mp3.converter.classify.ClassifiedError;
import com.scholary.mp3.converter.classify.ErrorKind;
import com.scholary.mp3.converter.config.ConversionProperties;
import com.scholary.mp3.converter.download.DirectDownloader;
import com.scholary.mp3.converter.extraction.ExtractionEngine;
import com.scholary.mp3.converter.extraction.ExtractionException;
import com.scholary.mp3.converter.extraction.ExtractionResult;
import com.scholary.mp3.converter.extraction.Persona;
import com.scholary.mp3.converter.job.ConversionJob;
import com.scholary.mp3.converter.normalize.UrlNormalizer;
import com.scholary.mp3.converter.pipe.PipeException;
import com.scholary.mp3.converter.pipe.StreamingTranscodePipe;
import com.scholary.mp3.converter.transcode.AudioQuality;
import com.scholary.mp3.converter.transcode.FfmpegTranscoder;
import com.scholary.mp3.converter.transcode.TranscodeException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ConversionServiceTest {

  private static final String WATCH_URL = "https://www.youtube.com/watch?v=abc12345678";
  private static final Persona PERSONA =
      new Persona("web", "web", null, List.of(), "bestaudio/best", false, false, List.of());

  @Mock private ResultCache cache;
  @Mock private ExtractionEngine extractionEngine;
  @Mock private StreamingTranscodePipe pipe;
  @Mock private FfmpegTranscoder transcoder;
  @Mock private DirectDownloader directDownloader;

  @TempDir Path tempDir;

  private Path workDir;
  private AdmissionController admission;

  @BeforeEach
  void setUp() {
    workDir = tempDir.resolve("work");
    admission = new AdmissionController(new AdmissionProperties(1, 2, 3, 4));
  }

  @Test
  void convert_shouldServeCacheHitWithoutTakingSlot() {
    String key = ResultCache.generateKey(WATCH_URL, AudioQuality.STANDARD);
    CacheEntry entry = new CacheEntry(key, tempDir.resolve(key + ".mp3"), Instant.now(), 2048);
    when(cache.lookup(key)).thenReturn(Optional.of(entry));

    ConversionResult result =
        service(true, cache)
            .convert(ConversionRequest.forReference("https://youtu.be/abc12345678", null));

    assertThat(result.cached()).isTrue();
    assertThat(result.temporary()).isFalse();
    assertThat(result.artifact()).isEqualTo(entry.filePath());
    assertThat(result.sizeBytes()).isEqualTo(2048);
    assertThat(result.tier()).isEqualTo(Tier.STANDARD);
    verifyNoInteractions(extractionEngine, pipe, transcoder);
  }

  @Test
  void convert_shouldStreamAndPublishToCache() throws Exception {
    when(extractionEngine.primaryPersona(any())).thenReturn(PERSONA);
    when(pipe.streamConvert(any(), eq(PERSONA), any()))
        .thenAnswer(invocation -> writeMp3(invocation.getArgument(2)));
    when(cache.populate(anyString(), any())).thenAnswer(invocation -> entry(invocation));

    ConversionResult result =
        service(true, cache).convert(ConversionRequest.forReference(WATCH_URL, Tier.PREMIUM));

    assertThat(result.cached()).isFalse();
    assertThat(result.temporary()).isFalse();
    assertThat(result.artifact().getParent()).isEqualTo(tempDir.resolve("cache"));
    assertThat(result.filename()).startsWith("audio_").endsWith(".mp3");
    verify(extractionEngine, never()).extract(any(), any());
    assertThat(scratchFiles()).isEmpty();
    assertThat(admission.activeCount()).isZero();
  }

  @Test
  void convert_shouldUsePremiumQualityInCacheKey() throws Exception {
    when(extractionEngine.primaryPersona(any())).thenReturn(PERSONA);
    when(pipe.streamConvert(any(), any(), any()))
        .thenAnswer(invocation -> writeMp3(invocation.getArgument(2)));
    when(cache.populate(anyString(), any())).thenAnswer(invocation -> entry(invocation));

    service(true, cache).convert(ConversionRequest.forReference(WATCH_URL, Tier.ENTERPRISE));

    verify(cache).populate(eq(ResultCache.generateKey(WATCH_URL, AudioQuality.HIGH)), any());
  }

  @Test
  void convert_shouldFallBackToExtractionWhenStreamingFails() throws Exception {
    when(extractionEngine.primaryPersona(any())).thenReturn(PERSONA);
    when(pipe.streamConvert(any(), any(), any()))
        .thenThrow(new PipeException("Transcoder exited with code 1"));
    when(extractionEngine.extract(any(), eq(workDir)))
        .thenAnswer(invocation -> extracted(invocation.getArgument(0), "m4a"));
    doAnswer(
            invocation -> {
              writeMp3(invocation.getArgument(1));
              return null;
            })
        .when(transcoder)
        .transcode(any(), any(), eq(AudioQuality.STANDARD));
    when(cache.populate(anyString(), any())).thenAnswer(invocation -> entry(invocation));

    ConversionResult result =
        service(true, cache).convert(ConversionRequest.forReference(WATCH_URL, null));

    assertThat(result.cached()).isFalse();
    verify(extractionEngine).extract(any(), eq(workDir));
    verify(transcoder).transcode(any(), any(), eq(AudioQuality.STANDARD));
    assertThat(scratchFiles()).isEmpty();
  }

  @Test
  void convert_shouldSkipTranscodeWhenExtractionYieldsMp3() throws Exception {
    when(extractionEngine.extract(any(), any()))
        .thenAnswer(invocation -> extracted(invocation.getArgument(0), "mp3"));
    when(cache.populate(anyString(), any())).thenAnswer(invocation -> entry(invocation));

    service(false, cache).convert(ConversionRequest.forReference(WATCH_URL, null));

    verifyNoInteractions(pipe, transcoder);
    verify(cache).populate(anyString(), any());
  }

  @Test
  void convert_shouldReturnTemporaryResultWhenCacheWriteFails() throws Exception {
    when(extractionEngine.extract(any(), any()))
        .thenAnswer(invocation -> extracted(invocation.getArgument(0), "mp3"));
    when(cache.populate(anyString(), any()))
        .thenThrow(new CacheWriteException("disk full", new IOException("ENOSPC")));
    ConversionService service = service(false, cache);

    ConversionResult result = service.convert(ConversionRequest.forReference(WATCH_URL, null));

    assertThat(result.temporary()).isTrue();
    assertThat(result.cached()).isFalse();
    assertThat(result.artifact()).exists();
    assertThat(result.sizeBytes()).isEqualTo(64);

    service.discard(result);
    assertThat(result.artifact()).doesNotExist();
  }

  @Test
  void convert_shouldPropagateClassifiedErrorAndReleaseSlot() {
    when(extractionEngine.extract(any(), any()))
        .thenThrow(
            new ExtractionException(ClassifiedError.of(ErrorKind.VIDEO_PRIVATE), List.of()));

    assertThatThrownBy(
            () -> service(false, cache).convert(ConversionRequest.forReference(WATCH_URL, null)))
        .isInstanceOfSatisfying(
            ExtractionException.class,
            e -> assertThat(e.error().kind()).isEqualTo(ErrorKind.VIDEO_PRIVATE));
    assertThat(admission.activeCount()).isZero();
    verify(cache, never()).populate(anyString(), any());
  }

  @Test
  void convert_shouldDownloadAndTranscodeDirectUrls() throws Exception {
    String url = "https://cdn.example.com/media/clip.mp4";
    doAnswer(invocation -> writeMp3(invocation.getArgument(1)))
        .when(directDownloader)
        .download(eq(url), any());
    doAnswer(
            invocation -> {
              writeMp3(invocation.getArgument(1));
              return null;
            })
        .when(transcoder)
        .transcode(any(), any(), any());
    when(cache.populate(anyString(), any())).thenAnswer(invocation -> entry(invocation));

    ConversionResult result =
        service(true, cache).convert(ConversionRequest.forReference(url, null));

    assertThat(result.cached()).isFalse();
    verify(cache).populate(eq(ResultCache.generateKey(url, AudioQuality.STANDARD)), any());
    verifyNoInteractions(extractionEngine, pipe);
    assertThat(scratchFiles()).isEmpty();
  }

  @Test
  void convert_shouldRejectRequestWithoutInput() {
    assertThatThrownBy(
            () ->
                service(true, cache)
                    .convert(new ConversionRequest(" ", null, null, null, null, null)))
        .isInstanceOfSatisfying(
            InvalidInputException.class,
            e -> assertThat(e.code()).isEqualTo(InputErrorCode.NO_INPUT));
  }

  @Test
  void convert_shouldRejectRequestWithBothInputs() {
    ConversionRequest request =
        new ConversionRequest(WATCH_URL, tempDir.resolve("a.mov"), "a.mov", null, null, null);

    assertThatThrownBy(() -> service(true, cache).convert(request))
        .isInstanceOfSatisfying(
            InvalidInputException.class,
            e -> assertThat(e.code()).isEqualTo(InputErrorCode.AMBIGUOUS_INPUT));
  }

  @Test
  void convert_shouldRejectUnsupportedReferenceBeforeAnyWork() {
    assertThatThrownBy(
            () ->
                service(true, cache)
                    .convert(ConversionRequest.forReference("ftp://example.com/a.mp4", null)))
        .isInstanceOfSatisfying(
            InvalidInputException.class,
            e -> assertThat(e.code()).isEqualTo(InputErrorCode.UNSUPPORTED_REFERENCE));
    verifyNoInteractions(cache, extractionEngine, directDownloader);
  }

  @Test
  void convert_shouldRejectOversizedUpload() throws Exception {
    Path upload = Files.write(tempDir.resolve("big.mov"), new byte[2048]);

    assertThatThrownBy(
            () ->
                service(true, cache)
                    .convert(ConversionRequest.forUpload(upload, "big.mov", Tier.STANDARD)))
        .isInstanceOfSatisfying(
            InvalidInputException.class,
            e -> assertThat(e.code()).isEqualTo(InputErrorCode.FILE_TOO_LARGE));
    verifyNoInteractions(transcoder);
  }

  @Test
  void convert_shouldRejectMissingUpload() {
    assertThatThrownBy(
            () ->
                service(true, cache)
                    .convert(
                        ConversionRequest.forUpload(tempDir.resolve("gone.mov"), "gone.mov", null)))
        .isInstanceOfSatisfying(
            InvalidInputException.class,
            e -> assertThat(e.code()).isEqualTo(InputErrorCode.UPLOAD_NOT_FOUND));
  }

  @Test
  void convert_shouldTranscodeUploadWithoutCaching() throws Exception {
    Path upload = Files.write(tempDir.resolve("upload.bin"), new byte[128]);
    doAnswer(
            invocation -> {
              writeMp3(invocation.getArgument(1));
              return null;
            })
        .when(transcoder)
        .transcode(eq(upload), any(), eq(AudioQuality.HIGH));

    ConversionResult result =
        service(true, cache)
            .convert(
                ConversionRequest.forUpload(upload, "C:\\clips\\My Talk.final.mov", Tier.PREMIUM));

    assertThat(result.filename()).isEqualTo("My Talk.mp3");
    assertThat(result.temporary()).isTrue();
    assertThat(result.artifact()).exists();
    verifyNoInteractions(cache);
    assertThat(admission.activeCount()).isZero();
  }

  @Test
  void convert_shouldRemoveUploadOutputWhenTranscodeFails() throws Exception {
    Path upload = Files.write(tempDir.resolve("upload.bin"), new byte[128]);
    doAnswer(
            invocation -> {
              writeMp3(invocation.getArgument(1));
              throw new TranscodeException("ffmpeg exited with code 1");
            })
        .when(transcoder)
        .transcode(any(), any(), any());

    assertThatThrownBy(
            () ->
                service(true, cache).convert(ConversionRequest.forUpload(upload, "a.mov", null)))
        .isInstanceOf(TranscodeException.class);
    assertThat(scratchFiles()).isEmpty();
    assertThat(admission.activeCount()).isZero();
  }

  @Test
  void convert_shouldCancelWhenInterruptedWhileQueued() throws Exception {
    ConversionService service = service(false, cache);
    ExecutorService pool = Executors.newSingleThreadExecutor();

    try (AdmissionSlot held = admission.acquire(Tier.STANDARD)) {
      Future<ConversionResult> queued =
          pool.submit(() -> service.convert(ConversionRequest.forReference(WATCH_URL, null)));
      awaitValue(admission::queuedCount, 1);

      queued.cancel(true);
      pool.shutdown();
      assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
      assertThat(admission.queuedCount()).isZero();
    } finally {
      pool.shutdownNow();
    }
    verifyNoInteractions(extractionEngine);
  }

  @Test
  void convertAsync_shouldRunConcurrentIdenticalRequestsOnce() throws Exception {
    FileSystemResultCache realCache =
        new FileSystemResultCache(
            new CacheProperties(
                tempDir.resolve("cache").toString(), Duration.ofDays(7), Duration.ofHours(1)));
    CountDownLatch extracting = new CountDownLatch(1);
    CountDownLatch proceed = new CountDownLatch(1);
    when(extractionEngine.extract(any(), any()))
        .thenAnswer(
            invocation -> {
              extracting.countDown();
              assertThat(proceed.await(10, TimeUnit.SECONDS)).isTrue();
              return extracted(invocation.getArgument(0), "mp3");
            });
    ExecutorService pool = Executors.newFixedThreadPool(2);
    ConversionService service = service(false, realCache, pool);

    try {
      CompletableFuture<ConversionResult> first =
          service.convertAsync(ConversionRequest.forReference(WATCH_URL, null));
      assertThat(extracting.await(10, TimeUnit.SECONDS)).isTrue();
      CompletableFuture<ConversionResult> second =
          service.convertAsync(ConversionRequest.forReference("abc12345678", null));
      awaitValue(admission::queuedCount, 1);
      proceed.countDown();

      ConversionResult firstResult = first.get(10, TimeUnit.SECONDS);
      ConversionResult secondResult = second.get(10, TimeUnit.SECONDS);

      assertThat(firstResult.cached()).isFalse();
      assertThat(secondResult.cached()).isTrue();
      assertThat(secondResult.artifact()).isEqualTo(firstResult.artifact());
      verify(extractionEngine, times(1)).extract(any(), any());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void convertAsync_shouldSurfaceFailuresThroughFuture() {
    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      ConversionRequest empty = new ConversionRequest(null, null, null, null, null, null);
      CompletableFuture<ConversionResult> future = service(true, cache, pool).convertAsync(empty);

      assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
          .isInstanceOf(ExecutionException.class)
          .hasCauseInstanceOf(InvalidInputException.class);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void uploadFilename_shouldKeepBaseNameOnly() {
    assertThat(ConversionService.uploadFilename("lecture.mp4")).isEqualTo("lecture.mp3");
    assertThat(ConversionService.uploadFilename("/tmp/x/a.b.c.mov")).isEqualTo("a.mp3");
    assertThat(ConversionService.uploadFilename(".hidden")).isEqualTo(".hidden.mp3");
    assertThat(ConversionService.uploadFilename(null)).isEqualTo("audio.mp3");
    assertThat(ConversionService.uploadFilename("  ")).isEqualTo("audio.mp3");
  }

  private ConversionService service(boolean streaming, ResultCache resultCache) {
    return service(streaming, resultCache, Runnable::run);
  }

  private ConversionService service(
      boolean streaming, ResultCache resultCache, Executor executor) {
    return new ConversionService(
        new ConversionProperties(
            workDir.toString(), 1024, streaming, Duration.ofSeconds(10), 2, 10),
        new UrlNormalizer(),
        admission,
        resultCache,
        extractionEngine,
        pipe,
        transcoder,
        directDownloader,
        executor);
  }

  private ExtractionResult extracted(ConversionJob job, String extension) throws Exception {
    Path file = workDir.resolve(job.extractionPrefix() + extension);
    writeMp3(file);
    return new ExtractionResult(file, PERSONA, List.of());
  }

  private CacheEntry entry(InvocationOnMock invocation) {
    String key = invocation.getArgument(0);
    return new CacheEntry(key, tempDir.resolve("cache").resolve(key + ".mp3"), Instant.now(), 64);
  }

  private static Path writeMp3(Path path) throws Exception {
    return Files.write(path, new byte[64]);
  }

  private List<Path> scratchFiles() throws Exception {
    try (Stream<Path> files = Files.list(workDir)) {
      return files.toList();
    }
  }

  private static void awaitValue(IntSupplier supplier, int expected) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (supplier.getAsInt() != expected && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    assertThat(supplier.getAsInt()).isEqualTo(expected);
  }
}
