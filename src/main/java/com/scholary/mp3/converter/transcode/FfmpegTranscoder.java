package com.scholary.mp3.converter.transcode;

import com.scholary.mp3.converter.process.ProcessResult;
import com.scholary.mp3.converter.process.ProcessRunner;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Transcodes audio (or the audio track of a video) to MP3 with ffmpeg.
 *
 * <p>Used directly for uploads and for the discrete extract-then-transcode flow. The streaming
 * pipe uses {@link #buildCommand} with {@code pipe:0} as input.
 */
@Component
public class FfmpegTranscoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegTranscoder.class);

  private final FfmpegProperties properties;
  private final ProcessRunner processRunner;

  public FfmpegTranscoder(FfmpegProperties properties, ProcessRunner processRunner) {
    this.properties = properties;
    this.processRunner = processRunner;
  }

  /**
   * Transcode a file to MP3.
   *
   * @param input source media file
   * @param output destination MP3 (overwritten)
   * @param quality encoding quality
   * @throws TranscodeException if ffmpeg fails or the output is implausibly small
   */
  public void transcode(Path input, Path output, AudioQuality quality) {
    LOGGER.info("Transcoding {} to {} at {}", input.getFileName(), output.getFileName(), quality);
    long start = System.currentTimeMillis();

    List<String> command = buildCommand(input.toString(), output, quality, false);
    ProcessResult result;
    try {
      result = processRunner.run(command, output.getParent(), properties.timeout());
    } catch (IOException e) {
      throw new TranscodeException("Failed to start ffmpeg: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranscodeException("Transcode interrupted", e);
    }

    if (result.timedOut()) {
      throw new TranscodeException(
          String.format("ffmpeg exceeded %ds", properties.timeout().toSeconds()));
    }
    if (result.exitCode() != 0) {
      throw new TranscodeException(
          String.format("ffmpeg exited with code %d: %s", result.exitCode(), result.stderr()));
    }
    verifyOutput(output);

    LOGGER.info("Transcode done in {}ms", System.currentTimeMillis() - start);
  }

  /**
   * Build the ffmpeg command line.
   *
   * <p>-vn/-sn/-dn drop video, subtitle and data streams; -map 0:a:0 takes the first audio
   * stream. With progress enabled, key=value telemetry is written to stdout.
   *
   * @param input input path or {@code pipe:0}
   * @param output output file
   * @param quality encoding quality
   * @param progress whether to emit {@code -progress pipe:1}
   * @return the command
   */
  public List<String> buildCommand(
      String input, Path output, AudioQuality quality, boolean progress) {
    List<String> command = new ArrayList<>();
    command.add(properties.binary());
    command.addAll(List.of("-hide_banner", "-nostdin", "-threads", "0"));
    if (progress) {
      command.addAll(List.of("-progress", "pipe:1", "-nostats"));
    }
    command.addAll(
        List.of(
            "-i", input,
            "-vn", "-sn", "-dn",
            "-map", "0:a:0",
            "-c:a", "libmp3lame",
            "-b:a", quality.bitrate(),
            "-ar", String.valueOf(properties.sampleRate()),
            "-ac", String.valueOf(properties.channels()),
            "-q:a", String.valueOf(quality.vbrQuality()),
            "-f", "mp3",
            "-y",
            output.toString()));
    return command;
  }

  /**
   * Check that an output file exists and is larger than the configured minimum size.
   *
   * @throws TranscodeException if it isn't
   */
  public void verifyOutput(Path output) {
    if (!isPlausibleOutput(output)) {
      throw new TranscodeException("ffmpeg produced no usable output: " + output.getFileName());
    }
  }

  /** Whether a file exists and exceeds the minimum plausible size. */
  public boolean isPlausibleOutput(Path output) {
    try {
      return Files.isRegularFile(output) && Files.size(output) > properties.minOutputBytes();
    } catch (IOException e) {
      LOGGER.warn("Could not stat {}: {}", output, e.getMessage());
      return false;
    }
  }
}
