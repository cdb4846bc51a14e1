package com.scholary.mp3.converter.pipe;

import java.util.Optional;

/**
 * Parses ffmpeg's {@code -progress} output.
 *
 * <p>ffmpeg writes blocks of {@code key=value} lines, each block terminated by
 * {@code progress=continue} or {@code progress=end}. One parser instance per session; not
 * thread-safe.
 */
public class FfmpegProgressParser {

  /**
   * One progress block.
   *
   * @param outTimeMs position of the encoder in the output, milliseconds
   * @param speed encoding speed as reported, e.g. {@code 12.3x}, or null
   * @param finished whether this was the final block
   */
  public record Progress(long outTimeMs, String speed, boolean finished) {}

  private long outTimeMicros = -1;
  private String speed;

  /**
   * Feed one line.
   *
   * @return a snapshot when the line closes a block, empty otherwise
   */
  public Optional<Progress> accept(String line) {
    if (line == null) {
      return Optional.empty();
    }
    int eq = line.indexOf('=');
    if (eq <= 0) {
      return Optional.empty();
    }
    String key = line.substring(0, eq).trim();
    String value = line.substring(eq + 1).trim();

    // out_time_ms is in microseconds despite its name
    if ("out_time_us".equals(key) || "out_time_ms".equals(key)) {
      outTimeMicros = parseLong(value, outTimeMicros);
    } else if ("speed".equals(key)) {
      speed = "N/A".equals(value) ? null : value;
    } else if ("progress".equals(key)) {
      long outTimeMs = outTimeMicros < 0 ? -1 : outTimeMicros / 1000;
      return Optional.of(new Progress(outTimeMs, speed, "end".equals(value)));
    }
    return Optional.empty();
  }

  private static long parseLong(String value, long fallback) {
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      return fallback;
    }
  }
}
