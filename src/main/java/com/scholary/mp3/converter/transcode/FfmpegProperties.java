package com.scholary.mp3.converter.transcode;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg operations.
 *
 * <p>minOutputBytes is the size a real MP3 must exceed; anything at or below it is treated as a
 * truncated artifact from a pipeline that failed quietly.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String binary,
    @Positive int sampleRate,
    @Positive int channels,
    @NotNull Duration timeout,
    @Positive long minOutputBytes) {}
