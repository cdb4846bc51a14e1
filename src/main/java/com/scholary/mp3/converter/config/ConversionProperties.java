package com.scholary.mp3.converter.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for conversion processing.
 *
 * <p>Controls the scratch directory, input limits, the streaming fast path and resource
 * allocation for asynchronous conversions.
 */
@ConfigurationProperties(prefix = "conversion")
@Validated
public record ConversionProperties(
    @NotBlank String tempDir,
    @Positive long maxUploadBytes,
    boolean streamingEnabled,
    @NotNull Duration directDownloadTimeout,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize) {}
