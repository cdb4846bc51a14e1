package com.scholary.mp3.converter.pipe;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the streaming transcode pipe.
 *
 * <p>inactivityTimeout is the longest the pipe may go without a single byte on any of its
 * streams. totalTimeout caps the whole session regardless of activity.
 */
@ConfigurationProperties(prefix = "pipe")
@Validated
public record PipeProperties(@NotNull Duration inactivityTimeout, @NotNull Duration totalTimeout) {}
