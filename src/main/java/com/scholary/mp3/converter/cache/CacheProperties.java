package com.scholary.mp3.converter.cache;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the on-disk result cache and its eviction sweep. */
@ConfigurationProperties(prefix = "cache")
@Validated
public record CacheProperties(
    @NotBlank String directory, @NotNull Duration maxAge, @NotNull Duration sweepInterval) {}
