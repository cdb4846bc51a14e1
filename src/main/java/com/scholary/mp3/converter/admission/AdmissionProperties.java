package com.scholary.mp3.converter.admission;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Per-tier concurrency ceilings.
 *
 * <p>A ceiling is the number of active conversions (across all tiers) below which a caller of
 * that tier is still admitted. Higher tiers must have a ceiling at least as high as lower ones.
 */
@ConfigurationProperties(prefix = "admission")
@Validated
public record AdmissionProperties(
    @Positive int standard,
    @Positive int premium,
    @Positive int business,
    @Positive int enterprise) {

  public int ceiling(Tier tier) {
    return switch (tier) {
      case STANDARD -> standard;
      case PREMIUM -> premium;
      case BUSINESS -> business;
      case ENTERPRISE -> enterprise;
    };
  }
}
