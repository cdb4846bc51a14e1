package com.scholary.mp3.converter.admission;

import java.util.Locale;

/** Caller class. Ordered from lowest to highest. */
public enum Tier {
  STANDARD,
  PREMIUM,
  BUSINESS,
  ENTERPRISE;

  /** Anything above standard gets the premium treatment (quality, ceilings). */
  public boolean isPremium() {
    return this != STANDARD;
  }

  /**
   * Parse a tier header value, case-insensitively.
   *
   * @param value the raw value, may be null
   * @return the tier, or {@link #STANDARD} for null or unknown values
   */
  public static Tier fromHeader(String value) {
    if (value == null || value.isBlank()) {
      return STANDARD;
    }
    try {
      return Tier.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return STANDARD;
    }
  }
}
