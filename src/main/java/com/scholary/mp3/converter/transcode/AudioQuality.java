package com.scholary.mp3.converter.transcode;

import com.scholary.mp3.converter.admission.Tier;

/** Output quality of the produced MP3. */
public enum AudioQuality {
  STANDARD("128k", 4),
  HIGH("192k", 2);

  private final String bitrate;
  private final int vbrQuality;

  AudioQuality(String bitrate, int vbrQuality) {
    this.bitrate = bitrate;
    this.vbrQuality = vbrQuality;
  }

  /** Bitrate as passed to ffmpeg's {@code -b:a}. */
  public String bitrate() {
    return bitrate;
  }

  /** libmp3lame quality as passed to {@code -q:a} (lower is better). */
  public int vbrQuality() {
    return vbrQuality;
  }

  /**
   * Resolve the effective quality for a tier.
   *
   * <p>Premium tiers default to HIGH. Standard tier is capped at STANDARD whatever it asks for.
   *
   * @param requested the requested quality, may be null
   * @param tier the caller tier
   * @return the quality to encode at
   */
  public static AudioQuality resolve(AudioQuality requested, Tier tier) {
    if (!tier.isPremium()) {
      return STANDARD;
    }
    return requested == null ? HIGH : requested;
  }
}
