package com.scholary.mp3.converter.cache;

import com.scholary.mp3.converter.transcode.AudioQuality;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Optional;

/**
 * Content-addressable store of finished MP3s.
 *
 * <p>Entries are immutable once published. Many requests may try to populate the same key at the
 * same time; exactly one file ends up published and the others are discarded without error.
 *
 * <p>Cache keys are the SHA-256 of the normalized reference and the output quality.
 */
public interface ResultCache {

  /**
   * Look up a published entry.
   *
   * @param key cache key
   * @return the entry, or empty if nothing is published under the key
   */
  Optional<CacheEntry> lookup(String key);

  /**
   * Publish a file under a key, unless something is already published there.
   *
   * @param key cache key
   * @param source finished MP3; it is copied, not moved
   * @return the published entry (this writer's or the one that won)
   * @throws CacheWriteException if the copy or publish failed
   */
  CacheEntry populate(String key, Path source);

  /**
   * Generate a cache key.
   *
   * @param normalizedReference canonical reference
   * @param quality output quality
   * @return lowercase hex SHA-256
   */
  static String generateKey(String normalizedReference, AudioQuality quality) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      byte[] digest =
          md.digest((normalizedReference + "|" + quality.name()).getBytes(StandardCharsets.UTF_8));
      StringBuilder sb = new StringBuilder(digest.length * 2);
      for (byte b : digest) {
        sb.append(String.format("%02x", b));
      }
      return sb.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
