package com.scholary.mp3.converter.cache;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A published MP3 in the result cache.
 *
 * @param key content-addressable key
 * @param filePath path of the MP3
 * @param createdAt last-modified time of the file
 * @param sizeBytes file size
 */
public record CacheEntry(String key, Path filePath, Instant createdAt, long sizeBytes) {}
