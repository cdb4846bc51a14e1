package com.scholary.mp3.converter.cache;

import com.scholary.mp3.converter.logging.StructuredLogger;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link ResultCache} backed by a directory of {@code <key>.mp3} files.
 *
 * <p>Populate copies the source into a private {@code .part} file in the cache directory, then
 * publishes it with a hard link. Creating a link fails if the target exists, so two writers can't
 * both publish and a reader never sees a half-written file. File systems without hard links fall
 * back to a non-replacing move, which gives the same guarantee.
 */
@Component
public class FileSystemResultCache implements ResultCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemResultCache.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final String EXTENSION = ".mp3";

  private final Path directory;

  public FileSystemResultCache(CacheProperties properties) {
    this.directory = Paths.get(properties.directory());
    LOGGER.info("Result cache directory: {}", directory.toAbsolutePath());
  }

  @Override
  public Optional<CacheEntry> lookup(String key) {
    Path path = pathFor(key);
    if (!Files.isRegularFile(path)) {
      LOGGER.debug("Cache miss: key={}", key);
      return Optional.empty();
    }
    try {
      CacheEntry entry =
          new CacheEntry(
              key, path, Files.getLastModifiedTime(path).toInstant(), Files.size(path));
      LOGGER.debug("Cache hit: key={}", key);
      return Optional.of(entry);
    } catch (IOException e) {
      // Evicted between the check and the stat
      LOGGER.debug("Cache entry vanished during lookup: key={}, {}", key, e.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public CacheEntry populate(String key, Path source) {
    Optional<CacheEntry> existing = lookup(key);
    if (existing.isPresent()) {
      STRUCTURED_LOGGER.logCachePopulated(key, existing.get().sizeBytes(), true);
      return existing.get();
    }

    Path target = pathFor(key);
    Path part = directory.resolve(key + "." + UUID.randomUUID() + ".part");
    try {
      Files.createDirectories(directory);
      Files.copy(source, part);
      publish(part, target);
      STRUCTURED_LOGGER.logCachePopulated(key, Files.size(target), false);
    } catch (FileAlreadyExistsException e) {
      STRUCTURED_LOGGER.logCachePopulated(key, 0, true);
    } catch (IOException e) {
      throw new CacheWriteException("Failed to populate cache entry " + key, e);
    } finally {
      try {
        Files.deleteIfExists(part);
      } catch (IOException e) {
        LOGGER.warn("Could not remove cache part file {}: {}", part, e.getMessage());
      }
    }

    return lookup(key)
        .orElseThrow(() -> new CacheWriteException("Cache entry missing after populate: " + key));
  }

  /** Path an entry is (or would be) published at. */
  public Path pathFor(String key) {
    return directory.resolve(key + EXTENSION);
  }

  private static void publish(Path part, Path target) throws IOException {
    try {
      Files.createLink(target, part);
    } catch (FileAlreadyExistsException e) {
      throw e;
    } catch (UnsupportedOperationException | FileSystemException e) {
      LOGGER.debug("Hard link unavailable ({}), publishing by move", e.getMessage());
      Files.move(part, target);
    }
  }
}
