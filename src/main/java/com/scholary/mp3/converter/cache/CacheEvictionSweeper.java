package com.scholary.mp3.converter.cache;

import com.scholary.mp3.converter.logging.StructuredLogger;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Deletes cache files older than the configured max age.
 *
 * <p>Runs once at startup and then every sweep interval. Age is last-modified time. A file that
 * can't be inspected or deleted is counted and skipped; it never stops the sweep.
 */
@Component
public class CacheEvictionSweeper {

  private static final Logger LOGGER = LoggerFactory.getLogger(CacheEvictionSweeper.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final Path directory;
  private final CacheProperties properties;
  private final Clock clock;
  private final FileDeleter deleter;

  @Autowired
  public CacheEvictionSweeper(CacheProperties properties) {
    this(properties, Clock.systemUTC());
  }

  CacheEvictionSweeper(CacheProperties properties, Clock clock) {
    this(properties, clock, Files::deleteIfExists);
  }

  CacheEvictionSweeper(CacheProperties properties, Clock clock, FileDeleter deleter) {
    this.directory = Paths.get(properties.directory());
    this.properties = properties;
    this.clock = clock;
    this.deleter = deleter;
  }

  @Scheduled(initialDelay = 0, fixedDelayString = "${cache.sweepInterval}")
  public void scheduledSweep() {
    sweep();
  }

  /**
   * Sweep the cache directory once.
   *
   * @return counts of deleted, kept and failed files
   */
  public SweepReport sweep() {
    if (!Files.isDirectory(directory)) {
      LOGGER.debug("Cache directory {} does not exist, nothing to sweep", directory);
      return SweepReport.empty();
    }

    Instant cutoff = clock.instant().minus(properties.maxAge());
    int deleted = 0;
    int kept = 0;
    int errors = 0;

    try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
      for (Path entry : entries) {
        if (!Files.isRegularFile(entry)) {
          continue;
        }
        try {
          Instant modified = Files.getLastModifiedTime(entry).toInstant();
          if (modified.isBefore(cutoff)) {
            deleter.delete(entry);
            deleted++;
            LOGGER.debug("Evicted {}", entry.getFileName());
          } else {
            kept++;
          }
        } catch (IOException e) {
          errors++;
          LOGGER.warn("Could not evict {}: {}", entry.getFileName(), e.getMessage());
        }
      }
    } catch (IOException e) {
      LOGGER.error("Cache sweep could not list {}: {}", directory, e.getMessage());
      errors++;
    }

    STRUCTURED_LOGGER.logCacheSweep(deleted, kept, errors);
    return new SweepReport(deleted, kept, errors);
  }

  @FunctionalInterface
  interface FileDeleter {
    void delete(Path path) throws IOException;
  }
}
