package com.scholary.mp3.converter.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.mp3.converter.process.ProcessResult;
import com.scholary.mp3.converter.process.ProcessRunner;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Asks the extraction tool for metadata without downloading anything.
 *
 * <p>Only the duration matters to the engine, to decide whether compact personas should go first.
 * A probe that fails for any reason yields empty; the engine then uses the configured order.
 * Successful probes are memoised per normalized reference, so a popular reference is probed once
 * per TTL rather than once per request.
 */
@Component
public class ExtractionProbe {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionProbe.class);

  private final ExtractionProperties properties;
  private final YtDlpCommandBuilder commandBuilder;
  private final ProcessRunner processRunner;
  private final ObjectMapper objectMapper;
  private final Cache<String, ProbeResult> memo;

  public ExtractionProbe(
      ExtractionProperties properties,
      YtDlpCommandBuilder commandBuilder,
      ProcessRunner processRunner,
      ObjectMapper objectMapper) {
    this.properties = properties;
    this.commandBuilder = commandBuilder;
    this.processRunner = processRunner;
    this.objectMapper = objectMapper;
    this.memo =
        Caffeine.newBuilder()
            .maximumSize(properties.probeCacheSize())
            .expireAfterWrite(properties.probeCacheTtl())
            .recordStats()
            .build();

    LOGGER.info(
        "Initialized probe memo: maxSize={}, ttl={}",
        properties.probeCacheSize(),
        properties.probeCacheTtl());
  }

  /**
   * Probe a reference.
   *
   * @param url normalized reference
   * @param host lower-case host
   * @return metadata, or empty if the probe failed
   */
  public Optional<ProbeResult> probe(String url, String host) {
    ProbeResult cached = memo.getIfPresent(url);
    if (cached != null) {
      LOGGER.debug("Probe memo hit: {}", url);
      return Optional.of(cached);
    }

    List<String> command = commandBuilder.buildProbe(url, host);
    ProcessResult result;
    try {
      result = processRunner.run(command, null, properties.probeTimeout());
    } catch (IOException e) {
      LOGGER.warn("Probe could not start: {}", e.getMessage());
      return Optional.empty();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Probe interrupted");
      return Optional.empty();
    }

    if (!result.succeeded()) {
      LOGGER.info("Probe failed (exit {}), using default persona order", result.exitCode());
      return Optional.empty();
    }

    Optional<ProbeResult> parsed = parse(result.stdout());
    parsed.ifPresent(p -> memo.put(url, p));
    return parsed;
  }

  /** Parse the tool's JSON document. Empty if it isn't one. */
  Optional<ProbeResult> parse(String json) {
    if (json == null || json.isBlank()) {
      return Optional.empty();
    }
    try {
      JsonNode root = objectMapper.readTree(json);
      if (root == null || !root.isObject()) {
        return Optional.empty();
      }
      JsonNode duration = root.path("duration");
      double seconds = duration.isNumber() ? duration.asDouble() : -1;
      String title = root.hasNonNull("title") ? root.get("title").asText() : null;
      return Optional.of(new ProbeResult(seconds, title));
    } catch (JsonProcessingException e) {
      LOGGER.warn("Probe output was not JSON: {}", e.getOriginalMessage());
      return Optional.empty();
    }
  }

  /**
   * Get memo statistics for monitoring.
   *
   * @return memo stats
   */
  public String getStats() {
    var stats = memo.stats();
    return String.format(
        "ProbeMemo[size=%d, hitRate=%.2f%%]", memo.estimatedSize(), stats.hitRate() * 100);
  }
}
