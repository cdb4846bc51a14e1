package com.scholary.mp3.converter.extraction;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the extraction tool (yt-dlp).
 *
 * <p>personaOrder is the operator-tunable fallback order. forcedPersona, when set, pins every
 * extraction to that one persona. Hosts in proxySkipHosts (and their subdomains) never go through
 * the proxy.
 */
@ConfigurationProperties(prefix = "extraction")
@Validated
public record ExtractionProperties(
    @NotBlank String binary,
    @NotNull Duration timeout,
    @NotEmpty List<String> personaOrder,
    String forcedPersona,
    String proxy,
    List<String> proxySkipHosts,
    String cookiesFile,
    String cookiesFromBrowser,
    boolean probeEnabled,
    @NotNull Duration probeTimeout,
    @Positive int shortContentSeconds,
    @Positive int probeCacheSize,
    @NotNull Duration probeCacheTtl) {

  public ExtractionProperties {
    proxySkipHosts = proxySkipHosts == null ? List.of() : List.copyOf(proxySkipHosts);
  }

  public boolean hasProxy() {
    return proxy != null && !proxy.isBlank();
  }

  public boolean hasForcedPersona() {
    return forcedPersona != null && !forcedPersona.isBlank();
  }
}
