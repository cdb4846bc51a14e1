package com.scholary.mp3.converter.extraction;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Builds yt-dlp command lines for a persona.
 *
 * <p>Three shapes: a download to a file template, a stream to stdout for the pipe, and a
 * metadata-only probe. The URL always comes last, after a {@code --} separator, so a reference
 * can never be mistaken for an option.
 */
@Component
public class YtDlpCommandBuilder {

  static final String PROXY_FLAG = "--proxy";
  static final String END_OF_OPTIONS = "--";

  private final ExtractionProperties properties;

  public YtDlpCommandBuilder(ExtractionProperties properties) {
    this.properties = properties;
  }

  /**
   * Download to a file.
   *
   * @param persona the persona
   * @param url normalized reference
   * @param host lower-case host of the reference
   * @param outputTemplate yt-dlp output template, e.g. {@code /tmp/ytdlp_<id>.%(ext)s}
   */
  public List<String> buildDownload(Persona persona, String url, String host, Path outputTemplate) {
    List<String> command = new ArrayList<>();
    command.add(properties.binary());
    command.addAll(List.of("--no-playlist", "--no-progress", "--no-part"));
    command.addAll(List.of("--format", persona.formatSelector()));
    command.addAll(List.of("--output", outputTemplate.toString()));
    addPersonaArgs(command, persona);
    addSessionArgs(command, persona.usesProxy(), host);
    command.add(END_OF_OPTIONS);
    command.add(url);
    return command;
  }

  /** Stream the media to stdout. */
  public List<String> buildStream(Persona persona, String url, String host) {
    List<String> command = new ArrayList<>();
    command.add(properties.binary());
    command.addAll(List.of("--no-playlist", "--no-progress", "--quiet", "--no-warnings"));
    command.addAll(List.of("--format", persona.formatSelector()));
    command.addAll(List.of("--output", "-"));
    addPersonaArgs(command, persona);
    addSessionArgs(command, persona.usesProxy(), host);
    command.add(END_OF_OPTIONS);
    command.add(url);
    return command;
  }

  /** Metadata-only query; prints one JSON document on stdout. */
  public List<String> buildProbe(String url, String host) {
    List<String> command = new ArrayList<>();
    command.add(properties.binary());
    command.addAll(
        List.of("--dump-single-json", "--skip-download", "--no-playlist", "--no-warnings"));
    addSessionArgs(command, true, host);
    command.add(END_OF_OPTIONS);
    command.add(url);
    return command;
  }

  /**
   * Whether the proxy should be used for a host.
   *
   * <p>Skip-list entries match the host itself and any subdomain of it.
   */
  public boolean shouldProxy(boolean personaUsesProxy, String host) {
    if (!personaUsesProxy || !properties.hasProxy()) {
      return false;
    }
    String h = host == null ? "" : host.toLowerCase(Locale.ROOT);
    for (String skip : properties.proxySkipHosts()) {
      String s = skip.trim().toLowerCase(Locale.ROOT);
      if (!s.isEmpty() && (h.equals(s) || h.endsWith("." + s))) {
        return false;
      }
    }
    return true;
  }

  private void addPersonaArgs(List<String> command, Persona persona) {
    if (persona.clientIdentity() != null) {
      command.addAll(
          List.of("--extractor-args", "youtube:player_client=" + persona.clientIdentity()));
    }
    if (persona.userAgent() != null) {
      command.addAll(List.of("--user-agent", persona.userAgent()));
    }
    for (String header : persona.headers()) {
      command.addAll(List.of("--add-header", header));
    }
    command.addAll(persona.extraArgs());
  }

  private void addSessionArgs(List<String> command, boolean personaUsesProxy, String host) {
    if (properties.cookiesFile() != null && !properties.cookiesFile().isBlank()) {
      command.addAll(List.of("--cookies", properties.cookiesFile()));
    } else if (properties.cookiesFromBrowser() != null
        && !properties.cookiesFromBrowser().isBlank()) {
      command.addAll(List.of("--cookies-from-browser", properties.cookiesFromBrowser()));
    }
    if (shouldProxy(personaUsesProxy, host)) {
      command.addAll(List.of(PROXY_FLAG, properties.proxy()));
    }
  }
}
