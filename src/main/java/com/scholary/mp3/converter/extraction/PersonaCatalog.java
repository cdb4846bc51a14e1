package com.scholary.mp3.converter.extraction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * The static set of personas and the order they are tried in.
 *
 * <p>Cheapest and most likely to succeed first. The order comes from configuration; an unknown
 * persona name there fails startup rather than silently shrinking the fallback chain.
 */
@Component
public class PersonaCatalog {

  private static final Logger LOGGER = LoggerFactory.getLogger(PersonaCatalog.class);

  static final Persona WEB =
      new Persona(
          "web",
          "android,web",
          "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko)"
              + " Chrome/120.0.0.0 Safari/537.36",
          List.of(
              "Referer:https://www.youtube.com/",
              "Accept-Language:en-US,en;q=0.9",
              "Accept:text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8",
              "Sec-Fetch-Site:none",
              "Sec-Fetch-Mode:navigate",
              "Sec-Fetch-Dest:document"),
          "bestaudio/best",
          true,
          false,
          List.of("--no-mtime", "--extractor-args", "youtube:skip=dash,hls"));

  static final Persona ANDROID =
      new Persona(
          "android",
          "android",
          "com.google.android.youtube/19.09.37 (Linux; U; Android 13) gzip",
          List.of(),
          "bestaudio[ext=m4a]/bestaudio/best",
          true,
          true,
          List.of());

  static final Persona IOS =
      new Persona(
          "ios",
          "ios",
          "com.google.ios.youtube/19.09.3 (iPhone14,3; U; CPU iOS 15_6 like Mac OS X)",
          List.of(),
          "bestaudio/best",
          true,
          false,
          List.of());

  static final Persona GEO_BYPASS =
      new Persona(
          "geo-bypass",
          null,
          null,
          List.of(),
          "bestaudio/best",
          true,
          false,
          List.of(
              "--geo-bypass",
              "--retries", "5",
              "--fragment-retries", "5",
              "--extractor-retries", "3"));

  private static final List<Persona> DEFAULTS = List.of(WEB, ANDROID, IOS, GEO_BYPASS);

  private final List<Persona> ordered;

  @Autowired
  public PersonaCatalog(ExtractionProperties properties) {
    this(DEFAULTS, properties);
  }

  PersonaCatalog(List<Persona> available, ExtractionProperties properties) {
    Map<String, Persona> byName = new LinkedHashMap<>();
    for (Persona persona : available) {
      byName.put(persona.name(), persona);
    }

    List<String> names =
        properties.hasForcedPersona()
            ? List.of(properties.forcedPersona().trim())
            : properties.personaOrder();

    List<Persona> resolved = new ArrayList<>();
    for (String name : names) {
      Persona persona = byName.get(name.trim());
      if (persona == null) {
        throw new IllegalArgumentException(
            String.format("Unknown persona '%s' (known: %s)", name, byName.keySet()));
      }
      if (!resolved.contains(persona)) {
        resolved.add(persona);
      }
    }
    this.ordered = List.copyOf(resolved);

    LOGGER.info(
        "Persona order: {}{}",
        ordered.stream().map(Persona::name).toList(),
        properties.hasForcedPersona() ? " (forced)" : "");
  }

  /** Personas in configured order. */
  public List<Persona> ordered() {
    return ordered;
  }

  /**
   * Personas in configured order, optionally with compact personas moved to the front.
   *
   * <p>The move is stable: compact personas keep their relative order, as do the rest.
   */
  public List<Persona> ordered(boolean preferCompact) {
    if (!preferCompact) {
      return ordered;
    }
    List<Persona> result = new ArrayList<>(ordered.size());
    ordered.stream().filter(Persona::compact).forEach(result::add);
    ordered.stream().filter(p -> !p.compact()).forEach(result::add);
    return List.copyOf(result);
  }

  /** The persona the streaming fast path should use. */
  public Persona primary(boolean preferCompact) {
    return ordered(preferCompact).get(0);
  }
}
