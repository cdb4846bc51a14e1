package com.scholary.mp3.converter.normalize;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Canonicalizes source references.
 *
 * <p>The output feeds the cache key, so {@link #normalize(String)} must be deterministic and
 * idempotent: two spellings of the same video have to land on the same string, and running the
 * result through again must not change it.
 *
 * <p>Rules:
 *
 * <ul>
 *   <li>Bare 11-character video IDs become a canonical watch URL
 *   <li>youtu.be short links and /embed/, /v/, /shorts/, /live/ paths become a watch URL
 *   <li>Watch URLs keep only the {@code v} and {@code t} parameters (playlist, radio, tracking
 *       parameters are dropped)
 *   <li>Vimeo and Dailymotion URLs lose their query string and fragment
 *   <li>Everything else, including anything we fail to parse, is returned unchanged
 * </ul>
 */
@Component
public class UrlNormalizer {

  private static final Pattern VIDEO_ID = Pattern.compile("^[A-Za-z0-9_-]{11}$");
  private static final String WATCH_URL = "https://www.youtube.com/watch";
  private static final URI RELATIVE_BASE = URI.create("https://www.youtube.com/");

  private static final List<String> ID_PATH_MARKERS = List.of("embed", "v", "shorts", "live");
  private static final List<String> PLATFORM_HOSTS =
      List.of("youtube.com", "youtu.be", "vimeo.com", "dailymotion.com");

  /**
   * Normalize a reference into its canonical form.
   *
   * @param reference a URL, a bare video ID, or anything else
   * @return the canonical reference, or the input unchanged if it can't be canonicalized
   */
  public String normalize(String reference) {
    if (reference == null) {
      return null;
    }
    try {
      String raw = reference.trim();
      if (raw.isEmpty()) {
        return reference;
      }
      if (VIDEO_ID.matcher(raw).matches()) {
        return watchUrl(raw, null);
      }

      URI uri = RELATIVE_BASE.resolve(raw);
      String host = lowerHost(uri);

      if (host.equals("youtu.be")) {
        String id = firstPathSegment(uri);
        return id.isEmpty() ? raw : watchUrl(id, queryParam(uri, "t").orElse(null));
      }

      if (host.endsWith("youtube.com") || host.contains("youtube")) {
        Optional<String> v = queryParam(uri, "v");
        if (v.isPresent()) {
          return watchUrl(v.get(), queryParam(uri, "t").orElse(null));
        }
        List<String> parts = pathSegments(uri);
        for (String marker : ID_PATH_MARKERS) {
          int idx = parts.indexOf(marker);
          if (idx != -1 && idx + 1 < parts.size()) {
            return watchUrl(parts.get(idx + 1), null);
          }
        }
        // Channel or playlist page, nothing to canonicalize
        return raw;
      }

      if (host.contains("vimeo.com") || host.contains("dailymotion.com")) {
        return origin(uri) + (uri.getRawPath() == null ? "" : uri.getRawPath());
      }

      return raw;
    } catch (RuntimeException e) {
      return reference;
    }
  }

  /**
   * Decide how a reference should be fetched.
   *
   * @param reference a raw or normalized reference
   * @return the reference kind
   */
  public ReferenceKind classify(String reference) {
    String normalized = normalize(reference);
    if (normalized == null || normalized.isBlank()) {
      return ReferenceKind.UNSUPPORTED;
    }
    try {
      URI uri = new URI(normalized);
      String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
      if (!scheme.equals("http") && !scheme.equals("https")) {
        return ReferenceKind.UNSUPPORTED;
      }
      String host = lowerHost(uri);
      if (host.isEmpty()) {
        return ReferenceKind.UNSUPPORTED;
      }
      return PLATFORM_HOSTS.stream().anyMatch(host::contains)
          ? ReferenceKind.PLATFORM
          : ReferenceKind.DIRECT;
    } catch (Exception e) {
      return ReferenceKind.UNSUPPORTED;
    }
  }

  /**
   * Whether the raw reference points at short-form content (a /shorts/ URL).
   *
   * <p>Has to look at the raw reference; normalization rewrites shorts into watch URLs.
   */
  public boolean isShortForm(String reference) {
    if (reference == null) {
      return false;
    }
    try {
      URI uri = RELATIVE_BASE.resolve(reference.trim());
      return lowerHost(uri).contains("youtube") && pathSegments(uri).contains("shorts");
    } catch (RuntimeException e) {
      return false;
    }
  }

  /**
   * Lower-case host of a reference.
   *
   * @return the host, or an empty string if there is none
   */
  public String hostOf(String reference) {
    if (reference == null) {
      return "";
    }
    try {
      return lowerHost(new URI(reference.trim()));
    } catch (Exception e) {
      return "";
    }
  }

  private static String watchUrl(String id, String timestamp) {
    StringBuilder url = new StringBuilder(WATCH_URL).append("?v=").append(encode(id));
    if (timestamp != null && !timestamp.isEmpty()) {
      url.append("&t=").append(encode(timestamp));
    }
    return url.toString();
  }

  private static String origin(URI uri) {
    StringBuilder origin = new StringBuilder();
    origin.append(uri.getScheme().toLowerCase(Locale.ROOT)).append("://").append(lowerHost(uri));
    if (uri.getPort() != -1) {
      origin.append(':').append(uri.getPort());
    }
    return origin.toString();
  }

  private static String lowerHost(URI uri) {
    return uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
  }

  private static String firstPathSegment(URI uri) {
    List<String> parts = pathSegments(uri);
    return parts.isEmpty() ? "" : parts.get(0);
  }

  private static List<String> pathSegments(URI uri) {
    String path = uri.getPath();
    if (path == null) {
      return List.of();
    }
    return Arrays.stream(path.split("/")).filter(s -> !s.isEmpty()).toList();
  }

  private static Optional<String> queryParam(URI uri, String name) {
    String query = uri.getRawQuery();
    if (query == null || query.isEmpty()) {
      return Optional.empty();
    }
    for (String pair : query.split("&")) {
      int eq = pair.indexOf('=');
      String key = eq == -1 ? pair : pair.substring(0, eq);
      if (decode(key).equals(name)) {
        String value = eq == -1 ? "" : decode(pair.substring(eq + 1));
        if (!value.isEmpty()) {
          return Optional.of(value);
        }
      }
    }
    return Optional.empty();
  }

  private static String decode(String value) {
    return URLDecoder.decode(value, StandardCharsets.UTF_8);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
