package com.scholary.mp3.converter.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Persona-level fixes applied once after a recognisable failure, before moving on.
 *
 * <p>Each constant pairs a predicate over the failed attempt's stderr and arguments with a
 * rewrite of those arguments. {@link #select} picks the first that applies.
 */
public enum CorrectiveRetry {

  /** The tool can't speak the proxy's scheme; try the proxy over plain http. */
  PROXY_PROTOCOL_DOWNGRADE {
    @Override
    boolean matches(String stderr, List<String> args) {
      String proxy = proxyValue(args);
      if (proxy == null || !proxy.toLowerCase(Locale.ROOT).startsWith("https://")) {
        return false;
      }
      String s = stderr.toLowerCase(Locale.ROOT);
      return s.contains("unsupported proxy")
          || (s.contains("proxy")
              && (s.contains("scheme") || s.contains("protocol"))
              && (s.contains("unsupported") || s.contains("not supported")));
    }

    @Override
    List<String> apply(List<String> args) {
      List<String> corrected = new ArrayList<>(args);
      int idx = corrected.indexOf(YtDlpCommandBuilder.PROXY_FLAG);
      corrected.set(idx + 1, "http://" + corrected.get(idx + 1).substring("https://".length()));
      return corrected;
    }
  },

  /** The proxy itself is unreachable; go direct. */
  PROXY_STRIP {
    @Override
    boolean matches(String stderr, List<String> args) {
      if (proxyValue(args) == null) {
        return false;
      }
      String s = stderr.toLowerCase(Locale.ROOT);
      return s.contains("proxyerror")
          || s.contains("unable to connect to proxy")
          || s.contains("cannot connect to proxy")
          || s.contains("tunnel connection failed")
          || s.contains("proxy authentication required");
    }

    @Override
    List<String> apply(List<String> args) {
      List<String> corrected = new ArrayList<>(args);
      int idx = corrected.indexOf(YtDlpCommandBuilder.PROXY_FLAG);
      corrected.remove(idx + 1);
      corrected.remove(idx);
      return corrected;
    }
  },

  /** The streaming container (HLS/DASH/MP4 fragments) didn't parse; use tolerant settings. */
  CONTAINER_TOLERANT {
    private static final String MARKER = "--hls-use-mpegts";

    @Override
    boolean matches(String stderr, List<String> args) {
      if (args.contains(MARKER)) {
        return false;
      }
      String s = stderr.toLowerCase(Locale.ROOT);
      return s.contains("moov atom not found")
          || s.contains("invalid data found when processing input")
          || (s.contains("unable to parse")
              && (s.contains("m3u8") || s.contains("mpd") || s.contains("manifest")))
          || (s.contains("fragment") && s.contains("malformed"));
    }

    @Override
    List<String> apply(List<String> args) {
      List<String> corrected = new ArrayList<>(args);
      int end = corrected.lastIndexOf(YtDlpCommandBuilder.END_OF_OPTIONS);
      int at = end == -1 ? Math.max(corrected.size() - 1, 0) : end;
      corrected.addAll(
          at, List.of(MARKER, "--fixup", "warn", "--concurrent-fragments", "1"));
      return corrected;
    }
  };

  abstract boolean matches(String stderr, List<String> args);

  abstract List<String> apply(List<String> args);

  /**
   * Pick the first corrective retry that applies to a failed attempt.
   *
   * @param stderr the attempt's stderr
   * @param args the arguments the attempt ran with
   * @return the correction, or empty if none applies
   */
  public static Optional<CorrectiveRetry> select(String stderr, List<String> args) {
    if (stderr == null || stderr.isEmpty()) {
      return Optional.empty();
    }
    for (CorrectiveRetry retry : values()) {
      if (retry.matches(stderr, args)) {
        return Optional.of(retry);
      }
    }
    return Optional.empty();
  }

  /** Apply this correction, returning new arguments. */
  public List<String> correct(List<String> args) {
    return List.copyOf(apply(args));
  }

  private static String proxyValue(List<String> args) {
    int idx = args.indexOf(YtDlpCommandBuilder.PROXY_FLAG);
    return idx == -1 || idx + 1 >= args.size() ? null : args.get(idx + 1);
  }
}
