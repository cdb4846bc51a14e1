package com.scholary.mp3.converter.process;

/**
 * Outcome of a finished (or killed) subprocess.
 *
 * @param exitCode the exit code, or -1 if the process was killed on timeout
 * @param stdout captured standard output (tail, bounded)
 * @param stderr captured standard error (tail, bounded)
 * @param timedOut whether the process was killed because it exceeded its timeout
 */
public record ProcessResult(int exitCode, String stdout, String stderr, boolean timedOut) {

  public boolean succeeded() {
    return exitCode == 0 && !timedOut;
  }

  /** Best diagnostic text: stderr if there is any, stdout otherwise. */
  public String diagnostics() {
    return stderr == null || stderr.isBlank() ? stdout : stderr;
  }
}
