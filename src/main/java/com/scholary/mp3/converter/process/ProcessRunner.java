package com.scholary.mp3.converter.process;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs external tools synchronously.
 *
 * <p>Abstracted so the extraction engine and transcoder can be tested without the real binaries.
 */
public interface ProcessRunner {

  /**
   * Run a command to completion, capturing its output.
   *
   * <p>A non-zero exit is not an error here; callers inspect {@link ProcessResult}. A process
   * that outlives the timeout is killed and reported with {@code timedOut=true}.
   *
   * @param command the command and its arguments
   * @param workDir working directory
   * @param timeout upper bound on the run
   * @return the result
   * @throws IOException if the process can't be started
   * @throws InterruptedException if interrupted while waiting (the process is killed)
   */
  ProcessResult run(List<String> command, Path workDir, Duration timeout)
      throws IOException, InterruptedException;
}
