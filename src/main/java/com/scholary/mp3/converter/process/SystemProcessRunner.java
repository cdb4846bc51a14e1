package com.scholary.mp3.converter.process;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}.
 *
 * <p>stdout and stderr are drained on background threads so a chatty tool can't block on a full
 * pipe buffer while we wait for it. Only the tail of each stream is kept.
 */
@Component
public class SystemProcessRunner implements ProcessRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(SystemProcessRunner.class);

  static final int MAX_CAPTURE_CHARS = 64 * 1024;
  private static final long DRAIN_GRACE_MS = 2000;

  private final ExecutorService drainers;

  public SystemProcessRunner() {
    AtomicInteger counter = new AtomicInteger();
    this.drainers =
        Executors.newCachedThreadPool(
            r -> {
              Thread t = new Thread(r, "process-drain-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  @Override
  public ProcessResult run(List<String> command, Path workDir, Duration timeout)
      throws IOException, InterruptedException {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    ProcessBuilder pb = new ProcessBuilder(command);
    if (workDir != null) {
      pb.directory(workDir.toFile());
    }
    Process process = pb.start();
    process.getOutputStream().close();

    CompletableFuture<String> stdout = drain(process.getInputStream());
    CompletableFuture<String> stderr = drain(process.getErrorStream());

    boolean finished;
    try {
      finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      kill(process);
      throw e;
    }

    if (!finished) {
      LOGGER.warn("Process exceeded {}s, killing: {}", timeout.toSeconds(), command.get(0));
      kill(process);
      process.waitFor(DRAIN_GRACE_MS, TimeUnit.MILLISECONDS);
      return new ProcessResult(-1, collect(stdout), collect(stderr), true);
    }

    return new ProcessResult(process.exitValue(), collect(stdout), collect(stderr), false);
  }

  @PreDestroy
  public void shutdown() {
    drainers.shutdownNow();
  }

  /** Children first: once the parent dies they are re-parented and no longer reachable. */
  private static void kill(Process process) {
    process.descendants().forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
  }

  private CompletableFuture<String> drain(InputStream stream) {
    return CompletableFuture.supplyAsync(
        () -> {
          StringBuilder tail = new StringBuilder();
          char[] buf = new char[8192];
          try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            int n;
            while ((n = reader.read(buf)) != -1) {
              tail.append(buf, 0, n);
              if (tail.length() > MAX_CAPTURE_CHARS * 2) {
                tail.delete(0, tail.length() - MAX_CAPTURE_CHARS);
              }
            }
          } catch (IOException e) {
            // Stream closed under us when the process was killed; keep what we have
            LOGGER.debug("Output stream closed while draining: {}", e.getMessage());
          }
          if (tail.length() > MAX_CAPTURE_CHARS) {
            tail.delete(0, tail.length() - MAX_CAPTURE_CHARS);
          }
          return tail.toString();
        },
        drainers);
  }

  private static String collect(CompletableFuture<String> output) throws InterruptedException {
    try {
      return output.get(DRAIN_GRACE_MS, TimeUnit.MILLISECONDS);
    } catch (ExecutionException | TimeoutException e) {
      LOGGER.debug("Could not collect process output: {}", e.toString());
      return "";
    }
  }
}
