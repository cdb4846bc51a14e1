package com.scholary.mp3.converter.pipe;

import com.scholary.mp3.converter.extraction.Persona;
import com.scholary.mp3.converter.extraction.YtDlpCommandBuilder;
import com.scholary.mp3.converter.job.ConversionJob;
import com.scholary.mp3.converter.logging.StructuredLogger;
import com.scholary.mp3.converter.transcode.FfmpegTranscoder;
import jakarta.annotation.PreDestroy;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Streams the extraction tool's stdout straight into ffmpeg, so the MP3 is written while the
 * media is still downloading.
 *
 * <p>Two processes, four background tasks:
 *
 * <ul>
 *   <li>a pump copying extractor stdout to ffmpeg stdin
 *   <li>drainers for both stderr streams
 *   <li>a reader for ffmpeg's {@code -progress pipe:1} telemetry on its stdout
 * </ul>
 *
 * <p>Every byte seen by any of them touches the inactivity {@link Watchdog}. If the watchdog or
 * the total-duration timer fires, both processes (and their children) are killed and the session
 * ends with {@link PipeTimeoutException}. Whatever happens, nothing is left running when
 * {@link #run} returns.
 */
@Component
public class StreamingTranscodePipe {

  private static final Logger LOGGER = LoggerFactory.getLogger(StreamingTranscodePipe.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final int MAX_STDERR_CHARS = 16 * 1024;
  private static final int PUMP_BUFFER_BYTES = 64 * 1024;
  private static final long EXIT_GRACE_MS = 5000;
  private static final long DRAIN_GRACE_MS = 2000;

  private final PipeProperties properties;
  private final FfmpegTranscoder transcoder;
  private final YtDlpCommandBuilder commandBuilder;
  private final ScheduledExecutorService timers;
  private final ExecutorService streams;

  @Autowired
  public StreamingTranscodePipe(
      PipeProperties properties,
      FfmpegTranscoder transcoder,
      YtDlpCommandBuilder commandBuilder) {
    this(
        properties,
        transcoder,
        commandBuilder,
        Executors.newScheduledThreadPool(1, daemonThreads("pipe-watchdog-")),
        Executors.newCachedThreadPool(daemonThreads("pipe-stream-")));
  }

  StreamingTranscodePipe(
      PipeProperties properties,
      FfmpegTranscoder transcoder,
      YtDlpCommandBuilder commandBuilder,
      ScheduledExecutorService timers,
      ExecutorService streams) {
    this.properties = properties;
    this.transcoder = transcoder;
    this.commandBuilder = commandBuilder;
    this.timers = timers;
    this.streams = streams;
  }

  /**
   * Stream-convert a job's reference with one persona.
   *
   * @param job the job
   * @param persona persona for the extraction tool
   * @param output destination MP3
   * @return the output path
   * @throws PipeTimeoutException if a timer killed the session
   * @throws PipeException on any other failure
   */
  public Path streamConvert(ConversionJob job, Persona persona, Path output) {
    List<String> extract =
        commandBuilder.buildStream(persona, job.normalizedReference(), job.host());
    List<String> transcode = transcoder.buildCommand("pipe:0", output, job.quality(), true);
    LOGGER.info("Streaming {} with persona {}", job.normalizedReference(), persona.name());
    return run(extract, transcode, output);
  }

  /**
   * Run one pipe session.
   *
   * @param extractCommand producer; writes media to stdout
   * @param transcodeCommand consumer; reads stdin, writes {@code output}, progress on stdout
   * @param output file the consumer writes
   * @return the output path
   */
  public Path run(List<String> extractCommand, List<String> transcodeCommand, Path output) {
    long start = System.nanoTime();
    AtomicReference<String> killedBy = new AtomicReference<>();
    List<Future<?>> tasks = new ArrayList<>();
    Process extractor = null;
    Process encoder = null;
    Watchdog watchdog = null;
    ScheduledFuture<?> totalTimer = null;
    boolean succeeded = false;

    try {
      extractor = new ProcessBuilder(extractCommand).start();
      encoder = new ProcessBuilder(transcodeCommand).start();

      Process ex = extractor;
      Process enc = encoder;
      watchdog =
          Watchdog.start(
              timers,
              properties.inactivityTimeout(),
              () -> {
                killedBy.compareAndSet(null, "inactivity");
                kill(ex, enc);
              });
      totalTimer =
          timers.schedule(
              () -> {
                killedBy.compareAndSet(null, "total");
                kill(ex, enc);
              },
              properties.totalTimeout().toMillis(),
              TimeUnit.MILLISECONDS);

      Watchdog wd = watchdog;
      tasks.add(streams.submit(() -> pump(ex.getInputStream(), enc.getOutputStream(), wd)));
      Future<String> extractorStderr = streams.submit(() -> drain(ex.getErrorStream(), wd));
      Future<String> encoderStderr = streams.submit(() -> drain(enc.getErrorStream(), wd));
      tasks.add(extractorStderr);
      tasks.add(encoderStderr);
      tasks.add(streams.submit(() -> readProgress(enc.getInputStream(), wd)));

      int encoderExit = encoder.waitFor();
      boolean extractorDone = extractor.waitFor(EXIT_GRACE_MS, TimeUnit.MILLISECONDS);
      long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

      String reason = killedBy.get();
      if (reason != null) {
        STRUCTURED_LOGGER.logPipeTimeout(reason, elapsedMs);
        throw new PipeTimeoutException(reason, elapsedMs);
      }
      if (encoderExit != 0) {
        throw new PipeException(
            String.format(
                "Transcoder exited with code %d: %s", encoderExit, collect(encoderStderr)));
      }
      if (!extractorDone) {
        throw new PipeException("Extractor still running after transcoder finished");
      }
      if (extractor.exitValue() != 0) {
        throw new PipeException(
            String.format(
                "Extractor exited with code %d: %s",
                extractor.exitValue(),
                collect(extractorStderr)));
      }
      if (!transcoder.isPlausibleOutput(output)) {
        throw new PipeException("Transcoder produced no usable output: " + output.getFileName());
      }

      succeeded = true;
      LOGGER.info("Pipe finished in {}ms: {}", elapsedMs, output.getFileName());
      return output;
    } catch (IOException e) {
      throw new PipeException("Failed to start pipe: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PipeException("Pipe interrupted", e);
    } finally {
      if (watchdog != null) {
        watchdog.close();
      }
      if (totalTimer != null) {
        totalTimer.cancel(false);
      }
      kill(extractor, encoder);
      closeStreams(extractor);
      closeStreams(encoder);
      tasks.forEach(t -> t.cancel(true));
      if (!succeeded) {
        deletePartialOutput(output);
      }
    }
  }

  @PreDestroy
  public void shutdown() {
    timers.shutdownNow();
    streams.shutdownNow();
  }

  private void pump(InputStream from, OutputStream to, Watchdog watchdog) {
    byte[] buffer = new byte[PUMP_BUFFER_BYTES];
    long total = 0;
    try (InputStream in = from;
        OutputStream out = to) {
      int n;
      while ((n = in.read(buffer)) != -1) {
        watchdog.touch();
        out.write(buffer, 0, n);
        total += n;
      }
    } catch (IOException e) {
      // Broken pipe when the transcoder exits early, or a stream closed by the kill
      LOGGER.debug("Pump stopped after {} bytes: {}", total, e.getMessage());
      return;
    }
    LOGGER.debug("Pump finished: {} bytes", total);
  }

  private String drain(InputStream stream, Watchdog watchdog) {
    StringBuilder tail = new StringBuilder();
    char[] buffer = new char[4096];
    try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
      int n;
      while ((n = reader.read(buffer)) != -1) {
        watchdog.touch();
        tail.append(buffer, 0, n);
        if (tail.length() > MAX_STDERR_CHARS * 2) {
          tail.delete(0, tail.length() - MAX_STDERR_CHARS);
        }
      }
    } catch (IOException e) {
      LOGGER.debug("stderr closed while draining: {}", e.getMessage());
    }
    if (tail.length() > MAX_STDERR_CHARS) {
      tail.delete(0, tail.length() - MAX_STDERR_CHARS);
    }
    return tail.toString();
  }

  private void readProgress(InputStream stream, Watchdog watchdog) {
    FfmpegProgressParser parser = new FfmpegProgressParser();
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        watchdog.touch();
        parser
            .accept(line)
            .ifPresent(p -> STRUCTURED_LOGGER.logPipeProgress(p.outTimeMs(), p.speed()));
      }
    } catch (IOException e) {
      LOGGER.debug("Progress channel closed: {}", e.getMessage());
    }
  }

  private static String collect(Future<String> output) throws InterruptedException {
    try {
      return output.get(DRAIN_GRACE_MS, TimeUnit.MILLISECONDS).strip();
    } catch (ExecutionException | TimeoutException e) {
      LOGGER.debug("Could not collect stderr: {}", e.toString());
      return "";
    }
  }

  private static void kill(Process... processes) {
    for (Process process : processes) {
      if (process != null && process.isAlive()) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
      }
    }
  }

  private static void closeStreams(Process process) {
    if (process == null) {
      return;
    }
    closeQuietly(process.getOutputStream());
    closeQuietly(process.getInputStream());
    closeQuietly(process.getErrorStream());
  }

  private static void closeQuietly(AutoCloseable closeable) {
    try {
      closeable.close();
    } catch (Exception e) {
      LOGGER.debug("Failed to close process stream: {}", e.getMessage());
    }
  }

  private static void deletePartialOutput(Path output) {
    try {
      Files.deleteIfExists(output);
    } catch (IOException e) {
      LOGGER.warn("Could not delete partial output {}: {}", output, e.getMessage());
    }
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
