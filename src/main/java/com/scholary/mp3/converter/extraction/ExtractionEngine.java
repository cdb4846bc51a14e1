package com.scholary.mp3.converter.extraction;

import com.scholary.mp3.converter.classify.ClassifiedError;
import com.scholary.mp3.converter.classify.ErrorClassifier;
import com.scholary.mp3.converter.job.ConversionCancelledException;
import com.scholary.mp3.converter.job.ConversionJob;
import com.scholary.mp3.converter.logging.StructuredLogger;
import com.scholary.mp3.converter.process.ProcessResult;
import com.scholary.mp3.converter.process.ProcessRunner;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Downloads the media behind a reference by walking the persona chain.
 *
 * <p>The flow for one job:
 *
 * <ol>
 *   <li>Plan: optionally probe the duration, and move compact personas to the front for short
 *       content. Forced personas and short-form URLs skip the probe.
 *   <li>For each persona, run the tool once. A failure with a recognisable cause gets one
 *       corrective retry with rewritten arguments; any other failure moves to the next persona.
 *   <li>When every persona has failed, the last stderr is classified into a user-facing error.
 * </ol>
 *
 * <p>Scratch files are named {@code ytdlp_<jobId>.<ext>}. Anything with that prefix is removed
 * before each attempt and after each failure, so a half-written file from one persona is never
 * picked up as another persona's output.
 */
@Service
public class ExtractionEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionEngine.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  // Preference order when more than one artifact is present
  static final List<String> AUDIO_EXTENSIONS =
      List.of("mp3", "m4a", "webm", "opus", "ogg", "wav", "aac", "mp4", "mka");

  private final ExtractionProperties properties;
  private final PersonaCatalog catalog;
  private final YtDlpCommandBuilder commandBuilder;
  private final ExtractionProbe probe;
  private final ProcessRunner processRunner;
  private final ErrorClassifier classifier;

  public ExtractionEngine(
      ExtractionProperties properties,
      PersonaCatalog catalog,
      YtDlpCommandBuilder commandBuilder,
      ExtractionProbe probe,
      ProcessRunner processRunner,
      ErrorClassifier classifier) {
    this.properties = properties;
    this.catalog = catalog;
    this.commandBuilder = commandBuilder;
    this.probe = probe;
    this.processRunner = processRunner;
    this.classifier = classifier;
  }

  /**
   * Extract the media for a job into a scratch directory.
   *
   * @param job the job
   * @param scratchDir directory the artifact is written to
   * @return the artifact and the attempts that led to it
   * @throws ExtractionException when every persona failed, carrying the classified error
   * @throws ConversionCancelledException when the thread is interrupted mid-attempt
   */
  public ExtractionResult extract(ConversionJob job, Path scratchDir) {
    List<Persona> plan = plan(job);
    String prefix = job.extractionPrefix();
    Path template = scratchDir.resolve(prefix + "%(ext)s");
    List<ExtractionAttempt> attempts = new ArrayList<>();

    LOGGER.info(
        "Extracting {} with personas {}",
        job.normalizedReference(),
        plan.stream().map(Persona::name).toList());

    try {
      for (Persona persona : plan) {
        List<String> args =
            commandBuilder.buildDownload(persona, job.normalizedReference(), job.host(), template);
        CorrectiveRetry applied = null;

        while (true) {
          AttemptResult result =
              attempt(scratchDir, prefix, persona, args, applied, attempts.size() + 1);

          if (result instanceof AttemptResult.Success success) {
            attempts.add(success.attempt());
            LOGGER.info(
                "Extracted {} with persona {} after {} attempt(s)",
                success.file().getFileName(),
                persona.name(),
                attempts.size());
            return new ExtractionResult(success.file(), persona, attempts);
          }
          if (result instanceof AttemptResult.Retry retry) {
            attempts.add(retry.failed());
            STRUCTURED_LOGGER.logCorrectiveRetry(persona.name(), retry.correction().name());
            args = retry.correctedArgs();
            applied = retry.correction();
            continue;
          }
          attempts.add(((AttemptResult.NextPersona) result).failed());
          break;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cleanupPartials(scratchDir, prefix);
      LOGGER.warn("Extraction of {} interrupted after {} attempt(s)", prefix, attempts.size());
      throw new ConversionCancelledException("Interrupted while extracting", e);
    }

    String lastStderr =
        attempts.isEmpty() ? null : attempts.get(attempts.size() - 1).capturedStderr();
    ClassifiedError error = classifier.classify(lastStderr);
    LOGGER.error(
        "All {} persona(s) exhausted after {} attempt(s): {}", plan.size(), attempts.size(), error);
    throw new ExtractionException(error, attempts);
  }

  /**
   * The persona the streaming fast path should use for a job.
   *
   * <p>Same planning as {@link #extract}; the probe memo keeps the second call cheap.
   */
  public Persona primaryPersona(ConversionJob job) {
    return catalog.primary(preferCompact(job));
  }

  List<Persona> plan(ConversionJob job) {
    return catalog.ordered(preferCompact(job));
  }

  private boolean preferCompact(ConversionJob job) {
    if (properties.hasForcedPersona()) {
      return false;
    }
    if (job.shortForm()) {
      return true;
    }
    if (!properties.probeEnabled()) {
      return false;
    }
    Optional<ProbeResult> probed = probe.probe(job.normalizedReference(), job.host());
    probed.ifPresent(p -> LOGGER.debug("Probed '{}': {}s", p.title(), p.durationSeconds()));
    return probed.map(p -> p.isShorterThan(properties.shortContentSeconds())).orElse(false);
  }

  private AttemptResult attempt(
      Path scratchDir,
      String prefix,
      Persona persona,
      List<String> args,
      CorrectiveRetry applied,
      int number)
      throws InterruptedException {
    STRUCTURED_LOGGER.logPersonaAttempt(
        persona.name(), number, applied == null ? null : applied.name());
    cleanupPartials(scratchDir, prefix);

    Instant startedAt = Instant.now();
    ProcessResult result;
    try {
      result = processRunner.run(args, scratchDir, properties.timeout());
    } catch (IOException e) {
      result =
          new ProcessResult(
              -1, "", "Failed to start extraction tool: " + e.getMessage(), false);
    }

    ExtractionAttempt.Outcome outcome;
    String stderr;
    if (result.succeeded()) {
      Optional<Path> artifact = findArtifact(scratchDir, prefix);
      if (artifact.isPresent()) {
        return new AttemptResult.Success(
            artifact.get(),
            new ExtractionAttempt(
                persona.name(), startedAt, ExtractionAttempt.Outcome.SUCCEEDED, "", 0, applied));
      }
      outcome = ExtractionAttempt.Outcome.NO_ARTIFACT;
      stderr = "Extraction tool exited cleanly but produced no audio file";
    } else {
      outcome =
          result.timedOut()
              ? ExtractionAttempt.Outcome.TIMED_OUT
              : ExtractionAttempt.Outcome.FAILED;
      stderr = result.diagnostics() == null ? "" : result.diagnostics();
    }

    ExtractionAttempt failed =
        new ExtractionAttempt(
            persona.name(), startedAt, outcome, stderr, result.exitCode(), applied);
    STRUCTURED_LOGGER.logPersonaFailed(persona.name(), number, result.exitCode(), lastLine(stderr));
    cleanupPartials(scratchDir, prefix);

    if (applied == null && outcome == ExtractionAttempt.Outcome.FAILED) {
      Optional<CorrectiveRetry> correction = CorrectiveRetry.select(stderr, args);
      if (correction.isPresent()) {
        return new AttemptResult.Retry(
            correction.get().correct(args), correction.get(), failed);
      }
    }
    return new AttemptResult.NextPersona(failed);
  }

  /**
   * Find the artifact an attempt wrote.
   *
   * @return the preferred audio file with the job prefix, if any
   */
  Optional<Path> findArtifact(Path scratchDir, String prefix) {
    try (Stream<Path> files = Files.list(scratchDir)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().startsWith(prefix))
          .filter(p -> AUDIO_EXTENSIONS.contains(extensionOf(p)))
          .min(Comparator.comparingInt(p -> AUDIO_EXTENSIONS.indexOf(extensionOf(p))));
    } catch (IOException e) {
      LOGGER.warn("Could not list scratch directory {}: {}", scratchDir, e.getMessage());
      return Optional.empty();
    }
  }

  /** Delete every file with the job prefix. */
  void cleanupPartials(Path scratchDir, String prefix) {
    if (!Files.isDirectory(scratchDir)) {
      return;
    }
    try (Stream<Path> files = Files.list(scratchDir)) {
      files
          .filter(p -> p.getFileName().toString().startsWith(prefix))
          .forEach(
              p -> {
                try {
                  Files.deleteIfExists(p);
                  LOGGER.debug("Removed partial artifact {}", p.getFileName());
                } catch (IOException e) {
                  LOGGER.warn("Could not remove partial artifact {}: {}", p, e.getMessage());
                }
              });
    } catch (IOException e) {
      LOGGER.warn("Could not list scratch directory {}: {}", scratchDir, e.getMessage());
    }
  }

  private static String extensionOf(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot == -1 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  private static String lastLine(String text) {
    String trimmed = text.strip();
    int nl = trimmed.lastIndexOf('\n');
    return nl == -1 ? trimmed : trimmed.substring(nl + 1);
  }
}
