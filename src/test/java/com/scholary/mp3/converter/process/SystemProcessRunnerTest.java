package com.scholary.mp3.converter.process;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisabledOnOs(OS.WINDOWS)
class SystemProcessRunnerTest {

  private final SystemProcessRunner runner = new SystemProcessRunner();

  @TempDir Path workDir;

  @AfterEach
  void tearDown() {
    runner.shutdown();
  }

  @Test
  void run_shouldCaptureOutputAndExitCode() throws Exception {
    ProcessResult result =
        runner.run(
            List.of("sh", "-c", "echo out; echo err >&2; exit 3"), workDir, Duration.ofSeconds(10));

    assertThat(result.exitCode()).isEqualTo(3);
    assertThat(result.stdout().strip()).isEqualTo("out");
    assertThat(result.stderr().strip()).isEqualTo("err");
    assertThat(result.timedOut()).isFalse();
    assertThat(result.succeeded()).isFalse();
    assertThat(result.diagnostics().strip()).isEqualTo("err");
  }

  @Test
  void run_shouldUseWorkingDirectory() throws Exception {
    ProcessResult result = runner.run(List.of("pwd"), workDir, Duration.ofSeconds(10));

    assertThat(result.succeeded()).isTrue();
    assertThat(Path.of(result.stdout().strip()).toRealPath()).isEqualTo(workDir.toRealPath());
  }

  @Test
  void run_shouldKillProcessOnTimeout() throws Exception {
    long start = System.nanoTime();

    ProcessResult result =
        runner.run(List.of("sh", "-c", "exec sleep 30"), workDir, Duration.ofMillis(300));

    assertThat(result.timedOut()).isTrue();
    assertThat(result.exitCode()).isEqualTo(-1);
    assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(10));
  }

  @Test
  void run_shouldKillBackgroundedChildrenOnTimeout() throws Exception {
    Path marker = workDir.resolve("ytdlp_job.partial");
    long start = System.nanoTime();

    ProcessResult result =
        runner.run(
            List.of(
                "sh",
                "-c",
                "echo 'ERROR: stalled fragment' >&2; (sleep 2; echo late > '"
                    + marker
                    + "') & wait"),
            workDir,
            Duration.ofMillis(300));

    assertThat(result.timedOut()).isTrue();
    assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofMillis(1500));

    Thread.sleep(3000);
    assertThat(Files.exists(marker)).isFalse();
  }

  @Test
  void run_shouldKeepOnlyTailOfLargeOutput() throws Exception {
    ProcessResult result =
        runner.run(
            List.of("sh", "-c", "head -c 300000 /dev/zero | tr '\\0' 'a'; echo END"),
            workDir,
            Duration.ofSeconds(20));

    assertThat(result.succeeded()).isTrue();
    assertThat(result.stdout()).hasSize(SystemProcessRunner.MAX_CAPTURE_CHARS);
    assertThat(result.stdout().strip()).endsWith("END");
  }

  @Test
  void run_shouldThrowWhenBinaryIsMissing() {
    assertThatThrownBy(
            () ->
                runner.run(
                    List.of(workDir.resolve("no-such-tool").toString()),
                    workDir,
                    Duration.ofSeconds(5)))
        .isInstanceOf(IOException.class);
  }
}
