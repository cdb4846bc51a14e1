package com.scholary.mp3.converter.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.mp3.converter.process.ProcessResult;
import com.scholary.mp3.converter.process.ProcessRunner;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ExtractionProbeTest {

  private static final String URL = "https://www.youtube.com/watch?v=abc12345678";

  @Mock private ProcessRunner processRunner;

  private ExtractionProbe probe;

  @BeforeEach
  void setUp() {
    ExtractionProperties properties =
        ExtractionTestSupport.properties(
            ExtractionTestSupport.ALL_PERSONAS, null, null, List.of(), true);
    probe =
        new ExtractionProbe(
            properties, new YtDlpCommandBuilder(properties), processRunner, new ObjectMapper());
  }

  @Test
  void parse_shouldReadDurationAndTitle() {
    assertThat(probe.parse("{\"duration\": 212.5, \"title\": \"Song\", \"id\": \"x\"}"))
        .contains(new ProbeResult(212.5, "Song"));
  }

  @Test
  void parse_shouldReportMissingDuration() {
    ProbeResult result = probe.parse("{\"title\": \"Live now\"}").orElseThrow();

    assertThat(result.hasDuration()).isFalse();
    assertThat(result.isShorterThan(600)).isFalse();
  }

  @Test
  void parse_shouldRejectNonJsonAndNonObjects() {
    assertThat(probe.parse("ERROR: not json")).isEmpty();
    assertThat(probe.parse("[1, 2]")).isEmpty();
    assertThat(probe.parse("  ")).isEmpty();
    assertThat(probe.parse(null)).isEmpty();
  }

  @Test
  void probe_shouldMemoiseSuccessfulResults() throws Exception {
    when(processRunner.run(anyList(), any(), any()))
        .thenReturn(new ProcessResult(0, "{\"duration\": 30}", "", false));

    assertThat(probe.probe(URL, "www.youtube.com")).isPresent();
    assertThat(probe.probe(URL, "www.youtube.com")).isPresent();

    verify(processRunner, times(1)).run(anyList(), any(), any());
    assertThat(probe.getStats()).startsWith("ProbeMemo[size=1");
  }

  @Test
  void probe_shouldNotMemoiseFailures() throws Exception {
    when(processRunner.run(anyList(), any(), any()))
        .thenReturn(new ProcessResult(1, "", "ERROR: Video unavailable", false))
        .thenReturn(new ProcessResult(0, "{\"duration\": 30}", "", false));

    assertThat(probe.probe(URL, "www.youtube.com")).isEmpty();
    assertThat(probe.probe(URL, "www.youtube.com")).contains(new ProbeResult(30, null));
  }

  @Test
  void probe_shouldReturnEmptyWhenToolCannotStart() throws Exception {
    when(processRunner.run(anyList(), any(), any())).thenThrow(new IOException("not found"));

    assertThat(probe.probe(URL, "www.youtube.com")).isEmpty();
  }
}
