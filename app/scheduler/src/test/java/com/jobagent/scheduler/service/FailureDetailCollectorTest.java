/*
 * Where: Scheduler detail collection tests
 * What: Verifies each diagnostic section and the behavior with missing sources
 * Why: Collection is best effort and must never fail the failure path
 */
package com.jobagent.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.jobagent.scheduler.config.AlertDetailProperties;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FailureDetailCollectorTest {

  @TempDir Path root;

  @Test
  void collectsHostJobAndApplicationLogSections() throws Exception {
    final Path meminfo =
        Files.writeString(
            root.resolve("meminfo"),
            "MemTotal:  16 kB\nMemFree:  8 kB\nMemAvailable:  10 kB\nBuffers:  1 kB\n");
    final Path loadavg = Files.writeString(root.resolve("loadavg"), "0.50 0.40 0.30 1/100 42\n");
    final Path jobLogs = Files.createDirectories(root.resolve("jobs"));
    Files.writeString(jobLogs.resolve("42.log"), "step 1 failed: relation missing\n");
    final Path appLog =
        Files.write(
            root.resolve("application.log"),
            List.of("job 42 starting", "job 7 starting", "old line", "job 42 failed"));
    final FailureDetailCollector collector =
        new FailureDetailCollector(
            new AlertDetailProperties(jobLogs, appLog, 50, 1024, meminfo, loadavg));

    final String details = collector.collect("42");

    assertThat(details)
        .contains("System Information:")
        .contains("MemTotal:  16 kB")
        .contains("MemAvailable:  10 kB")
        .doesNotContain("Buffers")
        .contains("Load Average: 0.50 0.40 0.30 1/100 42")
        .contains("JVM Heap:")
        .contains("Job Specific Logs:")
        .contains("step 1 failed: relation missing")
        .contains("Recent Application Logs:")
        .contains("job 42 starting")
        .contains("job 42 failed")
        .doesNotContain("job 7 starting");
  }

  @Test
  void applicationLogIsTailedBeforeFiltering() throws Exception {
    final Path appLog =
        Files.write(
            root.resolve("application.log"), List.of("job 42 early", "x", "y", "job 42 late"));
    final FailureDetailCollector collector =
        new FailureDetailCollector(new AlertDetailProperties(root, appLog, 2, 1024, null, null));

    final String details = collector.collect("42");

    assertThat(details).contains("job 42 late").doesNotContain("job 42 early");
  }

  @Test
  void missingSourcesAreNotedInline() {
    final FailureDetailCollector collector =
        new FailureDetailCollector(
            new AlertDetailProperties(
                root.resolve("none"),
                root.resolve("missing.log"),
                50,
                1024,
                root.resolve("no-meminfo"),
                root.resolve("no-loadavg")));

    final String details = collector.collect("42");

    assertThat(details)
        .contains("No job-specific log file found at")
        .contains("No application log found at")
        .contains("JVM Heap:");
  }

  @Test
  void jobLogIsBounded() throws Exception {
    Files.writeString(root.resolve("9.log"), "a".repeat(100));
    final FailureDetailCollector collector =
        new FailureDetailCollector(new AlertDetailProperties(root, null, 50, 10, null, null));

    final String details = collector.collect("9");

    assertThat(details).contains("a".repeat(10) + "\n[truncated after 10 bytes]");
    assertThat(details).doesNotContain("a".repeat(11));
  }

  @Test
  void pathLikeJobIdIsRejected() {
    final FailureDetailCollector collector =
        new FailureDetailCollector(new AlertDetailProperties(root, null, 50, 10, null, null));

    assertThat(collector.collect("../etc/passwd")).contains("Job id rejected for log lookup");
  }
}
