/*
 * Where: Scheduler service layer
 * What: Gathers host, job log and application log context for a failing job
 * Why: The alert report should explain a failure without a login to the host
 */
package com.jobagent.scheduler.service;

import com.jobagent.scheduler.config.AlertDetailProperties;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class FailureDetailCollector {

  private static final Logger logger = LoggerFactory.getLogger(FailureDetailCollector.class);
  private static final Pattern SAFE_JOB_ID = Pattern.compile("[A-Za-z0-9_-]+");
  private static final List<String> MEMINFO_KEYS = List.of("MemTotal", "MemFree", "MemAvailable");
  private static final long MEBIBYTE = 1024L * 1024L;

  private final AlertDetailProperties properties;

  /** Never throws; unreadable sources are noted in the returned text. */
  public String collect(String jobId) {
    final StringBuilder details = new StringBuilder();
    details.append("System Information:\n").append(systemSnapshot());
    details.append("\nJob Specific Logs:\n").append(jobLog(jobId));
    details.append("\nRecent Application Logs:\n").append(applicationLogTail(jobId));
    return details.toString();
  }

  public String systemSnapshot() {
    final StringBuilder snapshot = new StringBuilder();
    try {
      appendMeminfo(snapshot);
      appendLoadAverage(snapshot);
    } catch (RuntimeException ex) {
      logger.debug("host metrics unavailable", ex);
      snapshot.append("Host metrics unavailable: ").append(ex.getMessage()).append('\n');
    }
    final Runtime runtime = Runtime.getRuntime();
    snapshot
        .append("JVM Heap: used=")
        .append((runtime.totalMemory() - runtime.freeMemory()) / MEBIBYTE)
        .append("MiB max=")
        .append(runtime.maxMemory() / MEBIBYTE)
        .append("MiB\n");
    return snapshot.toString();
  }

  private void appendMeminfo(StringBuilder snapshot) {
    final Path meminfo = properties.meminfo();
    if (meminfo == null || !Files.isReadable(meminfo)) {
      return;
    }
    for (String line : readLines(meminfo)) {
      if (MEMINFO_KEYS.stream().anyMatch(line::startsWith)) {
        snapshot.append(line).append('\n');
      }
    }
  }

  private void appendLoadAverage(StringBuilder snapshot) {
    final Path loadavg = properties.loadavg();
    if (loadavg == null || !Files.isReadable(loadavg)) {
      return;
    }
    final List<String> lines = readLines(loadavg);
    if (!lines.isEmpty()) {
      snapshot.append("Load Average: ").append(lines.get(0)).append('\n');
    }
  }

  private String jobLog(String jobId) {
    if (jobId == null || !SAFE_JOB_ID.matcher(jobId).matches()) {
      return "Job id rejected for log lookup: " + jobId + "\n";
    }
    final Path directory = properties.jobLogDirectory();
    if (directory == null) {
      return "No job log directory configured\n";
    }
    final Path jobLogPath = directory.resolve(jobId + ".log");
    if (!Files.isReadable(jobLogPath)) {
      return "No job-specific log file found at " + jobLogPath + "\n";
    }
    final int maxBytes = Math.max(properties.maxJobLogBytes(), 0);
    try (InputStream in = Files.newInputStream(jobLogPath)) {
      final byte[] head = in.readNBytes(maxBytes);
      final boolean truncated = in.read() != -1;
      final StringBuilder section =
          new StringBuilder("Contents of ").append(jobLogPath).append(":\n");
      section.append(new String(head, StandardCharsets.UTF_8));
      if (truncated) {
        section.append("\n[truncated after ").append(maxBytes).append(" bytes]");
      }
      return section.append('\n').toString();
    } catch (IOException ex) {
      logger.warn("failed to read job log jobId={} path={}", jobId, jobLogPath, ex);
      return "Failed to read " + jobLogPath + ": " + ex.getMessage() + "\n";
    }
  }

  private String applicationLogTail(String jobId) {
    final Path applicationLog = properties.applicationLog();
    if (applicationLog == null || !Files.isReadable(applicationLog)) {
      return "No application log found at " + applicationLog + "\n";
    }
    final int tailLines = Math.max(properties.applicationLogTailLines(), 0);
    final Deque<String> tail = new ArrayDeque<>(tailLines + 1);
    try (BufferedReader reader = Files.newBufferedReader(applicationLog, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        tail.addLast(line);
        if (tail.size() > tailLines) {
          tail.removeFirst();
        }
      }
    } catch (IOException | UncheckedIOException ex) {
      logger.warn("failed to read application log path={}", applicationLog, ex);
      return "Failed to read " + applicationLog + ": " + ex.getMessage() + "\n";
    }
    final StringBuilder matches = new StringBuilder();
    for (String line : tail) {
      if (jobId != null && line.contains(jobId)) {
        matches.append(line).append('\n');
      }
    }
    if (matches.length() == 0) {
      return "No recent entries mention job " + jobId + "\n";
    }
    return matches.toString();
  }

  private static List<String> readLines(Path path) {
    try {
      return Files.readAllLines(path, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }
}
