/*
 * Where: Scheduler service layer
 * What: Writes report and unsent-alert files to the artifact directory and prunes old ones
 * Why: Files are the audit trail when mail delivery is down
 */
package com.jobagent.scheduler.service;

import com.google.common.annotations.VisibleForTesting;
import com.jobagent.scheduler.config.AlertArtifactProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AlertArtifactStore {

  public static final String REPORT_PREFIX = "job_failures_";
  public static final String REPORT_SUFFIX = ".log";
  public static final String UNSENT_PREFIX = "failed_email_";
  public static final String UNSENT_SUFFIX = ".html";

  private static final Logger logger = LoggerFactory.getLogger(AlertArtifactStore.class);
  private static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");
  private static final int MAX_NAME_ATTEMPTS = 100;

  private final AlertArtifactProperties properties;
  private final Clock clock;

  public Optional<Path> writeReport(String content) {
    return write(REPORT_PREFIX, REPORT_SUFFIX, content);
  }

  public Optional<Path> writeUnsentAlert(String subject, String bodyHtml) {
    return write(UNSENT_PREFIX, UNSENT_SUFFIX, "Subject: " + subject + "\n\n" + bodyHtml);
  }

  public int deleteOlderThan(Instant threshold) {
    final Path directory = properties.directory();
    if (directory == null || !Files.isDirectory(directory)) {
      return 0;
    }
    final List<Path> candidates;
    try (Stream<Path> files = Files.list(directory)) {
      candidates = files.filter(AlertArtifactStore::isArtifact).collect(Collectors.toList());
    } catch (IOException ex) {
      logger.warn("failed to list alert artifacts directory={}", directory, ex);
      return 0;
    }
    int deleted = 0;
    for (Path candidate : candidates) {
      try {
        if (Files.getLastModifiedTime(candidate).toInstant().isBefore(threshold)) {
          Files.deleteIfExists(candidate);
          deleted++;
        }
      } catch (IOException ex) {
        logger.warn("failed to delete alert artifact path={}", candidate, ex);
      }
    }
    return deleted;
  }

  @VisibleForTesting
  static boolean isArtifact(Path path) {
    final String name = path.getFileName().toString();
    return (name.startsWith(REPORT_PREFIX) && name.endsWith(REPORT_SUFFIX))
        || (name.startsWith(UNSENT_PREFIX) && name.endsWith(UNSENT_SUFFIX));
  }

  private Optional<Path> write(String prefix, String suffix, String content) {
    final Path directory = properties.directory();
    final String stamp = LocalDateTime.now(clock).format(FILE_TIMESTAMP);
    try {
      Files.createDirectories(directory);
      // same-second files get a counter instead of overwriting each other
      for (int attempt = 0; attempt < MAX_NAME_ATTEMPTS; attempt++) {
        final String name = prefix + stamp + (attempt == 0 ? "" : "-" + attempt) + suffix;
        final Path target = directory.resolve(name);
        try {
          Files.writeString(target, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
          return Optional.of(target);
        } catch (FileAlreadyExistsException ex) {
          logger.debug("alert artifact name taken path={}", target);
        }
      }
      logger.error("no free alert artifact name prefix={} stamp={}", prefix, stamp);
    } catch (IOException ex) {
      logger.error("failed to write alert artifact directory={} prefix={}", directory, prefix, ex);
    }
    return Optional.empty();
  }
}
