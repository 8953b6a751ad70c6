/*
 * Where: Scheduler artifact store tests
 * What: Verifies file naming, same-second collisions and retention
 * Why: Two batches in one second must not overwrite each other's audit file
 */
package com.jobagent.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.jobagent.scheduler.config.AlertArtifactProperties;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AlertArtifactStoreTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T09:30:00Z");

  @TempDir Path directory;

  private AlertArtifactStore store;

  @BeforeEach
  void setUp() {
    store =
        new AlertArtifactStore(
            new AlertArtifactProperties(directory.resolve("alerts"), true, 30, Duration.ofHours(6)),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void writesUnsentAlertWithSubjectHeader() throws Exception {
    final Optional<Path> written =
        store.writeUnsentAlert("ALERT: Job Failure Detected", "<html/>");

    assertThat(written).isPresent();
    assertThat(written.get().getFileName().toString())
        .isEqualTo("failed_email_2026-01-17_09-30-00.html");
    assertThat(Files.readString(written.get()))
        .isEqualTo("Subject: ALERT: Job Failure Detected\n\n<html/>");
  }

  @Test
  void sameSecondReportsGetDistinctNames() {
    final Path first = store.writeReport("one").orElseThrow();
    final Path second = store.writeReport("two").orElseThrow();

    assertThat(first.getFileName().toString()).isEqualTo("job_failures_2026-01-17_09-30-00.log");
    assertThat(second.getFileName().toString())
        .isEqualTo("job_failures_2026-01-17_09-30-00-1.log");
  }

  @Test
  void deletesOnlyOldArtifacts() throws Exception {
    final Path old = store.writeReport("old").orElseThrow();
    final Path recent = store.writeUnsentAlert("s", "b").orElseThrow();
    final Path unrelated = Files.writeString(old.resolveSibling("notes.txt"), "keep");
    final Instant threshold = FIXED_NOW.minus(Duration.ofDays(30));
    Files.setLastModifiedTime(old, FileTime.from(threshold.minusSeconds(1)));
    Files.setLastModifiedTime(unrelated, FileTime.from(threshold.minusSeconds(1)));
    Files.setLastModifiedTime(recent, FileTime.from(threshold.plusSeconds(1)));

    final int deleted = store.deleteOlderThan(threshold);

    assertThat(deleted).isEqualTo(1);
    assertThat(old).doesNotExist();
    assertThat(recent).exists();
    assertThat(unrelated).exists();
  }

  @Test
  void missingDirectoryHasNothingToDelete() {
    assertThat(store.deleteOlderThan(FIXED_NOW)).isZero();
  }
}
