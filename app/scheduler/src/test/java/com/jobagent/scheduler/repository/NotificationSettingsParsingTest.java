package com.jobagent.scheduler.repository;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class NotificationSettingsParsingTest {

  @ParameterizedTest
  @CsvSource(
      value = {"300, 300", "' 60 ', 60", "abc, 0", "-5, 0", "NULL, 0", "'', 0"},
      nullValues = "NULL")
  void minIntervalParsesLeniently(String raw, int expected) {
    assertThat(NotificationSettingsRepository.parseMinInterval("42", raw)).isEqualTo(expected);
  }
}
