/*
 * Where: Common configuration
 * What: Exposes Clock as an injectable bean
 * Why: Every component reads time from the same source so tests can fix it
 */
package com.jobagent.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  // host zone: status timestamps and alert reports are local wall-clock times
  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }
}
