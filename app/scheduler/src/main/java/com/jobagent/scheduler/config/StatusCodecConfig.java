/*
 * Where: Scheduler configuration
 * What: Provides the status payload codec on top of the Boot-managed ObjectMapper
 * Why: Publisher and listener must agree on one JSON shape
 */
package com.jobagent.scheduler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobagent.common.event.JobStatusPayloadCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StatusCodecConfig {

  @Bean
  public JobStatusPayloadCodec jobStatusPayloadCodec(ObjectMapper objectMapper) {
    return new JobStatusPayloadCodec(objectMapper);
  }
}
