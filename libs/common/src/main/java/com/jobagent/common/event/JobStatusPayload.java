/*
 * Where: Common event payload definitions
 * What: Wire shape of a job status update published on the status channel
 * Why: The worker that publishes and the listener that consumes share one shape
 */
package com.jobagent.common.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.format.DateTimeFormatter;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobStatusPayload(
    String jobId,
    String status,
    String description,
    String timestamp,
    String customText,
    Notification notification) {

  public static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Notification(Boolean browser, Boolean email) {}
}
