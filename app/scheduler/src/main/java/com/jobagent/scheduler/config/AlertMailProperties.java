/*
 * Where: Scheduler configuration binding
 * What: Holds mail relay endpoint, credentials, default recipients and retry policy
 * Why: Relay access comes from process configuration, never from job data
 */
package com.jobagent.scheduler.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent.alert.mail")
public record AlertMailProperties(
    boolean enabled,
    String host,
    int port,
    boolean starttls,
    String sender,
    String recipients,
    String password,
    Duration timeout,
    int maxAttempts,
    Duration backoffBase,
    Duration backoffMax,
    double backoffJitterMin,
    double backoffJitterMax,
    String detailsUrlTemplate) {

  public boolean hasCredentials() {
    return isPresent(sender) && isPresent(recipients) && isPresent(password);
  }

  private static boolean isPresent(String value) {
    return value != null && !value.isBlank();
  }
}
