/*
 * Where: Scheduler configuration binding
 * What: Holds control loop settings (connection retries, idle sleep, schema checks)
 * Why: Keep loop timing and startup policy tunable per environment
 */
package com.jobagent.scheduler.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "agent")
@Validated
public record AgentProperties(
    boolean enabled,
    @Positive int maxConnectionAttempts,
    @NotNull Duration idleInterval,
    @NotNull Duration reconnectInterval,
    @NotBlank @Pattern(regexp = "[a-z_][a-z0-9_]*") String statusChannel,
    @Positive int schemaVersion,
    boolean haltOnSchemaMismatch,
    String hostName) {

  @AssertTrue(message = "agent.idle-interval must be positive")
  public boolean isIdleIntervalPositive() {
    return isPositiveDuration(idleInterval);
  }

  @AssertTrue(message = "agent.reconnect-interval must be positive")
  public boolean isReconnectIntervalPositive() {
    return isPositiveDuration(reconnectInterval);
  }

  private boolean isPositiveDuration(Duration duration) {
    // null is reported by @NotNull
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
