/*
 * Where: Scheduler service layer
 * What: Alert sender that only logs
 * Why: Run the agent without a mail relay
 */
package com.jobagent.scheduler.service;

import com.jobagent.scheduler.model.OutboundAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "agent.alert.mail.enabled", havingValue = "false")
public class LocalAlertSender implements AlertSender {

  private static final Logger logger = LoggerFactory.getLogger(LocalAlertSender.class);

  @Override
  public void send(OutboundAlert alert) {
    logger.info(
        "alert simulated send subject={} recipients={} artifact={}",
        alert.subject(),
        alert.recipients(),
        alert.artifactPath());
  }
}
