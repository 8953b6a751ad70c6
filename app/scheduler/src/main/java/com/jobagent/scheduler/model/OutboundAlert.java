/*
 * Where: Scheduler domain model
 * What: A composed alert ready for the mail relay
 * Why: Recipients travel with the alert so an override never outlives one send
 */
package com.jobagent.scheduler.model;

import java.nio.file.Path;
import java.util.List;

public record OutboundAlert(
    String subject, String bodyHtml, Path artifactPath, List<String> recipients) {

  public OutboundAlert {
    recipients = recipients == null ? List.of() : List.copyOf(recipients);
  }

  public OutboundAlert withRecipients(List<String> resolved) {
    return new OutboundAlert(subject, bodyHtml, artifactPath, resolved);
  }
}
