/*
 * Where: Scheduler service layer
 * What: Abstraction over the alert transport
 * Why: Swap the real relay for a logging sender or a test double
 */
package com.jobagent.scheduler.service;

import com.jobagent.scheduler.model.OutboundAlert;

public interface AlertSender {

  /** Throws {@link AlertDeliveryException} when the alert was not accepted. */
  void send(OutboundAlert alert);
}
