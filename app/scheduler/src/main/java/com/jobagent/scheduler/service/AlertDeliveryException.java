/*
 * Where: Scheduler service layer
 * What: Signals that the relay did not accept an alert
 * Why: Lets the delivery service tell relay failures apart from programming errors
 */
package com.jobagent.scheduler.service;

public class AlertDeliveryException extends RuntimeException {

  public AlertDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
