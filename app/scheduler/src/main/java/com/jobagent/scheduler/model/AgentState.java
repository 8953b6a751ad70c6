/*
 * Where: Scheduler domain model
 * What: States of the control loop
 * Why: Reconnects return to CONNECTING; only exhausted attempts reach STOPPED
 */
package com.jobagent.scheduler.model;

public enum AgentState {
  CONNECTING,
  RUNNING,
  STOPPED
}
