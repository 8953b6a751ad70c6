/*
 * Where: Scheduler service layer
 * What: Host name and registered backend pid of this agent
 * Why: Due jobs are filtered by host, and claims are stamped with the pid
 */
package com.jobagent.scheduler.service;

import com.google.common.annotations.VisibleForTesting;
import com.jobagent.scheduler.config.AgentProperties;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AgentIdentity {

  private static final Logger logger = LoggerFactory.getLogger(AgentIdentity.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final String hostName;
  private final Set<Integer> sessionPids = ConcurrentHashMap.newKeySet();
  private volatile int agentPid;

  public AgentIdentity(AgentProperties properties) {
    final String configured = properties.hostName();
    this.hostName =
        configured != null && !configured.isBlank() ? configured.trim() : resolveHostName();
  }

  public String hostName() {
    return hostName;
  }

  /** Zero until the primary session has been opened. */
  public int agentPid() {
    return agentPid;
  }

  public void assignAgentPid(int pid) {
    sessionPids.add(pid);
    this.agentPid = pid;
  }

  /**
   * Every backend pid this process has registered under. A worker started before a reconnect
   * still holds its claim under one of them.
   */
  public Set<Integer> sessionPids() {
    return Set.copyOf(sessionPids);
  }

  @VisibleForTesting
  static String resolveHostName() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
