/*
 * Where: Scheduler control thread
 * What: Connects, prepares the agent session, then drains status events and dispatches due jobs
 * Why: One thread owns the primary session and the whole alert pipeline, so neither needs locks
 */
package com.jobagent.scheduler.service;

import com.google.common.annotations.VisibleForTesting;
import com.jobagent.scheduler.config.AgentProperties;
import com.jobagent.scheduler.db.IdleConnectionReleaser;
import com.jobagent.scheduler.db.PrimaryConnection;
import com.jobagent.scheduler.db.PrimaryConnectionFactory;
import com.jobagent.scheduler.model.AgentState;
import com.jobagent.scheduler.model.SchemaSanity;
import com.jobagent.scheduler.repository.AgentRepository;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Moves between {@link AgentState#CONNECTING} and {@link AgentState#RUNNING} until stopped.
 *
 * <p>Only consecutive failures to reach RUNNING count toward {@code agent.max-connection-attempts};
 * a session that was running and then lost its connection starts the count over.
 */
@Service
@RequiredArgsConstructor
public class SchedulerLoop {

  private static final Logger logger = LoggerFactory.getLogger(SchedulerLoop.class);

  private final AgentProperties properties;
  private final PrimaryConnectionFactory connectionFactory;
  private final AgentRepository agentRepository;
  private final AgentIdentity identity;
  private final ZombieReaper zombieReaper;
  private final JobStatusListener listener;
  private final JobStatusEventRouter router;
  private final FailureAlertPipeline alertPipeline;
  private final JobDispatcher dispatcher;
  private final IdleConnectionReleaser idleConnectionReleaser;
  private final Clock clock;

  private volatile AgentState state = AgentState.CONNECTING;
  private volatile boolean stopRequested;

  enum SessionOutcome {
    NOT_ESTABLISHED,
    LOST,
    HALTED,
    SHUTDOWN
  }

  public AgentState state() {
    return state;
  }

  public void requestStop() {
    stopRequested = true;
  }

  /** Blocks until stopped, halted or out of connection attempts. */
  public void run() {
    int attempt = 1;
    try {
      while (isActive()) {
        state = AgentState.CONNECTING;
        logger.debug("creating primary connection attempt={}", attempt);
        final SessionOutcome outcome = runSession();
        if (outcome == SessionOutcome.HALTED || outcome == SessionOutcome.SHUTDOWN) {
          return;
        }
        // mail needs no database, so a buffered batch still meets its time limit while reconnecting
        alertPipeline.checkPending(Instant.now(clock));
        if (outcome == SessionOutcome.LOST) {
          attempt = 1;
        } else {
          logger.warn("couldn't create the primary connection attempt={}", attempt);
          if (attempt >= properties.maxConnectionAttempts()) {
            logger.error(
                "stopping agent: couldn't establish the primary connection after {} attempts",
                attempt);
            return;
          }
          attempt++;
        }
        if (!pause(properties.reconnectInterval())) {
          return;
        }
      }
    } finally {
      state = AgentState.STOPPED;
      flushBeforeStop();
    }
  }

  @VisibleForTesting
  SessionOutcome runSession() {
    try (PrimaryConnection connection = connectionFactory.open()) {
      if (!startSession(connection)) {
        return SessionOutcome.HALTED;
      }
      state = AgentState.RUNNING;
      logger.info(
          "agent running pid={} host={} channel={}",
          identity.agentPid(),
          identity.hostName(),
          properties.statusChannel());
      try {
        while (isActive()) {
          runCycle(connection);
          if (!pause(properties.idleInterval())) {
            return SessionOutcome.SHUTDOWN;
          }
        }
        return SessionOutcome.SHUTDOWN;
      } catch (DataAccessException ex) {
        logger.warn("primary connection lost; reconnecting", ex);
        return SessionOutcome.LOST;
      } catch (RuntimeException ex) {
        logger.error("unexpected error in scheduler cycle; reconnecting", ex);
        return SessionOutcome.LOST;
      }
    } catch (SQLException | DataAccessException ex) {
      logger.warn("failed to establish agent session", ex);
      return SessionOutcome.NOT_ESTABLISHED;
    }
  }

  /** Returns false when the agent must halt. */
  @VisibleForTesting
  boolean startSession(PrimaryConnection connection) {
    logger.debug("database sanity check");
    final SchemaSanity sanity = agentRepository.checkSanity(connection);
    if (!sanity.jobTablePresent()) {
      logger.error("could not find the table 'pgagent.pga_job'; is the job schema installed?");
    }
    final int previousPid = identity.agentPid();
    identity.assignAgentPid(sanity.backendPid());
    if (!isSchemaVersionSupported(connection) && properties.haltOnSchemaMismatch()) {
      logger.error("stopping agent: unsupported job schema version");
      return false;
    }
    connection.listen(properties.statusChannel());
    logger.debug("listening for job status updates channel={}", properties.statusChannel());
    agentRepository.register(connection, identity.hostName());
    if (previousPid != 0 && previousPid != sanity.backendPid()) {
      // the old pid left pg_stat_activity with the lost session, but its jobs are still ours
      final int adopted = agentRepository.adoptSession(connection, previousPid);
      logger.info("adopted previous session pid={} claimedJobs={}", previousPid, adopted);
    }
    zombieReaper.reap(connection);
    return true;
  }

  @VisibleForTesting
  void runCycle(PrimaryConnection connection) {
    listener.poll(connection).forEach(router::route);
    alertPipeline.checkPending(Instant.now(clock));
    final List<String> dueJobs;
    try {
      dueJobs = dispatcher.pollDue();
    } catch (DataAccessException ex) {
      // pooled connection, not the primary session; retry on the next cycle
      logger.warn("failed to look up due jobs", ex);
      return;
    }
    for (String jobId : dueJobs) {
      dispatcher.dispatch(jobId);
    }
    if (dueJobs.isEmpty()) {
      idleConnectionReleaser.releaseIdle();
    }
  }

  /** Returns false when interrupted; the interrupt flag is restored. */
  @VisibleForTesting
  boolean pause(Duration duration) {
    try {
      Thread.sleep(duration.toMillis());
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private boolean isSchemaVersionSupported(PrimaryConnection connection) {
    if (!agentRepository.hasSchemaVersionFunction(connection)) {
      logger.error(
          "couldn't find the function 'pgagent.pgagent_schema_version'; update the job schema");
      return false;
    }
    final Optional<Integer> version = agentRepository.findSchemaVersion(connection);
    if (version.isEmpty() || version.get() != properties.schemaVersion()) {
      logger.error(
          "unsupported schema version: {}. Version {} is required; update the job schema",
          version.map(String::valueOf).orElse("none"),
          properties.schemaVersion());
      if (!properties.haltOnSchemaMismatch()) {
        logger.warn("continuing with an unsupported job schema");
      }
      return false;
    }
    return true;
  }

  private boolean isActive() {
    return !stopRequested && !Thread.currentThread().isInterrupted();
  }

  private void flushBeforeStop() {
    // file writes fail on an interrupted thread, so clear the flag while flushing
    final boolean interrupted = Thread.interrupted();
    try {
      alertPipeline.flushRemaining();
    } catch (RuntimeException ex) {
      logger.error("failed to flush buffered failures on stop", ex);
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
