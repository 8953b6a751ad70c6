/*
 * Where: Scheduler service layer
 * What: Drains pending status notifications from the primary session
 * Why: The drain is non-blocking so the control loop keeps its cadence
 */
package com.jobagent.scheduler.service;

import com.jobagent.scheduler.db.PrimaryConnection;
import com.jobagent.scheduler.model.JobStatusEvent;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JobStatusListener {

  private final JobStatusEventDecoder decoder;

  /**
   * Events received since the previous call, in delivery order. Malformed payloads are dropped.
   * Returns an empty stream once the channel is drained; call again on the next cycle.
   */
  public Stream<JobStatusEvent> poll(PrimaryConnection connection) {
    return connection.drainNotifications().stream()
        .map(decoder::decode)
        .flatMap(Optional::stream);
  }
}
