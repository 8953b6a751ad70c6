/*
 * Where: Scheduler lifecycle
 * What: Starts the control loop on its own thread and ties its end to the application context
 * Why: The loop blocks, so it cannot run on a Spring-managed scheduler thread
 */
package com.jobagent.scheduler.service;

import com.jobagent.scheduler.config.AgentProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SchedulerLoopRunner implements SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(SchedulerLoopRunner.class);
  private static final String THREAD_NAME = "scheduler-loop";
  private static final long JOIN_MILLIS = 10_000L;

  private final SchedulerLoop schedulerLoop;
  private final AgentProperties properties;
  private final ConfigurableApplicationContext applicationContext;

  private volatile Thread controlThread;
  private volatile boolean stopping;

  @Override
  public synchronized void start() {
    if (controlThread != null) {
      return;
    }
    if (!properties.enabled()) {
      logger.info("scheduler loop disabled (agent.enabled=false)");
      return;
    }
    stopping = false;
    final Thread thread = new Thread(this::runLoop, THREAD_NAME);
    thread.setDaemon(false);
    controlThread = thread;
    thread.start();
    logger.info("scheduler loop started");
  }

  @Override
  public synchronized void stop() {
    final Thread thread = controlThread;
    if (thread == null) {
      return;
    }
    stopping = true;
    schedulerLoop.requestStop();
    if (thread == Thread.currentThread()) {
      // the loop ended on its own and is closing the context
      controlThread = null;
      return;
    }
    thread.interrupt();
    try {
      thread.join(JOIN_MILLIS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    if (thread.isAlive()) {
      logger.warn("scheduler loop did not stop within {} ms", JOIN_MILLIS);
    }
    controlThread = null;
    logger.info("scheduler loop stopped");
  }

  private void runLoop() {
    schedulerLoop.run();
    if (!stopping) {
      logger.error("scheduler loop stopped on its own; closing the application");
      applicationContext.close();
    }
  }

  @Override
  public boolean isRunning() {
    final Thread thread = controlThread;
    return thread != null && thread.isAlive();
  }
}
