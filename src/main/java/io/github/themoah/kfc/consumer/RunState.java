package io.github.themoah.kfc.consumer;

import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keep-running flag of a consume run. Flips to stopped exactly once and never back.
 * Written by the control thread and by the shutdown hook.
 */
public class RunState {

  private static final Logger log = LoggerFactory.getLogger(RunState.class);

  public enum StopReason {
    EOF_REACHED,
    MESSAGE_LIMIT,
    FATAL_ERROR,
    SHUTDOWN
  }

  private final AtomicReference<StopReason> stopReason = new AtomicReference<>();

  public boolean isRunning() {
    return stopReason.get() == null;
  }

  /**
   * Stops the run.
   *
   * @return true if this call stopped it, false if it was already stopped
   */
  public boolean stop(StopReason reason) {
    if (stopReason.compareAndSet(null, reason)) {
      log.debug("Stopping: {}", reason);
      return true;
    }
    return false;
  }

  /**
   * Returns why the run stopped, or null while running.
   */
  public StopReason stopReason() {
    return stopReason.get();
  }
}
