package io.github.themoah.kfc.consumer;

import io.github.themoah.kfc.model.PartitionSet;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks which partitions reached their end and stops the run once enough did.
 *
 * <p>Each partition in scope moves at most once from active to at-EOF. The threshold is 1
 * when a single partition was requested, otherwise every partition of the topic must reach
 * its end. With exit-on-EOF disabled, end-of-partition events are only logged.
 */
public class EofTracker {

  private static final Logger log = LoggerFactory.getLogger(EofTracker.class);

  private final String topic;
  private final boolean exitOnEof;
  private final int threshold;
  private final RunState runState;
  private final Map<Integer, Boolean> atEof = new HashMap<>();
  private int eofCount;

  /**
   * @param scope partitions being consumed
   * @param singlePartition true when one partition was explicitly requested
   * @param exitOnEof whether reaching the end terminates the run
   * @param runState run flag to stop once the threshold is reached
   */
  public EofTracker(PartitionSet scope, boolean singlePartition, boolean exitOnEof, RunState runState) {
    this.topic = scope.topic();
    this.exitOnEof = exitOnEof;
    this.threshold = singlePartition ? 1 : scope.size();
    this.runState = runState;
    for (Integer partition : scope.partitions()) {
      atEof.put(partition, false);
    }
  }

  /**
   * Handles an end-of-partition signal.
   *
   * @return true if the partition transitioned to at-EOF on this call
   */
  public boolean onPartitionEnd(int partition, long offset) {
    if (!exitOnEof) {
      log.debug("Reached end of topic {} [{}] at offset {}", topic, partition, offset);
      return false;
    }
    Boolean reached = atEof.get(partition);
    if (reached == null) {
      log.warn("Ignoring end of topic {} [{}]: partition is not being consumed", topic, partition);
      return false;
    }
    if (reached) {
      return false;
    }

    atEof.put(partition, true);
    eofCount++;
    boolean exiting = eofCount >= threshold && runState.stop(RunState.StopReason.EOF_REACHED);
    log.debug("Reached end of topic {} [{}] at offset {}{}", topic, partition, offset,
      exiting ? ": exiting" : "");
    return true;
  }

  public boolean isAtEof(int partition) {
    return Boolean.TRUE.equals(atEof.get(partition));
  }

  public int eofCount() {
    return eofCount;
  }

  public int threshold() {
    return threshold;
  }

  public boolean thresholdReached() {
    return eofCount >= threshold;
  }
}
