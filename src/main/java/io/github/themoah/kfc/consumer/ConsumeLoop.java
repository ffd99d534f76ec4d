package io.github.themoah.kfc.consumer;

import io.github.themoah.kfc.error.StreamException;
import io.github.themoah.kfc.kafka.PartitionQueue;
import io.github.themoah.kfc.model.ConsumedRecord;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains the shared queue until the run is stopped.
 *
 * <p>Run state is checked before each poll and before each drained item; items drained
 * after the run stopped are dropped. Shutdown latency is bounded by the poll timeout.
 */
public class ConsumeLoop {

  private static final Logger log = LoggerFactory.getLogger(ConsumeLoop.class);

  private final String topic;
  private final PartitionQueue queue;
  private final EofTracker eofTracker;
  private final MessageFormatter formatter;
  private final ConsumeStats stats;
  private final RunState runState;
  private final long messageLimit;
  private final Duration pollTimeout;

  /**
   * @param messageLimit stop after this many emitted records, 0 for no limit
   */
  public ConsumeLoop(String topic, PartitionQueue queue, EofTracker eofTracker, MessageFormatter formatter,
      ConsumeStats stats, RunState runState, long messageLimit, Duration pollTimeout) {
    this.topic = topic;
    this.queue = Objects.requireNonNull(queue, "queue cannot be null");
    this.eofTracker = Objects.requireNonNull(eofTracker, "eofTracker cannot be null");
    this.formatter = Objects.requireNonNull(formatter, "formatter cannot be null");
    this.stats = Objects.requireNonNull(stats, "stats cannot be null");
    this.runState = Objects.requireNonNull(runState, "runState cannot be null");
    this.messageLimit = messageLimit;
    this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout cannot be null");
  }

  /**
   * @throws StreamException on the first non-EOF error drained from the queue
   * @throws io.github.themoah.kfc.error.OutputException if a record cannot be written
   */
  public void run() {
    while (runState.isRunning()) {
      List<ConsumedRecord> items = queue.dequeue(pollTimeout);
      for (ConsumedRecord item : items) {
        if (!runState.isRunning()) {
          log.trace("Dropping {} drained after stop", item);
          break;
        }
        dispatch(item);
      }
    }
    log.debug("Consume loop finished: {} after {} messages", runState.stopReason(), stats.rx());
  }

  private void dispatch(ConsumedRecord item) {
    if (item instanceof ConsumedRecord.Data data) {
      formatter.format(data);
      queue.markDelivered(topic, data.partition(), data.offset());
      long rx = stats.recordEmitted();
      if (messageLimit > 0 && rx == messageLimit) {
        runState.stop(RunState.StopReason.MESSAGE_LIMIT);
      }
    } else if (item instanceof ConsumedRecord.PartitionEnd end) {
      eofTracker.onPartitionEnd(end.partition(), end.offset());
    } else if (item instanceof ConsumedRecord.Error error) {
      runState.stop(RunState.StopReason.FATAL_ERROR);
      throw new StreamException(topic, error.partition(),
        "Topic " + topic + " [" + error.partition() + "] error: " + error.detail());
    }
  }
}
