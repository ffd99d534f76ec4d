package io.github.themoah.kfc.consumer;

import io.github.themoah.kfc.error.ConfigException;
import io.github.themoah.kfc.kafka.PartitionQueue;
import io.github.themoah.kfc.model.OffsetDirective;
import io.github.themoah.kfc.model.PartitionSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens the selected partitions of a topic into the shared queue and closes them again.
 */
public class ConsumptionOrchestrator implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ConsumptionOrchestrator.class);

  private final PartitionQueue queue;
  private final List<Integer> opened = new ArrayList<>();
  private String topic;
  private boolean stopped;

  public ConsumptionOrchestrator(PartitionQueue queue) {
    this.queue = Objects.requireNonNull(queue, "queue cannot be null");
  }

  /**
   * Opens one stream per selected partition, each starting at {@code offset}.
   *
   * @param partitions partitions of the topic
   * @param offset starting offset for every opened partition
   * @param requestedPartition single partition to open, or empty for all
   * @return the partitions actually opened, in open order
   * @throws ConfigException if the requested partition is not part of the topic
   * @throws io.github.themoah.kfc.error.StreamException if a partition cannot be opened;
   *     partitions opened before the failure stay open until {@link #stop()}
   */
  public PartitionSet start(PartitionSet partitions, OffsetDirective offset, OptionalInt requestedPartition) {
    if (stopped) {
      throw new IllegalStateException("Orchestrator already stopped");
    }
    topic = partitions.topic();

    if (requestedPartition.isPresent()) {
      int partition = requestedPartition.getAsInt();
      if (!partitions.contains(partition)) {
        throw new ConfigException("Topic " + topic + " (with partitions 0.." + (partitions.size() - 1)
          + "): partition " + partition + " does not exist");
      }
      queue.open(topic, partition, offset);
      opened.add(partition);
    } else {
      for (int partition : partitions.partitions()) {
        queue.open(topic, partition, offset);
        opened.add(partition);
      }
    }

    log.info("Consuming topic {} partitions {} from {}", topic, opened, describe(offset));
    return new PartitionSet(topic, opened);
  }

  /**
   * Closes every opened stream, then the shared queue. Safe to call more than once.
   */
  public void stop() {
    if (stopped) {
      return;
    }
    stopped = true;
    for (int partition : opened) {
      queue.close(topic, partition);
    }
    log.debug("Closed {} partition streams of topic {}", opened.size(), topic);
    opened.clear();
    queue.close();
  }

  @Override
  public void close() {
    stop();
  }

  public List<Integer> openedPartitions() {
    return List.copyOf(opened);
  }

  private static String describe(OffsetDirective offset) {
    if (offset instanceof OffsetDirective.Absolute absolute) {
      return "offset " + absolute.offset();
    }
    if (offset instanceof OffsetDirective.TailRelative tail) {
      return tail.count() + " messages before end";
    }
    if (offset instanceof OffsetDirective.Earliest) {
      return "beginning";
    }
    if (offset instanceof OffsetDirective.Stored) {
      return "stored offset";
    }
    return "end";
  }
}
