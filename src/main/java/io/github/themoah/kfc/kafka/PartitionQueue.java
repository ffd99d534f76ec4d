package io.github.themoah.kfc.kafka;

import io.github.themoah.kfc.model.ConsumedRecord;
import io.github.themoah.kfc.model.OffsetDirective;
import java.time.Duration;
import java.util.List;

/**
 * Shared queue merging the streams of several partitions of one topic.
 * Items of a single partition are dequeued in offset order; the interleaving
 * across partitions is unspecified. Not thread-safe: one control thread drives it.
 */
public interface PartitionQueue extends AutoCloseable {

  /**
   * Starts a stream for the partition, positioned according to the directive.
   *
   * @throws io.github.themoah.kfc.error.StreamException if the stream cannot be started
   */
  void open(String topic, int partition, OffsetDirective offset);

  /**
   * Records that the message at {@code offset} has been written out. Only delivered
   * messages count towards the consumer group's stored offset.
   */
  void markDelivered(String topic, int partition, long offset);

  /**
   * Stops the stream of a previously opened partition, storing its delivered offset first.
   */
  void close(String topic, int partition);

  /**
   * Waits at most {@code maxWait} for items and returns whatever was drained, possibly nothing.
   */
  List<ConsumedRecord> dequeue(Duration maxWait);

  /**
   * Releases the queue. Streams still open are dropped.
   */
  @Override
  void close();
}
