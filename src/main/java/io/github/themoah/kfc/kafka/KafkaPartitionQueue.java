package io.github.themoah.kfc.kafka;

import io.github.themoah.kfc.config.KafkaClientConfig;
import io.github.themoah.kfc.error.StreamException;
import io.github.themoah.kfc.model.ConsumedRecord;
import io.github.themoah.kfc.model.OffsetDirective;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.InvalidOffsetException;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.RecordDeserializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PartitionQueue backed by a single manually-assigned Kafka consumer.
 *
 * <p>Every opened partition is added to the consumer's assignment, so one poll drains
 * all of them. The Java client has no partition-EOF event: a {@link ConsumedRecord.PartitionEnd}
 * is emitted when a partition's position catches up with its high watermark, and again only
 * after new data arrived for that partition.
 *
 * <p>With a consumer group, offsets are committed only up to the last message reported
 * through {@link #markDelivered}, when its partition is closed. Messages polled but never
 * written out are consumed again by the next run from the stored offset.
 */
public class KafkaPartitionQueue implements PartitionQueue {

  private static final Logger log = LoggerFactory.getLogger(KafkaPartitionQueue.class);

  private final Consumer<byte[], byte[]> consumer;
  private final Set<TopicPartition> assigned = new LinkedHashSet<>();
  private final Set<TopicPartition> atEnd = new HashSet<>();
  private final boolean commitOffsets;
  // next offset to commit per partition
  private final Map<TopicPartition, Long> delivered = new HashMap<>();
  private boolean closed;

  public KafkaPartitionQueue(KafkaClientConfig config) {
    this(new KafkaConsumer<>(Objects.requireNonNull(config, "config cannot be null").toConsumerProperties()),
      config.hasGroupId());
    log.debug("Created consumer with bootstrap servers: {}", config.getBootstrapServers());
  }

  /**
   * @param commitOffsets commit delivered offsets to the consumer group on close
   */
  KafkaPartitionQueue(Consumer<byte[], byte[]> consumer, boolean commitOffsets) {
    this.consumer = Objects.requireNonNull(consumer, "consumer cannot be null");
    this.commitOffsets = commitOffsets;
  }

  @Override
  public void open(String topic, int partition, OffsetDirective offset) {
    TopicPartition tp = new TopicPartition(topic, partition);
    if (assigned.contains(tp)) {
      throw new StreamException(topic, partition, "Partition " + tp + " is already being consumed");
    }
    try {
      assigned.add(tp);
      consumer.assign(new ArrayList<>(assigned));
      seek(tp, offset);
      log.debug("Started consuming {} from {}", tp, offset);
    } catch (KafkaException | IllegalStateException e) {
      assigned.remove(tp);
      reassign();
      throw new StreamException(topic, partition,
        "Failed to start consuming topic " + topic + " [" + partition + "]: " + e.getMessage(), e);
    }
  }

  @Override
  public void markDelivered(String topic, int partition, long offset) {
    if (commitOffsets) {
      delivered.put(new TopicPartition(topic, partition), offset + 1);
    }
  }

  @Override
  public void close(String topic, int partition) {
    TopicPartition tp = new TopicPartition(topic, partition);
    if (assigned.contains(tp)) {
      commitDelivered(List.of(tp));
      assigned.remove(tp);
      atEnd.remove(tp);
      reassign();
      log.debug("Stopped consuming {}", tp);
    }
  }

  @Override
  public List<ConsumedRecord> dequeue(Duration maxWait) {
    List<ConsumedRecord> items = new ArrayList<>();
    if (assigned.isEmpty()) {
      return items;
    }

    ConsumerRecords<byte[], byte[]> records;
    try {
      records = consumer.poll(maxWait);
    } catch (InvalidOffsetException e) {
      for (TopicPartition tp : e.partitions()) {
        items.add(new ConsumedRecord.Error(tp.partition(), e.getMessage()));
      }
      return items;
    } catch (RecordDeserializationException e) {
      items.add(new ConsumedRecord.Error(e.topicPartition().partition(), e.getMessage()));
      return items;
    } catch (KafkaException e) {
      items.add(new ConsumedRecord.Error(ConsumedRecord.UNKNOWN_PARTITION, e.getMessage()));
      return items;
    }

    for (ConsumerRecord<byte[], byte[]> record : records) {
      items.add(new ConsumedRecord.Data(record.partition(), record.offset(), record.key(), record.value()));
      atEnd.remove(new TopicPartition(record.topic(), record.partition()));
    }

    for (TopicPartition tp : assigned) {
      if (atEnd.contains(tp)) {
        continue;
      }
      OptionalLong lag = consumer.currentLag(tp);
      if (lag.isPresent() && lag.getAsLong() <= 0) {
        atEnd.add(tp);
        items.add(new ConsumedRecord.PartitionEnd(tp.partition(), consumer.position(tp)));
      }
    }
    return items;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    commitDelivered(new ArrayList<>(assigned));
    assigned.clear();
    atEnd.clear();
    consumer.close();
    log.debug("Consumer closed");
  }

  private void seek(TopicPartition tp, OffsetDirective offset) {
    if (offset instanceof OffsetDirective.Earliest) {
      consumer.seekToBeginning(List.of(tp));
    } else if (offset instanceof OffsetDirective.Latest) {
      consumer.seekToEnd(List.of(tp));
    } else if (offset instanceof OffsetDirective.Absolute absolute) {
      consumer.seek(tp, absolute.offset());
    } else if (offset instanceof OffsetDirective.TailRelative tail) {
      long end = consumer.endOffsets(List.of(tp)).get(tp);
      long beginning = consumer.beginningOffsets(List.of(tp)).get(tp);
      consumer.seek(tp, Math.max(beginning, end - tail.count()));
    }
    // Stored: the consumer resumes from the group's committed offset, else auto.offset.reset
  }

  private void commitDelivered(Collection<TopicPartition> partitions) {
    Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>();
    for (TopicPartition tp : partitions) {
      Long next = delivered.remove(tp);
      if (next != null) {
        offsets.put(tp, new OffsetAndMetadata(next));
      }
    }
    if (offsets.isEmpty()) {
      return;
    }
    try {
      consumer.commitSync(offsets);
      log.debug("Committed delivered offsets {}", offsets);
    } catch (KafkaException e) {
      log.warn("Failed to commit delivered offsets {}: {}", offsets, e.getMessage());
    }
  }

  private void reassign() {
    try {
      consumer.assign(new ArrayList<>(assigned));
    } catch (KafkaException | IllegalStateException e) {
      log.warn("Failed to update partition assignment to {}: {}", assigned, e.getMessage());
    }
  }
}
