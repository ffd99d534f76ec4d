package io.github.themoah.kfc.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.kfc.consumer.ConsumeLoop;
import io.github.themoah.kfc.consumer.ConsumeStats;
import io.github.themoah.kfc.consumer.ConsumptionOrchestrator;
import io.github.themoah.kfc.consumer.EofTracker;
import io.github.themoah.kfc.consumer.MessageFormatter;
import io.github.themoah.kfc.consumer.RunState;
import io.github.themoah.kfc.error.StreamException;
import io.github.themoah.kfc.model.ConsumedRecord;
import io.github.themoah.kfc.model.OffsetDirective;
import io.github.themoah.kfc.model.PartitionSet;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetOutOfRangeException;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for KafkaPartitionQueue against the Kafka client's MockConsumer.
 */
public class KafkaPartitionQueueTest {

  private static final String TOPIC = "orders";
  private static final TopicPartition P0 = new TopicPartition(TOPIC, 0);
  private static final TopicPartition P1 = new TopicPartition(TOPIC, 1);
  private static final Duration POLL = Duration.ofMillis(10);

  private CommitRecordingConsumer consumer;
  private KafkaPartitionQueue queue;

  @BeforeEach
  void setUp() {
    consumer = new CommitRecordingConsumer();
    consumer.updateBeginningOffsets(Map.of(P0, 0L, P1, 0L));
    queue = new KafkaPartitionQueue(consumer, false);
  }

  @Test
  void mergesPartitions_thenSignalsEnd() {
    queue.open(TOPIC, 0, OffsetDirective.EARLIEST);
    queue.open(TOPIC, 1, OffsetDirective.EARLIEST);
    consumer.updateEndOffsets(Map.of(P0, 3L, P1, 1L));
    addRecords(P0, 0, 3);
    addRecords(P1, 0, 1);

    List<ConsumedRecord> items = queue.dequeue(POLL);

    List<ConsumedRecord.Data> data = dataOf(items);
    assertEquals(4, data.size());
    assertEquals(List.of(0L, 1L, 2L), offsetsOf(data, 0));
    assertEquals(List.of(0L), offsetsOf(data, 1));
    assertEquals("v-0-1", new String(data.stream()
      .filter(d -> d.partition() == 0 && d.offset() == 1).findFirst().orElseThrow().payload(), StandardCharsets.UTF_8));

    List<ConsumedRecord.PartitionEnd> ends = endsOf(items);
    assertEquals(Set.of(new ConsumedRecord.PartitionEnd(0, 3), new ConsumedRecord.PartitionEnd(1, 1)), Set.copyOf(ends));
    assertTrue(items.indexOf(ends.get(0)) > items.indexOf(data.get(data.size() - 1)));
  }

  @Test
  void endIsSignalledOnce_untilNewDataArrives() {
    queue.open(TOPIC, 0, OffsetDirective.EARLIEST);
    consumer.updateEndOffsets(Map.of(P0, 1L));
    addRecords(P0, 0, 1);

    assertEquals(1, endsOf(queue.dequeue(POLL)).size());
    assertTrue(queue.dequeue(POLL).isEmpty());

    consumer.updateEndOffsets(Map.of(P0, 2L));
    addRecords(P0, 1, 1);
    List<ConsumedRecord> items = queue.dequeue(POLL);

    assertEquals(1, dataOf(items).size());
    assertEquals(List.of(new ConsumedRecord.PartitionEnd(0, 2)), endsOf(items));
  }

  @Test
  void notCaughtUp_noEnd() {
    queue.open(TOPIC, 0, OffsetDirective.EARLIEST);
    consumer.updateEndOffsets(Map.of(P0, 10L));
    addRecords(P0, 0, 2);

    List<ConsumedRecord> items = queue.dequeue(POLL);

    assertEquals(2, dataOf(items).size());
    assertTrue(endsOf(items).isEmpty());
  }

  @Test
  void absoluteOffset_skipsEarlierRecords() {
    queue.open(TOPIC, 0, new OffsetDirective.Absolute(2));
    consumer.updateEndOffsets(Map.of(P0, 5L));
    addRecords(P0, 0, 5);

    assertEquals(List.of(2L, 3L, 4L), offsetsOf(dataOf(queue.dequeue(POLL)), 0));
  }

  @Test
  void tailRelative_startsBeforeEnd() {
    consumer.updateEndOffsets(Map.of(P0, 5L));
    queue.open(TOPIC, 0, new OffsetDirective.TailRelative(2));
    addRecords(P0, 0, 5);

    assertEquals(3L, consumer.position(P0));
    assertEquals(List.of(3L, 4L), offsetsOf(dataOf(queue.dequeue(POLL)), 0));
  }

  @Test
  void tailRelative_clampsToBeginning() {
    consumer.updateBeginningOffsets(Map.of(P0, 1L));
    consumer.updateEndOffsets(Map.of(P0, 4L));

    queue.open(TOPIC, 0, new OffsetDirective.TailRelative(100));

    assertEquals(1L, consumer.position(P0));
  }

  @Test
  void latest_startsAtEnd() {
    consumer.updateEndOffsets(Map.of(P0, 5L));
    queue.open(TOPIC, 0, OffsetDirective.LATEST);
    addRecords(P0, 0, 5);

    List<ConsumedRecord> items = queue.dequeue(POLL);

    assertTrue(dataOf(items).isEmpty());
    assertEquals(List.of(new ConsumedRecord.PartitionEnd(0, 5)), endsOf(items));
  }

  @Test
  void openFailure_rollsBackAssignment() {
    queue.open(TOPIC, 0, OffsetDirective.EARLIEST);

    // no end offset known for partition 1
    StreamException e = assertThrows(StreamException.class,
      () -> queue.open(TOPIC, 1, new OffsetDirective.TailRelative(3)));

    assertEquals(1, e.partition());
    assertEquals(Set.of(P0), consumer.assignment());
  }

  @Test
  void openTwice_isRejected() {
    queue.open(TOPIC, 0, OffsetDirective.EARLIEST);

    assertThrows(StreamException.class, () -> queue.open(TOPIC, 0, OffsetDirective.EARLIEST));
  }

  @Test
  void pollFailure_becomesErrorItem() {
    queue.open(TOPIC, 0, OffsetDirective.EARLIEST);
    consumer.setPollException(new KafkaException("Broker transport failure"));

    List<ConsumedRecord> items = queue.dequeue(POLL);

    assertEquals(List.of(new ConsumedRecord.Error(ConsumedRecord.UNKNOWN_PARTITION, "Broker transport failure")), items);
  }

  @Test
  void offsetOutOfRange_isAttributedToPartition() {
    queue.open(TOPIC, 1, OffsetDirective.EARLIEST);
    consumer.setPollException(new OffsetOutOfRangeException("Offset out of range", Map.of(P1, 99L)));

    List<ConsumedRecord> items = queue.dequeue(POLL);

    assertEquals(1, items.size());
    assertEquals(1, items.get(0).partition());
    assertTrue(items.get(0) instanceof ConsumedRecord.Error);
  }

  @Test
  void nothingOpen_dequeuesNothing() {
    assertTrue(queue.dequeue(POLL).isEmpty());
  }

  @Test
  void closePartition_removesItFromAssignment() {
    queue.open(TOPIC, 0, OffsetDirective.EARLIEST);
    queue.open(TOPIC, 1, OffsetDirective.EARLIEST);

    queue.close(TOPIC, 0);

    assertEquals(Set.of(P1), consumer.assignment());
  }

  @Test
  void close_closesConsumerOnce() {
    queue.open(TOPIC, 0, OffsetDirective.EARLIEST);

    queue.close();
    queue.close();

    assertTrue(consumer.closed());
  }

  @Test
  void storedOffset_commitsOnlyDeliveredRecords() {
    KafkaPartitionQueue grouped = new KafkaPartitionQueue(consumer, true);
    grouped.open(TOPIC, 0, OffsetDirective.STORED);
    consumer.updateEndOffsets(Map.of(P0, 10L));
    addRecords(P0, 0, 10);

    assertEquals(10, dataOf(grouped.dequeue(POLL)).size());
    grouped.markDelivered(TOPIC, 0, 0);
    grouped.close(TOPIC, 0);
    grouped.close();

    assertEquals(List.of(Map.of(P0, new OffsetAndMetadata(1))), consumer.commits);
  }

  @Test
  void nothingDelivered_nothingCommitted() {
    KafkaPartitionQueue grouped = new KafkaPartitionQueue(consumer, true);
    grouped.open(TOPIC, 0, OffsetDirective.STORED);
    consumer.updateEndOffsets(Map.of(P0, 3L));
    addRecords(P0, 0, 3);
    grouped.dequeue(POLL);

    grouped.close(TOPIC, 0);
    grouped.close();

    assertTrue(consumer.commits.isEmpty());
  }

  @Test
  void closingQueue_commitsPartitionsStillOpen() {
    KafkaPartitionQueue grouped = new KafkaPartitionQueue(consumer, true);
    grouped.open(TOPIC, 0, OffsetDirective.EARLIEST);
    grouped.open(TOPIC, 1, OffsetDirective.EARLIEST);
    grouped.markDelivered(TOPIC, 0, 4);
    grouped.markDelivered(TOPIC, 1, 7);
    grouped.markDelivered(TOPIC, 1, 8);

    grouped.close();

    assertEquals(List.of(Map.of(P0, new OffsetAndMetadata(5), P1, new OffsetAndMetadata(9))), consumer.commits);
    assertTrue(consumer.closed());
  }

  @Test
  void withoutGroup_neverCommits() {
    queue.open(TOPIC, 0, OffsetDirective.EARLIEST);
    queue.markDelivered(TOPIC, 0, 2);

    queue.close(TOPIC, 0);
    queue.close();

    assertTrue(consumer.commits.isEmpty());
  }

  @Test
  void messageLimit_commitMatchesOutput() {
    KafkaPartitionQueue grouped = new KafkaPartitionQueue(consumer, true);
    consumer.updateEndOffsets(Map.of(P0, 10L));
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    RunState runState = new RunState();
    ConsumeStats stats = new ConsumeStats();

    try (ConsumptionOrchestrator orchestrator = new ConsumptionOrchestrator(grouped)) {
      PartitionSet opened = orchestrator.start(new PartitionSet(TOPIC, List.of(0)), OffsetDirective.STORED,
        OptionalInt.of(0));
      addRecords(P0, 0, 10);
      EofTracker tracker = new EofTracker(opened, true, false, runState);
      MessageFormatter formatter = new MessageFormatter(out, new MessageFormatter.Options(false, null, (byte) '\n', false));
      new ConsumeLoop(TOPIC, grouped, tracker, formatter, stats, runState, 1, POLL).run();
    }

    assertEquals("v-0-0\n", out.toString(StandardCharsets.UTF_8));
    assertEquals(1, stats.rx());
    assertEquals(List.of(Map.of(P0, new OffsetAndMetadata(1))), consumer.commits);
  }

  private void addRecords(TopicPartition tp, long from, int count) {
    for (long offset = from; offset < from + count; offset++) {
      byte[] value = ("v-" + tp.partition() + "-" + offset).getBytes(StandardCharsets.UTF_8);
      consumer.addRecord(new ConsumerRecord<>(tp.topic(), tp.partition(), offset, null, value));
    }
  }

  private static List<ConsumedRecord.Data> dataOf(List<ConsumedRecord> items) {
    return items.stream()
      .filter(ConsumedRecord.Data.class::isInstance)
      .map(ConsumedRecord.Data.class::cast)
      .collect(Collectors.toList());
  }

  private static List<ConsumedRecord.PartitionEnd> endsOf(List<ConsumedRecord> items) {
    return items.stream()
      .filter(ConsumedRecord.PartitionEnd.class::isInstance)
      .map(ConsumedRecord.PartitionEnd.class::cast)
      .collect(Collectors.toList());
  }

  private static List<Long> offsetsOf(List<ConsumedRecord.Data> data, int partition) {
    return data.stream()
      .filter(d -> d.partition() == partition)
      .map(ConsumedRecord.Data::offset)
      .collect(Collectors.toList());
  }

  /**
   * MockConsumer keeping every synchronous commit request.
   */
  private static class CommitRecordingConsumer extends MockConsumer<byte[], byte[]> {

    final List<Map<TopicPartition, OffsetAndMetadata>> commits = new ArrayList<>();

    CommitRecordingConsumer() {
      super(OffsetResetStrategy.EARLIEST);
    }

    @Override
    public synchronized void commitSync(Map<TopicPartition, OffsetAndMetadata> offsets) {
      commits.add(Map.copyOf(offsets));
      super.commitSync(offsets);
    }
  }
}
