package io.github.themoah.kfc.consumer;

import io.github.themoah.kfc.error.MetadataException;
import io.github.themoah.kfc.error.MetadataException.Reason;
import io.github.themoah.kfc.kafka.KafkaMetadataService;
import io.github.themoah.kfc.model.PartitionMetadata;
import io.github.themoah.kfc.model.PartitionSet;
import io.github.themoah.kfc.model.TopicMetadata;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a topic into its partition set and rejects topics that cannot be consumed.
 * Blocks the caller until the metadata arrives or the timeout expires; must not run on an event loop.
 */
public class TopicMetadataResolver {

  private static final Logger log = LoggerFactory.getLogger(TopicMetadataResolver.class);

  private final KafkaMetadataService metadataService;

  public TopicMetadataResolver(KafkaMetadataService metadataService) {
    this.metadataService = Objects.requireNonNull(metadataService, "metadataService cannot be null");
  }

  /**
   * @param topic topic to describe
   * @param requestedPartition partition the caller wants, or empty for all
   * @param timeout maximum wait for the cluster reply
   * @return partitions of the topic in cluster order
   * @throws MetadataException if the topic or the requested partition cannot be consumed
   */
  public PartitionSet resolve(String topic, OptionalInt requestedPartition, Duration timeout) {
    TopicMetadata metadata = fetch(topic, timeout);

    if (!metadata.exists()) {
      throw new MetadataException(Reason.TOPIC_NOT_FOUND, topic, "No such topic in cluster: " + topic);
    }
    if (metadata.hasError()) {
      throw new MetadataException(Reason.TOPIC_ERROR, topic,
        "Topic " + topic + " error: " + metadata.error());
    }
    List<PartitionMetadata> partitions = metadata.partitions();
    if (partitions.isEmpty()) {
      throw new MetadataException(Reason.NO_PARTITIONS, topic, "Topic " + topic + " has no partitions");
    }

    if (requestedPartition.isPresent()) {
      int wanted = requestedPartition.getAsInt();
      PartitionMetadata match = partitions.stream()
        .filter(p -> p.partition() == wanted)
        .findFirst()
        .orElseThrow(() -> new MetadataException(Reason.PARTITION_NOT_FOUND, topic,
          "Topic " + topic + " (with partitions 0.." + (partitions.size() - 1) + "): partition "
            + wanted + " does not exist"));
      checkHealthy(topic, match);
    } else {
      partitions.forEach(p -> checkHealthy(topic, p));
    }

    PartitionSet partitionSet = new PartitionSet(topic, partitions.stream()
      .map(PartitionMetadata::partition)
      .collect(Collectors.toList()));
    log.debug("Topic {} has {} partitions", topic, partitionSet.size());
    return partitionSet;
  }

  private TopicMetadata fetch(String topic, Duration timeout) {
    try {
      return metadataService.fetchTopicMetadata(topic)
        .toCompletionStage()
        .toCompletableFuture()
        .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      throw new MetadataException(Reason.FETCH_FAILED, topic,
        "Failed to query metadata for topic " + topic + ": timed out after " + timeout.toMillis() + "ms", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new MetadataException(Reason.FETCH_FAILED, topic,
        "Failed to query metadata for topic " + topic + ": " + cause.getMessage(), cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MetadataException(Reason.FETCH_FAILED, topic,
        "Interrupted while querying metadata for topic " + topic, e);
    }
  }

  private static void checkHealthy(String topic, PartitionMetadata partition) {
    if (partition.hasError()) {
      throw new MetadataException(Reason.PARTITION_ERROR, topic,
        "Topic " + topic + " [" + partition.partition() + "] error: " + partition.error());
    }
  }
}
