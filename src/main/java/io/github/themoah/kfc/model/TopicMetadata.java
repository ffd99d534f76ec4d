package io.github.themoah.kfc.model;

import java.util.List;

/**
 * Topic metadata reply from the cluster.
 *
 * @param topic topic name
 * @param exists false when the cluster does not know the topic
 * @param error topic-level error, or null
 * @param partitions partitions in cluster order
 */
public record TopicMetadata(
  String topic,
  boolean exists,
  String error,
  List<PartitionMetadata> partitions
) {

  public TopicMetadata {
    partitions = partitions == null ? List.of() : List.copyOf(partitions);
  }

  public static TopicMetadata notFound(String topic) {
    return new TopicMetadata(topic, false, null, List.of());
  }

  public static TopicMetadata failed(String topic, String error) {
    return new TopicMetadata(topic, true, error, List.of());
  }

  public static TopicMetadata of(String topic, List<PartitionMetadata> partitions) {
    return new TopicMetadata(topic, true, null, partitions);
  }

  public boolean hasError() {
    return error != null;
  }
}
