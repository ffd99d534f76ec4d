package io.github.themoah.kfc.model;

import java.util.List;
import java.util.Objects;

/**
 * Partitions of a topic in the order reported by the cluster metadata.
 */
public record PartitionSet(
  String topic,
  List<Integer> partitions
) {

  public PartitionSet {
    Objects.requireNonNull(topic, "topic cannot be null");
    partitions = List.copyOf(partitions);
  }

  public int size() {
    return partitions.size();
  }

  public boolean contains(int partition) {
    return partitions.contains(partition);
  }
}
