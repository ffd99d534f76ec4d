package io.github.themoah.kfc.model;

/**
 * Metadata of a single partition as reported by the cluster.
 *
 * @param partition partition id
 * @param error partition-level error, or null when the partition is healthy
 */
public record PartitionMetadata(
  int partition,
  String error
) {

  public static PartitionMetadata healthy(int partition) {
    return new PartitionMetadata(partition, null);
  }

  public boolean hasError() {
    return error != null;
  }
}
