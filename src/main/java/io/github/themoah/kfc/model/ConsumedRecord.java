package io.github.themoah.kfc.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * One item drained from the shared partition queue.
 */
public sealed interface ConsumedRecord
    permits ConsumedRecord.Data, ConsumedRecord.PartitionEnd, ConsumedRecord.Error {

  /** Partition id used when an error cannot be attributed to a partition. */
  int UNKNOWN_PARTITION = -1;

  int partition();

  /**
   * A message read from a partition. Key and payload may be null and compare by content.
   */
  record Data(int partition, long offset, byte[] key, byte[] payload) implements ConsumedRecord {

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Data other)) {
        return false;
      }
      return partition == other.partition
        && offset == other.offset
        && Arrays.equals(key, other.key)
        && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
      int result = Objects.hash(partition, offset);
      result = 31 * result + Arrays.hashCode(key);
      return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
      return "Data[partition=" + partition + ", offset=" + offset
        + ", key=" + (key == null ? "null" : key.length + " bytes")
        + ", payload=" + (payload == null ? "null" : payload.length + " bytes") + "]";
    }
  }

  /**
   * The partition has no more messages available at {@code offset}.
   */
  record PartitionEnd(int partition, long offset) implements ConsumedRecord {}

  /**
   * Transport or broker error reported for a partition.
   */
  record Error(int partition, String detail) implements ConsumedRecord {}
}
