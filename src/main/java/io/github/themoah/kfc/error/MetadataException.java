package io.github.themoah.kfc.error;

/**
 * Topic metadata could not be resolved into a usable partition set.
 */
public class MetadataException extends ConsumerException {

  public enum Reason {
    FETCH_FAILED,
    TOPIC_NOT_FOUND,
    TOPIC_ERROR,
    NO_PARTITIONS,
    PARTITION_NOT_FOUND,
    PARTITION_ERROR
  }

  private final Reason reason;
  private final String topic;

  public MetadataException(Reason reason, String topic, String message) {
    super(message);
    this.reason = reason;
    this.topic = topic;
  }

  public MetadataException(Reason reason, String topic, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.topic = topic;
  }

  public Reason reason() {
    return reason;
  }

  public String topic() {
    return topic;
  }

  @Override
  public int exitCode() {
    return EXIT_FAILURE;
  }
}
