package io.github.themoah.kfc.error;

/**
 * A partition stream failed to open or delivered a non-EOF error.
 */
public class StreamException extends ConsumerException {

  private final String topic;
  private final int partition;

  public StreamException(String topic, int partition, String message) {
    super(message);
    this.topic = topic;
    this.partition = partition;
  }

  public StreamException(String topic, int partition, String message, Throwable cause) {
    super(message, cause);
    this.topic = topic;
    this.partition = partition;
  }

  public String topic() {
    return topic;
  }

  public int partition() {
    return partition;
  }

  @Override
  public int exitCode() {
    return EXIT_FAILURE;
  }
}
