package io.github.themoah.kfc.config;

import io.github.themoah.kfc.error.ConfigException;
import io.github.themoah.kfc.model.OffsetDirective;
import java.util.Objects;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolved settings of one consume run. Immutable once the command line is parsed.
 *
 * @param topic topic to consume
 * @param partition single partition to consume, or empty for all partitions
 * @param offset starting offset applied to every selected partition
 * @param recordDelimiter byte written after each payload
 * @param keyDelimiter byte written after the key, or null when keys are not printed
 * @param messageLimit stop after this many records, 0 for no limit
 * @param exitOnEof stop once every selected partition reached its end
 * @param printOffset prefix each record with its offset
 * @param unbuffered flush the output after every record
 * @param verbosity 0 quiet, 1 normal, 2+ verbose
 * @param metadataTimeoutMs maximum wait for topic metadata
 * @param pollTimeoutMs maximum wait of a single queue poll
 */
public record ConsumeConfig(
  String topic,
  OptionalInt partition,
  OffsetDirective offset,
  byte recordDelimiter,
  Byte keyDelimiter,
  long messageLimit,
  boolean exitOnEof,
  boolean printOffset,
  boolean unbuffered,
  int verbosity,
  long metadataTimeoutMs,
  long pollTimeoutMs
) {
  private static final Logger log = LoggerFactory.getLogger(ConsumeConfig.class);

  public static final byte DEFAULT_DELIMITER = '\n';
  public static final long DEFAULT_METADATA_TIMEOUT_MS = 5_000L;
  public static final long DEFAULT_POLL_TIMEOUT_MS = 100L;
  public static final int DEFAULT_VERBOSITY = 1;

  public ConsumeConfig {
    if (topic == null || topic.isBlank()) {
      throw new ConfigException("Topic missing");
    }
    Objects.requireNonNull(partition, "partition cannot be null");
    Objects.requireNonNull(offset, "offset cannot be null");
    if (partition.isPresent() && partition.getAsInt() < 0) {
      throw new ConfigException("Invalid partition: " + partition.getAsInt());
    }
    if (messageLimit < 0) {
      throw new ConfigException("Invalid message count: " + messageLimit);
    }
    if (metadataTimeoutMs <= 0 || pollTimeoutMs <= 0) {
      throw new ConfigException("Timeouts must be positive");
    }
  }

  public static Builder builder(String topic) {
    return new Builder(topic);
  }

  public static class Builder {

    private final String topic;
    private OptionalInt partition = OptionalInt.empty();
    private OffsetDirective offset = OffsetDirective.LATEST;
    private byte recordDelimiter = DEFAULT_DELIMITER;
    private Byte keyDelimiter;
    private long messageLimit;
    private boolean exitOnEof;
    private boolean printOffset;
    private boolean unbuffered;
    private int verbosity = DEFAULT_VERBOSITY;
    private long metadataTimeoutMs = DEFAULT_METADATA_TIMEOUT_MS;
    private long pollTimeoutMs = DEFAULT_POLL_TIMEOUT_MS;

    private Builder(String topic) {
      this.topic = topic;
    }

    public Builder partition(int partition) {
      this.partition = OptionalInt.of(partition);
      return this;
    }

    public Builder offset(OffsetDirective offset) {
      this.offset = offset;
      return this;
    }

    public Builder recordDelimiter(byte recordDelimiter) {
      this.recordDelimiter = recordDelimiter;
      return this;
    }

    public Builder keyDelimiter(byte keyDelimiter) {
      this.keyDelimiter = keyDelimiter;
      return this;
    }

    public Builder messageLimit(long messageLimit) {
      this.messageLimit = messageLimit;
      return this;
    }

    public Builder exitOnEof(boolean exitOnEof) {
      this.exitOnEof = exitOnEof;
      return this;
    }

    public Builder printOffset(boolean printOffset) {
      this.printOffset = printOffset;
      return this;
    }

    public Builder unbuffered(boolean unbuffered) {
      this.unbuffered = unbuffered;
      return this;
    }

    public Builder verbosity(int verbosity) {
      this.verbosity = verbosity;
      return this;
    }

    public Builder metadataTimeoutMs(long metadataTimeoutMs) {
      this.metadataTimeoutMs = metadataTimeoutMs;
      return this;
    }

    public Builder pollTimeoutMs(long pollTimeoutMs) {
      this.pollTimeoutMs = pollTimeoutMs;
      return this;
    }

    /**
     * Overrides the timeouts from KFC_METADATA_TIMEOUT_MS and KFC_POLL_TIMEOUT_MS when set.
     */
    public Builder timeoutsFromEnvironment() {
      this.metadataTimeoutMs = getEnvLong("KFC_METADATA_TIMEOUT_MS", metadataTimeoutMs);
      this.pollTimeoutMs = getEnvLong("KFC_POLL_TIMEOUT_MS", pollTimeoutMs);
      return this;
    }

    public ConsumeConfig build() {
      return new ConsumeConfig(topic, partition, offset, recordDelimiter, keyDelimiter,
        messageLimit, exitOnEof, printOffset, unbuffered, verbosity, metadataTimeoutMs, pollTimeoutMs);
    }
  }

  private static long getEnvLong(String name, long defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Long.parseLong(value);
      } catch (NumberFormatException e) {
        log.warn("Invalid long for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }
}
