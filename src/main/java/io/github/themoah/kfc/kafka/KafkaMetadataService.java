package io.github.themoah.kfc.kafka;

import io.github.themoah.kfc.model.TopicMetadata;
import io.vertx.core.Future;

/**
 * Cluster metadata queries used before consumption starts.
 * All methods return Vert.x Futures for async, non-blocking execution.
 */
public interface KafkaMetadataService {

  /**
   * Fetches the partition layout of a topic.
   * An unknown topic or a topic-level error completes successfully with the
   * corresponding {@link TopicMetadata}; the future fails only when the query itself fails.
   *
   * @param topic the topic name
   * @return Future containing the topic metadata
   */
  Future<TopicMetadata> fetchTopicMetadata(String topic);

  /**
   * Closes the underlying Kafka admin client and releases resources.
   *
   * @return Future that completes when the client is closed
   */
  Future<Void> close();
}
