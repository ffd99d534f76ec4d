package io.github.themoah.kfc.kafka;

import io.github.themoah.kfc.config.KafkaClientConfig;
import io.github.themoah.kfc.model.PartitionMetadata;
import io.github.themoah.kfc.model.TopicMetadata;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.kafka.admin.KafkaAdminClient;
import io.vertx.kafka.admin.TopicDescription;
import io.vertx.kafka.client.common.Node;
import io.vertx.kafka.client.common.TopicPartitionInfo;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.apache.kafka.common.errors.ApiException;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of KafkaMetadataService using Vert.x KafkaAdminClient.
 */
public class KafkaMetadataServiceImpl implements KafkaMetadataService {

  private static final Logger log = LoggerFactory.getLogger(KafkaMetadataServiceImpl.class);

  static final String NO_LEADER = "Leader not available";

  private final KafkaAdminClient adminClient;

  /**
   * Creates a new KafkaMetadataServiceImpl.
   *
   * @param vertx  the Vert.x instance
   * @param config the Kafka client configuration
   */
  public KafkaMetadataServiceImpl(Vertx vertx, KafkaClientConfig config) {
    Objects.requireNonNull(vertx, "vertx cannot be null");
    Objects.requireNonNull(config, "config cannot be null");
    log.debug("Creating Kafka admin client with bootstrap servers: {}", config.getBootstrapServers());
    this.adminClient = KafkaAdminClient.create(vertx, config.toAdminProperties());
  }

  @Override
  public Future<TopicMetadata> fetchTopicMetadata(String topic) {
    Objects.requireNonNull(topic, "topic cannot be null");
    log.debug("Describing topic: {}", topic);

    return adminClient.describeTopics(Collections.singletonList(topic))
      .map(descriptions -> toTopicMetadata(topic, descriptions.get(topic)))
      .recover(err -> recoverTopicError(topic, err))
      .onSuccess(metadata -> log.debug("Topic {}: exists={}, partitions={}",
        topic, metadata.exists(), metadata.partitions().size()))
      .onFailure(err -> log.debug("Failed to describe topic: {}", topic, err));
  }

  @Override
  public Future<Void> close() {
    log.debug("Closing Kafka admin client");
    return adminClient.close()
      .onFailure(err -> log.warn("Failed to close Kafka admin client", err));
  }

  static TopicMetadata toTopicMetadata(String topic, TopicDescription description) {
    if (description == null) {
      return TopicMetadata.notFound(topic);
    }
    List<PartitionMetadata> partitions = description.getPartitions() == null
      ? List.of()
      : description.getPartitions().stream()
        .map(KafkaMetadataServiceImpl::toPartitionMetadata)
        .collect(Collectors.toList());
    return TopicMetadata.of(topic, partitions);
  }

  static PartitionMetadata toPartitionMetadata(TopicPartitionInfo info) {
    Node leader = info.getLeader();
    if (leader == null || leader.getId() < 0) {
      return new PartitionMetadata(info.getPartition(), NO_LEADER);
    }
    return PartitionMetadata.healthy(info.getPartition());
  }

  /**
   * Broker-reported topic errors become metadata, anything else fails the query.
   */
  static Future<TopicMetadata> recoverTopicError(String topic, Throwable err) {
    for (Throwable t = err; t != null; t = t.getCause()) {
      if (t instanceof UnknownTopicOrPartitionException) {
        return Future.succeededFuture(TopicMetadata.notFound(topic));
      }
      if (t instanceof ApiException apiException && !(t instanceof RetriableException)) {
        return Future.succeededFuture(TopicMetadata.failed(topic, apiException.getMessage()));
      }
    }
    return Future.failedFuture(err);
  }
}
