package io.github.themoah.kfc;

import io.github.themoah.kfc.config.ConsumeConfig;
import io.github.themoah.kfc.config.KafkaClientConfig;
import io.github.themoah.kfc.config.VertxConfig;
import io.github.themoah.kfc.consumer.ConsumeLoop;
import io.github.themoah.kfc.consumer.ConsumeStats;
import io.github.themoah.kfc.consumer.ConsumptionOrchestrator;
import io.github.themoah.kfc.consumer.EofTracker;
import io.github.themoah.kfc.consumer.MessageFormatter;
import io.github.themoah.kfc.consumer.RunState;
import io.github.themoah.kfc.consumer.TopicMetadataResolver;
import io.github.themoah.kfc.error.ConsumerException;
import io.github.themoah.kfc.error.OutputException;
import io.github.themoah.kfc.kafka.KafkaMetadataService;
import io.github.themoah.kfc.kafka.KafkaMetadataServiceImpl;
import io.github.themoah.kfc.kafka.KafkaPartitionQueue;
import io.github.themoah.kfc.kafka.PartitionQueue;
import io.github.themoah.kfc.model.PartitionSet;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.io.OutputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One consume run: resolves the topic, opens the wanted partitions and writes their
 * messages to the sink until the run stops.
 */
public class ConsumerApplication implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ConsumerApplication.class);

  public static final int EXIT_OK = 0;

  private static final long CLOSE_TIMEOUT_MS = 5_000L;

  private final ConsumeConfig config;
  private final KafkaMetadataService metadataService;
  private final Supplier<PartitionQueue> queueFactory;
  private final OutputStream sink;
  private final Vertx vertx;
  private final RunState runState = new RunState();
  private final ConsumeStats stats = new ConsumeStats();
  private final CountDownLatch finished = new CountDownLatch(1);

  /**
   * @param queueFactory creates the shared queue once the topic has been validated
   * @param vertx instance owning the metadata client, closed with this application; may be null
   */
  ConsumerApplication(ConsumeConfig config, KafkaMetadataService metadataService,
      Supplier<PartitionQueue> queueFactory, OutputStream sink, Vertx vertx) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.metadataService = Objects.requireNonNull(metadataService, "metadataService cannot be null");
    this.queueFactory = Objects.requireNonNull(queueFactory, "queueFactory cannot be null");
    this.sink = Objects.requireNonNull(sink, "sink cannot be null");
    this.vertx = vertx;
  }

  /**
   * Creates an application talking to the cluster described by {@code kafkaConfig}.
   */
  public static ConsumerApplication create(ConsumeConfig config, KafkaClientConfig kafkaConfig, OutputStream sink) {
    return create(config, kafkaConfig, sink, Vertx.vertx(VertxConfig.createVertxOptions()),
      vertx -> new KafkaMetadataServiceImpl(vertx, kafkaConfig));
  }

  /**
   * The Vert.x instance is closed again if the metadata client cannot be created.
   */
  static ConsumerApplication create(ConsumeConfig config, KafkaClientConfig kafkaConfig, OutputStream sink,
      Vertx vertx, Function<Vertx, KafkaMetadataService> metadataServiceFactory) {
    KafkaMetadataService metadataService;
    try {
      metadataService = metadataServiceFactory.apply(vertx);
    } catch (RuntimeException e) {
      vertx.close().onFailure(err -> log.warn("Failed to close Vert.x: {}", err.getMessage()));
      throw e;
    }
    return new ConsumerApplication(config, metadataService, () -> new KafkaPartitionQueue(kafkaConfig), sink, vertx);
  }

  /**
   * Runs to completion on the calling thread.
   *
   * @return process exit code: 0 on success, non-zero on any fatal condition
   */
  public int run() {
    try {
      consume();
      log.debug("Consumed {} messages from topic {}", stats.rx(), config.topic());
      return EXIT_OK;
    } catch (ConsumerException e) {
      runState.stop(RunState.StopReason.FATAL_ERROR);
      log.error("{}", e.getMessage());
      log.debug("Run failed", e);
      return e.exitCode();
    } catch (KafkaException e) {
      runState.stop(RunState.StopReason.FATAL_ERROR);
      log.error("Kafka client error: {}", e.getMessage(), e);
      return ConsumerException.EXIT_FAILURE;
    } finally {
      finished.countDown();
    }
  }

  /**
   * Requests the run to stop and waits until its partitions are closed.
   * Called from the JVM shutdown hook.
   */
  public void shutdown(Duration timeout) {
    if (runState.stop(RunState.StopReason.SHUTDOWN)) {
      log.info("Shutting down");
    }
    try {
      if (!finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Consumer did not stop within {}ms", timeout.toMillis());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  public RunState runState() {
    return runState;
  }

  public ConsumeStats stats() {
    return stats;
  }

  @Override
  public void close() {
    Future<Void> closed = metadataService.close();
    if (vertx != null) {
      closed = closed.transform(ar -> vertx.close());
    }
    try {
      closed.toCompletionStage().toCompletableFuture().get(CLOSE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
    } catch (ExecutionException | TimeoutException e) {
      log.warn("Failed to release Kafka clients: {}", e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void consume() {
    PartitionSet partitions = new TopicMetadataResolver(metadataService)
      .resolve(config.topic(), config.partition(), Duration.ofMillis(config.metadataTimeoutMs()));

    if (!runState.isRunning()) {
      return;
    }

    MessageFormatter formatter = new MessageFormatter(sink, new MessageFormatter.Options(
      config.printOffset(), config.keyDelimiter(), config.recordDelimiter(), config.unbuffered()));

    PartitionQueue queue = queueFactory.get();
    try (ConsumptionOrchestrator orchestrator = new ConsumptionOrchestrator(queue)) {
      PartitionSet scope = orchestrator.start(partitions, config.offset(), config.partition());
      EofTracker eofTracker = new EofTracker(scope, config.partition().isPresent(), config.exitOnEof(), runState);
      new ConsumeLoop(config.topic(), queue, eofTracker, formatter, stats, runState,
        config.messageLimit(), Duration.ofMillis(config.pollTimeoutMs())).run();
      // written out before the orchestrator commits delivered offsets
      formatter.flush();
    } catch (ConsumerException | KafkaException e) {
      flushAfterFailure(formatter);
      throw e;
    }
  }

  /**
   * Records written before a fatal error still reach the sink.
   */
  private void flushAfterFailure(MessageFormatter formatter) {
    try {
      formatter.flush();
    } catch (OutputException e) {
      log.debug("Flush after failure failed: {}", e.getMessage());
    }
  }
}
