package io.github.themoah.kfc;

import io.github.themoah.kfc.config.ConsumeConfig;
import io.github.themoah.kfc.config.DelimiterParser;
import io.github.themoah.kfc.config.KafkaClientConfig;
import io.github.themoah.kfc.config.LoggingConfig;
import io.github.themoah.kfc.consumer.OffsetResolver;
import io.github.themoah.kfc.error.ConfigException;
import io.github.themoah.kfc.error.ConsumerException;
import io.github.themoah.kfc.model.OffsetDirective;
import java.io.BufferedOutputStream;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.KafkaException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
  name = "kfc",
  mixinStandardHelpOptions = true,
  version = "kfc 0.1.0",
  description = "Consume messages from a Kafka topic and write them to standard output."
)
public class ConsumeCommand implements Callable<Integer> {

  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  private static final int OUTPUT_BUFFER_SIZE = 64 * 1024;

  @Spec
  CommandSpec spec;

  @Parameters(index = "0", arity = "0..1", paramLabel = "TOPIC", description = "Topic to consume")
  String topic;

  @Option(names = {"-b", "--brokers"}, paramLabel = "HOST:PORT[,...]", description = "Bootstrap broker list")
  String brokers;

  @Option(names = {"-p", "--partition"}, description = "Consume a single partition (default: all)")
  Integer partition;

  @Option(names = {"-d", "--delimiter"}, defaultValue = "\\n", description = "Message delimiter (default: \\n)")
  String delimiter;

  @Option(names = {"-k", "--key-delimiter"}, description = "Print keys, followed by this delimiter")
  String keyDelimiter;

  @Option(names = {"-o", "--offset"}, defaultValue = "end",
    description = "Start offset: beginning, end, stored, <offset> or -<count> from end (default: end)")
  String offset;

  @Option(names = {"-c", "--count"}, defaultValue = "0", description = "Exit after this many messages")
  long count;

  @Option(names = {"-e", "--exit"}, description = "Exit when the last message of the partitions is reached")
  boolean exitOnEof;

  @Option(names = {"-O", "--print-offset"}, description = "Print each message's offset before it")
  boolean printOffset;

  @Option(names = {"-u", "--unbuffered"}, description = "Flush output after every message")
  boolean unbuffered;

  @Option(names = {"-v", "--verbose"}, description = "Increase verbosity (repeatable)")
  boolean[] verbose = new boolean[0];

  @Option(names = {"-q", "--quiet"}, description = "Only log errors")
  boolean quiet;

  @Option(names = "-X", paramLabel = "PROP=VALUE",
    description = "Kafka client property; 'list' shows known properties, 'dump' the effective ones")
  List<String> properties = new ArrayList<>();

  @Override
  public Integer call() {
    LoggingConfig.applyVerbosity(verbosity());
    PrintWriter out = spec.commandLine().getOut();

    try {
      if (properties.contains("list") || properties.contains("help")) {
        new TreeSet<>(ConsumerConfig.configNames()).forEach(out::println);
        out.flush();
        return ConsumerApplication.EXIT_OK;
      }

      KafkaClientConfig kafkaConfig = toKafkaClientConfig(KafkaClientConfig.load());
      if (properties.contains("dump")) {
        kafkaConfig.dump().forEach((key, value) -> out.println(key + " = " + value));
        out.flush();
        return ConsumerApplication.EXIT_OK;
      }

      ConsumeConfig config = toConsumeConfig();
      if (config.offset() instanceof OffsetDirective.Stored && !kafkaConfig.hasGroupId()) {
        throw new ConfigException("Offset 'stored' requires a consumer group: -X group.id=<group>");
      }
      return consume(config, kafkaConfig);
    } catch (ConfigException e) {
      PrintWriter err = spec.commandLine().getErr();
      err.println("% " + e.getMessage());
      err.flush();
      return e.exitCode();
    }
  }

  ConsumeConfig toConsumeConfig() {
    ConsumeConfig.Builder builder = ConsumeConfig.builder(topic)
      .offset(OffsetResolver.resolve(offset))
      .recordDelimiter(DelimiterParser.parse(delimiter))
      .messageLimit(count)
      .exitOnEof(exitOnEof)
      .printOffset(printOffset)
      .unbuffered(unbuffered)
      .verbosity(verbosity())
      .timeoutsFromEnvironment();
    if (partition != null) {
      builder.partition(partition);
    }
    if (keyDelimiter != null) {
      builder.keyDelimiter(DelimiterParser.parse(keyDelimiter));
    }
    return builder.build();
  }

  /**
   * Applies {@code -b} and {@code -X name=value} on top of the loaded settings.
   */
  KafkaClientConfig toKafkaClientConfig(KafkaClientConfig base) {
    KafkaClientConfig.Builder builder = base.toBuilder();
    if (brokers != null) {
      builder.bootstrapServers(brokers);
    }
    for (String property : properties) {
      if (property.equals("dump")) {
        continue;
      }
      int eq = property.indexOf('=');
      if (eq <= 0) {
        throw new ConfigException("Expected -X property=value, not " + property
          + ", use -X list to display available properties");
      }
      try {
        builder.property(property.substring(0, eq), property.substring(eq + 1));
      } catch (NumberFormatException e) {
        throw new ConfigException("Invalid value for -X " + property);
      }
    }
    return builder.build();
  }

  int verbosity() {
    return quiet ? 0 : ConsumeConfig.DEFAULT_VERBOSITY + verbose.length;
  }

  private int consume(ConsumeConfig config, KafkaClientConfig kafkaConfig) {
    OutputStream stdout = new BufferedOutputStream(new FileOutputStream(FileDescriptor.out), OUTPUT_BUFFER_SIZE);
    try (ConsumerApplication app = ConsumerApplication.create(config, kafkaConfig, stdout)) {
      Runtime.getRuntime().addShutdownHook(new Thread(() -> app.shutdown(SHUTDOWN_TIMEOUT), "kfc-shutdown"));
      return app.run();
    } catch (KafkaException e) {
      PrintWriter err = spec.commandLine().getErr();
      err.println("% Failed to create Kafka client: " + e.getMessage());
      err.flush();
      return ConsumerException.EXIT_FAILURE;
    }
  }
}
