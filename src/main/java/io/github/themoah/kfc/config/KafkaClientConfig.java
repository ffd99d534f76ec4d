package io.github.themoah.kfc.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.TreeMap;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection settings shared by the metadata admin client and the partition consumer.
 */
public class KafkaClientConfig {

  private static final Logger log = LoggerFactory.getLogger(KafkaClientConfig.class);

  private static final String DEFAULT_CONFIG_FILE = "kfc.properties";
  private static final String PROP_BOOTSTRAP_SERVERS = "kafka.bootstrap.servers";
  private static final String PROP_REQUEST_TIMEOUT_MS = "kafka.request.timeout.ms";
  private static final String PROP_PREFIX = "kafka.";
  private static final String TOPIC_PROP_PREFIX = "topic.";

  private static final String DEFAULT_BOOTSTRAP_SERVERS = "localhost:9092";
  private static final int DEFAULT_REQUEST_TIMEOUT_MS = 30000;
  private static final String DEFAULT_CLIENT_ID = "kfc";

  private final String bootstrapServers;
  private final int requestTimeoutMs;
  private final Map<String, String> additionalProperties;

  private KafkaClientConfig(Builder builder) {
    this.bootstrapServers = builder.bootstrapServers;
    this.requestTimeoutMs = builder.requestTimeoutMs;
    this.additionalProperties = new HashMap<>(builder.additionalProperties);
  }

  public String getBootstrapServers() {
    return bootstrapServers;
  }

  public int getRequestTimeoutMs() {
    return requestTimeoutMs;
  }

  /**
   * Returns the passthrough property value, or null when unset.
   */
  public String getProperty(String key) {
    return additionalProperties.get(key);
  }

  public boolean hasGroupId() {
    String groupId = additionalProperties.get(ConsumerConfig.GROUP_ID_CONFIG);
    return groupId != null && !groupId.isBlank();
  }

  public Map<String, String> toAdminProperties() {
    Map<String, String> props = new HashMap<>();
    props.put(CommonClientConfigs.CLIENT_ID_CONFIG, DEFAULT_CLIENT_ID);
    props.putAll(additionalProperties);
    props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, String.valueOf(requestTimeoutMs));
    return props;
  }

  /**
   * Properties for the byte-array consumer behind the shared partition queue.
   * Passthrough properties override the defaults, except the deserializers and auto-commit.
   */
  public Map<String, Object> toConsumerProperties() {
    Map<String, Object> props = new HashMap<>();
    props.put(ConsumerConfig.CLIENT_ID_CONFIG, DEFAULT_CLIENT_ID);
    props.putAll(additionalProperties);
    // the partition queue commits delivered offsets itself
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(ConsumerConfig.REQUEST_TIMEOUT_MS_CONFIG, String.valueOf(requestTimeoutMs));
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    return props;
  }

  /**
   * Effective consumer properties in key order, as printed by {@code -X dump}.
   */
  public Map<String, String> dump() {
    Map<String, String> sorted = new TreeMap<>();
    toConsumerProperties().forEach((key, value) -> sorted.put(key, String.valueOf(value)));
    return sorted;
  }

  public Builder toBuilder() {
    Builder builder = builder()
      .bootstrapServers(bootstrapServers)
      .requestTimeoutMs(requestTimeoutMs);
    additionalProperties.forEach(builder::property);
    return builder;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Loads the classpath {@code kfc.properties}, falling back to the environment.
   */
  public static KafkaClientConfig load() {
    try {
      return fromClasspath();
    } catch (IOException e) {
      log.debug("No classpath config found, loading from environment: {}", e.getMessage());
      return fromEnvironment();
    }
  }

  public static KafkaClientConfig fromEnvironment() {
    String timeout = System.getenv("KAFKA_REQUEST_TIMEOUT_MS");
    Builder builder = builder()
      .bootstrapServers(
        System.getenv().getOrDefault("KAFKA_BOOTSTRAP_SERVERS", DEFAULT_BOOTSTRAP_SERVERS)
      );
    if (timeout != null && !timeout.isBlank()) {
      try {
        builder.requestTimeoutMs(Integer.parseInt(timeout));
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for KAFKA_REQUEST_TIMEOUT_MS: {}, using default: {}",
          timeout, DEFAULT_REQUEST_TIMEOUT_MS);
      }
    }
    return builder.build();
  }

  /**
   * Loads configuration from the default kfc.properties file on the classpath.
   *
   * @return KafkaClientConfig loaded from classpath
   * @throws IOException if the config file cannot be read
   */
  public static KafkaClientConfig fromClasspath() throws IOException {
    return fromClasspath(DEFAULT_CONFIG_FILE);
  }

  /**
   * Loads configuration from a properties file on the classpath.
   *
   * @param resourceName the name of the properties file on the classpath
   * @return KafkaClientConfig loaded from the resource
   * @throws IOException if the config file cannot be read
   */
  public static KafkaClientConfig fromClasspath(String resourceName) throws IOException {
    try (InputStream is = KafkaClientConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
      if (is == null) {
        throw new IOException("Resource not found on classpath: " + resourceName);
      }
      log.debug("Loading configuration from classpath: {}", resourceName);
      Properties props = new Properties();
      props.load(is);
      return fromProperties(props);
    }
  }

  /**
   * Creates configuration from a Properties object.
   *
   * @param props the properties containing kafka.* configuration
   * @return KafkaClientConfig built from the properties
   */
  public static KafkaClientConfig fromProperties(Properties props) {
    Builder builder = builder();

    String bootstrapServers = props.getProperty(PROP_BOOTSTRAP_SERVERS);
    if (bootstrapServers != null && !bootstrapServers.isBlank()) {
      builder.bootstrapServers(bootstrapServers);
    }

    String requestTimeout = props.getProperty(PROP_REQUEST_TIMEOUT_MS);
    if (requestTimeout != null && !requestTimeout.isBlank()) {
      try {
        builder.requestTimeoutMs(Integer.parseInt(requestTimeout.trim()));
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using default: {}",
          PROP_REQUEST_TIMEOUT_MS, requestTimeout, DEFAULT_REQUEST_TIMEOUT_MS);
      }
    }

    for (String name : props.stringPropertyNames()) {
      if (name.startsWith(PROP_PREFIX)
          && !name.equals(PROP_BOOTSTRAP_SERVERS)
          && !name.equals(PROP_REQUEST_TIMEOUT_MS)) {
        // kafka.group.id -> group.id
        builder.property(name.substring(PROP_PREFIX.length()), props.getProperty(name));
      }
    }

    log.debug("Configuration loaded: bootstrapServers={}", builder.bootstrapServers);
    return builder.build();
  }

  public static class Builder {

    private String bootstrapServers = DEFAULT_BOOTSTRAP_SERVERS;
    private int requestTimeoutMs = DEFAULT_REQUEST_TIMEOUT_MS;
    private final Map<String, String> additionalProperties = new HashMap<>();

    public Builder bootstrapServers(String bootstrapServers) {
      this.bootstrapServers = Objects.requireNonNull(bootstrapServers, "bootstrapServers cannot be null");
      return this;
    }

    public Builder requestTimeoutMs(int requestTimeoutMs) {
      this.requestTimeoutMs = requestTimeoutMs;
      return this;
    }

    /**
     * Sets a client property. The {@code topic.} prefix of per-topic properties is dropped,
     * the Java client has a single configuration namespace. {@code bootstrap.servers},
     * {@code metadata.broker.list} and {@code request.timeout.ms} map to the typed settings.
     *
     * @throws NumberFormatException if {@code request.timeout.ms} is not an integer
     */
    public Builder property(String key, String value) {
      Objects.requireNonNull(key, "key cannot be null");
      Objects.requireNonNull(value, "value cannot be null");
      String name = key.startsWith(TOPIC_PROP_PREFIX) ? key.substring(TOPIC_PROP_PREFIX.length()) : key;
      if (name.equals(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG) || name.equals("metadata.broker.list")) {
        return bootstrapServers(value);
      }
      if (name.equals(CommonClientConfigs.REQUEST_TIMEOUT_MS_CONFIG)) {
        return requestTimeoutMs(Integer.parseInt(value));
      }
      this.additionalProperties.put(name, value);
      return this;
    }

    public KafkaClientConfig build() {
      return new KafkaClientConfig(this);
    }
  }
}
