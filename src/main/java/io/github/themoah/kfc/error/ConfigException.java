package io.github.themoah.kfc.error;

/**
 * Invalid or inconsistent configuration, detected before consumption starts.
 */
public class ConfigException extends ConsumerException {

  public ConfigException(String message) {
    super(message);
  }

  @Override
  public int exitCode() {
    return EXIT_USAGE;
  }
}
