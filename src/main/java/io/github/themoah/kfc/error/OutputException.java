package io.github.themoah.kfc.error;

/**
 * Writing a record to the output sink failed.
 */
public class OutputException extends ConsumerException {

  public OutputException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public int exitCode() {
    return EXIT_FAILURE;
  }
}
