package io.github.themoah.kfc.error;

/**
 * Base class of every fatal condition of a consume run.
 * Each subclass maps to the process exit code reported to the shell.
 */
public abstract class ConsumerException extends RuntimeException {

  public static final int EXIT_FAILURE = 1;
  public static final int EXIT_USAGE = 2;

  protected ConsumerException(String message) {
    super(message);
  }

  protected ConsumerException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract int exitCode();
}
