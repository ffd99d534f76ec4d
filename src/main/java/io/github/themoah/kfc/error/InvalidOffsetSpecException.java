package io.github.themoah.kfc.error;

/**
 * Starting offset is neither a known keyword nor an integer.
 */
public class InvalidOffsetSpecException extends ConfigException {

  private final String spec;

  public InvalidOffsetSpecException(String spec) {
    super("Invalid offset: '" + spec + "' (expected end, beginning, stored or an integer)");
    this.spec = spec;
  }

  public String spec() {
    return spec;
  }
}
