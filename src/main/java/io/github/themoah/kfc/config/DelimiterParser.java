package io.github.themoah.kfc.config;

import io.github.themoah.kfc.error.ConfigException;

/**
 * Parses a delimiter given on the command line into a single output byte.
 * Accepts one character or one of the escapes {@code \n \t \r \0 \\}.
 */
public final class DelimiterParser {

  private DelimiterParser() {}

  public static byte parse(String value) {
    if (value == null || value.isEmpty()) {
      throw new ConfigException("Empty delimiter");
    }
    if (value.length() == 1) {
      char c = value.charAt(0);
      if (c > 0xFF) {
        throw new ConfigException("Delimiter must be a single byte: '" + value + "'");
      }
      return (byte) c;
    }
    if (value.length() == 2 && value.charAt(0) == '\\') {
      return switch (value.charAt(1)) {
        case 'n' -> '\n';
        case 't' -> '\t';
        case 'r' -> '\r';
        case '0' -> 0;
        case '\\' -> '\\';
        default -> throw new ConfigException("Unknown delimiter escape: '" + value + "'");
      };
    }
    throw new ConfigException("Delimiter must be a single character: '" + value + "'");
  }
}
