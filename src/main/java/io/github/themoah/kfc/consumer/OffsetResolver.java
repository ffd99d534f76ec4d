package io.github.themoah.kfc.consumer;

import io.github.themoah.kfc.error.InvalidOffsetSpecException;
import io.github.themoah.kfc.model.OffsetDirective;

/**
 * Parses the starting-offset argument.
 *
 * <pre>
 * end       -> Latest
 * beginning -> Earliest
 * stored    -> Stored (committed offset of the consumer group)
 * 100       -> Absolute(100)
 * -5        -> TailRelative(5), five messages before the end
 * </pre>
 */
public final class OffsetResolver {

  private OffsetResolver() {}

  public static OffsetDirective resolve(String spec) {
    if (spec == null) {
      throw new InvalidOffsetSpecException(null);
    }
    switch (spec) {
      case "end":
        return OffsetDirective.LATEST;
      case "beginning":
        return OffsetDirective.EARLIEST;
      case "stored":
        return OffsetDirective.STORED;
      default:
        break;
    }

    long value;
    try {
      value = Long.parseLong(spec.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOffsetSpecException(spec);
    }
    if (value == Long.MIN_VALUE) {
      throw new InvalidOffsetSpecException(spec);
    }
    return value >= 0
      ? new OffsetDirective.Absolute(value)
      : new OffsetDirective.TailRelative(-value);
  }
}
