package io.github.themoah.kfc.model;

/**
 * Where consumption starts on each selected partition.
 */
public sealed interface OffsetDirective
    permits OffsetDirective.Earliest, OffsetDirective.Latest, OffsetDirective.Stored,
    OffsetDirective.Absolute, OffsetDirective.TailRelative {

  /** Oldest offset still retained by the broker. */
  record Earliest() implements OffsetDirective {}

  /** Current end of the partition; only new messages are consumed. */
  record Latest() implements OffsetDirective {}

  /** Offset committed for the configured consumer group. */
  record Stored() implements OffsetDirective {}

  /**
   * Fixed offset.
   *
   * @param offset non-negative log offset
   */
  record Absolute(long offset) implements OffsetDirective {
    public Absolute {
      if (offset < 0) {
        throw new IllegalArgumentException("offset must be >= 0: " + offset);
      }
    }
  }

  /**
   * {@code count} messages before the current end of the partition.
   *
   * @param count number of trailing messages, always positive
   */
  record TailRelative(long count) implements OffsetDirective {
    public TailRelative {
      if (count <= 0) {
        throw new IllegalArgumentException("count must be > 0: " + count);
      }
    }
  }

  OffsetDirective EARLIEST = new Earliest();
  OffsetDirective LATEST = new Latest();
  OffsetDirective STORED = new Stored();
}
