package io.github.themoah.kfc.consumer;

/**
 * Count of records written to the output. Confined to the control thread.
 */
public class ConsumeStats {

  private long rx;

  /**
   * Counts one emitted record.
   *
   * @return the new total
   */
  public long recordEmitted() {
    return ++rx;
  }

  public long rx() {
    return rx;
  }
}
