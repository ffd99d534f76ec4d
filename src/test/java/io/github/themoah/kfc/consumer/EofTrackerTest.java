package io.github.themoah.kfc.consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.kfc.model.PartitionSet;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for EofTracker.
 */
public class EofTrackerTest {

  private static final PartitionSet THREE = new PartitionSet("orders", List.of(0, 1, 2));

  @Test
  void threshold_allPartitions() {
    EofTracker tracker = new EofTracker(THREE, false, true, new RunState());

    assertEquals(3, tracker.threshold());
  }

  @Test
  void threshold_singlePartition() {
    EofTracker tracker = new EofTracker(new PartitionSet("orders", List.of(1)), true, true, new RunState());

    assertEquals(1, tracker.threshold());
  }

  @Test
  void stopsOnlyWhenEveryPartitionReachedEnd() {
    RunState runState = new RunState();
    EofTracker tracker = new EofTracker(THREE, false, true, runState);

    assertTrue(tracker.onPartitionEnd(2, 10));
    assertTrue(runState.isRunning());
    assertTrue(tracker.onPartitionEnd(0, 4));
    assertTrue(runState.isRunning());
    assertFalse(tracker.thresholdReached());

    assertTrue(tracker.onPartitionEnd(1, 7));

    assertFalse(runState.isRunning());
    assertEquals(RunState.StopReason.EOF_REACHED, runState.stopReason());
    assertEquals(3, tracker.eofCount());
    assertTrue(tracker.thresholdReached());
  }

  @Test
  void repeatedEnd_countsOnce() {
    RunState runState = new RunState();
    EofTracker tracker = new EofTracker(THREE, false, true, runState);

    assertTrue(tracker.onPartitionEnd(0, 4));
    assertFalse(tracker.onPartitionEnd(0, 4));
    assertFalse(tracker.onPartitionEnd(0, 9));
    assertTrue(tracker.onPartitionEnd(1, 1));

    assertEquals(2, tracker.eofCount());
    assertTrue(runState.isRunning());
    assertTrue(tracker.isAtEof(0));
    assertFalse(tracker.isAtEof(2));
  }

  @Test
  void eofCount_neverExceedsScope() {
    EofTracker tracker = new EofTracker(THREE, false, true, new RunState());

    for (int round = 0; round < 3; round++) {
      for (int partition = 0; partition < 3; partition++) {
        tracker.onPartitionEnd(partition, round);
      }
    }

    assertEquals(3, tracker.eofCount());
  }

  @Test
  void exitOnEofDisabled_neverStops() {
    RunState runState = new RunState();
    EofTracker tracker = new EofTracker(THREE, false, false, runState);

    assertFalse(tracker.onPartitionEnd(0, 1));
    assertFalse(tracker.onPartitionEnd(1, 1));
    assertFalse(tracker.onPartitionEnd(2, 1));

    assertTrue(runState.isRunning());
    assertEquals(0, tracker.eofCount());
    assertFalse(tracker.isAtEof(0));
  }

  @Test
  void partitionOutsideScope_isIgnored() {
    RunState runState = new RunState();
    EofTracker tracker = new EofTracker(new PartitionSet("orders", List.of(1)), true, true, runState);

    assertFalse(tracker.onPartitionEnd(0, 3));
    assertFalse(tracker.onPartitionEnd(2, 3));
    assertTrue(runState.isRunning());

    assertTrue(tracker.onPartitionEnd(1, 3));
    assertFalse(runState.isRunning());
  }

  @Test
  void alreadyStoppedRun_keepsOriginalReason() {
    RunState runState = new RunState();
    runState.stop(RunState.StopReason.MESSAGE_LIMIT);
    EofTracker tracker = new EofTracker(new PartitionSet("orders", List.of(0)), false, true, runState);

    assertTrue(tracker.onPartitionEnd(0, 3));

    assertEquals(RunState.StopReason.MESSAGE_LIMIT, runState.stopReason());
  }
}
