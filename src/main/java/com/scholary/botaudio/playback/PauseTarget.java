package com.scholary.botaudio.playback;

/** Anything that can be asked to hold its output for a while. */
@FunctionalInterface
public interface PauseTarget {

  /**
   * Suspend output for at least {@code durationSeconds} from now.
   *
   * <p>Overlapping requests combine by taking the later deadline. Non-positive durations are
   * ignored.
   */
  void pauseFor(double durationSeconds);
}
