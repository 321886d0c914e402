package com.scholary.botaudio.autopause;

import com.scholary.botaudio.audio.PcmFormat;
import com.scholary.botaudio.logging.StructuredLogger;
import com.scholary.botaudio.playback.PauseTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutes the bot while other participants are audibly talking.
 *
 * <p>Each inbound mixed-audio chunk is reduced to its RMS level. At or above the threshold, the
 * target is paused for a fixed window. Loud audio keeps re-arming the same window, and since
 * pauses combine by maximum the bot stays quiet until the room has been below the threshold for
 * one full window.
 *
 * <p>The threshold is fixed at construction; see {@link AutoPauseThresholdResolver}.
 */
public class AutoPauseDecision {

  private static final Logger LOGGER = LoggerFactory.getLogger(AutoPauseDecision.class);
  private static final StructuredLogger STRUCTURED = new StructuredLogger(LOGGER);

  private final PauseTarget target;
  private final int threshold;
  private final double pauseDurationSeconds;

  public AutoPauseDecision(PauseTarget target, int threshold, double pauseDurationSeconds) {
    if (threshold <= 0) {
      throw new IllegalArgumentException("threshold must be positive: " + threshold);
    }
    if (!(pauseDurationSeconds > 0)) {
      throw new IllegalArgumentException(
          "pause duration must be positive: " + pauseDurationSeconds);
    }
    this.target = target;
    this.threshold = threshold;
    this.pauseDurationSeconds = pauseDurationSeconds;
  }

  /**
   * Inspect one chunk of inbound audio and pause the target if it is loud enough.
   *
   * @return true if a pause was requested
   */
  public boolean maybePause(byte[] mixedAudio) {
    if (mixedAudio == null || mixedAudio.length < PcmFormat.BYTES_PER_SAMPLE) {
      return false;
    }
    double level = rms(mixedAudio);
    if (level < threshold) {
      return false;
    }
    STRUCTURED.logAutoPauseTriggered(level, threshold, pauseDurationSeconds);
    target.pauseFor(pauseDurationSeconds);
    return true;
  }

  public int threshold() {
    return threshold;
  }

  public double pauseDurationSeconds() {
    return pauseDurationSeconds;
  }

  /** Root mean square over whole 16-bit samples; a trailing odd byte is ignored. */
  static double rms(byte[] pcm) {
    int samples = pcm.length / PcmFormat.BYTES_PER_SAMPLE;
    if (samples == 0) {
      return 0;
    }
    double sumOfSquares = 0;
    for (int i = 0; i < samples; i++) {
      double sample = PcmFormat.sampleAt(pcm, i);
      sumOfSquares += sample * sample;
    }
    return Math.sqrt(sumOfSquares / samples);
  }
}
