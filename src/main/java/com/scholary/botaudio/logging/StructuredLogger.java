package com.scholary.botaudio.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Playback events carry an {@code event_type} plus event-specific fields so they can be
 * filtered per bot in the log pipeline. The bot id itself is set once per thread via {@link
 * #setBotContext(String)}.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log playback worker start. */
  public void logWorkerStarted(String threadName, int queuedFrames) {
    try {
      MDC.put("event_type", "worker_started");
      MDC.put("thread", threadName);
      MDC.put("queuedFrames", String.valueOf(queuedFrames));

      logger.info("Playback worker started: thread={}, queued={}", threadName, queuedFrames);
    } finally {
      clearEventFields();
    }
  }

  /** Log playback worker exit. */
  public void logWorkerExited(String threadName, String reason, long framesPlayed) {
    try {
      MDC.put("event_type", "worker_exited");
      MDC.put("thread", threadName);
      MDC.put("reason", reason);
      MDC.put("framesPlayed", String.valueOf(framesPlayed));

      logger.info(
          "Playback worker exited: thread={}, reason={}, framesPlayed={}",
          threadName,
          reason,
          framesPlayed);
    } finally {
      clearEventFields();
    }
  }

  /** Log a frame that could not be played. */
  public void logFrameFailed(String stage, Throwable error) {
    try {
      MDC.put("event_type", "frame_failed");
      MDC.put("stage", stage);
      MDC.put("errorType", error.getClass().getSimpleName());

      logger.error("Frame failed during {}: {}", stage, error.getMessage(), error);
    } finally {
      clearEventFields();
    }
  }

  /** Log frames discarded without playback. */
  public void logFramesDropped(int count, String reason) {
    if (count == 0) {
      return;
    }
    try {
      MDC.put("event_type", "frames_dropped");
      MDC.put("droppedFrames", String.valueOf(count));
      MDC.put("reason", reason);

      logger.info("Dropped {} queued frames: reason={}", count, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log a pause request. */
  public void logPauseRequested(double durationSeconds, boolean extended) {
    try {
      MDC.put("event_type", "pause_requested");
      MDC.put("durationSeconds", String.valueOf(durationSeconds));
      MDC.put("extended", String.valueOf(extended));

      logger.debug("Pause requested: duration={}s, extended={}", durationSeconds, extended);
    } finally {
      clearEventFields();
    }
  }

  /** Log an auto-pause triggered by loud inbound audio. */
  public void logAutoPauseTriggered(double level, int threshold, double durationSeconds) {
    try {
      MDC.put("event_type", "auto_pause_triggered");
      MDC.put("level", String.format("%.1f", level));
      MDC.put("threshold", String.valueOf(threshold));
      MDC.put("durationSeconds", String.valueOf(durationSeconds));

      logger.debug(
          "Auto-pause: level={} >= threshold={}, pausing {}s",
          String.format("%.1f", level),
          threshold,
          durationSeconds);
    } finally {
      clearEventFields();
    }
  }

  /** Set bot context in MDC. */
  public static void setBotContext(String botId) {
    MDC.put("bot_id", botId);
  }

  /** Clear bot context from MDC. */
  public static void clearBotContext() {
    MDC.remove("bot_id");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("thread");
    MDC.remove("queuedFrames");
    MDC.remove("reason");
    MDC.remove("framesPlayed");
    MDC.remove("stage");
    MDC.remove("errorType");
    MDC.remove("droppedFrames");
    MDC.remove("durationSeconds");
    MDC.remove("extended");
    MDC.remove("level");
    MDC.remove("threshold");
  }
}
