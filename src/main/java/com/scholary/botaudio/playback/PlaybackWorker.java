package com.scholary.botaudio.playback;

import com.scholary.botaudio.audio.AudioFrame;
import com.scholary.botaudio.audio.SampleRateConverter;
import com.scholary.botaudio.logging.StructuredLogger;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single consumer of a manager's {@link PlaybackQueue}.
 *
 * <p>For each frame, in order: convert to the output rate, wait out any active pause, hand the
 * bytes to the sink, then sleep for the pacing interval. Each step that can block gives up within
 * {@link PauseGate#MAX_WAIT_SLICE_MILLIS}ms of a stop request.
 *
 * <p>A frame that fails to convert or that the sink rejects with a runtime exception is counted,
 * logged and skipped. An {@link Error} ends the thread, and the supervisor starts a replacement if
 * frames are still queued.
 *
 * <p>When no audio has arrived for the idle timeout the worker asks its supervisor to retire it
 * and exits. The next enqueue starts a fresh one.
 */
class PlaybackWorker implements Runnable {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlaybackWorker.class);
  private static final StructuredLogger STRUCTURED = new StructuredLogger(LOGGER);

  static final long QUEUE_POLL_MILLIS = PauseGate.MAX_WAIT_SLICE_MILLIS;

  private final PlaybackSupervisor supervisor;
  private final PlaybackQueue queue;
  private final PauseGate pauseGate;
  private final AudioSink sink;
  private final PlaybackCounters counters;
  private final String label;
  private final int outputSampleRate;
  private final long pacingNanos;
  private final long idleTimeoutNanos;
  private final LongSupplier nanosSinceLastActivity;

  private volatile boolean stopRequested;

  PlaybackWorker(
      PlaybackSupervisor supervisor,
      PlaybackQueue queue,
      PauseGate pauseGate,
      AudioSink sink,
      PlaybackCounters counters,
      String label,
      int outputSampleRate,
      long pacingNanos,
      long idleTimeoutNanos,
      LongSupplier nanosSinceLastActivity) {
    this.supervisor = supervisor;
    this.queue = queue;
    this.pauseGate = pauseGate;
    this.sink = sink;
    this.counters = counters;
    this.label = label;
    this.outputSampleRate = outputSampleRate;
    this.pacingNanos = pacingNanos;
    this.idleTimeoutNanos = idleTimeoutNanos;
    this.nanosSinceLastActivity = nanosSinceLastActivity;
  }

  void requestStop() {
    stopRequested = true;
  }

  boolean isStopRequested() {
    return stopRequested;
  }

  @Override
  public void run() {
    String threadName = Thread.currentThread().getName();
    StructuredLogger.setBotContext(label);
    STRUCTURED.logWorkerStarted(threadName, queue.size());
    long playedBefore = counters.played.sum();
    String exitReason = "stopped";
    try {
      while (!stopRequested) {
        AudioFrame frame = queue.poll(QUEUE_POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (frame == null) {
          if (nanosSinceLastActivity.getAsLong() > idleTimeoutNanos && supervisor.retire(this)) {
            exitReason = stopRequested ? "stopped" : "idle";
            break;
          }
          continue;
        }
        playFrame(frame);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      exitReason = "interrupted";
    } catch (RuntimeException | Error e) {
      exitReason = "crashed";
      LOGGER.error("Playback worker terminated unexpectedly", e);
      throw e;
    } finally {
      supervisor.workerExited(this);
      STRUCTURED.logWorkerExited(threadName, exitReason, counters.played.sum() - playedBefore);
      StructuredLogger.clearBotContext();
    }
  }

  private void playFrame(AudioFrame frame) throws InterruptedException {
    byte[] output;
    try {
      output = SampleRateConverter.convert(frame, outputSampleRate);
    } catch (RuntimeException e) {
      counters.failed.increment();
      STRUCTURED.logFrameFailed("conversion", e);
      return;
    }

    if (!pauseGate.awaitClear(this::isStopRequested)) {
      counters.dropped.increment();
      return;
    }

    try {
      sink.play(output, outputSampleRate);
      counters.played.increment();
    } catch (RuntimeException e) {
      counters.failed.increment();
      STRUCTURED.logFrameFailed("sink", e);
    } catch (Error e) {
      // Not recoverable on this thread; the supervisor starts a replacement for queued frames.
      counters.failed.increment();
      throw e;
    }

    pauseGate.sleepUnlessPaused(pacingNanos, this::isStopRequested);
  }
}
