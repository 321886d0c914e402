package com.scholary.botaudio.playback;

import com.scholary.botaudio.audio.AudioFrame;
import com.scholary.botaudio.audio.ChunkAccumulator;
import com.scholary.botaudio.audio.PcmFormat;
import com.scholary.botaudio.logging.StructuredLogger;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Plays a bot's outbound speech into the call at a steady cadence.
 *
 * <p>Producers push raw 16-bit mono PCM of any size and rate through {@link #addChunk}. The audio
 * is cut into 100ms frames, queued, and played by a background worker that converts each frame to
 * the output rate and calls the {@link AudioSink}. The worker is started on demand and exits by
 * itself after {@link #IDLE_TIMEOUT} without any {@code addChunk} or {@code enqueue} call.
 *
 * <p>{@link #pauseFor} holds playback for a while (for example while a human is talking), and
 * {@link #cleanup} stops everything and throws away whatever is still queued.
 *
 * <p>Thread-safety: {@code pauseFor}, {@code enqueue} and {@code cleanup} may be called from any
 * thread. {@code addChunk} calls must be serialized by the producer.
 */
public class RealtimeAudioOutputManager implements PauseTarget {

  private static final Logger LOGGER = LoggerFactory.getLogger(RealtimeAudioOutputManager.class);
  private static final StructuredLogger STRUCTURED = new StructuredLogger(LOGGER);

  public static final Duration IDLE_TIMEOUT = Duration.ofSeconds(10);

  private final String label;
  private final int outputSampleRate;
  private final ChunkAccumulator accumulator;
  private final PlaybackQueue queue;
  private final PauseGate pauseGate;
  private final PlaybackSupervisor supervisor;
  private final PlaybackCounters counters = new PlaybackCounters();

  public RealtimeAudioOutputManager(
      AudioSink sink, double interChunkDelayMultiplier, int outputSampleRate) {
    this("default", sink, interChunkDelayMultiplier, outputSampleRate);
  }

  public RealtimeAudioOutputManager(
      String label, AudioSink sink, double interChunkDelayMultiplier, int outputSampleRate) {
    this(
        label,
        sink,
        interChunkDelayMultiplier,
        outputSampleRate,
        IDLE_TIMEOUT,
        daemonThreadFactory(label));
  }

  RealtimeAudioOutputManager(
      String label,
      AudioSink sink,
      double interChunkDelayMultiplier,
      int outputSampleRate,
      Duration idleTimeout,
      ThreadFactory threadFactory) {
    Objects.requireNonNull(sink, "sink");
    if (outputSampleRate <= 0) {
      throw new IllegalArgumentException(
          "output sample rate must be positive: " + outputSampleRate);
    }
    if (!(interChunkDelayMultiplier >= 0) || Double.isInfinite(interChunkDelayMultiplier)) {
      throw new IllegalArgumentException(
          "inter-chunk delay multiplier must be a finite value >= 0: " + interChunkDelayMultiplier);
    }
    this.label = label;
    this.outputSampleRate = outputSampleRate;
    this.queue = new PlaybackQueue();
    this.pauseGate = new PauseGate();
    this.accumulator = new ChunkAccumulator(this::enqueue);

    long pacingNanos =
        (long) (interChunkDelayMultiplier * PcmFormat.FRAME_DURATION_SECONDS * 1_000_000_000d);
    long idleTimeoutNanos = idleTimeout.toNanos();
    this.supervisor =
        new PlaybackSupervisor(
            queue,
            threadFactory,
            owner ->
                new PlaybackWorker(
                    owner,
                    queue,
                    pauseGate,
                    sink,
                    counters,
                    label,
                    outputSampleRate,
                    pacingNanos,
                    idleTimeoutNanos,
                    this::nanosSinceLastActivity),
            counters);

    LOGGER.debug(
        "Created output manager: label={}, outputRate={}, pacing={}ms",
        label,
        outputSampleRate,
        pacingNanos / 1_000_000);
  }

  /**
   * Accept a chunk of raw PCM from a producer.
   *
   * @param chunk 16-bit signed little-endian mono samples, any length
   * @param sampleRate rate the chunk was produced at
   */
  public void addChunk(byte[] chunk, int sampleRate) {
    accumulator.add(chunk, sampleRate);
  }

  /** Queue one ready frame for playback, starting the worker if none is running. */
  public void enqueue(AudioFrame frame) {
    Objects.requireNonNull(frame, "frame");
    queue.offer(frame);
    counters.enqueued.increment();
    supervisor.ensureRunning();
  }

  @Override
  public void pauseFor(double durationSeconds) {
    boolean extended = pauseGate.pauseFor(durationSeconds);
    if (durationSeconds > 0) {
      STRUCTURED.logPauseRequested(durationSeconds, extended);
    }
  }

  /** Time left on the current pause, zero when playing normally. */
  public Duration remainingPause() {
    return pauseGate.remaining();
  }

  /**
   * Stop the worker and discard every queued frame.
   *
   * <p>When this returns the sink will not be called again for anything enqueued before the call.
   * Any pending pause is cleared. The manager stays usable: a later {@link #addChunk} starts a
   * new worker. Calling this repeatedly is harmless.
   */
  public void cleanup() {
    supervisor.stop(
        () -> {
          pauseGate.wakeAll();
          drop(queue.drain());
        });
    drop(queue.drain());
    pauseGate.reset();
    LOGGER.debug("Output manager cleaned up: label={}", label);
  }

  public boolean isWorkerRunning() {
    return supervisor.state() == PlaybackSupervisor.WorkerState.RUNNING;
  }

  public int outputSampleRate() {
    return outputSampleRate;
  }

  public String label() {
    return label;
  }

  public PlaybackStats stats() {
    return counters.snapshot();
  }

  // Partial chunks still buffered count as activity, not only complete frames.
  private long nanosSinceLastActivity() {
    return Math.min(queue.nanosSinceLastOffer(), accumulator.nanosSinceLastActivity());
  }

  private void drop(int frames) {
    counters.dropped.add(frames);
    STRUCTURED.logFramesDropped(frames, "cleanup");
  }

  private static ThreadFactory daemonThreadFactory(String label) {
    CustomizableThreadFactory factory =
        new CustomizableThreadFactory("realtime-audio-" + label + "-");
    factory.setDaemon(true);
    return factory;
  }
}
