package com.scholary.botaudio.audio;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coalesces arbitrarily sized inbound PCM chunks into fixed 100ms frames.
 *
 * <p>Producers push whatever the transport hands them. Each time the buffer holds at least one
 * full frame at the chunk's sample rate, that frame is cut off and forwarded to the consumer; the
 * remainder stays buffered for the next call.
 *
 * <p>If more than {@link #STALE_GAP_MILLIS}ms pass between calls, whatever is left in the buffer
 * is the tail of a previous utterance and is discarded rather than glued onto new speech.
 *
 * <p>Not thread-safe. Callers serialize their producer calls.
 */
public class ChunkAccumulator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkAccumulator.class);

  public static final long STALE_GAP_MILLIS = 150;

  private static final long STALE_GAP_NANOS = TimeUnit.MILLISECONDS.toNanos(STALE_GAP_MILLIS);

  private final Consumer<AudioFrame> frameConsumer;
  private final LongSupplier nanoClock;

  private byte[] buffer = new byte[0];
  private int bufferedBytes;
  private int bufferedSampleRate;
  // Read by the playback worker for its idle timeout.
  private volatile long lastActivityNanos;

  public ChunkAccumulator(Consumer<AudioFrame> frameConsumer) {
    this(frameConsumer, System::nanoTime);
  }

  ChunkAccumulator(Consumer<AudioFrame> frameConsumer, LongSupplier nanoClock) {
    this.frameConsumer = Objects.requireNonNull(frameConsumer, "frameConsumer");
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    this.lastActivityNanos = nanoClock.getAsLong();
  }

  /**
   * Append a chunk and forward every complete frame it produces.
   *
   * @param chunk raw 16-bit mono PCM, any length
   * @param sampleRate rate the chunk was produced at
   * @return number of frames forwarded by this call
   */
  public int add(byte[] chunk, int sampleRate) {
    Objects.requireNonNull(chunk, "chunk");
    long now = nanoClock.getAsLong();
    boolean stale = now - lastActivityNanos > STALE_GAP_NANOS;
    lastActivityNanos = now;

    int frameSize = PcmFormat.frameSizeBytes(sampleRate);
    if (frameSize <= 0) {
      LOGGER.warn(
          "Rejecting chunk: sample rate {} yields frame size {} bytes", sampleRate, frameSize);
      return 0;
    }

    if (bufferedBytes > 0 && (stale || sampleRate != bufferedSampleRate)) {
      LOGGER.debug(
          "Discarding {} residual bytes (stale={}, rate {} -> {})",
          bufferedBytes,
          stale,
          bufferedSampleRate,
          sampleRate);
      bufferedBytes = 0;
    }
    bufferedSampleRate = sampleRate;

    append(chunk);

    int frames = 0;
    int offset = 0;
    while (bufferedBytes - offset >= frameSize) {
      frameConsumer.accept(
          new AudioFrame(Arrays.copyOfRange(buffer, offset, offset + frameSize), sampleRate));
      offset += frameSize;
      frames++;
    }
    if (offset > 0) {
      System.arraycopy(buffer, offset, buffer, 0, bufferedBytes - offset);
      bufferedBytes -= offset;
    }
    return frames;
  }

  /** Bytes currently held back waiting for a full frame. */
  public int bufferedBytes() {
    return bufferedBytes;
  }

  /** Monotonic timestamp of the last {@link #add} call. */
  public long lastActivityNanos() {
    return lastActivityNanos;
  }

  public long nanosSinceLastActivity() {
    return nanoClock.getAsLong() - lastActivityNanos;
  }

  private void append(byte[] chunk) {
    int required = bufferedBytes + chunk.length;
    if (required > buffer.length) {
      buffer = Arrays.copyOf(buffer, Math.max(required, buffer.length * 2));
    }
    System.arraycopy(chunk, 0, buffer, bufferedBytes, chunk.length);
    bufferedBytes = required;
  }
}
