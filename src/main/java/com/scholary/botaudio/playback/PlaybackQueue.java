package com.scholary.botaudio.playback;

import com.scholary.botaudio.audio.AudioFrame;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Unbounded FIFO between producers and the playback worker.
 *
 * <p>Also remembers when the last frame was offered, which feeds the worker's idle timeout.
 */
public class PlaybackQueue {

  private final BlockingQueue<AudioFrame> frames = new LinkedBlockingQueue<>();
  private final LongSupplier nanoClock;
  private volatile long lastOfferNanos;

  public PlaybackQueue() {
    this(System::nanoTime);
  }

  PlaybackQueue(LongSupplier nanoClock) {
    this.nanoClock = nanoClock;
    this.lastOfferNanos = nanoClock.getAsLong();
  }

  public void offer(AudioFrame frame) {
    lastOfferNanos = nanoClock.getAsLong();
    frames.add(frame);
  }

  /** Next frame in enqueue order, or null if none arrived within the timeout. */
  public AudioFrame poll(long timeout, TimeUnit unit) throws InterruptedException {
    return frames.poll(timeout, unit);
  }

  /**
   * Remove everything still queued without handing it to anyone.
   *
   * @return number of frames discarded
   */
  public int drain() {
    List<AudioFrame> discarded = new ArrayList<>();
    frames.drainTo(discarded);
    return discarded.size();
  }

  public boolean isEmpty() {
    return frames.isEmpty();
  }

  public int size() {
    return frames.size();
  }

  public long nanosSinceLastOffer() {
    return nanoClock.getAsLong() - lastOfferNanos;
  }
}
