package com.scholary.botaudio.playback;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;

/**
 * Shared "paused until" deadline consulted by the playback worker.
 *
 * <p>Any thread may extend the deadline. Extensions never shorten it and never add up: two
 * overlapping pauses of 2s and 3s end 3s after the later request, not 5s.
 *
 * <p>Waiters block on a condition that is signalled whenever the deadline moves or the gate is
 * woken for shutdown. Waits are still sliced to {@link #MAX_WAIT_SLICE_MILLIS} so a stop flag
 * flipped without a wake-up is noticed promptly.
 *
 * <p>The gate uses its own lock and never calls out while holding it.
 */
public class PauseGate {

  public static final long MAX_WAIT_SLICE_MILLIS = 50;

  private static final long MAX_WAIT_SLICE_NANOS =
      TimeUnit.MILLISECONDS.toNanos(MAX_WAIT_SLICE_MILLIS);

  // Caps absurd durations so now + duration cannot overflow.
  private static final long MAX_PAUSE_NANOS = TimeUnit.DAYS.toNanos(365);

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final LongSupplier nanoClock;

  private boolean armed;
  private long pausedUntilNanos;

  public PauseGate() {
    this(System::nanoTime);
  }

  PauseGate(LongSupplier nanoClock) {
    this.nanoClock = nanoClock;
  }

  /**
   * Raise the deadline to {@code max(current, now + durationSeconds)}.
   *
   * @return true if the deadline moved
   */
  public boolean pauseFor(double durationSeconds) {
    if (!(durationSeconds > 0)) {
      return false;
    }
    long durationNanos = (long) Math.min(durationSeconds * 1_000_000_000d, MAX_PAUSE_NANOS);
    long candidate = nanoClock.getAsLong() + durationNanos;

    lock.lock();
    try {
      if (armed && candidate - pausedUntilNanos <= 0) {
        return false;
      }
      armed = true;
      pausedUntilNanos = candidate;
      changed.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** Time left until playback may resume, zero when not paused. */
  public Duration remaining() {
    return Duration.ofNanos(remainingNanos());
  }

  public boolean isPaused() {
    return remainingNanos() > 0;
  }

  long remainingNanos() {
    lock.lock();
    try {
      return remainingNanosLocked();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Block until the deadline has passed or {@code stopRequested} turns true.
   *
   * @return true if the gate is clear, false if the wait ended because of a stop request
   */
  public boolean awaitClear(BooleanSupplier stopRequested) throws InterruptedException {
    lock.lock();
    try {
      while (!stopRequested.getAsBoolean()) {
        long remaining = remainingNanosLocked();
        if (remaining <= 0) {
          return true;
        }
        changed.awaitNanos(Math.min(remaining, MAX_WAIT_SLICE_NANOS));
      }
      return false;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Sleep for up to {@code nanos}, returning early when a pause becomes active or a stop is
   * requested.
   *
   * @return true if the full duration elapsed undisturbed
   */
  public boolean sleepUnlessPaused(long nanos, BooleanSupplier stopRequested)
      throws InterruptedException {
    if (nanos <= 0) {
      return true;
    }
    long end = nanoClock.getAsLong() + nanos;
    lock.lock();
    try {
      while (!stopRequested.getAsBoolean()) {
        if (remainingNanosLocked() > 0) {
          return false;
        }
        long left = end - nanoClock.getAsLong();
        if (left <= 0) {
          return true;
        }
        changed.awaitNanos(Math.min(left, MAX_WAIT_SLICE_NANOS));
      }
      return false;
    } finally {
      lock.unlock();
    }
  }

  /** Wake every waiter so it re-checks its stop condition. */
  public void wakeAll() {
    lock.lock();
    try {
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /** Clear any pending pause. Only used when the owning manager is cleaned up. */
  public void reset() {
    lock.lock();
    try {
      armed = false;
      pausedUntilNanos = 0;
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  private long remainingNanosLocked() {
    if (!armed) {
      return 0;
    }
    return Math.max(pausedUntilNanos - nanoClock.getAsLong(), 0);
  }
}
