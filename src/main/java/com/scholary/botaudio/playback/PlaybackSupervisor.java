package com.scholary.botaudio.playback;

import java.util.concurrent.ThreadFactory;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the lifecycle of a manager's playback worker.
 *
 * <p>The worker is either {@link WorkerState#IDLE} (no thread) or {@link WorkerState#RUNNING}.
 * Transitions happen under the lifecycle lock; the state field is volatile so producers can skip
 * the lock when a worker is already running.
 *
 * <p>Idle retirement can race with an enqueue. The worker flips to IDLE before looking at the
 * queue one last time, while producers offer before looking at the state, so either the worker
 * sees the new frame and stays or the producer sees IDLE and starts a new worker.
 *
 * <p>The lifecycle lock is never held while joining a worker or touching the pause gate.
 */
class PlaybackSupervisor {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlaybackSupervisor.class);

  enum WorkerState {
    IDLE,
    RUNNING
  }

  private final Object lifecycleLock = new Object();
  private final PlaybackQueue queue;
  private final ThreadFactory threadFactory;
  private final Function<PlaybackSupervisor, PlaybackWorker> workerFactory;
  private final PlaybackCounters counters;

  private volatile WorkerState state = WorkerState.IDLE;
  private PlaybackWorker current;
  private Thread currentThread;

  PlaybackSupervisor(
      PlaybackQueue queue,
      ThreadFactory threadFactory,
      Function<PlaybackSupervisor, PlaybackWorker> workerFactory,
      PlaybackCounters counters) {
    this.queue = queue;
    this.threadFactory = threadFactory;
    this.workerFactory = workerFactory;
    this.counters = counters;
  }

  WorkerState state() {
    return state;
  }

  /** Start a worker unless one is already running. Safe to call from any thread. */
  void ensureRunning() {
    if (state == WorkerState.RUNNING) {
      return;
    }
    synchronized (lifecycleLock) {
      if (state == WorkerState.RUNNING) {
        return;
      }
      startLocked();
    }
  }

  /**
   * Called by an idle worker that wants to exit.
   *
   * @return true if the worker must exit, false if frames arrived and it should keep going
   */
  boolean retire(PlaybackWorker worker) {
    synchronized (lifecycleLock) {
      if (current != worker || worker.isStopRequested()) {
        return true;
      }
      state = WorkerState.IDLE;
      if (!queue.isEmpty()) {
        state = WorkerState.RUNNING;
        return false;
      }
      current = null;
      currentThread = null;
      return true;
    }
  }

  /**
   * Called from the worker's own thread on the way out, whatever the reason.
   *
   * <p>If the worker died without being stopped or retired and frames are still queued, a
   * replacement is started.
   */
  void workerExited(PlaybackWorker worker) {
    synchronized (lifecycleLock) {
      if (current != worker || worker.isStopRequested()) {
        return;
      }
      current = null;
      currentThread = null;
      state = WorkerState.IDLE;
      if (!queue.isEmpty()) {
        LOGGER.warn(
            "Playback worker exited with {} frames queued; starting a new one", queue.size());
        startLocked();
      }
    }
  }

  /**
   * Stop the running worker, if any, and wait for its thread to finish.
   *
   * @param whileStopping run after the stop flag is set and before joining, outside the lock
   */
  void stop(Runnable whileStopping) {
    PlaybackWorker worker;
    Thread thread;
    synchronized (lifecycleLock) {
      worker = current;
      thread = currentThread;
      if (worker != null) {
        worker.requestStop();
      }
    }

    whileStopping.run();

    if (thread != null) {
      if (thread == Thread.currentThread()) {
        LOGGER.warn("stop() called from the playback thread itself; not joining");
      } else {
        joinUninterruptibly(thread);
      }
    }

    synchronized (lifecycleLock) {
      if (worker != null && current == worker) {
        current = null;
        currentThread = null;
        state = WorkerState.IDLE;
      }
    }
  }

  private void startLocked() {
    PlaybackWorker worker = workerFactory.apply(this);
    Thread thread = threadFactory.newThread(worker);
    current = worker;
    currentThread = thread;
    state = WorkerState.RUNNING;
    counters.workerStarts.increment();
    thread.start();
  }

  private static void joinUninterruptibly(Thread thread) {
    boolean interrupted = false;
    while (true) {
      try {
        thread.join();
        break;
      } catch (InterruptedException e) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }
}
