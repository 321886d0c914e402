package com.scholary.botaudio.playback;

import java.util.concurrent.atomic.LongAdder;

final class PlaybackCounters {

  final LongAdder enqueued = new LongAdder();
  final LongAdder played = new LongAdder();
  final LongAdder failed = new LongAdder();
  final LongAdder dropped = new LongAdder();
  final LongAdder workerStarts = new LongAdder();

  PlaybackStats snapshot() {
    return new PlaybackStats(
        enqueued.sum(), played.sum(), failed.sum(), dropped.sum(), workerStarts.sum());
  }
}
