package com.scholary.botaudio.playback;

/** Point-in-time counters for one output manager. */
public record PlaybackStats(
    long framesEnqueued,
    long framesPlayed,
    long framesFailed,
    long framesDropped,
    long workerStarts) {}
