package com.scholary.botaudio.playback;

/**
 * Downstream consumer of output audio, usually the bot's outbound track in the call.
 *
 * <p>Called from the playback worker thread, once per frame, always at the manager's output rate.
 * Exceptions thrown here are logged and the frame is counted as failed; playback continues with
 * the next frame.
 */
@FunctionalInterface
public interface AudioSink {

  void play(byte[] pcm, int sampleRate);
}
