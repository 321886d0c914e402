package com.scholary.botaudio.session;

import com.scholary.botaudio.autopause.AutoPauseDecision;
import com.scholary.botaudio.control.RealtimeAudioMessageHandler;
import com.scholary.botaudio.playback.RealtimeAudioOutputManager;

/** Everything the realtime audio path keeps for one bot in a call. */
public record BotAudioSession(
    String botId,
    RealtimeAudioOutputManager outputManager,
    AutoPauseDecision autoPauseDecision,
    RealtimeAudioMessageHandler messageHandler) {

  /** Stop playback and drop anything still queued. */
  public void close() {
    outputManager.cleanup();
  }
}
