package com.scholary.botaudio.playback;

import com.scholary.botaudio.config.RealtimeAudioProperties;
import org.springframework.stereotype.Component;

/** Creates output managers with the configured output rate and pacing. */
@Component
public class RealtimeAudioOutputManagerFactory {

  private final RealtimeAudioProperties properties;

  public RealtimeAudioOutputManagerFactory(RealtimeAudioProperties properties) {
    this.properties = properties;
  }

  public RealtimeAudioOutputManager create(String botId, AudioSink sink) {
    return new RealtimeAudioOutputManager(
        botId, sink, properties.interChunkDelayMultiplier(), properties.outputSampleRate());
  }
}
