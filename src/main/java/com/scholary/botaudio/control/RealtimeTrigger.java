package com.scholary.botaudio.control;

import java.util.Arrays;
import java.util.Optional;

/** Triggers understood on the realtime audio websocket. */
public enum RealtimeTrigger {
  /** Speech for the bot to play: base64 PCM plus its sample rate. */
  BOT_OUTPUT("realtime_audio.bot_output"),

  /** Hold the bot's speech for {@code duration} milliseconds. */
  PAUSE_CURRENT_LECTURE("realtime_audio.pause_current_lecture");

  private final String apiCode;

  RealtimeTrigger(String apiCode) {
    this.apiCode = apiCode;
  }

  public String apiCode() {
    return apiCode;
  }

  public static Optional<RealtimeTrigger> fromApiCode(String apiCode) {
    return Arrays.stream(values()).filter(t -> t.apiCode.equals(apiCode)).findFirst();
  }
}
