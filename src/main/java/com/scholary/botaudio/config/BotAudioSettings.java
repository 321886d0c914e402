package com.scholary.botaudio.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Audio-related settings stored on a bot.
 *
 * <p>Read from the bot's settings document, where they live under {@code
 * websocket_settings.audio}. Anything missing is null and falls back to process-wide defaults.
 *
 * @param pauseThreshold loudness at or above which inbound audio auto-pauses output
 */
public record BotAudioSettings(Integer pauseThreshold) {

  public static BotAudioSettings empty() {
    return new BotAudioSettings(null);
  }

  /** Extract the audio settings from a bot settings tree. Missing nodes are fine. */
  public static BotAudioSettings fromSettings(JsonNode settings) {
    if (settings == null) {
      return empty();
    }
    JsonNode threshold = settings.path("websocket_settings").path("audio").path("pause_threshold");
    return new BotAudioSettings(threshold.isNumber() ? threshold.intValue() : null);
  }

  /**
   * Parse a bot settings document.
   *
   * @throws IllegalArgumentException if the document is not valid JSON
   */
  public static BotAudioSettings parse(ObjectMapper objectMapper, String settingsJson) {
    if (settingsJson == null || settingsJson.isBlank()) {
      return empty();
    }
    try {
      return fromSettings(objectMapper.readTree(settingsJson));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid bot settings JSON", e);
    }
  }
}
