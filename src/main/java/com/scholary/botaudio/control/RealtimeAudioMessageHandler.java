package com.scholary.botaudio.control;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.botaudio.autopause.AutoPauseDecision;
import com.scholary.botaudio.playback.RealtimeAudioOutputManager;
import java.util.Base64;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes messages from a bot's realtime audio websocket to its output manager.
 *
 * <p>Messages look like {@code {"trigger": "...", "data": {...}}}. Two triggers are handled:
 *
 * <ul>
 *   <li>{@code realtime_audio.bot_output}: {@code data.chunk} is base64 PCM, {@code
 *       data.sample_rate} its rate. The audio is handed to {@link
 *       RealtimeAudioOutputManager#addChunk}.
 *   <li>{@code realtime_audio.pause_current_lecture}: {@code data.duration} in milliseconds,
 *       converted to seconds for {@link RealtimeAudioOutputManager#pauseFor}.
 * </ul>
 *
 * <p>Malformed or unknown messages are logged and dropped. Nothing is thrown back to the
 * transport.
 */
public class RealtimeAudioMessageHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(RealtimeAudioMessageHandler.class);

  private final ObjectMapper objectMapper;
  private final RealtimeAudioOutputManager outputManager;
  private final AutoPauseDecision autoPauseDecision;

  public RealtimeAudioMessageHandler(
      ObjectMapper objectMapper,
      RealtimeAudioOutputManager outputManager,
      AutoPauseDecision autoPauseDecision) {
    this.objectMapper = objectMapper;
    this.outputManager = outputManager;
    this.autoPauseDecision = autoPauseDecision;
  }

  /**
   * Handle one text message from the websocket.
   *
   * @return the trigger that was acted on, or empty if the message was ignored
   */
  public Optional<RealtimeTrigger> onMessage(String message) {
    JsonNode root;
    try {
      root = objectMapper.readTree(message);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      LOGGER.warn("Ignoring unparseable realtime audio message: {}", e.getMessage());
      return Optional.empty();
    }
    if (root == null || !root.isObject()) {
      LOGGER.warn("Ignoring realtime audio message that is not a JSON object");
      return Optional.empty();
    }

    String code = root.path("trigger").asText("");
    Optional<RealtimeTrigger> trigger = RealtimeTrigger.fromApiCode(code);
    if (trigger.isEmpty()) {
      LOGGER.warn("Ignoring realtime audio message with unknown trigger '{}'", code);
      return Optional.empty();
    }

    JsonNode data = root.path("data");
    boolean handled;
    if (trigger.get() == RealtimeTrigger.BOT_OUTPUT) {
      handled = handleBotOutput(data);
    } else {
      handled = handlePause(data);
    }
    return handled ? trigger : Optional.empty();
  }

  /** Feed inbound mixed audio from the other participants to the auto-pause check. */
  public boolean onMixedAudio(byte[] mixedAudio) {
    return autoPauseDecision.maybePause(mixedAudio);
  }

  private boolean handleBotOutput(JsonNode data) {
    JsonNode chunk = data.path("chunk");
    JsonNode sampleRate = data.path("sample_rate");
    if (!chunk.isTextual() || !sampleRate.canConvertToInt()) {
      LOGGER.warn("Ignoring bot_output message without chunk/sample_rate");
      return false;
    }
    byte[] pcm;
    try {
      pcm = Base64.getDecoder().decode(chunk.asText());
    } catch (IllegalArgumentException e) {
      LOGGER.warn("Ignoring bot_output message with invalid base64 chunk: {}", e.getMessage());
      return false;
    }
    outputManager.addChunk(pcm, sampleRate.intValue());
    return true;
  }

  private boolean handlePause(JsonNode data) {
    JsonNode duration = data.path("duration");
    if (!duration.isNumber()) {
      LOGGER.warn("Ignoring pause message without numeric duration");
      return false;
    }
    double seconds = duration.doubleValue() / 1000.0;
    LOGGER.info("Pause requested over websocket: {}s", seconds);
    outputManager.pauseFor(seconds);
    return true;
  }
}
