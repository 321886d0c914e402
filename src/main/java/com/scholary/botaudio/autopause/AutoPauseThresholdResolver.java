package com.scholary.botaudio.autopause;

import com.scholary.botaudio.config.BotAudioSettings;
import com.scholary.botaudio.config.RealtimeAudioProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Decides which loudness threshold a bot's auto-pause uses.
 *
 * <p>Precedence, first match wins:
 *
 * <ol>
 *   <li>the bot's own {@code websocket_settings.audio.pause_threshold}
 *   <li>the {@value #THRESHOLD_ENV_VAR} environment variable
 *   <li>{@code realtime-audio.auto-pause.default-threshold}
 * </ol>
 *
 * <p>Values that are not positive integers are logged and skipped.
 */
@Component
public class AutoPauseThresholdResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(AutoPauseThresholdResolver.class);

  public static final String THRESHOLD_ENV_VAR = "REALTIME_AUDIO_AUTOPAUSE_THRESHOLD";

  private final Environment environment;
  private final int defaultThreshold;

  public AutoPauseThresholdResolver(Environment environment, RealtimeAudioProperties properties) {
    this.environment = environment;
    this.defaultThreshold = properties.autoPause().defaultThreshold();
  }

  public int resolve(BotAudioSettings settings) {
    if (settings != null && settings.pauseThreshold() != null) {
      int configured = settings.pauseThreshold();
      if (configured > 0) {
        return configured;
      }
      LOGGER.warn("Ignoring non-positive bot pause_threshold: {}", configured);
    }

    String override = environment.getProperty(THRESHOLD_ENV_VAR);
    if (override != null && !override.isBlank()) {
      try {
        int value = Integer.parseInt(override.trim());
        if (value > 0) {
          return value;
        }
        LOGGER.warn("Ignoring non-positive {}: {}", THRESHOLD_ENV_VAR, value);
      } catch (NumberFormatException e) {
        LOGGER.warn("Ignoring non-numeric {}: '{}'", THRESHOLD_ENV_VAR, override);
      }
    }

    return defaultThreshold;
  }
}
