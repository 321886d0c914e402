package com.scholary.botaudio.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for realtime bot audio output.
 *
 * <p>These map to the "realtime-audio.*" keys in application.yml. Frame length, the stale-buffer
 * gap and the worker idle timeout are fixed in code and deliberately not exposed here.
 */
@ConfigurationProperties(prefix = "realtime-audio")
@Validated
public record RealtimeAudioProperties(
    @Positive int outputSampleRate,
    @PositiveOrZero double interChunkDelayMultiplier,
    @NotNull @Valid AutoPauseProperties autoPause,
    @NotNull @Valid SessionProperties session) {

  /**
   * Loudness-driven auto-pause.
   *
   * <p>{@code defaultThreshold} is the last resort after per-bot settings and the environment
   * override.
   */
  public record AutoPauseProperties(
      @Positive int defaultThreshold, @Positive double durationSeconds) {}

  public record SessionProperties(
      @Positive int maxSessions, @Positive int expireAfterIdleMinutes) {}
}
