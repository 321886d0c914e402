package com.scholary.botaudio.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.scholary.botaudio.autopause.AutoPauseDecision;
import com.scholary.botaudio.autopause.AutoPauseThresholdResolver;
import com.scholary.botaudio.config.BotAudioSettings;
import com.scholary.botaudio.config.RealtimeAudioProperties;
import com.scholary.botaudio.control.RealtimeAudioMessageHandler;
import com.scholary.botaudio.playback.AudioSink;
import com.scholary.botaudio.playback.RealtimeAudioOutputManager;
import com.scholary.botaudio.playback.RealtimeAudioOutputManagerFactory;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Live audio sessions, one per bot.
 *
 * <p>Backed by a Caffeine cache so a bot that disappears without saying goodbye is eventually
 * reclaimed. However a session leaves the cache (explicit close, idle expiry, size eviction,
 * shutdown) its output manager is cleaned up, which stops the worker and drops queued audio.
 */
@Component
public class AudioSessionRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioSessionRegistry.class);

  private final RealtimeAudioOutputManagerFactory managerFactory;
  private final AutoPauseThresholdResolver thresholdResolver;
  private final ObjectMapper objectMapper;
  private final double autoPauseDurationSeconds;
  private final Cache<String, BotAudioSession> sessions;

  public AudioSessionRegistry(
      RealtimeAudioOutputManagerFactory managerFactory,
      AutoPauseThresholdResolver thresholdResolver,
      ObjectMapper objectMapper,
      RealtimeAudioProperties properties) {
    this.managerFactory = managerFactory;
    this.thresholdResolver = thresholdResolver;
    this.objectMapper = objectMapper;
    this.autoPauseDurationSeconds = properties.autoPause().durationSeconds();

    RealtimeAudioProperties.SessionProperties session = properties.session();
    this.sessions =
        Caffeine.newBuilder()
            .maximumSize(session.maxSessions())
            .expireAfterAccess(Duration.ofMinutes(session.expireAfterIdleMinutes()))
            .executor(Runnable::run)
            .removalListener(
                (String botId, BotAudioSession removed, RemovalCause cause) -> {
                  if (removed != null) {
                    LOGGER.info("Closing audio session: botId={}, cause={}", botId, cause);
                    removed.close();
                  }
                })
            .build();

    LOGGER.info(
        "Initialized audio session registry: maxSessions={}, expireAfterIdleMinutes={}",
        session.maxSessions(),
        session.expireAfterIdleMinutes());
  }

  /**
   * Get the bot's session, creating it on first use.
   *
   * <p>An existing session keeps its original sink and settings.
   */
  public BotAudioSession open(String botId, AudioSink sink, BotAudioSettings settings) {
    return sessions.get(botId, id -> create(id, sink, settings));
  }

  public Optional<BotAudioSession> find(String botId) {
    return Optional.ofNullable(sessions.getIfPresent(botId));
  }

  /**
   * Route a websocket message to the bot's session.
   *
   * @return false if the bot has no session
   */
  public boolean dispatch(String botId, String message) {
    BotAudioSession session = sessions.getIfPresent(botId);
    if (session == null) {
      LOGGER.warn("Dropping realtime audio message for unknown bot: botId={}", botId);
      return false;
    }
    session.messageHandler().onMessage(message);
    return true;
  }

  /**
   * Feed inbound mixed audio for a bot to its auto-pause check.
   *
   * @return true if the bot's output was paused
   */
  public boolean onMixedAudio(String botId, byte[] mixedAudio) {
    BotAudioSession session = sessions.getIfPresent(botId);
    return session != null && session.messageHandler().onMixedAudio(mixedAudio);
  }

  public void close(String botId) {
    sessions.invalidate(botId);
  }

  public long size() {
    sessions.cleanUp();
    return sessions.estimatedSize();
  }

  @PreDestroy
  public void closeAll() {
    sessions.invalidateAll();
    sessions.cleanUp();
  }

  private BotAudioSession create(String botId, AudioSink sink, BotAudioSettings settings) {
    RealtimeAudioOutputManager manager = managerFactory.create(botId, sink);
    int threshold = thresholdResolver.resolve(settings);
    AutoPauseDecision decision =
        new AutoPauseDecision(manager, threshold, autoPauseDurationSeconds);
    RealtimeAudioMessageHandler handler =
        new RealtimeAudioMessageHandler(objectMapper, manager, decision);
    LOGGER.info("Opened audio session: botId={}, autoPauseThreshold={}", botId, threshold);
    return new BotAudioSession(botId, manager, decision, handler);
  }
}
