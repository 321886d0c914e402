package com.scholary.botaudio.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for realtime audio beans.
 *
 * <p>Enables the RealtimeAudioProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(RealtimeAudioProperties.class)
public class RealtimeAudioConfig {}
