package com.scholary.botaudio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BotAudioApplication {

  public static void main(String[] args) {
    SpringApplication.run(BotAudioApplication.class, args);
  }
}
