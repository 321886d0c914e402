package com.scholary.botaudio.audio;

import java.util.Arrays;

/**
 * One fixed-duration slice of PCM audio together with the rate it was captured at.
 *
 * <p>The byte array is copied on the way in and on the way out so a frame can be handed between
 * threads without further synchronization.
 */
public record AudioFrame(byte[] pcm, int sampleRate) {

  public AudioFrame {
    if (pcm == null) {
      throw new IllegalArgumentException("pcm must not be null");
    }
    if (sampleRate <= 0) {
      throw new IllegalArgumentException("sample rate must be positive: " + sampleRate);
    }
    pcm = pcm.clone();
  }

  @Override
  public byte[] pcm() {
    return pcm.clone();
  }

  public int lengthBytes() {
    return pcm.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AudioFrame other)) {
      return false;
    }
    return sampleRate == other.sampleRate && Arrays.equals(pcm, other.pcm);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(pcm) + sampleRate;
  }

  @Override
  public String toString() {
    return "AudioFrame[bytes=" + pcm.length + ", sampleRate=" + sampleRate + "]";
  }
}
