package com.scholary.botaudio.audio;

/**
 * Exception thrown when a PCM buffer cannot be converted to the output rate.
 *
 * <p>Typically a byte length that is not a whole number of 16-bit samples, or a non-positive
 * sample rate. The playback worker drops the offending frame and moves on.
 */
public class AudioConversionException extends RuntimeException {

  public AudioConversionException(String message) {
    super(message);
  }

  public AudioConversionException(String message, Throwable cause) {
    super(message, cause);
  }
}
