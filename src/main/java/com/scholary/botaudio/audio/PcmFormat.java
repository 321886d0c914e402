package com.scholary.botaudio.audio;

/**
 * The single PCM layout this pipeline handles: 16-bit signed little-endian mono.
 *
 * <p>Frames are fixed at 100ms of audio regardless of sample rate, so the byte size of a frame
 * depends on the rate it was produced at.
 */
public final class PcmFormat {

  public static final int BYTES_PER_SAMPLE = 2;
  public static final int CHANNELS = 1;
  public static final double FRAME_DURATION_SECONDS = 0.1;

  private PcmFormat() {}

  /**
   * Size in bytes of one frame at the given rate, rounded down to a whole sample.
   *
   * <p>Returns zero or a negative number for degenerate rates; callers must check.
   */
  public static int frameSizeBytes(int sampleRate) {
    return (int) (FRAME_DURATION_SECONDS * sampleRate) * BYTES_PER_SAMPLE;
  }

  /** Read the sample at {@code index} (in samples, not bytes). */
  public static short sampleAt(byte[] pcm, int index) {
    int offset = index * BYTES_PER_SAMPLE;
    return (short) ((pcm[offset] & 0xFF) | (pcm[offset + 1] << 8));
  }

  /** Write {@code value} at sample {@code index}. */
  public static void putSample(byte[] pcm, int index, short value) {
    int offset = index * BYTES_PER_SAMPLE;
    pcm[offset] = (byte) value;
    pcm[offset + 1] = (byte) (value >> 8);
  }
}
