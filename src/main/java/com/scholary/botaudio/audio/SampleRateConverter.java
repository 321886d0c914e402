package com.scholary.botaudio.audio;

/**
 * Converts 16-bit mono PCM from a source rate to the fixed output rate.
 *
 * <p>Three paths:
 *
 * <ul>
 *   <li>Same rate: the input is returned as is.
 *   <li>Output rate an exact integer multiple of the input rate: every sample is repeated
 *       {@code ratio} times. For speech at the rates we see (8k/16k/24k into 48k) this sounds
 *       smoother than the interpolating path and costs almost nothing.
 *   <li>Anything else, including downsampling: linear interpolation.
 * </ul>
 *
 * <p>No filter state is carried between calls. Each 100ms frame is converted on its own, which can
 * leave a tiny discontinuity at frame edges on the interpolating path.
 */
public final class SampleRateConverter {

  private SampleRateConverter() {}

  /**
   * Convert {@code pcm} from {@code sourceRate} to {@code targetRate}.
   *
   * @throws AudioConversionException if a rate is not positive, the buffer is not a whole number
   *     of samples, or the converted buffer would not fit in an array
   */
  public static byte[] convert(byte[] pcm, int sourceRate, int targetRate) {
    if (sourceRate <= 0 || targetRate <= 0) {
      throw new AudioConversionException(
          "Sample rates must be positive: source=" + sourceRate + ", target=" + targetRate);
    }
    if (pcm.length % PcmFormat.BYTES_PER_SAMPLE != 0) {
      throw new AudioConversionException(
          "PCM length " + pcm.length + " is not a multiple of the 16-bit sample width");
    }
    if (sourceRate == targetRate) {
      return pcm;
    }
    if (targetRate % sourceRate == 0) {
      return repeatSamples(pcm, targetRate / sourceRate);
    }
    return interpolate(pcm, sourceRate, targetRate);
  }

  /** Convenience overload for a whole frame. */
  public static byte[] convert(AudioFrame frame, int targetRate) {
    return convert(frame.pcm(), frame.sampleRate(), targetRate);
  }

  static byte[] repeatSamples(byte[] pcm, int ratio) {
    int samples = pcm.length / PcmFormat.BYTES_PER_SAMPLE;
    int outLength;
    try {
      outLength = Math.multiplyExact(pcm.length, ratio);
    } catch (ArithmeticException e) {
      throw new AudioConversionException(
          "Upsampling " + pcm.length + " bytes by " + ratio + "x exceeds the maximum array size",
          e);
    }
    byte[] out = new byte[outLength];
    int outIndex = 0;
    for (int i = 0; i < samples; i++) {
      byte lo = pcm[i * 2];
      byte hi = pcm[i * 2 + 1];
      for (int r = 0; r < ratio; r++) {
        out[outIndex++] = lo;
        out[outIndex++] = hi;
      }
    }
    return out;
  }

  static byte[] interpolate(byte[] pcm, int sourceRate, int targetRate) {
    int inSamples = pcm.length / PcmFormat.BYTES_PER_SAMPLE;
    if (inSamples == 0) {
      return new byte[0];
    }
    int outSamples = (int) Math.max(1, (long) inSamples * targetRate / sourceRate);
    byte[] out = new byte[outSamples * PcmFormat.BYTES_PER_SAMPLE];

    double step = (double) sourceRate / targetRate;
    for (int i = 0; i < outSamples; i++) {
      double position = i * step;
      int index = (int) position;
      double frac = position - index;
      int a = PcmFormat.sampleAt(pcm, Math.min(index, inSamples - 1));
      int b = PcmFormat.sampleAt(pcm, Math.min(index + 1, inSamples - 1));
      long value = Math.round(a + frac * (b - a));
      PcmFormat.putSample(out, i, clamp(value));
    }
    return out;
  }

  private static short clamp(long value) {
    return (short) Math.max(Short.MIN_VALUE, Math.min(Short.MAX_VALUE, value));
  }
}
