package com.scholary.botaudio.audio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SampleRateConverterTest {

  @Test
  void convert_shouldReturnInputWhenRatesMatch() {
    byte[] pcm = samples(1, 2, 3);

    assertThat(SampleRateConverter.convert(pcm, 16000, 16000)).isSameAs(pcm);
  }

  @Test
  void convert_shouldDuplicateEachSampleForIntegerRatio() {
    byte[] pcm = samples(100, -200, 300);

    byte[] out = SampleRateConverter.convert(pcm, 8000, 16000);

    assertThat(out).isEqualTo(samples(100, 100, -200, -200, 300, 300));
  }

  @Test
  void convert_shouldRepeatSamplesForLargerRatio() {
    byte[] pcm = samples(7, -7);

    byte[] out = SampleRateConverter.convert(pcm, 16000, 48000);

    assertThat(out).isEqualTo(samples(7, 7, 7, -7, -7, -7));
  }

  @Test
  void convert_shouldDoubleFullFrameLength() {
    byte[] frame = new byte[PcmFormat.frameSizeBytes(8000)];

    byte[] out = SampleRateConverter.convert(frame, 8000, 16000);

    assertThat(out).hasSize(PcmFormat.frameSizeBytes(16000));
  }

  @Test
  void convert_shouldInterpolateForNonIntegerRatio() {
    byte[] frame = constant(2000, 1600);

    byte[] out = SampleRateConverter.convert(frame, 16000, 24000);

    assertThat(out).hasSize(2400 * 2);
    for (int i = 0; i < 2400; i++) {
      assertThat(PcmFormat.sampleAt(out, i)).isEqualTo((short) 2000);
    }
  }

  @Test
  void convert_shouldInterpolateBetweenNeighbours() {
    byte[] pcm = samples(0, 300, 600, 900);

    byte[] out = SampleRateConverter.convert(pcm, 2, 3);

    assertThat(out).hasSize(6 * 2);
    assertThat(PcmFormat.sampleAt(out, 0)).isEqualTo((short) 0);
    assertThat(PcmFormat.sampleAt(out, 1)).isEqualTo((short) 200);
    assertThat(PcmFormat.sampleAt(out, 2)).isEqualTo((short) 400);
    assertThat(PcmFormat.sampleAt(out, 3)).isEqualTo((short) 600);
  }

  @Test
  void convert_shouldDownsampleThroughFallback() {
    byte[] frame = constant(-1500, 4800);

    byte[] out = SampleRateConverter.convert(frame, 48000, 16000);

    assertThat(out).hasSize(PcmFormat.frameSizeBytes(16000));
    assertThat(PcmFormat.sampleAt(out, 0)).isEqualTo((short) -1500);
    assertThat(PcmFormat.sampleAt(out, 1599)).isEqualTo((short) -1500);
  }

  @Test
  void convert_shouldHandleEmptyInput() {
    assertThat(SampleRateConverter.convert(new byte[0], 16000, 24000)).isEmpty();
    assertThat(SampleRateConverter.convert(new byte[0], 8000, 16000)).isEmpty();
  }

  @Test
  void convert_shouldRejectPartialSample() {
    assertThatThrownBy(() -> SampleRateConverter.convert(new byte[3], 8000, 16000))
        .isInstanceOf(AudioConversionException.class)
        .hasMessageContaining("not a multiple");
  }

  @Test
  void convert_shouldRejectUpsampleLargerThanAnArray() {
    assertThatThrownBy(() -> SampleRateConverter.convert(new byte[50_000], 1, 48000))
        .isInstanceOf(AudioConversionException.class)
        .hasMessageContaining("maximum array size")
        .hasCauseInstanceOf(ArithmeticException.class);
  }

  @Test
  void convert_shouldRejectNonPositiveRates() {
    assertThatThrownBy(() -> SampleRateConverter.convert(new byte[4], 0, 16000))
        .isInstanceOf(AudioConversionException.class);
    assertThatThrownBy(() -> SampleRateConverter.convert(new byte[4], 16000, -1))
        .isInstanceOf(AudioConversionException.class);
  }

  static byte[] samples(int... values) {
    byte[] pcm = new byte[values.length * 2];
    for (int i = 0; i < values.length; i++) {
      PcmFormat.putSample(pcm, i, (short) values[i]);
    }
    return pcm;
  }

  static byte[] constant(int value, int count) {
    int[] values = new int[count];
    java.util.Arrays.fill(values, value);
    return samples(values);
  }
}
