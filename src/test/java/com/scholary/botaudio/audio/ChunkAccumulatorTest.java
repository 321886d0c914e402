package com.scholary.botaudio.audio;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChunkAccumulatorTest {

  private final AtomicLong clock = new AtomicLong(1_000_000_000L);
  private final List<AudioFrame> frames = new ArrayList<>();
  private ChunkAccumulator accumulator;

  @BeforeEach
  void setUp() {
    accumulator = new ChunkAccumulator(frames::add, clock::get);
  }

  @Test
  void frameSizeBytes_shouldBeHundredMillisecondsOfSixteenBitMono() {
    assertThat(PcmFormat.frameSizeBytes(16000)).isEqualTo(3200);
    assertThat(PcmFormat.frameSizeBytes(8000)).isEqualTo(1600);
    assertThat(PcmFormat.frameSizeBytes(24000)).isEqualTo(4800);
    assertThat(PcmFormat.frameSizeBytes(4)).isZero();
  }

  @Test
  void frameSizeBytes_shouldRoundDownToWholeSample() {
    assertThat(PcmFormat.frameSizeBytes(11025)).isEqualTo(2204);
    assertThat(PcmFormat.frameSizeBytes(22050)).isEqualTo(4410);
    assertThat(PcmFormat.frameSizeBytes(5)).isZero();
  }

  @Test
  void add_shouldCutConvertibleFramesAtOddSampleCountRate() {
    accumulator.add(ramp(2204 * 2 + 3), 11025);

    assertThat(frames).hasSize(2);
    for (AudioFrame frame : frames) {
      assertThat(frame.lengthBytes()).isEqualTo(2204);
      assertThat(SampleRateConverter.convert(frame, 16000)).hasSize(1599 * 2);
    }
    assertThat(accumulator.bufferedBytes()).isEqualTo(3);
  }

  @Test
  void nanosSinceLastActivity_shouldMeasureFromLatestAdd() {
    accumulator.add(new byte[10], 16000);
    clock.addAndGet(5_000);

    assertThat(accumulator.nanosSinceLastActivity()).isEqualTo(5_000);

    accumulator.add(new byte[10], 16000);
    assertThat(accumulator.nanosSinceLastActivity()).isZero();
  }

  @Test
  void add_shouldHoldBackPartialFrame() {
    int emitted = accumulator.add(new byte[3000], 16000);

    assertThat(emitted).isZero();
    assertThat(frames).isEmpty();
    assertThat(accumulator.bufferedBytes()).isEqualTo(3000);
  }

  @Test
  void add_shouldSliceFramesAcrossChunkBoundariesInOrder() {
    byte[] audio = ramp(3200 * 3 + 500);
    ByteArrayOutputStream expected = new ByteArrayOutputStream();
    expected.write(audio, 0, 3200 * 3);

    int[] chunkSizes = {700, 2900, 100, 4000, 1800, 600};
    int offset = 0;
    for (int size : chunkSizes) {
      byte[] chunk = new byte[size];
      System.arraycopy(audio, offset, chunk, 0, size);
      offset += size;
      clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(20));
      accumulator.add(chunk, 16000);
    }

    assertThat(frames).hasSize(3);
    ByteArrayOutputStream actual = new ByteArrayOutputStream();
    for (AudioFrame frame : frames) {
      assertThat(frame.lengthBytes()).isEqualTo(3200);
      assertThat(frame.sampleRate()).isEqualTo(16000);
      actual.writeBytes(frame.pcm());
    }
    assertThat(actual.toByteArray()).isEqualTo(expected.toByteArray());
    assertThat(accumulator.bufferedBytes()).isEqualTo(500);
  }

  @Test
  void add_shouldEmitSeveralFramesFromOneLargeChunk() {
    int emitted = accumulator.add(new byte[1600 * 4 + 10], 8000);

    assertThat(emitted).isEqualTo(4);
    assertThat(frames).extracting(AudioFrame::lengthBytes).containsOnly(1600);
    assertThat(accumulator.bufferedBytes()).isEqualTo(10);
  }

  @Test
  void add_shouldDiscardResidueAfterSilenceGap() {
    accumulator.add(filled(2000, (byte) 1), 16000);
    clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(ChunkAccumulator.STALE_GAP_MILLIS + 1));

    accumulator.add(filled(3200, (byte) 2), 16000);

    assertThat(frames).hasSize(1);
    assertThat(frames.get(0).pcm()).containsOnly((byte) 2);
    assertThat(accumulator.bufferedBytes()).isZero();
  }

  @Test
  void add_shouldKeepResidueWithinGap() {
    accumulator.add(filled(2000, (byte) 1), 16000);
    clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(100));

    accumulator.add(filled(1200, (byte) 2), 16000);

    assertThat(frames).hasSize(1);
    byte[] pcm = frames.get(0).pcm();
    assertThat(pcm[0]).isEqualTo((byte) 1);
    assertThat(pcm[1999]).isEqualTo((byte) 1);
    assertThat(pcm[2000]).isEqualTo((byte) 2);
  }

  @Test
  void add_shouldDiscardResidueWhenSampleRateChanges() {
    accumulator.add(new byte[1000], 16000);

    accumulator.add(new byte[1600], 8000);

    assertThat(frames)
        .singleElement()
        .satisfies(
            f -> {
              assertThat(f.sampleRate()).isEqualTo(8000);
              assertThat(f.lengthBytes()).isEqualTo(1600);
            });
    assertThat(accumulator.bufferedBytes()).isZero();
  }

  @Test
  void add_shouldRejectDegenerateSampleRateWithoutTouchingBuffer() {
    accumulator.add(new byte[100], 16000);
    long before = accumulator.lastActivityNanos();
    clock.addAndGet(1_000);

    assertThat(accumulator.add(new byte[10_000], 0)).isZero();
    assertThat(accumulator.add(new byte[10_000], -16000)).isZero();
    assertThat(accumulator.add(new byte[10_000], 3)).isZero();

    assertThat(frames).isEmpty();
    assertThat(accumulator.bufferedBytes()).isEqualTo(100);
    assertThat(accumulator.lastActivityNanos()).isGreaterThan(before);
  }

  @Test
  void add_shouldRefreshActivityOnEveryCall() {
    clock.addAndGet(5_000);
    accumulator.add(new byte[0], 16000);

    assertThat(accumulator.lastActivityNanos()).isEqualTo(clock.get());
  }

  private static byte[] ramp(int length) {
    byte[] data = new byte[length];
    for (int i = 0; i < length; i++) {
      data[i] = (byte) i;
    }
    return data;
  }

  private static byte[] filled(int length, byte value) {
    byte[] data = new byte[length];
    java.util.Arrays.fill(data, value);
    return data;
  }
}
