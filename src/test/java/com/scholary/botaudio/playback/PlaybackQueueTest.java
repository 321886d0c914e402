package com.scholary.botaudio.playback;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.botaudio.audio.AudioFrame;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class PlaybackQueueTest {

  private final AtomicLong clock = new AtomicLong(0);
  private final PlaybackQueue queue = new PlaybackQueue(clock::get);

  @Test
  void poll_shouldReturnFramesInEnqueueOrder() throws Exception {
    AudioFrame first = new AudioFrame(new byte[] {1, 0}, 16000);
    AudioFrame second = new AudioFrame(new byte[] {2, 0}, 16000);
    queue.offer(first);
    queue.offer(second);

    assertThat(queue.poll(10, TimeUnit.MILLISECONDS)).isEqualTo(first);
    assertThat(queue.poll(10, TimeUnit.MILLISECONDS)).isEqualTo(second);
    assertThat(queue.poll(10, TimeUnit.MILLISECONDS)).isNull();
  }

  @Test
  void drain_shouldDiscardEverything() {
    queue.offer(new AudioFrame(new byte[2], 8000));
    queue.offer(new AudioFrame(new byte[2], 8000));

    assertThat(queue.drain()).isEqualTo(2);
    assertThat(queue.isEmpty()).isTrue();
    assertThat(queue.drain()).isZero();
  }

  @Test
  void nanosSinceLastOffer_shouldMeasureFromMostRecentOffer() {
    clock.set(1_000);
    queue.offer(new AudioFrame(new byte[2], 8000));
    clock.set(6_000);

    assertThat(queue.nanosSinceLastOffer()).isEqualTo(5_000);
  }
}
