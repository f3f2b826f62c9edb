package com.meetbridge.media;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AudioDownmixerTest {

    @Test
    void monoIsCopied() {
        assertThat(AudioDownmixer.toMono(TestAudioFrame.mono(0.1f, -0.2f))).containsExactly(0.1f, -0.2f);
    }

    @Test
    void channelsAreAveraged() {
        TestAudioFrame stereo = new TestAudioFrame(48000, new float[]{1f, 0f}, new float[]{0f, -0.5f});

        assertThat(AudioDownmixer.toMono(stereo)).containsExactly(0.5f, -0.25f);
    }

    @Test
    void detectsAllZeroBuffers() {
        assertThat(AudioDownmixer.isAllZero(new float[]{0f, 0f})).isTrue();
        assertThat(AudioDownmixer.isAllZero(new float[0])).isTrue();
        assertThat(AudioDownmixer.isAllZero(new float[]{0f, 1e-6f})).isFalse();
    }
}
