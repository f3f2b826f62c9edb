package com.meetbridge.media;

/**
 * Helpers for turning planar audio frames into the mono float buffers sent on the wire.
 */
public final class AudioDownmixer {

    private AudioDownmixer() {
    }

    /**
     * Average all channels of the frame into one mono buffer
     */
    public static float[] toMono(AudioFrame frame) {
        int channels = frame.numberOfChannels();
        int samples = frame.numberOfFrames();
        float[] mono = new float[samples];

        if (channels <= 1) {
            frame.copyPlane(0, mono);
            return mono;
        }

        float[] plane = new float[samples];
        for (int channel = 0; channel < channels; channel++) {
            frame.copyPlane(channel, plane);
            for (int i = 0; i < samples; i++) {
                mono[i] += plane[i];
            }
        }
        for (int i = 0; i < samples; i++) {
            mono[i] /= channels;
        }
        return mono;
    }

    public static boolean isAllZero(float[] samples) {
        for (float sample : samples) {
            if (sample != 0f) {
                return false;
            }
        }
        return true;
    }
}
