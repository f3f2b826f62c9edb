package com.meetbridge.media;

/**
 * Planar float audio frame.
 */
public interface AudioFrame extends MediaFrame {

    int numberOfChannels();

    int numberOfFrames();

    int sampleRate();

    String format();

    long durationMicros();

    /**
     * Copy one channel's samples into dest, which must hold at least numberOfFrames() values
     */
    void copyPlane(int planeIndex, float[] dest);
}
