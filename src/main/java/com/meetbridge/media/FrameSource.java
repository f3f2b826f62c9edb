package com.meetbridge.media;

/**
 * Pull side of a media track. poll() never blocks.
 */
public interface FrameSource<F extends MediaFrame> extends AutoCloseable {

    /**
     * Next available frame, or null when none is ready right now
     */
    F poll();

    /**
     * True once the track has ended and every remaining frame has been polled
     */
    boolean isEnded();

    /**
     * Stop producing frames and release anything still buffered
     */
    @Override
    void close();
}
