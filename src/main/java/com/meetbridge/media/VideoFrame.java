package com.meetbridge.media;

/**
 * Decoded video frame that can be read out as planar I420.
 */
public interface VideoFrame extends MediaFrame {

    int displayWidth();

    int displayHeight();

    byte[] copyI420();
}
