package com.meetbridge.media;

/**
 * A frame that holds native or pooled media memory until closed.
 * Every frame taken from a FrameSource must be closed exactly once.
 */
public interface MediaFrame extends AutoCloseable {

    @Override
    void close();
}
