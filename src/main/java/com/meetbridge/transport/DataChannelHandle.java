package com.meetbridge.transport;

import java.util.function.Consumer;

/**
 * A data channel of an intercepted peer connection, whether the page or the remote side opened it.
 */
public interface DataChannelHandle {

    String getLabel();

    /**
     * Register the handler for binary messages. Called at most once per channel.
     */
    void onMessage(Consumer<byte[]> handler);
}
