package com.meetbridge.protocol;

/**
 * Ordered, message-oriented local channel to the recording backend.
 */
public interface OutboundChannel {

    boolean isOpen();

    /**
     * Queue one complete framed message
     *
     * @return false if the message could not be handed to the transport
     */
    boolean send(byte[] frame);
}
