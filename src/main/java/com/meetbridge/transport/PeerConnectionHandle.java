package com.meetbridge.transport;

/**
 * A peer connection created by the meeting page.
 */
public interface PeerConnectionHandle {

    String getId();
}
