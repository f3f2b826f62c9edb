package com.meetbridge.service;

/**
 * Notified on the event loop when media sending changes state.
 */
public interface MediaSendingListener {

    void onMediaSendingEnabled();

    void onMediaSendingDisabled();
}
