package com.meetbridge.service;

public enum MediaSendingState {
    DISABLED,
    ENABLED
}
