package com.meetbridge.transport;

public enum TrackKind {
    AUDIO,
    VIDEO
}
