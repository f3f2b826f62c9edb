package com.meetbridge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * A chat message as observed in the meeting. Timestamp is in platform milliseconds.
 */
@Value
@Builder
@AllArgsConstructor
public class ChatMessageRecord {

    String messageId;
    String deviceId;
    long timestamp;
    String text;
}
