package com.meetbridge.model.message;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of JSON control message carried in tag-1 frames, by their wire name.
 */
public enum ControlMessageType {
    USERS_UPDATE("UsersUpdate"),
    DEVICE_OUTPUTS_UPDATE("DeviceOutputsUpdate"),
    CAPTION_UPDATE("CaptionUpdate"),
    CHAT_MESSAGE("ChatMessage"),
    SILENCE_STATUS("SilenceStatus"),
    ERROR("Error"),
    UI_INTERACTION("UiInteraction"),
    MEETING_STATUS_CHANGE("MeetingStatusChange"),
    CHAT_STATUS_CHANGE("ChatStatusChange"),
    AUDIO_FORMAT_UPDATE("AudioFormatUpdate"),
    MEMORY_USAGE("MemoryUsage");

    private final String wireName;

    ControlMessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
