package com.meetbridge.protocol;

import java.util.Optional;

/**
 * Type tags of the outbound multiplexed channel. The tag is the first four bytes of every
 * message, little-endian.
 */
public enum WireMessageType {
    JSON(1),
    VIDEO(2),
    AUDIO(3),
    ENCODED_MEDIA_CHUNK(4),
    PER_PARTICIPANT_AUDIO(5);

    private final int tag;

    WireMessageType(int tag) {
        this.tag = tag;
    }

    public int getTag() {
        return tag;
    }

    /**
     * Media messages are only sent while media sending is enabled
     */
    public boolean isMedia() {
        return switch (this) {
            case JSON -> false;
            case VIDEO, AUDIO, ENCODED_MEDIA_CHUNK, PER_PARTICIPANT_AUDIO -> true;
        };
    }

    public static Optional<WireMessageType> fromTag(int tag) {
        for (WireMessageType type : values()) {
            if (type.tag == tag) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
