package com.meetbridge.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Kind of media a device output carries. Serialized as the platform's numeric code.
 */
public enum OutputType {
    AUDIO(1),
    VIDEO(2);

    private final int code;

    OutputType(int code) {
        this.code = code;
    }

    @JsonValue
    public int getCode() {
        return code;
    }

    public static Optional<OutputType> fromCode(long code) {
        for (OutputType type : values()) {
            if (type.code == code) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
