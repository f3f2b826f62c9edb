package com.meetbridge.model;

import java.util.Arrays;

/**
 * Presence status codes reported by the platform for a device.
 */
public enum DeviceStatus {
    IN_MEETING(1, "in_meeting"),
    NOT_IN_MEETING(6, "not_in_meeting"),
    REMOVED(7, "removed_from_meeting"),
    UNKNOWN(-1, "unknown");

    private final int code;
    private final String humanized;

    DeviceStatus(int code, String humanized) {
        this.code = code;
        this.humanized = humanized;
    }

    public int getCode() {
        return code;
    }

    public String getHumanized() {
        return humanized;
    }

    public static DeviceStatus fromCode(long code) {
        return Arrays.stream(values())
                .filter(status -> status.code == code)
                .findFirst()
                .orElse(UNKNOWN);
    }
}
