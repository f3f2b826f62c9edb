package com.meetbridge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A participant's presence in the meeting, or a screen share when parentDeviceId is set.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Device {

    private String deviceId;
    private String displayName;
    private String fullName;
    private String profilePicture;

    // raw platform code, see DeviceStatus
    private int status;

    private String parentDeviceId;

    @JsonProperty("isCurrentUser")
    private boolean currentUser;

    @JsonProperty("isHost")
    private boolean host;

    @JsonIgnore
    public DeviceStatus getMeetingStatus() {
        return DeviceStatus.fromCode(status);
    }

    @JsonProperty("humanized_status")
    public String getHumanizedStatus() {
        return getMeetingStatus().getHumanized();
    }

    @JsonIgnore
    public boolean isInMeeting() {
        return getMeetingStatus() == DeviceStatus.IN_MEETING;
    }

    @JsonIgnore
    public boolean isScreenShare() {
        return parentDeviceId != null && !parentDeviceId.isEmpty();
    }
}
