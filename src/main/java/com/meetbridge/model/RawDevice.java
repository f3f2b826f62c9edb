package com.meetbridge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Device entry as it arrives in a roster snapshot, before the current-user marker is resolved.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RawDevice {

    private String deviceId;
    private String displayName;
    private String fullName;
    private String profilePicture;
    private long status;
    private String parentDeviceId;
    private boolean host;

    // present only on this client's own device
    private String currentUserMarker;

    public boolean hasCurrentUserMarker() {
        return currentUserMarker != null && !currentUserMarker.isEmpty();
    }
}
