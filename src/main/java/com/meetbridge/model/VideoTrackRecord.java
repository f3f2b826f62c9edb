package com.meetbridge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class VideoTrackRecord {

    private String trackId;
    private String streamId;
    private boolean screenShare;

    // monotonic nanos, kept from the first observation of the track
    private long firstSeenAt;
}
