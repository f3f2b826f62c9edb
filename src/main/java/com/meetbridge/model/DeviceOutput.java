package com.meetbridge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceOutput {

    private String deviceId;
    private OutputType outputType;
    private String streamId;
    private boolean disabled;

    // monotonic millis at the time of the upsert
    private long lastUpdated;
}
