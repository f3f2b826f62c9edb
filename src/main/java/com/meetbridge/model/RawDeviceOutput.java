package com.meetbridge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawDeviceOutput {

    private String deviceId;
    private long outputTypeCode;
    private String streamId;
    private boolean disabled;
}
