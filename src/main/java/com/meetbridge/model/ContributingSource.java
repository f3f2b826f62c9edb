package com.meetbridge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One synchronization source's audio level as last polled from a receiver.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContributingSource {

    private String sourceId;
    private double audioLevel;
}
