package com.meetbridge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of applying one roster snapshot, with screen-share devices already removed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RosterDiff {

    @Builder.Default
    private List<Device> joined = new ArrayList<>();

    @Builder.Default
    private List<Device> left = new ArrayList<>();

    @Builder.Default
    private List<Device> updated = new ArrayList<>();

    public boolean isEmpty() {
        return joined.isEmpty() && left.isEmpty() && updated.isEmpty();
    }
}
