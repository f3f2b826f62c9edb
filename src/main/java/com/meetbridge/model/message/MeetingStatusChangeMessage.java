package com.meetbridge.model.message;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class MeetingStatusChangeMessage extends ControlMessage {

    public static final String REMOVED_FROM_MEETING = "removed_from_meeting";

    private String change;

    @Override
    public ControlMessageType getType() {
        return ControlMessageType.MEETING_STATUS_CHANGE;
    }
}
