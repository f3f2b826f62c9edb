package com.meetbridge.model;

import com.meetbridge.service.MediaSendingState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BridgeStatus {

    private MediaSendingState mediaSending;
    private boolean channelOpen;
    private String attachedUrl;
    private int participantsInMeeting;
    private List<String> runningPipelines;
    private boolean tornDown;
}
