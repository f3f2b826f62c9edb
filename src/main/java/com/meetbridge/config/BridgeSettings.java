package com.meetbridge.config;

import lombok.Builder;
import lombok.Value;

/**
 * Resolved bridge configuration, built once from application.yml.
 */
@Value
@Builder(toBuilder = true)
public class BridgeSettings {

    @Builder.Default
    String channelUrl = "ws://localhost:8765";

    @Builder.Default
    int channelConnectRetries = 5;

    @Builder.Default
    boolean sendMixedAudio = true;

    @Builder.Default
    boolean sendPerParticipantAudio = false;

    @Builder.Default
    boolean collectCaptions = true;

    @Builder.Default
    long disableGraceMillis = 2000;

    @Builder.Default
    int screenShareFps = 5;

    @Builder.Default
    int cameraFps = 15;

    @Builder.Default
    double silenceThreshold = 0.5;

    @Builder.Default
    long audioActivityMillis = 1000;

    @Builder.Default
    long memoryUsageMillis = 60_000;

    @Builder.Default
    long neededInteractionsMillis = 5000;

    @Builder.Default
    long pumpIntervalMillis = 10;

    String cdpUrl;

    @Builder.Default
    long browserPollMillis = 100;

    @Builder.Default
    String meetingHost = "meet.google.com";

    @Builder.Default
    String rosterSyncUrl = "https://meet.google.com/$rpc/google.rtc.meetings.v1.MeetingSpaceService/SyncMeetingSpaceCollections";

    public static BridgeSettings defaults() {
        return BridgeSettings.builder().build();
    }
}
