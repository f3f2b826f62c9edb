package com.meetbridge.media;

import com.meetbridge.config.BridgeSettings;
import com.meetbridge.service.BridgeMessageSender;
import com.meetbridge.service.StreamSelectionService;
import lombok.extern.slf4j.Slf4j;

/**
 * Relays frames of one video track while it is the selected track, throttled to the
 * screen-share or camera frame rate.
 */
@Slf4j
public class VideoFrameProcessor implements FrameProcessor<VideoFrame> {

    private final String streamId;
    private final StreamSelectionService streamSelection;
    private final BridgeMessageSender sender;
    private final MonotonicClock clock;
    private final long frameIntervalNanos;

    private boolean sentAny;
    private long lastSentNanos;

    public VideoFrameProcessor(String streamId, boolean screenShare, StreamSelectionService streamSelection,
                               BridgeMessageSender sender, MonotonicClock clock, BridgeSettings settings) {
        this.streamId = streamId;
        this.streamSelection = streamSelection;
        this.sender = sender;
        this.clock = clock;
        int fps = screenShare ? settings.getScreenShareFps() : settings.getCameraFps();
        this.frameIntervalNanos = 1_000_000_000L / fps;
    }

    @Override
    public void process(VideoFrame frame) {
        if (streamId == null || !sender.isMediaSendingEnabled()) {
            return;
        }
        if (!streamId.equals(streamSelection.getActiveStreamId().orElse(null))) {
            return;
        }

        long now = clock.nanos();
        if (sentAny && now - lastSentNanos < frameIntervalNanos) {
            return;
        }

        sender.sendVideo(now / 1_000L, streamId, frame.displayWidth(), frame.displayHeight(), frame.copyI420());
        sentAny = true;
        lastSentNanos = now;
    }

    public long getFrameIntervalNanos() {
        return frameIntervalNanos;
    }
}
