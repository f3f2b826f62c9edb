package com.meetbridge.transport;

import com.meetbridge.media.AudioFrame;
import com.meetbridge.media.FrameSource;
import com.meetbridge.media.VideoFrame;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A remote media track added to a peer connection. Exactly one of the frame sources is set,
 * matching the kind.
 */
@Value
@Builder
public class TrackEvent {

    String trackId;
    TrackKind kind;
    // ids of the media streams the track belongs to, in platform order
    @Builder.Default
    List<String> streamIds = List.of();
    String receiverId;
    FrameSource<VideoFrame> videoFrames;
    FrameSource<AudioFrame> audioFrames;

    public String getFirstStreamId() {
        return streamIds.isEmpty() ? null : streamIds.get(0);
    }
}
