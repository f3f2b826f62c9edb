package com.meetbridge.transport;

import com.meetbridge.media.AudioFrame;
import com.meetbridge.media.FrameSource;
import com.meetbridge.model.ContributingSource;

import java.util.List;

/**
 * Callbacks from the layer that intercepts the meeting page's real-time transport.
 * Implementations must accept calls from any thread.
 */
public interface TransportObserver {

    void onPeerConnectionCreated(PeerConnectionHandle peerConnection);

    void onDataChannelCreated(DataChannelHandle dataChannel);

    void onTrackAdded(TrackEvent event);

    void onTrackEnded(String trackId);

    /**
     * Body of a network response observed by the page, as text
     */
    void onNetworkResponse(String url, String body);

    void onContributingSources(String receiverId, List<ContributingSource> sources);

    /**
     * The mixed meeting audio, excluding the bot's own output
     */
    void onMixedAudioAvailable(FrameSource<AudioFrame> mixedAudio);

    /**
     * A chunk of container-encoded output from the in-page recorder
     */
    void onEncodedMediaChunk(byte[] chunk);
}
