package com.meetbridge.transport;

import com.meetbridge.config.BridgeSettings;
import com.meetbridge.decoder.DecodedMessage;
import com.meetbridge.decoder.MeetMessageType;
import com.meetbridge.decoder.SchemaRegistry;
import com.meetbridge.exception.MessageDecodeException;
import com.meetbridge.media.AudioFrame;
import com.meetbridge.media.FramePipeline;
import com.meetbridge.media.FrameSource;
import com.meetbridge.media.MixedAudioProcessor;
import com.meetbridge.media.MonotonicClock;
import com.meetbridge.media.ParticipantAudioProcessor;
import com.meetbridge.media.PipelineSupervisor;
import com.meetbridge.media.VideoFrameProcessor;
import com.meetbridge.model.ContributingSource;
import com.meetbridge.model.RawDevice;
import com.meetbridge.model.RawDeviceOutput;
import com.meetbridge.service.AudioAttributionService;
import com.meetbridge.service.BridgeEventLoop;
import com.meetbridge.service.BridgeMessageSender;
import com.meetbridge.service.BridgeTimers;
import com.meetbridge.service.CaptionService;
import com.meetbridge.service.ChatService;
import com.meetbridge.service.ParticipantStateService;
import com.meetbridge.service.ReceiverRegistry;
import com.meetbridge.service.SilenceDetector;
import com.meetbridge.service.StreamSelectionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.zip.InflaterInputStream;

/**
 * Receives intercepted transport events, decodes Meet payloads and drives the participant,
 * track and media services. Every callback is moved onto the bridge event loop before it
 * touches any state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeetTransportBridge implements TransportObserver {

    static final String MIXED_AUDIO_PIPELINE = "mixed-audio";

    private final BridgeEventLoop eventLoop;
    private final SchemaRegistry schemaRegistry;
    private final ParticipantStateService participantState;
    private final StreamSelectionService streamSelection;
    private final ReceiverRegistry receiverRegistry;
    private final AudioAttributionService attribution;
    private final CaptionService captionService;
    private final ChatService chatService;
    private final SilenceDetector silenceDetector;
    private final BridgeMessageSender sender;
    private final BridgeTimers timers;
    private final PipelineSupervisor pipelines;
    private final MonotonicClock clock;
    private final BridgeSettings settings;

    private final AtomicBoolean tornDown = new AtomicBoolean(false);
    private final Map<String, String> receiverByTrack = new HashMap<>();
    private int peerConnections;

    @Override
    public void onPeerConnectionCreated(PeerConnectionHandle peerConnection) {
        eventLoop.execute("peer-connection", () -> {
            if (tornDown.get()) {
                return;
            }
            peerConnections++;
            log.info("Peer connection {} created ({} total)", peerConnection.getId(), peerConnections);
        });
    }

    @Override
    public void onDataChannelCreated(DataChannelHandle dataChannel) {
        DataChannelKind kind = DataChannelKind.fromLabel(dataChannel.getLabel());
        switch (kind) {
            case COLLECTIONS -> dataChannel.onMessage(bytes ->
                    eventLoop.execute("collections", () -> handleCollectionEvent(bytes)));
            case CAPTIONS -> {
                if (settings.isCollectCaptions()) {
                    dataChannel.onMessage(bytes ->
                            eventLoop.execute("captions", () -> handleCaptionEvent(bytes)));
                }
            }
            case MEDIA_DIRECTOR -> dataChannel.onMessage(bytes ->
                    log.debug("Media director event ({} bytes)", bytes.length));
            case OTHER -> log.debug("Ignoring data channel '{}'", dataChannel.getLabel());
        }
        log.info("Data channel '{}' routed as {}", dataChannel.getLabel(), kind);
    }

    @Override
    public void onTrackAdded(TrackEvent event) {
        eventLoop.execute("track-added", () -> {
            if (tornDown.get()) {
                closeSources(event);
                return;
            }
            switch (event.getKind()) {
                case VIDEO -> handleVideoTrack(event);
                case AUDIO -> handleAudioTrack(event);
            }
        });
    }

    @Override
    public void onTrackEnded(String trackId) {
        eventLoop.execute("track-ended", () -> {
            streamSelection.deleteTrack(trackId);
            pipelines.stop(videoPipelineName(trackId));
            pipelines.stop(audioPipelineName(trackId));
            String receiverId = receiverByTrack.remove(trackId);
            if (receiverId != null) {
                receiverRegistry.remove(receiverId);
            }
            log.info("Track {} ended", trackId);
        });
    }

    @Override
    public void onNetworkResponse(String url, String body) {
        if (!settings.getRosterSyncUrl().equals(url)) {
            return;
        }
        eventLoop.execute("roster-sync", () -> handleRosterSync(body));
    }

    @Override
    public void onContributingSources(String receiverId, List<ContributingSource> sources) {
        eventLoop.execute("contributing-sources", () -> {
            if (tornDown.get()) {
                return;
            }
            receiverRegistry.update(receiverId, sources);
        });
    }

    @Override
    public void onMixedAudioAvailable(FrameSource<AudioFrame> mixedAudio) {
        eventLoop.execute("mixed-audio", () -> {
            if (tornDown.get()) {
                mixedAudio.close();
                return;
            }
            pipelines.start(new FramePipeline<>(MIXED_AUDIO_PIPELINE, mixedAudio,
                    new MixedAudioProcessor(sender, silenceDetector, settings.isSendMixedAudio())));
        });
    }

    @Override
    public void onEncodedMediaChunk(byte[] chunk) {
        eventLoop.execute("encoded-chunk", () -> sender.sendEncodedMediaChunk(chunk));
    }

    /**
     * Stop timers and pipelines and forget tracks. Only the first call has any effect.
     */
    public void teardown() {
        if (!tornDown.compareAndSet(false, true)) {
            return;
        }
        eventLoop.execute("teardown", () -> {
            timers.stopAll();
            pipelines.stopAll();
            streamSelection.clear();
            receiverRegistry.clear();
            receiverByTrack.clear();
            silenceDetector.reset();
            log.info("Transport bridge torn down");
        });
    }

    public boolean isTornDown() {
        return tornDown.get();
    }

    void handleCollectionEvent(byte[] deflated) {
        if (tornDown.get()) {
            return;
        }
        DecodedMessage event;
        try {
            event = schemaRegistry.decode(MeetMessageType.COLLECTION_EVENT, inflate(deflated));
        } catch (IOException | MessageDecodeException e) {
            log.warn("Dropping collection event ({} bytes): {}", deflated.length, e.getMessage());
            sender.sendError("Could not decode collection event: " + e.getMessage());
            return;
        }

        List<RawDeviceOutput> outputs = MeetPayloadMapper.deviceOutputs(event);
        if (!outputs.isEmpty()) {
            participantState.applyDeviceOutputs(outputs);
        }

        MeetPayloadMapper.chatMessages(event).forEach(chatService::handleChatMessage);

        // the platform does not say whether this is a join or a leave, the next roster sync settles it
        for (RawDevice device : MeetPayloadMapper.collectionDevices(event)) {
            participantState.applySingleDevice(device);
        }
    }

    void handleCaptionEvent(byte[] payload) {
        if (tornDown.get()) {
            return;
        }
        try {
            DecodedMessage wrapper = schemaRegistry.decode(MeetMessageType.CAPTION_WRAPPER, payload);
            MeetPayloadMapper.caption(wrapper).ifPresent(captionService::handleCaption);
        } catch (MessageDecodeException e) {
            log.warn("Dropping caption event ({} bytes): {}", payload.length, e.getMessage());
            sender.sendError("Could not decode caption event: " + e.getMessage());
        }
    }

    void handleRosterSync(String body) {
        if (tornDown.get()) {
            return;
        }
        try {
            byte[] decoded = Base64.getDecoder().decode(body.trim());
            DecodedMessage response = schemaRegistry.decode(MeetMessageType.USER_INFO_LIST_RESPONSE, decoded);
            List<RawDevice> devices = MeetPayloadMapper.rosterDevices(response);
            log.debug("Roster sync with {} devices", devices.size());
            if (!devices.isEmpty()) {
                participantState.applyFullRoster(devices);
            }
        } catch (IllegalArgumentException | MessageDecodeException e) {
            log.warn("Dropping roster sync response: {}", e.getMessage());
            sender.sendError("Could not decode roster sync response: " + e.getMessage());
        }
    }

    private void handleVideoTrack(TrackEvent event) {
        String streamId = event.getFirstStreamId();
        boolean screenShare = participantState.isScreenShareStream(streamId);
        if (streamId != null) {
            streamSelection.upsertTrack(event.getTrackId(), streamId, screenShare);
        }

        pipelines.start(new FramePipeline<>(videoPipelineName(event.getTrackId()), event.getVideoFrames(),
                new VideoFrameProcessor(streamId, screenShare, streamSelection, sender, clock, settings)));
        log.info("Video track {} added (stream {}, screen share {})", event.getTrackId(), streamId, screenShare);
    }

    private void handleAudioTrack(TrackEvent event) {
        if (!settings.isSendPerParticipantAudio()) {
            event.getAudioFrames().close();
            log.debug("Audio track {} not relayed, per-participant audio is off", event.getTrackId());
            return;
        }
        if (event.getReceiverId() != null) {
            receiverByTrack.put(event.getTrackId(), event.getReceiverId());
        }
        pipelines.start(new FramePipeline<>(audioPipelineName(event.getTrackId()), event.getAudioFrames(),
                new ParticipantAudioProcessor(event.getReceiverId(), attribution, sender)));
        log.info("Audio track {} added (receiver {})", event.getTrackId(), event.getReceiverId());
    }

    private static void closeSources(TrackEvent event) {
        if (event.getVideoFrames() != null) {
            event.getVideoFrames().close();
        }
        if (event.getAudioFrames() != null) {
            event.getAudioFrames().close();
        }
    }

    static byte[] inflate(byte[] deflated) throws IOException {
        try (InputStream in = new InflaterInputStream(new ByteArrayInputStream(deflated))) {
            return in.readAllBytes();
        }
    }

    static String videoPipelineName(String trackId) {
        return "video-" + trackId;
    }

    static String audioPipelineName(String trackId) {
        return "audio-" + trackId;
    }
}
