package com.meetbridge.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meetbridge.config.BridgeSettings;
import com.meetbridge.model.message.ControlMessage;
import com.meetbridge.model.message.ControlMessageType;
import com.meetbridge.model.message.ErrorMessage;
import com.meetbridge.protocol.OutboundChannel;
import com.meetbridge.protocol.WireMessageEncoder;
import com.meetbridge.protocol.WireMessageType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;

/**
 * Single entry point for everything written to the outbound channel.
 * Owns the media sending state: media messages are dropped while disabled, JSON never is.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BridgeMessageSender {

    private final OutboundChannel channel;
    private final ObjectMapper objectMapper;
    private final BridgeEventLoop eventLoop;
    private final BridgeSettings settings;

    private final List<MediaSendingListener> listeners = new CopyOnWriteArrayList<>();

    private volatile MediaSendingState state = MediaSendingState.DISABLED;
    private ScheduledFuture<?> pendingDisable;

    public void addMediaSendingListener(MediaSendingListener listener) {
        listeners.add(listener);
    }

    public MediaSendingState getState() {
        return state;
    }

    public boolean isMediaSendingEnabled() {
        return state == MediaSendingState.ENABLED;
    }

    /**
     * Start relaying media. Cancels a disable that is still inside its grace period.
     */
    public void enableMediaSending() {
        if (pendingDisable != null) {
            pendingDisable.cancel(false);
            pendingDisable = null;
            log.info("Pending media disable cancelled");
        }
        if (state == MediaSendingState.ENABLED) {
            return;
        }
        state = MediaSendingState.ENABLED;
        log.info("Media sending enabled");
        listeners.forEach(MediaSendingListener::onMediaSendingEnabled);
    }

    /**
     * Stop relaying media after the grace period, so frames already being encoded can flush
     */
    public void disableMediaSending() {
        if (state == MediaSendingState.DISABLED || pendingDisable != null) {
            return;
        }
        log.info("Media sending will be disabled in {} ms", settings.getDisableGraceMillis());
        pendingDisable = eventLoop.schedule("media-disable", this::completeDisable,
                Duration.ofMillis(settings.getDisableGraceMillis()));
    }

    private void completeDisable() {
        pendingDisable = null;
        if (state == MediaSendingState.DISABLED) {
            return;
        }
        state = MediaSendingState.DISABLED;
        log.info("Media sending disabled");
        listeners.forEach(MediaSendingListener::onMediaSendingDisabled);
    }

    public void sendJson(ControlMessage message) {
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize {} message", message.getType(), e);
            return;
        }

        // caption and chat text stays out of the logs
        if (isRoutine(message.getType())) {
            log.debug("Sending {} ({} bytes)", message.getType(), json.length);
        } else {
            log.info("Sending {} ({} bytes)", message.getType(), json.length);
        }
        send(WireMessageType.JSON, WireMessageEncoder.json(json));
    }

    public void sendError(String message) {
        log.warn("Reporting error: {}", message);
        sendJson(ErrorMessage.builder().message(message).build());
    }

    public void sendVideo(long timestampMicros, String streamId, int width, int height, byte[] i420) {
        if (isMediaSendingEnabled()) {
            send(WireMessageType.VIDEO, WireMessageEncoder.video(timestampMicros, streamId, width, height, i420));
        }
    }

    public void sendMixedAudio(float[] samples) {
        if (isMediaSendingEnabled()) {
            send(WireMessageType.AUDIO, WireMessageEncoder.mixedAudio(samples));
        }
    }

    public void sendPerParticipantAudio(String participantId, float[] samples) {
        if (isMediaSendingEnabled()) {
            send(WireMessageType.PER_PARTICIPANT_AUDIO, WireMessageEncoder.perParticipantAudio(participantId, samples));
        }
    }

    public void sendEncodedMediaChunk(byte[] chunk) {
        if (isMediaSendingEnabled()) {
            send(WireMessageType.ENCODED_MEDIA_CHUNK, WireMessageEncoder.encodedMediaChunk(chunk));
        }
    }

    private boolean send(WireMessageType type, byte[] frame) {
        if (type.isMedia() && !isMediaSendingEnabled()) {
            return false;
        }
        if (!channel.isOpen()) {
            log.error("Outbound channel is not open, dropping {} message", type);
            return false;
        }
        return channel.send(frame);
    }

    private static boolean isRoutine(ControlMessageType type) {
        return switch (type) {
            case CAPTION_UPDATE, CHAT_MESSAGE, DEVICE_OUTPUTS_UPDATE, SILENCE_STATUS,
                    AUDIO_FORMAT_UPDATE, MEMORY_USAGE -> true;
            case USERS_UPDATE, ERROR, UI_INTERACTION, MEETING_STATUS_CHANGE, CHAT_STATUS_CHANGE -> false;
        };
    }
}
