package com.meetbridge.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meetbridge.config.BridgeSettings;
import com.meetbridge.model.message.UiInteractionMessage;
import com.meetbridge.protocol.RecordingOutboundChannel;
import com.meetbridge.protocol.WireMessageType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class BridgeMessageSenderTest {

    private RecordingOutboundChannel channel;
    private ManualEventLoop eventLoop;
    private BridgeMessageSender sender;

    @BeforeEach
    void setUp() {
        channel = new RecordingOutboundChannel();
        eventLoop = new ManualEventLoop();
        sender = new BridgeMessageSender(channel, new ObjectMapper(), eventLoop, BridgeSettings.defaults());
    }

    @Test
    void startsDisabledAndDropsEveryMediaKind() {
        assertThat(sender.getState()).isEqualTo(MediaSendingState.DISABLED);

        sendOneOfEachMediaKind();

        assertThat(channel.messages()).isEmpty();
    }

    @Test
    void jsonIsSentInBothStates() {
        sender.sendJson(UiInteractionMessage.builder().message("while disabled").build());
        sender.enableMediaSending();
        sender.sendError("while enabled");

        assertThat(channel.json()).extracting(node -> node.path("type").asText())
                .containsExactly("UiInteraction", "Error");
        JsonNode error = channel.json().get(1);
        assertThat(error.path("message").asText()).isEqualTo("while enabled");
    }

    @Test
    void mediaFlowsOnceEnabled() {
        sender.enableMediaSending();

        sendOneOfEachMediaKind();

        assertThat(channel.messages()).extracting(message -> message.getType().orElseThrow())
                .containsExactly(WireMessageType.VIDEO, WireMessageType.AUDIO,
                        WireMessageType.PER_PARTICIPANT_AUDIO, WireMessageType.ENCODED_MEDIA_CHUNK);
    }

    @Test
    void disableWaitsForGracePeriod() {
        sender.enableMediaSending();

        sender.disableMediaSending();
        assertThat(eventLoop.periodOf("media-disable")).isEqualTo(Duration.ofMillis(2000));

        // frames already in flight still go out
        sender.sendMixedAudio(new float[]{0.5f});
        assertThat(sender.isMediaSendingEnabled()).isTrue();

        eventLoop.fireDelayed("media-disable");
        sender.sendMixedAudio(new float[]{0.5f});

        assertThat(sender.getState()).isEqualTo(MediaSendingState.DISABLED);
        assertThat(channel.messagesOfType(WireMessageType.AUDIO)).hasSize(1);
    }

    @Test
    void enableDuringGracePeriodCancelsDisable() {
        MediaSendingListener listener = mock(MediaSendingListener.class);
        sender.addMediaSendingListener(listener);
        sender.enableMediaSending();
        sender.disableMediaSending();

        sender.enableMediaSending();

        assertThat(eventLoop.fireDelayed("media-disable")).isZero();
        assertThat(sender.isMediaSendingEnabled()).isTrue();
        verify(listener).onMediaSendingEnabled();
        verify(listener, never()).onMediaSendingDisabled();
    }

    @Test
    void listenersSeeEachTransition() {
        MediaSendingListener listener = mock(MediaSendingListener.class);
        sender.addMediaSendingListener(listener);

        sender.enableMediaSending();
        sender.enableMediaSending();
        sender.disableMediaSending();
        sender.disableMediaSending();
        eventLoop.fireDelayed("media-disable");

        InOrder order = inOrder(listener);
        order.verify(listener).onMediaSendingEnabled();
        order.verify(listener).onMediaSendingDisabled();
        order.verifyNoMoreInteractions();
    }

    @Test
    void disableWhileDisabledSchedulesNothing() {
        sender.disableMediaSending();

        assertThat(eventLoop.isActive("media-disable")).isFalse();
    }

    @Test
    void closedChannelDropsMessages() {
        channel.setOpen(false);
        sender.enableMediaSending();

        sender.sendError("nobody listening");
        sender.sendMixedAudio(new float[]{0.1f});

        channel.setOpen(true);
        assertThat(channel.messages()).isEmpty();
    }

    private void sendOneOfEachMediaKind() {
        sender.sendVideo(1L, "stream", 2, 2, new byte[6]);
        sender.sendMixedAudio(new float[]{0.1f, 0.2f});
        sender.sendPerParticipantAudio("device", new float[]{0.1f});
        sender.sendEncodedMediaChunk(new byte[]{1, 2, 3});
    }
}
