package com.meetbridge.service;

import com.meetbridge.browser.PlaywrightAttachService;
import com.meetbridge.config.BridgeSettings;
import com.meetbridge.media.PipelineSupervisor;
import com.meetbridge.model.AttachRequest;
import com.meetbridge.model.BridgeStatus;
import com.meetbridge.model.Device;
import com.meetbridge.protocol.OutboundChannel;
import com.meetbridge.transport.MeetTransportBridge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Control operations exposed over REST. Calls are handed to the event loop; reads wait for its answer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BridgeLifecycleService {

    private static final long LOOP_TIMEOUT_SECONDS = 30;

    private final BridgeEventLoop eventLoop;
    private final BridgeMessageSender sender;
    private final ParticipantStateService participantState;
    private final PipelineSupervisor pipelines;
    private final MeetTransportBridge transportBridge;
    private final PlaywrightAttachService attachService;
    private final OutboundChannel channel;
    private final BridgeSettings settings;

    public String attach(AttachRequest request) {
        if (transportBridge.isTornDown()) {
            throw new IllegalStateException("Bridge has been torn down");
        }
        String cdpUrl = request.getCdpUrl() != null && !request.getCdpUrl().isBlank()
                ? request.getCdpUrl()
                : settings.getCdpUrl();
        if (cdpUrl == null || cdpUrl.isBlank()) {
            throw new IllegalArgumentException("No CDP URL given and bridge.browser.cdp-url is not set");
        }
        log.info("Attach requested: cdpUrl={}, page={}", cdpUrl, request.getMeetingUrlFragment());
        return await(attachService.attach(cdpUrl, request.getMeetingUrlFragment()));
    }

    public void enableMediaSending() {
        if (transportBridge.isTornDown()) {
            throw new IllegalStateException("Bridge has been torn down");
        }
        eventLoop.execute("media-enable", sender::enableMediaSending);
    }

    public void disableMediaSending() {
        eventLoop.execute("media-disable-request", sender::disableMediaSending);
    }

    public List<Device> getParticipants() {
        return await(eventLoop.call("participants", participantState::getCurrentDevicesInMeeting));
    }

    public BridgeStatus getStatus() {
        return await(eventLoop.call("status", () -> BridgeStatus.builder()
                .mediaSending(sender.getState())
                .channelOpen(channel.isOpen())
                .attachedUrl(attachService.getAttachedUrl().orElse(null))
                .participantsInMeeting(participantState.getCurrentDevicesInMeeting().size())
                .runningPipelines(pipelines.getRunningPipelines())
                .tornDown(transportBridge.isTornDown())
                .build()));
    }

    /**
     * Stop everything. Repeated calls are harmless.
     */
    public void teardown() {
        log.info("Teardown requested");
        transportBridge.teardown();
        await(attachService.detach());
    }

    private <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(LOOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the bridge event loop", e);
        } catch (TimeoutException e) {
            throw new IllegalStateException("Bridge event loop did not answer within " + LOOP_TIMEOUT_SECONDS + "s", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException(e.getCause().getMessage(), e.getCause());
        }
    }
}
