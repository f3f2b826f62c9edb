package com.meetbridge.config;

import com.meetbridge.decoder.MeetSchemas;
import com.meetbridge.decoder.SchemaRegistry;
import com.meetbridge.media.MonotonicClock;
import com.meetbridge.protocol.InboundMessageHandler;
import com.meetbridge.protocol.WebSocketOutboundChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

import java.net.URI;

@Slf4j
@Configuration
public class BridgeConfig {

    @Value("${bridge.channel.url:ws://localhost:8765}")
    private String channelUrl;

    @Value("${bridge.channel.connect-retries:5}")
    private int channelConnectRetries;

    @Value("${bridge.media.send-mixed-audio:true}")
    private boolean sendMixedAudio;

    @Value("${bridge.media.send-per-participant-audio:false}")
    private boolean sendPerParticipantAudio;

    @Value("${bridge.media.collect-captions:true}")
    private boolean collectCaptions;

    @Value("${bridge.media.disable-grace-millis:2000}")
    private long disableGraceMillis;

    @Value("${bridge.video.screen-share-fps:5}")
    private int screenShareFps;

    @Value("${bridge.video.camera-fps:15}")
    private int cameraFps;

    @Value("${bridge.audio.silence-threshold:0.5}")
    private double silenceThreshold;

    @Value("${bridge.timers.audio-activity-millis:1000}")
    private long audioActivityMillis;

    @Value("${bridge.timers.memory-usage-millis:60000}")
    private long memoryUsageMillis;

    @Value("${bridge.timers.needed-interactions-millis:5000}")
    private long neededInteractionsMillis;

    @Value("${bridge.pipeline.pump-interval-millis:10}")
    private long pumpIntervalMillis;

    @Value("${bridge.browser.cdp-url:}")
    private String cdpUrl;

    @Value("${bridge.browser.meeting-host:meet.google.com}")
    private String meetingHost;

    @Value("${bridge.browser.roster-sync-url:https://meet.google.com/$rpc/google.rtc.meetings.v1.MeetingSpaceService/SyncMeetingSpaceCollections}")
    private String rosterSyncUrl;

    @Value("${bridge.browser.poll-millis:100}")
    private long browserPollMillis;

    @Bean
    public BridgeSettings bridgeSettings() {
        BridgeSettings settings = BridgeSettings.builder()
                .channelUrl(channelUrl)
                .channelConnectRetries(channelConnectRetries)
                .sendMixedAudio(sendMixedAudio)
                .sendPerParticipantAudio(sendPerParticipantAudio)
                .collectCaptions(collectCaptions)
                .disableGraceMillis(disableGraceMillis)
                .screenShareFps(screenShareFps)
                .cameraFps(cameraFps)
                .silenceThreshold(silenceThreshold)
                .audioActivityMillis(audioActivityMillis)
                .memoryUsageMillis(memoryUsageMillis)
                .neededInteractionsMillis(neededInteractionsMillis)
                .pumpIntervalMillis(pumpIntervalMillis)
                .cdpUrl(cdpUrl)
                .meetingHost(meetingHost)
                .rosterSyncUrl(rosterSyncUrl)
                .browserPollMillis(browserPollMillis)
                .build();
        log.info("Bridge settings: {}", settings);
        return settings;
    }

    @Bean
    public MonotonicClock monotonicClock() {
        return MonotonicClock.system();
    }

    @Bean
    public SchemaRegistry schemaRegistry() {
        return new SchemaRegistry(MeetSchemas.all());
    }

    @Bean(initMethod = "connect", destroyMethod = "close")
    public WebSocketOutboundChannel outboundChannel(BridgeSettings bridgeSettings,
                                                    InboundMessageHandler inboundMessageHandler) {
        return new WebSocketOutboundChannel(new ReactorNettyWebSocketClient(),
                URI.create(bridgeSettings.getChannelUrl()),
                bridgeSettings.getChannelConnectRetries(),
                inboundMessageHandler);
    }
}
