package com.meetbridge.service;

import com.meetbridge.browser.MeetingUiInspector;
import com.meetbridge.config.BridgeSettings;
import com.meetbridge.model.message.MemoryUsageMessage;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Runs the periodic checks for as long as media sending is enabled.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeetingActivityMonitor implements MediaSendingListener {

    private final BridgeMessageSender sender;
    private final BridgeTimers timers;
    private final SilenceDetector silenceDetector;
    private final MeetingUiInspector uiInspector;
    private final BridgeSettings settings;

    @PostConstruct
    public void register() {
        sender.addMediaSendingListener(this);
    }

    @Override
    public void onMediaSendingEnabled() {
        timers.start(BridgeTimers.Kind.AUDIO_ACTIVITY,
                Duration.ofMillis(settings.getAudioActivityMillis()), silenceDetector::checkAudioActivity);
        timers.start(BridgeTimers.Kind.MEMORY_USAGE,
                Duration.ofMillis(settings.getMemoryUsageMillis()), this::reportMemoryUsage);
        timers.start(BridgeTimers.Kind.NEEDED_INTERACTIONS,
                Duration.ofMillis(settings.getNeededInteractionsMillis()), uiInspector::checkNeededInteractions);
        log.info("Activity checks started");

        uiInspector.probeChatReady();
    }

    @Override
    public void onMediaSendingDisabled() {
        timers.stopAll();
        silenceDetector.reset();
        log.info("Activity checks stopped");
    }

    public void reportMemoryUsage() {
        Runtime runtime = Runtime.getRuntime();
        sender.sendJson(MemoryUsageMessage.builder()
                .memoryUsage(MemoryUsageMessage.MemoryUsage.builder()
                        .heapSizeLimit(runtime.maxMemory())
                        .totalHeapSize(runtime.totalMemory())
                        .usedHeapSize(runtime.totalMemory() - runtime.freeMemory())
                        .build())
                .build());
    }
}
