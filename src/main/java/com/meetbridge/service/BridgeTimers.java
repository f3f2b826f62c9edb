package com.meetbridge.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * The bridge's periodic checks. Each kind runs at most once; starting a kind again
 * replaces the running instance.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BridgeTimers {

    public enum Kind {
        AUDIO_ACTIVITY,
        MEMORY_USAGE,
        NEEDED_INTERACTIONS
    }

    private final BridgeEventLoop eventLoop;

    private final Map<Kind, ScheduledFuture<?>> running = new EnumMap<>(Kind.class);

    public synchronized void start(Kind kind, Duration period, Runnable task) {
        stop(kind);
        running.put(kind, eventLoop.scheduleAtFixedRate(kind.name().toLowerCase(), task, period));
        log.debug("Timer {} started every {} ms", kind, period.toMillis());
    }

    public synchronized void stop(Kind kind) {
        ScheduledFuture<?> future = running.remove(kind);
        if (future != null) {
            future.cancel(false);
            log.debug("Timer {} stopped", kind);
        }
    }

    public synchronized void stopAll() {
        for (Kind kind : Kind.values()) {
            stop(kind);
        }
    }

    public synchronized boolean isRunning(Kind kind) {
        return running.containsKey(kind);
    }
}
