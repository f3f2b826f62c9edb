package com.meetbridge.media;

import com.meetbridge.config.BridgeSettings;
import com.meetbridge.service.BridgeEventLoop;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the running frame pipelines and pumps each one on the event loop.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineSupervisor {

    private final BridgeEventLoop eventLoop;
    private final BridgeSettings settings;

    private final Map<String, Running> running = new LinkedHashMap<>();

    /**
     * Start pumping a pipeline. A pipeline already running under the same name is cancelled first.
     */
    public void start(FramePipeline<?> pipeline) {
        stop(pipeline.getName());

        Running entry = new Running(pipeline);
        running.put(pipeline.getName(), entry);
        entry.future = eventLoop.scheduleAtFixedRate("pipeline-" + pipeline.getName(), () -> {
            if (!pipeline.pump()) {
                finished(entry);
            }
        }, Duration.ofMillis(settings.getPumpIntervalMillis()));
        log.info("[{}] Pipeline started", pipeline.getName());
    }

    public void stop(String name) {
        Running entry = running.remove(name);
        if (entry != null) {
            entry.shutdown();
            log.info("[{}] Pipeline stopped after {} frames", name, entry.pipeline.getProcessedFrames());
        }
    }

    /**
     * Cancel every pipeline, releasing the frames they still hold
     */
    public void stopAll() {
        for (String name : new ArrayList<>(running.keySet())) {
            stop(name);
        }
    }

    public List<String> getRunningPipelines() {
        return List.copyOf(running.keySet());
    }

    private void finished(Running entry) {
        running.remove(entry.pipeline.getName(), entry);
        entry.shutdown();
    }

    private static final class Running {
        private final FramePipeline<?> pipeline;
        private ScheduledFuture<?> future;

        Running(FramePipeline<?> pipeline) {
            this.pipeline = pipeline;
        }

        void shutdown() {
            if (future != null) {
                future.cancel(false);
            }
            pipeline.cancel();
        }
    }
}
