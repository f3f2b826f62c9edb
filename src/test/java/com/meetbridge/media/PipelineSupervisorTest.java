package com.meetbridge.media;

import com.meetbridge.config.BridgeSettings;
import com.meetbridge.service.ManualEventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineSupervisorTest {

    private ManualEventLoop eventLoop;
    private PipelineSupervisor supervisor;

    @BeforeEach
    void setUp() {
        eventLoop = new ManualEventLoop();
        supervisor = new PipelineSupervisor(eventLoop, BridgeSettings.defaults());
    }

    @Test
    void pumpsOnTheLoop() {
        QueueFrameSource<TestAudioFrame> source = new QueueFrameSource<>();
        AtomicInteger processed = new AtomicInteger();
        supervisor.start(new FramePipeline<>("audio-1", source, frame -> processed.incrementAndGet()));

        assertThat(eventLoop.periodOf("pipeline-audio-1")).isEqualTo(Duration.ofMillis(10));
        source.offer(TestAudioFrame.mono(0.1f), TestAudioFrame.mono(0.2f));
        eventLoop.tick("pipeline-audio-1");

        assertThat(processed).hasValue(2);
        assertThat(supervisor.getRunningPipelines()).containsExactly("audio-1");
    }

    @Test
    void startingSameNameReplacesPipeline() {
        QueueFrameSource<TestAudioFrame> first = new QueueFrameSource<>();
        QueueFrameSource<TestAudioFrame> second = new QueueFrameSource<>();
        TestAudioFrame stranded = TestAudioFrame.mono(0.1f);
        first.offer(stranded);

        supervisor.start(new FramePipeline<>("video-1", first, frame -> { }));
        supervisor.start(new FramePipeline<>("video-1", second, frame -> { }));

        assertThat(first.isClosed()).isTrue();
        assertThat(stranded.getCloseCount()).isEqualTo(1);
        assertThat(second.isClosed()).isFalse();
        assertThat(supervisor.getRunningPipelines()).containsExactly("video-1");
    }

    @Test
    void endedPipelineIsRemoved() {
        QueueFrameSource<TestAudioFrame> source = new QueueFrameSource<>();
        supervisor.start(new FramePipeline<>("audio-1", source, frame -> { }));

        source.end();
        eventLoop.tick("pipeline-audio-1");

        assertThat(supervisor.getRunningPipelines()).isEmpty();
        assertThat(eventLoop.isActive("pipeline-audio-1")).isFalse();
    }

    @Test
    void stopAllCancelsEverything() {
        QueueFrameSource<TestAudioFrame> a = new QueueFrameSource<>();
        QueueFrameSource<TestVideoFrame> b = new QueueFrameSource<>();
        supervisor.start(new FramePipeline<>("audio-1", a, frame -> { }));
        supervisor.start(new FramePipeline<>("video-1", b, frame -> { }));

        supervisor.stopAll();

        assertThat(a.isClosed()).isTrue();
        assertThat(b.isClosed()).isTrue();
        assertThat(supervisor.getRunningPipelines()).isEmpty();
    }
}
