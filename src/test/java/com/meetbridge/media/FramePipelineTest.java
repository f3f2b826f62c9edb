package com.meetbridge.media;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FramePipelineTest {

    @Test
    void processedFramesAreClosedOnce() {
        QueueFrameSource<TestAudioFrame> source = new QueueFrameSource<>();
        TestAudioFrame first = TestAudioFrame.mono(0.1f);
        TestAudioFrame second = TestAudioFrame.mono(0.2f);
        source.offer(first, second);
        List<TestAudioFrame> seen = new ArrayList<>();

        FramePipeline<TestAudioFrame> pipeline = new FramePipeline<>("audio", source, seen::add);

        assertThat(pipeline.pump()).isTrue();
        assertThat(seen).containsExactly(first, second);
        assertThat(first.getCloseCount()).isEqualTo(1);
        assertThat(second.getCloseCount()).isEqualTo(1);
        assertThat(pipeline.getProcessedFrames()).isEqualTo(2);
    }

    @Test
    void failingProcessorStillClosesFrameAndContinues() {
        QueueFrameSource<TestAudioFrame> source = new QueueFrameSource<>();
        TestAudioFrame bad = TestAudioFrame.mono(0.1f);
        TestAudioFrame good = TestAudioFrame.mono(0.2f);
        source.offer(bad, good);

        FramePipeline<TestAudioFrame> pipeline = new FramePipeline<>("audio", source, frame -> {
            if (frame == bad) {
                throw new IllegalStateException("encoder failed");
            }
        });

        assertThat(pipeline.pump()).isTrue();
        assertThat(bad.getCloseCount()).isEqualTo(1);
        assertThat(good.getCloseCount()).isEqualTo(1);
        assertThat(pipeline.getFailedFrames()).isEqualTo(1);
        assertThat(pipeline.getProcessedFrames()).isEqualTo(1);
    }

    @Test
    void cancelReleasesQueuedFramesAndClosesSource() {
        QueueFrameSource<TestAudioFrame> source = new QueueFrameSource<>();
        TestAudioFrame queued = TestAudioFrame.mono(0.1f);
        source.offer(queued);
        List<TestAudioFrame> seen = new ArrayList<>();
        FramePipeline<TestAudioFrame> pipeline = new FramePipeline<>("audio", source, seen::add);

        pipeline.cancel();
        pipeline.cancel();

        assertThat(queued.getCloseCount()).isEqualTo(1);
        assertThat(source.isClosed()).isTrue();
        assertThat(pipeline.pump()).isFalse();
        assertThat(seen).isEmpty();
    }

    @Test
    void cancelFromProcessorClosesRemainingFrames() {
        QueueFrameSource<TestAudioFrame> source = new QueueFrameSource<>();
        TestAudioFrame first = TestAudioFrame.mono(0.1f);
        TestAudioFrame second = TestAudioFrame.mono(0.2f);
        source.offer(first, second);
        CancellationToken token = new CancellationToken();
        FramePipeline<TestAudioFrame> pipeline = new FramePipeline<>("audio", source, frame -> token.cancel(), token);

        assertThat(pipeline.pump()).isFalse();
        assertThat(first.getCloseCount()).isEqualTo(1);
        assertThat(second.getCloseCount()).isEqualTo(1);
        assertThat(source.pending()).isZero();
        assertThat(source.isClosed()).isTrue();
    }

    @Test
    void endedSourceFinishesPipeline() {
        QueueFrameSource<TestAudioFrame> source = new QueueFrameSource<>();
        TestAudioFrame last = TestAudioFrame.mono(0.1f);
        source.offer(last);
        source.end();
        FramePipeline<TestAudioFrame> pipeline = new FramePipeline<>("audio", source, frame -> { });

        assertThat(pipeline.pump()).isFalse();
        assertThat(last.getCloseCount()).isEqualTo(1);
        assertThat(pipeline.isCancelled()).isTrue();
        assertThat(source.isClosed()).isTrue();
    }

    @Test
    void emptySourceKeepsRunning() {
        FramePipeline<TestAudioFrame> pipeline = new FramePipeline<>("audio", new QueueFrameSource<>(), frame -> { });

        assertThat(pipeline.pump()).isTrue();
        assertThat(pipeline.pump()).isTrue();
    }
}
