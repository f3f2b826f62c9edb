package com.meetbridge.media;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Pull-based per-track pipeline. Each pump drains whatever frames are ready and hands them
 * to the processor; the frame is released in one finally block whatever happens to it.
 */
@Slf4j
public class FramePipeline<F extends MediaFrame> {

    @Getter
    private final String name;
    private final FrameSource<F> source;
    private final FrameProcessor<F> processor;
    private final CancellationToken token;

    @Getter
    private long processedFrames;
    @Getter
    private long failedFrames;

    private boolean released;

    public FramePipeline(String name, FrameSource<F> source, FrameProcessor<F> processor) {
        this(name, source, processor, new CancellationToken());
    }

    public FramePipeline(String name, FrameSource<F> source, FrameProcessor<F> processor, CancellationToken token) {
        this.name = name;
        this.source = source;
        this.processor = processor;
        this.token = token;
    }

    /**
     * Drain the frames that are ready now
     *
     * @return false once the pipeline has finished, either cancelled or because the source ended
     */
    public boolean pump() {
        while (!token.isCancelled()) {
            F frame = source.poll();
            if (frame == null) {
                break;
            }
            try {
                if (!token.isCancelled()) {
                    processor.process(frame);
                    processedFrames++;
                }
            } catch (Exception e) {
                failedFrames++;
                log.warn("[{}] Error processing frame: {}", name, e.getMessage());
            } finally {
                frame.close();
            }
        }

        if (token.isCancelled()) {
            release();
            return false;
        }
        if (source.isEnded()) {
            log.info("[{}] Source ended after {} frames", name, processedFrames);
            cancel();
            return false;
        }
        return true;
    }

    /**
     * Stop the pipeline and release every frame still held by the source. Safe to call repeatedly.
     */
    public void cancel() {
        token.cancel();
        release();
    }

    private void release() {
        if (released) {
            return;
        }
        released = true;
        try {
            F frame;
            while ((frame = source.poll()) != null) {
                frame.close();
            }
        } finally {
            source.close();
        }
        log.debug("[{}] Pipeline cancelled", name);
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }
}
