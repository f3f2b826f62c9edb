package com.meetbridge.media;

/**
 * Per-frame stage of a pipeline. Must not close the frame; the pipeline does.
 */
@FunctionalInterface
public interface FrameProcessor<F extends MediaFrame> {

    void process(F frame) throws Exception;
}
