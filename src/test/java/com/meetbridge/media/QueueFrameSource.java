package com.meetbridge.media;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Frame source fed by the test.
 */
public class QueueFrameSource<F extends MediaFrame> implements FrameSource<F> {

    private final Deque<F> frames = new ArrayDeque<>();
    private boolean ended;
    private boolean closed;

    @SafeVarargs
    public final QueueFrameSource<F> offer(F... offered) {
        for (F frame : offered) {
            frames.addLast(frame);
        }
        return this;
    }

    public void end() {
        ended = true;
    }

    @Override
    public F poll() {
        return frames.pollFirst();
    }

    @Override
    public boolean isEnded() {
        return ended && frames.isEmpty();
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public int pending() {
        return frames.size();
    }
}
