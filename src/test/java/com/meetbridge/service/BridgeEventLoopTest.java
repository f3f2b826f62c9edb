package com.meetbridge.service;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BridgeEventLoopTest {

    private final BridgeEventLoop eventLoop = new BridgeEventLoop(Runnable::run, null);

    @Test
    void failingTaskDoesNotStopLaterOnes() {
        AtomicInteger ran = new AtomicInteger();

        eventLoop.execute("boom", () -> {
            throw new IllegalStateException("boom");
        });
        eventLoop.execute("count", ran::incrementAndGet);

        assertThat(ran).hasValue(1);
    }

    @Test
    void callReturnsResult() throws Exception {
        CompletableFuture<String> result = eventLoop.call("read", () -> "value");

        assertThat(result.get()).isEqualTo("value");
    }

    @Test
    void callSurfacesFailure() {
        CompletableFuture<String> result = eventLoop.call("read", () -> {
            throw new IllegalArgumentException("bad");
        });

        assertThatThrownBy(result::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }
}
