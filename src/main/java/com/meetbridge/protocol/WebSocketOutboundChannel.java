package com.meetbridge.protocol;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Outbound channel over a local WebSocket. Each framed message is one binary WebSocket message,
 * queued through a unicast sink so ordering is preserved.
 */
@Slf4j
public class WebSocketOutboundChannel implements OutboundChannel {

    private final WebSocketClient client;
    private final URI uri;
    private final int connectRetries;
    private final InboundMessageHandler inboundHandler;

    private final AtomicBoolean open = new AtomicBoolean(false);
    private volatile Sinks.Many<byte[]> outbound;
    private Disposable connection;

    public WebSocketOutboundChannel(WebSocketClient client, URI uri, int connectRetries,
                                    InboundMessageHandler inboundHandler) {
        this.client = client;
        this.uri = uri;
        this.connectRetries = connectRetries;
        this.inboundHandler = inboundHandler;
    }

    /**
     * Open the connection in the background, retrying with backoff
     */
    public synchronized void connect() {
        if (connection != null && !connection.isDisposed()) {
            return;
        }
        log.info("Connecting outbound channel to {}", uri);

        connection = client.execute(uri, session -> {
                    Sinks.Many<byte[]> sink = Sinks.many().unicast().onBackpressureBuffer();
                    outbound = sink;
                    open.set(true);
                    log.info("Outbound channel connected to {}", uri);

                    Mono<Void> send = session.send(sink.asFlux()
                            .map(frame -> session.binaryMessage(factory -> factory.wrap(frame))));
                    Mono<Void> receive = session.receive()
                            .doOnNext(message -> inboundHandler.handle(payload(message)))
                            .then();

                    return Mono.when(send, receive)
                            .doFinally(signal -> {
                                open.set(false);
                                log.info("Outbound channel to {} closed ({})", uri, signal);
                            });
                })
                .retryWhen(Retry.backoff(connectRetries, Duration.ofSeconds(1))
                        .maxBackoff(Duration.ofSeconds(10))
                        .doBeforeRetry(signal ->
                                log.warn("Retrying outbound channel connection, attempt: {}",
                                        signal.totalRetries() + 1)))
                .doOnError(error ->
                        log.error("Outbound channel to {} failed: {}", uri, error.getMessage()))
                .onErrorResume(e -> Mono.empty())
                .subscribe();
    }

    @Override
    public boolean isOpen() {
        return open.get() && outbound != null;
    }

    @Override
    public boolean send(byte[] frame) {
        Sinks.Many<byte[]> sink = outbound;
        if (sink == null || !open.get()) {
            return false;
        }
        Sinks.EmitResult result = sink.tryEmitNext(frame);
        if (result.isFailure()) {
            log.error("Could not queue {} bytes on the outbound channel: {}", frame.length, result);
            return false;
        }
        return true;
    }

    public synchronized void close() {
        open.set(false);
        Sinks.Many<byte[]> sink = outbound;
        if (sink != null) {
            sink.tryEmitComplete();
        }
        if (connection != null) {
            connection.dispose();
        }
        log.info("Outbound channel to {} closed", uri);
    }

    private static byte[] payload(WebSocketMessage message) {
        DataBuffer buffer = message.getPayload();
        byte[] bytes = new byte[buffer.readableByteCount()];
        buffer.read(bytes);
        return bytes;
    }
}
