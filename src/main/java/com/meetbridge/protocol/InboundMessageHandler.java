package com.meetbridge.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;

/**
 * Messages arriving from the backend on the local channel. JSON is parsed and logged;
 * every other tag is ignored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InboundMessageHandler {

    private final ObjectMapper objectMapper;

    /**
     * @return the parsed JSON document, or empty when the message was not JSON or could not be read
     */
    public Optional<JsonNode> handle(byte[] frame) {
        WireMessage message;
        try {
            message = WireMessage.parse(frame);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring inbound message: {}", e.getMessage());
            return Optional.empty();
        }

        Optional<WireMessageType> type = message.getType();
        if (type.isEmpty()) {
            log.debug("Ignoring inbound message with unknown tag {}", message.getTag());
            return Optional.empty();
        }

        return switch (type.get()) {
            case JSON -> parseJson(message);
            case VIDEO, AUDIO, ENCODED_MEDIA_CHUNK, PER_PARTICIPANT_AUDIO -> {
                log.debug("Ignoring inbound {} message ({} bytes)", type.get(), message.getBody().length);
                yield Optional.empty();
            }
        };
    }

    private Optional<JsonNode> parseJson(WireMessage message) {
        try {
            JsonNode json = objectMapper.readTree(message.getBody());
            log.info("Inbound message: {}", json);
            return Optional.of(json);
        } catch (IOException e) {
            log.warn("Inbound JSON message could not be parsed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
