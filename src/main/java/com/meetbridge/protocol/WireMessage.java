package com.meetbridge.protocol;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * A framed message split into its tag and body.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class WireMessage {

    public static final int TAG_BYTES = 4;

    private final int tag;
    private final byte[] body;

    public static WireMessage parse(byte[] frame) {
        if (frame.length < TAG_BYTES) {
            throw new IllegalArgumentException("Message shorter than its " + TAG_BYTES + "-byte tag: " + frame.length);
        }
        int tag = ByteBuffer.wrap(frame, 0, TAG_BYTES).order(ByteOrder.LITTLE_ENDIAN).getInt();
        return new WireMessage(tag, Arrays.copyOfRange(frame, TAG_BYTES, frame.length));
    }

    /**
     * Empty for tags this side does not know, which must be ignored rather than rejected
     */
    public Optional<WireMessageType> getType() {
        return WireMessageType.fromTag(tag);
    }

    public String bodyAsText() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
