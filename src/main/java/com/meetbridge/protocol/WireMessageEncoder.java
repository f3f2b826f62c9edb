package com.meetbridge.protocol;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Builds outbound frames. All integers and floats are little-endian.
 */
public final class WireMessageEncoder {

    private WireMessageEncoder() {
    }

    public static byte[] json(byte[] utf8Json) {
        return allocate(WireMessageType.JSON, utf8Json.length)
                .put(utf8Json)
                .array();
    }

    /**
     * tag | int64 timestamp (us) | int32 stream-id length | stream-id | int32 width | int32 height | frame
     */
    public static byte[] video(long timestampMicros, String streamId, int width, int height, byte[] frameData) {
        byte[] streamIdBytes = streamId.getBytes(StandardCharsets.UTF_8);
        return allocate(WireMessageType.VIDEO, 8 + 4 + streamIdBytes.length + 4 + 4 + frameData.length)
                .putLong(timestampMicros)
                .putInt(streamIdBytes.length)
                .put(streamIdBytes)
                .putInt(width)
                .putInt(height)
                .put(frameData)
                .array();
    }

    public static byte[] mixedAudio(float[] samples) {
        ByteBuffer buffer = allocate(WireMessageType.AUDIO, samples.length * Float.BYTES);
        putSamples(buffer, samples);
        return buffer.array();
    }

    public static byte[] encodedMediaChunk(byte[] chunk) {
        return allocate(WireMessageType.ENCODED_MEDIA_CHUNK, chunk.length)
                .put(chunk)
                .array();
    }

    /**
     * tag | uint8 participant-id length | participant-id | float32 samples
     */
    public static byte[] perParticipantAudio(String participantId, float[] samples) {
        byte[] idBytes = participantId.getBytes(StandardCharsets.UTF_8);
        if (idBytes.length > 0xFF) {
            throw new IllegalArgumentException("Participant id too long for a one-byte length: " + idBytes.length + " bytes");
        }
        ByteBuffer buffer = allocate(WireMessageType.PER_PARTICIPANT_AUDIO, 1 + idBytes.length + samples.length * Float.BYTES)
                .put((byte) idBytes.length)
                .put(idBytes);
        putSamples(buffer, samples);
        return buffer.array();
    }

    private static ByteBuffer allocate(WireMessageType type, int bodyLength) {
        return ByteBuffer.allocate(WireMessage.TAG_BYTES + bodyLength)
                .order(ByteOrder.LITTLE_ENDIAN)
                .putInt(type.getTag());
    }

    private static void putSamples(ByteBuffer buffer, float[] samples) {
        for (float sample : samples) {
            buffer.putFloat(sample);
        }
    }
}
