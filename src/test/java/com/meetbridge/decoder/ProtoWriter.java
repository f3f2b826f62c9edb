package com.meetbridge.decoder;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Minimal encoder for building test payloads in the tag-length-value format.
 */
public final class ProtoWriter {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    public static ProtoWriter create() {
        return new ProtoWriter();
    }

    public ProtoWriter varint(int field, long value) {
        tag(field, WireReader.WIRE_VARINT);
        rawVarint(value);
        return this;
    }

    public ProtoWriter string(int field, String value) {
        return bytes(field, value.getBytes(StandardCharsets.UTF_8));
    }

    public ProtoWriter bytes(int field, byte[] value) {
        tag(field, WireReader.WIRE_LENGTH_DELIMITED);
        rawVarint(value.length);
        out.writeBytes(value);
        return this;
    }

    public ProtoWriter message(int field, ProtoWriter nested) {
        return bytes(field, nested.toByteArray());
    }

    public ProtoWriter fixed32(int field, int value) {
        tag(field, WireReader.WIRE_FIXED32);
        for (int i = 0; i < 4; i++) {
            out.write((value >>> (8 * i)) & 0xFF);
        }
        return this;
    }

    public ProtoWriter fixed64(int field, long value) {
        tag(field, WireReader.WIRE_FIXED64);
        for (int i = 0; i < 8; i++) {
            out.write((int) ((value >>> (8 * i)) & 0xFF));
        }
        return this;
    }

    public ProtoWriter tag(int field, int wireType) {
        rawVarint(((long) field << 3) | wireType);
        return this;
    }

    public ProtoWriter rawVarint(long value) {
        while ((value & ~0x7FL) != 0) {
            out.write((int) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        out.write((int) value);
        return this;
    }

    public ProtoWriter raw(int... bytes) {
        for (int b : bytes) {
            out.write(b);
        }
        return this;
    }

    public byte[] toByteArray() {
        return out.toByteArray();
    }
}
