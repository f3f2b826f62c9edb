package com.meetbridge.decoder;

import com.meetbridge.exception.MessageDecodeException;

import java.nio.charset.StandardCharsets;

/**
 * Cursor over a tag-length-value encoded buffer.
 * All reads are bounds-checked against the limit given at construction.
 */
public class WireReader {

    public static final int WIRE_VARINT = 0;
    public static final int WIRE_FIXED64 = 1;
    public static final int WIRE_LENGTH_DELIMITED = 2;
    public static final int WIRE_START_GROUP = 3;
    public static final int WIRE_END_GROUP = 4;
    public static final int WIRE_FIXED32 = 5;

    private static final int MAX_VARINT_BYTES = 10;
    private static final int MAX_GROUP_DEPTH = 64;

    private final byte[] buffer;
    private final int limit;
    private int pos;

    public WireReader(byte[] buffer) {
        this(buffer, 0, buffer.length);
    }

    public WireReader(byte[] buffer, int offset, int length) {
        if (offset < 0 || length < 0 || offset + length > buffer.length) {
            throw new IllegalArgumentException("Reader window out of range: offset=" + offset + ", length=" + length);
        }
        this.buffer = buffer;
        this.pos = offset;
        this.limit = offset + length;
    }

    public int position() {
        return pos;
    }

    public int limit() {
        return limit;
    }

    /**
     * Read a raw base-128 varint (up to 64 bits)
     */
    public long readVarint() throws MessageDecodeException {
        long result = 0;
        for (int i = 0; i < MAX_VARINT_BYTES; i++) {
            if (pos >= limit) {
                throw new MessageDecodeException("Truncated varint at offset " + pos);
            }
            byte b = buffer[pos++];
            result |= (long) (b & 0x7F) << (7 * i);
            if ((b & 0x80) == 0) {
                return result;
            }
        }
        throw new MessageDecodeException("Malformed varint longer than " + MAX_VARINT_BYTES + " bytes at offset " + pos);
    }

    /**
     * Read a varint and keep its low 32 bits as an unsigned value
     */
    public long readUint32() throws MessageDecodeException {
        return readVarint() & 0xFFFFFFFFL;
    }

    public int readTag() throws MessageDecodeException {
        long tag = readUint32();
        int fieldNumber = (int) (tag >>> 3);
        if (fieldNumber == 0) {
            throw new MessageDecodeException("Invalid tag with field number 0 at offset " + pos);
        }
        return (int) tag;
    }

    public int readLength() throws MessageDecodeException {
        long length = readUint32();
        if (length > limit - pos) {
            throw new MessageDecodeException("Length " + length + " exceeds remaining " + (limit - pos) + " bytes at offset " + pos);
        }
        return (int) length;
    }

    public String readString() throws MessageDecodeException {
        int length = readLength();
        String value = new String(buffer, pos, length, StandardCharsets.UTF_8);
        pos += length;
        return value;
    }

    /**
     * Open a reader over the next length-delimited chunk and advance past it
     */
    public WireReader readNested() throws MessageDecodeException {
        int length = readLength();
        WireReader nested = new WireReader(buffer, pos, length);
        pos += length;
        return nested;
    }

    /**
     * Consume one value of the given wire type without interpreting it
     */
    public void skip(int wireType) throws MessageDecodeException {
        switch (wireType) {
            case WIRE_VARINT -> readVarint();
            case WIRE_FIXED64 -> advance(8);
            case WIRE_LENGTH_DELIMITED -> advance(readLength());
            case WIRE_FIXED32 -> advance(4);
            case WIRE_START_GROUP -> skipGroup();
            default -> throw new MessageDecodeException("Invalid wire type " + wireType + " at offset " + pos);
        }
    }

    private void skipGroup() throws MessageDecodeException {
        int depth = 1;
        while (depth > 0) {
            int innerType = readTag() & 7;
            if (innerType == WIRE_START_GROUP) {
                if (++depth > MAX_GROUP_DEPTH) {
                    throw new MessageDecodeException("Group nesting exceeds " + MAX_GROUP_DEPTH + " levels at offset " + pos);
                }
            } else if (innerType == WIRE_END_GROUP) {
                depth--;
            } else {
                skip(innerType);
            }
        }
    }

    private void advance(int count) throws MessageDecodeException {
        if (count > limit - pos) {
            throw new MessageDecodeException("Cannot skip " + count + " bytes, only " + (limit - pos) + " remain");
        }
        pos += count;
    }
}
