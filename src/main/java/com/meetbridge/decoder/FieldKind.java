package com.meetbridge.decoder;

/**
 * Primitive kinds a schema field can declare, with the wire type each one is carried in.
 */
public enum FieldKind {
    STRING(WireReader.WIRE_LENGTH_DELIMITED),
    VARINT(WireReader.WIRE_VARINT),
    INT64(WireReader.WIRE_VARINT),
    MESSAGE(WireReader.WIRE_LENGTH_DELIMITED);

    private final int wireType;

    FieldKind(int wireType) {
        this.wireType = wireType;
    }

    public int getWireType() {
        return wireType;
    }
}
