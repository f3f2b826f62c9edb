package com.meetbridge.decoder;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One field of a message schema.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class FieldSpec {

    private final int number;
    private final String name;
    private final FieldKind kind;
    private final boolean repeated;
    private final MeetMessageType nestedType;

    public static FieldSpec string(int number, String name) {
        return new FieldSpec(number, name, FieldKind.STRING, false, null);
    }

    public static FieldSpec varint(int number, String name) {
        return new FieldSpec(number, name, FieldKind.VARINT, false, null);
    }

    public static FieldSpec int64(int number, String name) {
        return new FieldSpec(number, name, FieldKind.INT64, false, null);
    }

    public static FieldSpec message(int number, String name, MeetMessageType nestedType) {
        return new FieldSpec(number, name, FieldKind.MESSAGE, false, nestedType);
    }

    public FieldSpec repeated() {
        return new FieldSpec(number, name, kind, true, nestedType);
    }
}
