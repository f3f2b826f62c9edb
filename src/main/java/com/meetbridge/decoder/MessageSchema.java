package com.meetbridge.decoder;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered field table for one message type.
 */
@Getter
@ToString
public final class MessageSchema {

    private final MeetMessageType type;
    private final List<FieldSpec> fields;

    @ToString.Exclude
    private final Map<Integer, FieldSpec> fieldsByNumber;

    public MessageSchema(MeetMessageType type, List<FieldSpec> fields) {
        this.type = type;
        this.fields = List.copyOf(fields);

        Map<Integer, FieldSpec> byNumber = new LinkedHashMap<>();
        for (FieldSpec field : fields) {
            if (byNumber.put(field.getNumber(), field) != null) {
                throw new IllegalArgumentException(
                        "Duplicate field number " + field.getNumber() + " in schema " + type);
            }
        }
        this.fieldsByNumber = Collections.unmodifiableMap(byNumber);
    }

    public static MessageSchema of(MeetMessageType type, FieldSpec... fields) {
        return new MessageSchema(type, List.of(fields));
    }

    public FieldSpec fieldByNumber(int number) {
        return fieldsByNumber.get(number);
    }
}
