package com.meetbridge.decoder;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Result of decoding one buffer against a schema.
 * Values are String, Long or DecodedMessage; repeated fields hold a List of those.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DecodedMessage {

    private final MeetMessageType type;
    private final Map<String, Object> fields;

    public DecodedMessage(MeetMessageType type, Map<String, Object> fields) {
        this.type = type;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public boolean has(String name) {
        return fields.containsKey(name);
    }

    public String getString(String name) {
        return (String) fields.get(name);
    }

    public Long getLong(String name) {
        return (Long) fields.get(name);
    }

    public long getLong(String name, long defaultValue) {
        Long value = getLong(name);
        return value != null ? value : defaultValue;
    }

    public boolean getFlag(String name) {
        Long value = getLong(name);
        return value != null && value != 0;
    }

    public DecodedMessage getMessage(String name) {
        return (DecodedMessage) fields.get(name);
    }

    public List<DecodedMessage> getMessages(String name) {
        Object value = fields.get(name);
        if (value == null) {
            return List.of();
        }
        return ((List<?>) value).stream()
                .map(DecodedMessage.class::cast)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Builder used by the decoder while it walks a buffer
     */
    static final class Accumulator {
        private final MeetMessageType type;
        // repeated fields keep a null slot in values so the field order survives
        private final Map<String, Object> values = new LinkedHashMap<>();
        private final Map<String, List<Object>> repeated = new HashMap<>();

        Accumulator(MeetMessageType type) {
            this.type = type;
        }

        void put(FieldSpec field, Object value) {
            String name = field.getName();
            if (field.isRepeated()) {
                if (!repeated.containsKey(name)) {
                    repeated.put(name, new ArrayList<>());
                    values.put(name, null);
                }
                repeated.get(name).add(value);
            } else {
                values.put(name, value);
            }
        }

        DecodedMessage build() {
            Map<String, Object> frozen = new LinkedHashMap<>();
            values.forEach((name, value) -> frozen.put(name,
                    repeated.containsKey(name) ? List.copyOf(repeated.get(name)) : value));
            return new DecodedMessage(type, frozen);
        }
    }
}
