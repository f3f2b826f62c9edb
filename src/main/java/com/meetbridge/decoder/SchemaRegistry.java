package com.meetbridge.decoder;

import com.meetbridge.exception.MessageDecodeException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Table from message type to decoder, resolved once at construction.
 * Nested message fields are linked directly to the decoder of their sub-schema, so decoding
 * never looks anything up by name.
 */
@Slf4j
public class SchemaRegistry {

    private final Map<MeetMessageType, SchemaDecoder> decoders = new EnumMap<>(MeetMessageType.class);

    public SchemaRegistry(Collection<MessageSchema> schemas) {
        for (MessageSchema schema : schemas) {
            if (decoders.put(schema.getType(), new SchemaDecoder(schema)) != null) {
                throw new IllegalArgumentException("Schema registered twice: " + schema.getType());
            }
        }

        // Link nested fields now so a missing sub-schema fails at startup, not mid-meeting
        for (SchemaDecoder decoder : decoders.values()) {
            decoder.link(decoders);
        }
        log.info("Schema registry initialized with {} message types", decoders.size());
    }

    public boolean supports(MeetMessageType type) {
        return decoders.containsKey(type);
    }

    /**
     * Decode a complete buffer as the given top-level message type
     */
    public DecodedMessage decode(MeetMessageType type, byte[] buffer) throws MessageDecodeException {
        SchemaDecoder decoder = decoders.get(type);
        if (decoder == null) {
            throw new MessageDecodeException("No schema registered for message type " + type);
        }
        return decoder.decode(new WireReader(buffer));
    }

    private static final class SchemaDecoder {
        private final MessageSchema schema;
        private final Map<Integer, SchemaDecoder> nestedByFieldNumber = new HashMap<>();

        SchemaDecoder(MessageSchema schema) {
            this.schema = schema;
        }

        void link(Map<MeetMessageType, SchemaDecoder> all) {
            for (FieldSpec field : schema.getFields()) {
                if (field.getKind() != FieldKind.MESSAGE) {
                    continue;
                }
                SchemaDecoder nested = all.get(field.getNestedType());
                if (nested == null) {
                    throw new IllegalStateException("Schema " + schema.getType() + " field '" + field.getName()
                            + "' refers to unregistered type " + field.getNestedType());
                }
                nestedByFieldNumber.put(field.getNumber(), nested);
            }
        }

        DecodedMessage decode(WireReader reader) throws MessageDecodeException {
            DecodedMessage.Accumulator message = new DecodedMessage.Accumulator(schema.getType());

            while (reader.position() < reader.limit()) {
                int tag = reader.readTag();
                int fieldNumber = tag >>> 3;
                int wireType = tag & 7;

                FieldSpec field = schema.fieldByNumber(fieldNumber);
                if (field == null) {
                    reader.skip(wireType);
                    continue;
                }
                if (wireType != field.getKind().getWireType()) {
                    throw new MessageDecodeException("Field '" + field.getName() + "' of " + schema.getType()
                            + " expects wire type " + field.getKind().getWireType() + " but got " + wireType);
                }

                Object value = switch (field.getKind()) {
                    case STRING -> reader.readString();
                    case VARINT -> reader.readUint32();
                    case INT64 -> reader.readVarint();
                    case MESSAGE -> nestedByFieldNumber.get(fieldNumber).decode(reader.readNested());
                };
                message.put(field, value);
            }
            return message.build();
        }
    }
}
