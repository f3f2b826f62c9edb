package com.meetbridge.model.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Base of every JSON control message. The concrete class fixes the type tag.
 */
@JsonPropertyOrder({"type"})
public abstract class ControlMessage {

    @JsonProperty("type")
    public abstract ControlMessageType getType();
}
