package com.meetbridge.model.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class SilenceStatusMessage extends ControlMessage {

    private double volume;

    @JsonProperty("isSilent")
    private boolean silent;

    @Override
    public ControlMessageType getType() {
        return ControlMessageType.SILENCE_STATUS;
    }
}
