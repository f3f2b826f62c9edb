package com.meetbridge.model.message;

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
public class ErrorMessage extends ControlMessage {

    private String message;

    @Override
    public ControlMessageType getType() {
        return ControlMessageType.ERROR;
    }
}
