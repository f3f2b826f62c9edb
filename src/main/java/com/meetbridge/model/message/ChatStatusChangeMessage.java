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
public class ChatStatusChangeMessage extends ControlMessage {

    public static final String READY_TO_SEND = "ready_to_send";

    private String change;

    @Override
    public ControlMessageType getType() {
        return ControlMessageType.CHAT_STATUS_CHANGE;
    }
}
