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
public class ChatMessageEvent extends ControlMessage {

    @JsonProperty("message_uuid")
    private String messageUuid;

    @JsonProperty("participant_uuid")
    private String participantUuid;

    // seconds
    private long timestamp;

    private String text;

    @Override
    public ControlMessageType getType() {
        return ControlMessageType.CHAT_MESSAGE;
    }
}
