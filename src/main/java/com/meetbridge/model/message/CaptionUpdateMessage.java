package com.meetbridge.model.message;

import com.meetbridge.model.CaptionRecord;
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
public class CaptionUpdateMessage extends ControlMessage {

    private CaptionRecord caption;

    @Override
    public ControlMessageType getType() {
        return ControlMessageType.CAPTION_UPDATE;
    }
}
