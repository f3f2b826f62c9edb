package com.meetbridge.model.message;

import com.meetbridge.model.AudioFormat;
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
public class AudioFormatUpdateMessage extends ControlMessage {

    private AudioFormat format;

    @Override
    public ControlMessageType getType() {
        return ControlMessageType.AUDIO_FORMAT_UPDATE;
    }
}
