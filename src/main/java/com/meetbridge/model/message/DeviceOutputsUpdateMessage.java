package com.meetbridge.model.message;

import com.meetbridge.model.DeviceOutput;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class DeviceOutputsUpdateMessage extends ControlMessage {

    private List<DeviceOutput> deviceOutputs;

    @Override
    public ControlMessageType getType() {
        return ControlMessageType.DEVICE_OUTPUTS_UPDATE;
    }
}
