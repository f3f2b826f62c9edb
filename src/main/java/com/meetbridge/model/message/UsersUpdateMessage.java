package com.meetbridge.model.message;

import com.meetbridge.model.Device;
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
public class UsersUpdateMessage extends ControlMessage {

    private List<Device> newUsers;
    private List<Device> removedUsers;
    private List<Device> updatedUsers;

    @Override
    public ControlMessageType getType() {
        return ControlMessageType.USERS_UPDATE;
    }
}
