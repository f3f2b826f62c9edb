package com.meetbridge.service;

import com.meetbridge.media.MonotonicClock;
import com.meetbridge.model.Device;
import com.meetbridge.model.DeviceOutput;
import com.meetbridge.model.OutputType;
import com.meetbridge.model.RawDevice;
import com.meetbridge.model.RawDeviceOutput;
import com.meetbridge.model.RosterDiff;
import com.meetbridge.model.message.DeviceOutputsUpdateMessage;
import com.meetbridge.model.message.UsersUpdateMessage;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Participant and device-output tables, and the join/leave/update diffing between roster snapshots.
 * Only touched from the bridge event loop.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ParticipantStateService {

    private final BridgeMessageSender sender;
    private final MonotonicClock clock;

    // every device ever seen, screen shares included
    private final Map<String, Device> allDevices = new LinkedHashMap<>();
    // devices currently IN_MEETING
    private Map<String, Device> currentRoster = new LinkedHashMap<>();
    private final Map<OutputKey, DeviceOutput> deviceOutputs = new LinkedHashMap<>();

    private String currentUserDeviceId;

    /**
     * Replace the current roster with a full snapshot and report what changed
     */
    public RosterDiff applyFullRoster(List<RawDevice> snapshot) {
        List<Device> devices = new ArrayList<>(snapshot.size());
        for (RawDevice raw : snapshot) {
            devices.add(resolve(raw));
        }
        return reconcile(devices);
    }

    /**
     * Merge one incremental device into the current roster. The incoming entry replaces the
     * stored one; a device that left is only noticed by the next full snapshot.
     */
    public RosterDiff applySingleDevice(RawDevice raw) {
        Device incoming = resolve(raw);
        Map<String, Device> merged = new LinkedHashMap<>(currentRoster);
        merged.put(incoming.getDeviceId(), incoming);
        return reconcile(merged.values());
    }

    /**
     * Upsert outputs by device and type, then publish the whole table
     */
    public void applyDeviceOutputs(List<RawDeviceOutput> outputs) {
        long now = clock.millis();
        for (RawDeviceOutput raw : outputs) {
            Optional<OutputType> type = OutputType.fromCode(raw.getOutputTypeCode());
            if (type.isEmpty()) {
                log.debug("Ignoring output of device {} with unknown type {}", raw.getDeviceId(), raw.getOutputTypeCode());
                continue;
            }
            DeviceOutput output = DeviceOutput.builder()
                    .deviceId(raw.getDeviceId())
                    .outputType(type.get())
                    .streamId(raw.getStreamId())
                    .disabled(raw.isDisabled())
                    .lastUpdated(now)
                    .build();
            deviceOutputs.put(new OutputKey(raw.getDeviceId(), type.get()), output);
        }

        sender.sendJson(DeviceOutputsUpdateMessage.builder()
                .deviceOutputs(new ArrayList<>(deviceOutputs.values()))
                .build());
    }

    private Device resolve(RawDevice raw) {
        if (currentUserDeviceId == null && raw.hasCurrentUserMarker()) {
            currentUserDeviceId = raw.getDeviceId();
            log.info("Current user device is {}", currentUserDeviceId);
        }
        return Device.builder()
                .deviceId(raw.getDeviceId())
                .displayName(raw.getDisplayName())
                .fullName(raw.getFullName())
                .profilePicture(raw.getProfilePicture())
                .status((int) raw.getStatus())
                .parentDeviceId(raw.getParentDeviceId())
                .currentUser(Objects.equals(raw.getDeviceId(), currentUserDeviceId))
                .host(raw.isHost())
                .build();
    }

    private RosterDiff reconcile(Collection<Device> devices) {
        Map<String, Device> nextRoster = new LinkedHashMap<>();
        for (Device device : devices) {
            allDevices.put(device.getDeviceId(), device);
            if (device.isInMeeting()) {
                nextRoster.put(device.getDeviceId(), device);
            }
        }

        RosterDiff diff = new RosterDiff();
        for (Device device : nextRoster.values()) {
            Device previous = currentRoster.get(device.getDeviceId());
            if (previous == null) {
                diff.getJoined().add(device);
            } else if (!previous.equals(device)) {
                diff.getUpdated().add(device);
            }
        }
        for (Device previous : currentRoster.values()) {
            if (!nextRoster.containsKey(previous.getDeviceId())) {
                diff.getLeft().add(previous);
            }
        }
        currentRoster = nextRoster;

        diff.getJoined().removeIf(Device::isScreenShare);
        diff.getLeft().removeIf(Device::isScreenShare);
        diff.getUpdated().removeIf(Device::isScreenShare);

        if (!diff.isEmpty()) {
            log.info("Roster changed: {} joined, {} left, {} updated",
                    diff.getJoined().size(), diff.getLeft().size(), diff.getUpdated().size());
            sender.sendJson(UsersUpdateMessage.builder()
                    .newUsers(diff.getJoined())
                    .removedUsers(diff.getLeft())
                    .updatedUsers(diff.getUpdated())
                    .build());
        }
        return diff;
    }

    public Optional<Device> findByDeviceId(String deviceId) {
        return Optional.ofNullable(allDevices.get(deviceId));
    }

    /**
     * Resolve a media stream to the device whose output carries it
     */
    public Optional<Device> findByStreamId(String streamId) {
        if (streamId == null) {
            return Optional.empty();
        }
        return deviceOutputs.values().stream()
                .filter(output -> streamId.equals(output.getStreamId()))
                .findFirst()
                .flatMap(output -> findByDeviceId(output.getDeviceId()));
    }

    public Optional<Device> findByFullName(String fullName) {
        return allDevices.values().stream()
                .filter(device -> Objects.equals(device.getFullName(), fullName))
                .findFirst();
    }

    public Optional<Device> findByDisplayName(String displayName) {
        return allDevices.values().stream()
                .filter(device -> Objects.equals(device.getDisplayName(), displayName))
                .findFirst();
    }

    public Optional<DeviceOutput> getDeviceOutput(String deviceId, OutputType type) {
        return Optional.ofNullable(deviceOutputs.get(new OutputKey(deviceId, type)));
    }

    public List<Device> getCurrentDevicesInMeeting() {
        return List.copyOf(currentRoster.values());
    }

    public List<DeviceOutput> getDeviceOutputs() {
        return List.copyOf(deviceOutputs.values());
    }

    public Optional<String> getCurrentUserDeviceId() {
        return Optional.ofNullable(currentUserDeviceId);
    }

    /**
     * True when the stream is the video output of a screen share that is currently in the meeting
     */
    public boolean isScreenShareStream(String streamId) {
        if (streamId == null) {
            return false;
        }
        return currentRoster.values().stream()
                .filter(Device::isScreenShare)
                .map(device -> getDeviceOutput(device.getDeviceId(), OutputType.VIDEO))
                .flatMap(Optional::stream)
                .anyMatch(output -> streamId.equals(output.getStreamId()));
    }

    @Value
    private static class OutputKey {
        String deviceId;
        OutputType type;
    }
}
