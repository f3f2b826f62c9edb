package com.meetbridge.transport;

import com.meetbridge.decoder.DecodedMessage;
import com.meetbridge.model.CaptionRecord;
import com.meetbridge.model.ChatMessageRecord;
import com.meetbridge.model.RawDevice;
import com.meetbridge.model.RawDeviceOutput;
import com.meetbridge.service.CaptionService;
import com.meetbridge.service.ChatService;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks decoded Meet payloads down to the records the services work with.
 * Every wrapper level is optional on the wire.
 */
public final class MeetPayloadMapper {

    private MeetPayloadMapper() {
    }

    /**
     * Devices of a roster-sync UserInfoListResponse
     */
    public static List<RawDevice> rosterDevices(DecodedMessage userInfoListResponse) {
        return child(userInfoListResponse, "userInfoListWrapperWrapper")
                .flatMap(wrapper -> child(wrapper, "userInfoListWrapper"))
                .map(MeetPayloadMapper::devices)
                .orElse(List.of());
    }

    /**
     * Devices carried incrementally by a CollectionEvent, usually a single one
     */
    public static List<RawDevice> collectionDevices(DecodedMessage collectionEvent) {
        return userInfoAndChat(collectionEvent)
                .flatMap(wrapper -> child(wrapper, "userInfoListWrapper"))
                .map(MeetPayloadMapper::devices)
                .orElse(List.of());
    }

    public static List<RawDeviceOutput> deviceOutputs(DecodedMessage collectionEvent) {
        List<DecodedMessage> entries = wrapperWrapper(collectionEvent)
                .flatMap(wrapper -> child(wrapper, "deviceInfoWrapper"))
                .map(wrapper -> wrapper.getMessages("deviceOutputInfoList"))
                .orElse(List.of());

        List<RawDeviceOutput> outputs = new ArrayList<>(entries.size());
        for (DecodedMessage entry : entries) {
            outputs.add(RawDeviceOutput.builder()
                    .deviceId(entry.getString("deviceId"))
                    .outputTypeCode(entry.getLong("deviceOutputType", 0))
                    .streamId(entry.getString("streamId"))
                    .disabled(child(entry, "deviceOutputStatus")
                            .map(status -> status.getFlag("disabled"))
                            .orElse(false))
                    .build());
        }
        return outputs;
    }

    public static List<ChatMessageRecord> chatMessages(DecodedMessage collectionEvent) {
        List<DecodedMessage> wrappers = userInfoAndChat(collectionEvent)
                .map(wrapper -> wrapper.getMessages("chatMessageWrapper"))
                .orElse(List.of());

        List<ChatMessageRecord> messages = new ArrayList<>(wrappers.size());
        for (DecodedMessage wrapper : wrappers) {
            ChatService.normalize(wrapper).ifPresent(messages::add);
        }
        return messages;
    }

    public static Optional<CaptionRecord> caption(DecodedMessage captionWrapper) {
        return child(captionWrapper, "caption").map(CaptionService::normalize);
    }

    static RawDevice device(DecodedMessage userInfo) {
        return RawDevice.builder()
                .deviceId(userInfo.getString("deviceId"))
                .fullName(userInfo.getString("fullName"))
                .profilePicture(userInfo.getString("profilePicture"))
                .status(userInfo.getLong("status", 0))
                .currentUserMarker(userInfo.getString("isCurrentUserString"))
                .parentDeviceId(userInfo.getString("parentDeviceId"))
                .displayName(userInfo.getString("displayName"))
                .host(userInfo.getFlag("isHost"))
                .build();
    }

    private static List<RawDevice> devices(DecodedMessage userInfoListWrapper) {
        List<DecodedMessage> entries = userInfoListWrapper.getMessages("userInfoList");
        List<RawDevice> devices = new ArrayList<>(entries.size());
        for (DecodedMessage entry : entries) {
            devices.add(device(entry));
        }
        return devices;
    }

    private static Optional<DecodedMessage> wrapperWrapper(DecodedMessage collectionEvent) {
        return child(collectionEvent, "body")
                .flatMap(body -> child(body, "userInfoListWrapperAndChatWrapperWrapper"));
    }

    private static Optional<DecodedMessage> userInfoAndChat(DecodedMessage collectionEvent) {
        return wrapperWrapper(collectionEvent)
                .flatMap(wrapper -> child(wrapper, "userInfoListWrapperAndChatWrapper"));
    }

    private static Optional<DecodedMessage> child(DecodedMessage parent, String field) {
        return Optional.ofNullable(parent).map(message -> message.getMessage(field));
    }
}
