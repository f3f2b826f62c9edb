package com.meetbridge.decoder;

import java.util.List;

import static com.meetbridge.decoder.FieldSpec.int64;
import static com.meetbridge.decoder.FieldSpec.message;
import static com.meetbridge.decoder.FieldSpec.string;
import static com.meetbridge.decoder.FieldSpec.varint;
import static com.meetbridge.decoder.MeetMessageType.*;

/**
 * Schema table for the Meet collections, captions and roster-sync payloads.
 * Field numbers were recovered from observed traffic; anything not listed here is skipped.
 */
public final class MeetSchemas {

    private MeetSchemas() {
    }

    public static List<MessageSchema> all() {
        return List.of(
                MessageSchema.of(COLLECTION_EVENT,
                        message(1, "body", COLLECTION_EVENT_BODY)),
                MessageSchema.of(COLLECTION_EVENT_BODY,
                        message(2, "userInfoListWrapperAndChatWrapperWrapper", USER_INFO_LIST_WRAPPER_AND_CHAT_WRAPPER_WRAPPER)),
                MessageSchema.of(USER_INFO_LIST_WRAPPER_AND_CHAT_WRAPPER_WRAPPER,
                        message(3, "deviceInfoWrapper", DEVICE_INFO_WRAPPER),
                        message(13, "userInfoListWrapperAndChatWrapper", USER_INFO_LIST_WRAPPER_AND_CHAT_WRAPPER)),
                MessageSchema.of(USER_INFO_LIST_WRAPPER_AND_CHAT_WRAPPER,
                        message(1, "userInfoListWrapper", USER_INFO_LIST_WRAPPER),
                        message(4, "chatMessageWrapper", CHAT_MESSAGE_WRAPPER).repeated()),
                MessageSchema.of(DEVICE_INFO_WRAPPER,
                        message(2, "deviceOutputInfoList", DEVICE_OUTPUT_INFO_LIST).repeated()),
                MessageSchema.of(DEVICE_OUTPUT_INFO_LIST,
                        varint(2, "deviceOutputType"),
                        string(4, "streamId"),
                        string(6, "deviceId"),
                        message(10, "deviceOutputStatus", DEVICE_OUTPUT_STATUS)),
                MessageSchema.of(DEVICE_OUTPUT_STATUS,
                        varint(1, "disabled")),
                MessageSchema.of(USER_INFO_LIST_RESPONSE,
                        message(2, "userInfoListWrapperWrapper", USER_INFO_LIST_WRAPPER_WRAPPER)),
                MessageSchema.of(USER_INFO_LIST_WRAPPER_WRAPPER,
                        message(2, "userInfoListWrapper", USER_INFO_LIST_WRAPPER)),
                MessageSchema.of(USER_EVENT_INFO,
                        varint(1, "eventNumber")),
                MessageSchema.of(USER_INFO_LIST_WRAPPER,
                        message(1, "userEventInfo", USER_EVENT_INFO),
                        message(2, "userInfoList", USER_INFO_LIST).repeated()),
                MessageSchema.of(USER_INFO_LIST,
                        string(1, "deviceId"),
                        string(2, "fullName"),
                        string(3, "profilePicture"),
                        // 1 = in meeting, 6 = not in meeting, 7 = removed
                        varint(4, "status"),
                        // presence marks this client's own device, the value itself is opaque
                        string(7, "isCurrentUserString"),
                        // set on screen-share devices, points at the sharer
                        string(21, "parentDeviceId"),
                        string(29, "displayName"),
                        varint(34, "isHost")),
                MessageSchema.of(CAPTION_WRAPPER,
                        message(1, "caption", CAPTION)),
                MessageSchema.of(CAPTION,
                        string(1, "deviceId"),
                        int64(2, "captionId"),
                        int64(3, "version"),
                        varint(4, "isFinal"),
                        string(6, "text"),
                        int64(8, "languageId")),
                MessageSchema.of(CHAT_MESSAGE_WRAPPER,
                        message(2, "chatMessage", CHAT_MESSAGE)),
                MessageSchema.of(CHAT_MESSAGE,
                        string(1, "messageId"),
                        string(2, "deviceId"),
                        int64(3, "timestamp"),
                        message(5, "chatMessageContent", CHAT_MESSAGE_CONTENT)),
                MessageSchema.of(CHAT_MESSAGE_CONTENT,
                        string(1, "text"))
        );
    }
}
