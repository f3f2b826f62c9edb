package com.meetbridge.decoder;

/**
 * Message types of the meeting platform's internal transport that the bridge knows how to read.
 * Names follow the structure observed on the wire; several are plain wrappers.
 */
public enum MeetMessageType {
    COLLECTION_EVENT,
    COLLECTION_EVENT_BODY,
    USER_INFO_LIST_WRAPPER_AND_CHAT_WRAPPER_WRAPPER,
    USER_INFO_LIST_WRAPPER_AND_CHAT_WRAPPER,
    DEVICE_INFO_WRAPPER,
    DEVICE_OUTPUT_INFO_LIST,
    DEVICE_OUTPUT_STATUS,
    USER_INFO_LIST_RESPONSE,
    USER_INFO_LIST_WRAPPER_WRAPPER,
    USER_EVENT_INFO,
    USER_INFO_LIST_WRAPPER,
    USER_INFO_LIST,
    CAPTION_WRAPPER,
    CAPTION,
    CHAT_MESSAGE_WRAPPER,
    CHAT_MESSAGE,
    CHAT_MESSAGE_CONTENT
}
