package com.meetbridge.exception;

/**
 * Raised when a transport buffer cannot be decoded against its schema.
 * The whole message is rejected; callers never see a partially decoded result.
 */
public class MessageDecodeException extends Exception {

    public MessageDecodeException(String message) {
        super(message);
    }

    public MessageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
