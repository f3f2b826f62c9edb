package com.meetbridge.browser;

/**
 * Checks against the meeting page that need the rendered UI rather than the transport.
 */
public interface MeetingUiInspector {

    /**
     * Accept consent dialogs and report whether the bot was removed from the meeting
     */
    void checkNeededInteractions();

    /**
     * Report whether the chat input is available for sending messages
     */
    void probeChatReady();
}
