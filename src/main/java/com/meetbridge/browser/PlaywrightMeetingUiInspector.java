package com.meetbridge.browser;

import com.meetbridge.model.message.ChatStatusChangeMessage;
import com.meetbridge.model.message.MeetingStatusChangeMessage;
import com.meetbridge.model.message.UiInteractionMessage;
import com.meetbridge.service.BridgeEventLoop;
import com.meetbridge.service.BridgeMessageSender;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * UI checks against the attached Meet page. Must only be called on the event loop,
 * the thread that owns the Playwright instance.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlaywrightMeetingUiInspector implements MeetingUiInspector {

    static final String RECORDING_DIALOG = "div[aria-modal='true'][role='dialog']";
    static final String RECORDING_DIALOG_ACCEPT = "button[data-mdc-dialog-action='ok']";
    static final String REMOVED_BANNER = ".roSPhc";
    static final String CHAT_BUTTON = "button[aria-label='Chat with everyone']";
    static final String CHAT_INPUT = "textarea[aria-label='Send a message']";

    static final List<String> RECORDING_NOTICES = List.of(
            "This video call is being recorded",
            "This video call is being transcribed",
            "Gemini is taking notes");

    static final List<String> REMOVED_NOTICES = List.of(
            "You've been removed from the meeting",
            "Your host ended the meeting for everyone");

    static final String CHAT_INPUT_POLL_TASK = "chat-input-poll";
    static final Duration CHAT_INPUT_POLL_INTERVAL = Duration.ofMillis(250);
    // 12 polls of 250 ms give the panel 3 s to render the input
    static final int CHAT_INPUT_MAX_POLLS = 12;

    private final BridgeMessageSender sender;
    private final BridgeEventLoop eventLoop;

    private volatile Page page;
    private boolean removalReported;
    private ScheduledFuture<?> chatInputPoll;
    private int chatInputPolls;

    public void attach(Page page) {
        stopChatInputPoll();
        this.page = page;
        this.removalReported = false;
    }

    public void detach() {
        stopChatInputPoll();
        this.page = null;
    }

    public boolean isAttached() {
        return page != null;
    }

    @Override
    public void checkNeededInteractions() {
        Page current = page;
        if (current == null) {
            return;
        }

        Locator dialog = current.locator(RECORDING_DIALOG);
        if (dialog.count() > 0 && containsAny(dialog.first().textContent(), RECORDING_NOTICES)) {
            acceptRecordingNotice(dialog.first());
        }

        Locator removedBanner = current.locator(REMOVED_BANNER);
        if (!removalReported && removedBanner.count() > 0
                && containsAny(removedBanner.first().textContent(), REMOVED_NOTICES)) {
            removalReported = true;
            log.info("Bot is no longer in the meeting");
            sender.sendJson(MeetingStatusChangeMessage.builder()
                    .change(MeetingStatusChangeMessage.REMOVED_FROM_MEETING)
                    .build());
        }
    }

    @Override
    public void probeChatReady() {
        Page current = page;
        if (current == null) {
            log.debug("No page attached, skipping chat probe");
            return;
        }

        Locator chatButton = current.locator(CHAT_BUTTON);
        if (chatButton.count() == 0) {
            log.debug("Chat button not found");
            return;
        }

        if (chatInputPoll != null) {
            log.debug("Chat input poll already running");
            return;
        }

        try {
            chatButton.first().click();
        } catch (PlaywrightException e) {
            log.warn("Could not open the chat panel: {}", e.getMessage());
            sender.sendError("Failed to open the chat panel (" + CHAT_BUTTON + ")");
            return;
        }

        chatInputPolls = 0;
        chatInputPoll = eventLoop.scheduleAtFixedRate(CHAT_INPUT_POLL_TASK,
                () -> pollChatInput(current, chatButton), CHAT_INPUT_POLL_INTERVAL);
    }

    private void pollChatInput(Page current, Locator chatButton) {
        if (current != page) {
            stopChatInputPoll();
            return;
        }
        chatInputPolls++;

        if (current.locator(CHAT_INPUT).count() > 0) {
            stopChatInputPoll();
            try {
                // close the panel again
                chatButton.first().click();
            } catch (PlaywrightException e) {
                log.warn("Could not close the chat panel: {}", e.getMessage());
            }
            sender.sendJson(ChatStatusChangeMessage.builder()
                    .change(ChatStatusChangeMessage.READY_TO_SEND)
                    .build());
            return;
        }

        if (chatInputPolls >= CHAT_INPUT_MAX_POLLS) {
            stopChatInputPoll();
            log.warn("Chat input did not appear after {} polls", chatInputPolls);
            sender.sendError("Failed to find chat input (" + CHAT_INPUT + ") after opening the chat panel");
        }
    }

    private void stopChatInputPoll() {
        if (chatInputPoll != null) {
            chatInputPoll.cancel(false);
            chatInputPoll = null;
        }
    }

    private void acceptRecordingNotice(Locator dialog) {
        Locator acceptButton = dialog.locator(RECORDING_DIALOG_ACCEPT);
        if (acceptButton.count() == 0) {
            sender.sendError("Found recording dialog but could not find button to accept recording notification ("
                    + RECORDING_DIALOG_ACCEPT + ")");
            return;
        }

        try {
            acceptButton.first().click();
            log.info("Accepted recording notification");
            sender.sendJson(UiInteractionMessage.builder()
                    .message("Automatically accepted recording notification")
                    .build());
        } catch (PlaywrightException e) {
            log.warn("Could not click recording notification button: {}", e.getMessage());
            sender.sendError("Error clicking button to accept recording notification ("
                    + RECORDING_DIALOG_ACCEPT + ")");
        }
    }

    private static boolean containsAny(String text, List<String> phrases) {
        if (text == null) {
            return false;
        }
        return phrases.stream().anyMatch(text::contains);
    }
}
