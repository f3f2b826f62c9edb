package com.meetbridge.browser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meetbridge.config.BridgeSettings;
import com.meetbridge.protocol.RecordingOutboundChannel;
import com.meetbridge.service.BridgeMessageSender;
import com.meetbridge.service.ManualEventLoop;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PlaywrightMeetingUiInspectorTest {

    @Mock
    private Page page;

    private RecordingOutboundChannel channel;
    private ManualEventLoop eventLoop;
    private PlaywrightMeetingUiInspector inspector;

    @BeforeEach
    void setUp() {
        channel = new RecordingOutboundChannel();
        eventLoop = new ManualEventLoop();
        BridgeMessageSender sender = new BridgeMessageSender(channel, new ObjectMapper(), eventLoop,
                BridgeSettings.defaults());
        inspector = new PlaywrightMeetingUiInspector(sender, eventLoop);
        inspector.attach(page);

        absent(PlaywrightMeetingUiInspector.RECORDING_DIALOG);
        absent(PlaywrightMeetingUiInspector.REMOVED_BANNER);
        absent(PlaywrightMeetingUiInspector.CHAT_BUTTON);
    }

    @Test
    void detachedInspectorDoesNothing() {
        inspector.detach();

        inspector.checkNeededInteractions();
        inspector.probeChatReady();

        assertThat(inspector.isAttached()).isFalse();
        verify(page, never()).locator(any(String.class));
    }

    @Test
    void acceptsRecordingNotice() {
        Locator dialog = present(PlaywrightMeetingUiInspector.RECORDING_DIALOG, "This video call is being recorded");
        Locator accept = element(1, null);
        when(dialog.locator(PlaywrightMeetingUiInspector.RECORDING_DIALOG_ACCEPT)).thenReturn(accept);

        inspector.checkNeededInteractions();

        verify(accept).click();
        assertThat(channel.jsonOfType("UiInteraction")).hasSize(1);
    }

    @Test
    void unrelatedDialogIsLeftAlone() {
        Locator dialog = present(PlaywrightMeetingUiInspector.RECORDING_DIALOG, "Something else entirely");

        inspector.checkNeededInteractions();

        verify(dialog, never()).locator(any(String.class));
        assertThat(channel.messages()).isEmpty();
    }

    @Test
    void missingAcceptButtonIsReported() {
        Locator dialog = present(PlaywrightMeetingUiInspector.RECORDING_DIALOG, "Gemini is taking notes");
        Locator accept = element(0, null);
        when(dialog.locator(PlaywrightMeetingUiInspector.RECORDING_DIALOG_ACCEPT)).thenReturn(accept);

        inspector.checkNeededInteractions();

        assertThat(channel.jsonOfType("Error").get(0).path("message").asText())
                .contains("could not find button");
    }

    @Test
    void removalReportedOncePerAttach() {
        present(PlaywrightMeetingUiInspector.REMOVED_BANNER, "You've been removed from the meeting");

        inspector.checkNeededInteractions();
        inspector.checkNeededInteractions();

        assertThat(channel.jsonOfType("MeetingStatusChange")).hasSize(1);
        assertThat(channel.jsonOfType("MeetingStatusChange").get(0).path("change").asText())
                .isEqualTo("removed_from_meeting");

        inspector.attach(page);
        inspector.checkNeededInteractions();
        assertThat(channel.jsonOfType("MeetingStatusChange")).hasSize(2);
    }

    @Test
    void chatProbeReportsReadyOnceInputAppears() {
        Locator button = present(PlaywrightMeetingUiInspector.CHAT_BUTTON, null);
        Locator input = element(0, null);
        when(page.locator(PlaywrightMeetingUiInspector.CHAT_INPUT)).thenReturn(input);

        inspector.probeChatReady();

        verify(button, times(1)).click();
        assertThat(eventLoop.periodOf(PlaywrightMeetingUiInspector.CHAT_INPUT_POLL_TASK))
                .isEqualTo(PlaywrightMeetingUiInspector.CHAT_INPUT_POLL_INTERVAL);
        eventLoop.tick(PlaywrightMeetingUiInspector.CHAT_INPUT_POLL_TASK);
        assertThat(channel.jsonOfType("ChatStatusChange")).isEmpty();

        when(input.count()).thenReturn(1);
        eventLoop.tick(PlaywrightMeetingUiInspector.CHAT_INPUT_POLL_TASK);

        verify(button, times(2)).click();
        verify(input, never()).waitFor(any(Locator.WaitForOptions.class));
        assertThat(channel.jsonOfType("ChatStatusChange").get(0).path("change").asText())
                .isEqualTo("ready_to_send");
        assertThat(eventLoop.isActive(PlaywrightMeetingUiInspector.CHAT_INPUT_POLL_TASK)).isFalse();
    }

    @Test
    void chatProbeReportsMissingInputAfterLastPoll() {
        present(PlaywrightMeetingUiInspector.CHAT_BUTTON, null);
        absent(PlaywrightMeetingUiInspector.CHAT_INPUT);

        inspector.probeChatReady();
        for (int i = 1; i < PlaywrightMeetingUiInspector.CHAT_INPUT_MAX_POLLS; i++) {
            eventLoop.tick(PlaywrightMeetingUiInspector.CHAT_INPUT_POLL_TASK);
        }
        assertThat(channel.jsonOfType("Error")).isEmpty();

        eventLoop.tick(PlaywrightMeetingUiInspector.CHAT_INPUT_POLL_TASK);

        assertThat(channel.jsonOfType("ChatStatusChange")).isEmpty();
        assertThat(channel.jsonOfType("Error")).hasSize(1);
        assertThat(eventLoop.isActive(PlaywrightMeetingUiInspector.CHAT_INPUT_POLL_TASK)).isFalse();
    }

    @Test
    void failedChatButtonClickIsReported() {
        Locator button = present(PlaywrightMeetingUiInspector.CHAT_BUTTON, null);
        doThrow(new PlaywrightException("Element is not attached")).when(button).click();

        inspector.probeChatReady();

        assertThat(channel.jsonOfType("Error")).hasSize(1);
        assertThat(eventLoop.isActive(PlaywrightMeetingUiInspector.CHAT_INPUT_POLL_TASK)).isFalse();
    }

    @Test
    void detachStopsPendingChatInputPoll() {
        present(PlaywrightMeetingUiInspector.CHAT_BUTTON, null);
        absent(PlaywrightMeetingUiInspector.CHAT_INPUT);
        inspector.probeChatReady();

        inspector.detach();

        assertThat(eventLoop.isActive(PlaywrightMeetingUiInspector.CHAT_INPUT_POLL_TASK)).isFalse();
        assertThat(eventLoop.tick(PlaywrightMeetingUiInspector.CHAT_INPUT_POLL_TASK)).isZero();
        assertThat(channel.messages()).isEmpty();
    }

    @Test
    void chatProbeWithoutButtonIsSilent() {
        inspector.probeChatReady();

        assertThat(channel.messages()).isEmpty();
    }

    private Locator present(String selector, String text) {
        Locator locator = element(1, text);
        when(page.locator(selector)).thenReturn(locator);
        return locator;
    }

    private void absent(String selector) {
        Locator locator = element(0, null);
        when(page.locator(selector)).thenReturn(locator);
    }

    private static Locator element(int count, String text) {
        Locator locator = mock(Locator.class);
        when(locator.count()).thenReturn(count);
        when(locator.first()).thenReturn(locator);
        when(locator.textContent()).thenReturn(text);
        return locator;
    }
}
