package com.meetbridge.controller;

import com.meetbridge.model.AttachRequest;
import com.meetbridge.model.BridgeStatus;
import com.meetbridge.model.Device;
import com.meetbridge.service.BridgeLifecycleService;
import com.meetbridge.service.MediaSendingState;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BridgeController.class)
class BridgeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BridgeLifecycleService lifecycleService;

    @Test
    void attachReturnsPageUrl() throws Exception {
        when(lifecycleService.attach(any(AttachRequest.class))).thenReturn("https://meet.google.com/abc-defg-hij");

        mockMvc.perform(post("/api/bridge/attach")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cdpUrl\":\"http://localhost:9222\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.pageUrl").value("https://meet.google.com/abc-defg-hij"));
    }

    @Test
    void attachWithoutBodyUsesConfiguredBrowser() throws Exception {
        when(lifecycleService.attach(any(AttachRequest.class))).thenReturn("https://meet.google.com/x");

        mockMvc.perform(post("/api/bridge/attach"))
                .andExpect(status().isOk());

        verify(lifecycleService).attach(any(AttachRequest.class));
    }

    @Test
    void attachRejectsMalformedCdpUrl() throws Exception {
        mockMvc.perform(post("/api/bridge/attach")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cdpUrl\":\"localhost:9222\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.data.cdpUrl").exists());

        verify(lifecycleService, never()).attach(any(AttachRequest.class));
    }

    @Test
    void missingCdpUrlIsBadRequest() throws Exception {
        when(lifecycleService.attach(any(AttachRequest.class)))
                .thenThrow(new IllegalArgumentException("No CDP URL given and bridge.browser.cdp-url is not set"));

        mockMvc.perform(post("/api/bridge/attach"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("No CDP URL given and bridge.browser.cdp-url is not set"));
    }

    @Test
    void enableAfterTeardownIsConflict() throws Exception {
        doThrow(new IllegalStateException("Bridge has been torn down")).when(lifecycleService).enableMediaSending();

        mockMvc.perform(post("/api/bridge/media/enable"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void mediaToggles() throws Exception {
        mockMvc.perform(post("/api/bridge/media/enable")).andExpect(status().isOk());
        mockMvc.perform(post("/api/bridge/media/disable")).andExpect(status().isOk());

        verify(lifecycleService).enableMediaSending();
        verify(lifecycleService).disableMediaSending();
    }

    @Test
    void listsParticipants() throws Exception {
        when(lifecycleService.getParticipants()).thenReturn(List.of(
                Device.builder().deviceId("dev-1").fullName("Ada").status(1).host(true).build()));

        mockMvc.perform(get("/api/bridge/participants"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].deviceId").value("dev-1"))
                .andExpect(jsonPath("$.data[0].isHost").value(true))
                .andExpect(jsonPath("$.data[0].humanized_status").value("in_meeting"));
    }

    @Test
    void healthReportsStatus() throws Exception {
        when(lifecycleService.getStatus()).thenReturn(BridgeStatus.builder()
                .mediaSending(MediaSendingState.ENABLED)
                .channelOpen(true)
                .runningPipelines(List.of("mixed-audio"))
                .build());

        mockMvc.perform(get("/api/bridge/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.mediaSending").value("ENABLED"))
                .andExpect(jsonPath("$.data.runningPipelines[0]").value("mixed-audio"));
    }

    @Test
    void unexpectedFailureIsServerError() throws Exception {
        doThrow(new RuntimeException("boom")).when(lifecycleService).teardown();

        mockMvc.perform(post("/api/bridge/teardown"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }

    @Test
    void unknownPathIsNotFound() throws Exception {
        mockMvc.perform(get("/api/bridge/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }
}
