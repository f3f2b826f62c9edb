package com.meetbridge.controller;

import com.meetbridge.model.ApiResponse;
import com.meetbridge.model.AttachRequest;
import com.meetbridge.model.BridgeStatus;
import com.meetbridge.model.Device;
import com.meetbridge.service.BridgeLifecycleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/bridge")
@RequiredArgsConstructor
public class BridgeController {

    private final BridgeLifecycleService lifecycleService;

    /**
     * Attach to a running browser and hook the meeting page
     */
    @PostMapping("/attach")
    public ResponseEntity<ApiResponse<Map<String, Object>>> attach(
            @Valid @RequestBody(required = false) AttachRequest request) {
        AttachRequest effective = request != null ? request : new AttachRequest();
        String pageUrl = lifecycleService.attach(effective);

        Map<String, Object> data = new HashMap<>();
        data.put("pageUrl", pageUrl);
        return ResponseEntity.ok(ApiResponse.success("Attached to meeting page", data));
    }

    /**
     * Start relaying media
     */
    @PostMapping("/media/enable")
    public ResponseEntity<ApiResponse<Void>> enableMediaSending() {
        lifecycleService.enableMediaSending();
        return ResponseEntity.ok(ApiResponse.success("Media sending enabled"));
    }

    /**
     * Stop relaying media after the grace period
     */
    @PostMapping("/media/disable")
    public ResponseEntity<ApiResponse<Void>> disableMediaSending() {
        lifecycleService.disableMediaSending();
        return ResponseEntity.ok(ApiResponse.success("Media sending will be disabled"));
    }

    /**
     * Devices currently in the meeting
     */
    @GetMapping("/participants")
    public ResponseEntity<ApiResponse<List<Device>>> getParticipants() {
        List<Device> participants = lifecycleService.getParticipants();
        return ResponseEntity.ok(ApiResponse.success(participants.size() + " devices in meeting", participants));
    }

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<BridgeStatus>> healthCheck() {
        return ResponseEntity.ok(ApiResponse.success("Bridge is running", lifecycleService.getStatus()));
    }

    @PostMapping("/teardown")
    public ResponseEntity<ApiResponse<Void>> teardown() {
        lifecycleService.teardown();
        return ResponseEntity.ok(ApiResponse.success("Bridge torn down"));
    }
}
