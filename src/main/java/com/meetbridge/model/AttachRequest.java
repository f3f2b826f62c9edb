package com.meetbridge.model;

import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttachRequest {

    // optional, defaults to bridge.browser.cdp-url
    @Pattern(regexp = "^(https?|wss?)://.+", message = "CDP URL must be an http(s) or ws(s) URL")
    private String cdpUrl;

    // optional, defaults to the configured meeting host
    private String meetingUrlFragment;
}
