package com.meetbridge.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CaptionRecord {

    private long captionId;
    private String deviceId;
    private long version;

    @JsonProperty("isFinal")
    private boolean finalVersion;

    private String text;
    private long languageId;
}
