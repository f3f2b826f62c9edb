package com.meetbridge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Shape of the audio frames being relayed; numberOfChannels is always 1 after down-mixing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AudioFormat {

    private int numberOfChannels;
    private int originalNumberOfChannels;
    private int numberOfFrames;
    private int sampleRate;
    private String format;
    private long duration;
}
