package com.meetbridge.service;

import com.meetbridge.config.BridgeSettings;
import com.meetbridge.model.message.SilenceStatusMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Audio-activity check over the latest mixed meeting audio. Samples are scaled to the 8-bit
 * analyser range (silence at 128) and the average deviation is compared with the threshold.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SilenceDetector {

    private final BridgeMessageSender sender;
    private final BridgeSettings settings;

    private float[] latestSamples = new float[0];

    public void record(float[] samples) {
        latestSamples = samples;
    }

    public double averageDeviation() {
        if (latestSamples.length == 0) {
            return 0;
        }
        long sum = 0;
        for (float sample : latestSamples) {
            sum += Math.abs(toAnalyserByte(sample) - 128);
        }
        return (double) sum / latestSamples.length;
    }

    /**
     * Report activity when the latest audio is above the silence threshold. Silence is not reported.
     */
    public void checkAudioActivity() {
        double deviation = averageDeviation();
        if (deviation > settings.getSilenceThreshold()) {
            sender.sendJson(SilenceStatusMessage.builder()
                    .volume(deviation)
                    .silent(false)
                    .build());
        }
    }

    public void reset() {
        latestSamples = new float[0];
    }

    static int toAnalyserByte(float sample) {
        int value = (int) Math.floor(128 + sample * 128);
        return Math.max(0, Math.min(255, value));
    }
}
