package com.meetbridge.media;

import com.meetbridge.service.BridgeMessageSender;
import com.meetbridge.service.SilenceDetector;

/**
 * Feeds the mixed meeting audio to the activity check and, when enabled, to the channel.
 */
public class MixedAudioProcessor implements FrameProcessor<AudioFrame> {

    private final BridgeMessageSender sender;
    private final SilenceDetector silenceDetector;
    private final boolean sendMixedAudio;

    public MixedAudioProcessor(BridgeMessageSender sender, SilenceDetector silenceDetector, boolean sendMixedAudio) {
        this.sender = sender;
        this.silenceDetector = silenceDetector;
        this.sendMixedAudio = sendMixedAudio;
    }

    @Override
    public void process(AudioFrame frame) {
        float[] samples = AudioDownmixer.toMono(frame);
        silenceDetector.record(samples);
        if (sendMixedAudio) {
            sender.sendMixedAudio(samples);
        }
    }
}
