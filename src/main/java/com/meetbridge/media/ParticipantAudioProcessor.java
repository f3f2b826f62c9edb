package com.meetbridge.media;

import com.meetbridge.model.AudioFormat;
import com.meetbridge.model.message.AudioFormatUpdateMessage;
import com.meetbridge.service.AudioAttributionService;
import com.meetbridge.service.BridgeMessageSender;

/**
 * Down-mixes one receiver's audio and sends it as the loudest attributed participant.
 */
public class ParticipantAudioProcessor implements FrameProcessor<AudioFrame> {

    private final String receiverId;
    private final AudioAttributionService attribution;
    private final BridgeMessageSender sender;

    private AudioFormat lastFormat;

    public ParticipantAudioProcessor(String receiverId, AudioAttributionService attribution, BridgeMessageSender sender) {
        this.receiverId = receiverId;
        this.attribution = attribution;
        this.sender = sender;
    }

    @Override
    public void process(AudioFrame frame) {
        float[] samples = AudioDownmixer.toMono(frame);

        AudioFormat format = AudioFormat.builder()
                .numberOfChannels(1)
                .originalNumberOfChannels(frame.numberOfChannels())
                .numberOfFrames(frame.numberOfFrames())
                .sampleRate(frame.sampleRate())
                .format(frame.format())
                .duration(frame.durationMicros())
                .build();
        if (!format.equals(lastFormat)) {
            lastFormat = format;
            sender.sendJson(AudioFormatUpdateMessage.builder().format(format).build());
        }

        if (AudioDownmixer.isAllZero(samples)) {
            return;
        }

        attribution.loudestSpeaker(receiverId)
                .ifPresent(device -> sender.sendPerParticipantAudio(device.getDeviceId(), samples));
    }
}
