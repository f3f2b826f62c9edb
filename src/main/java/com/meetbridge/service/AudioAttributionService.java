package com.meetbridge.service;

import com.meetbridge.model.ContributingSource;
import com.meetbridge.model.Device;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Decides which participant a received audio buffer belongs to.
 */
@Service
@RequiredArgsConstructor
public class AudioAttributionService {

    private final ParticipantStateService participantState;
    private final ReceiverRegistry receiverRegistry;

    public Optional<Device> loudestSpeaker(String receiverId) {
        return attribute(receiverRegistry.getContributingSources(receiverId));
    }

    /**
     * The loudest source that resolves to a known participant. Sources whose stream id is
     * unknown are ignored; equal levels keep their original order.
     */
    public Optional<Device> attribute(List<ContributingSource> sources) {
        List<Attributed> resolved = new ArrayList<>();
        for (ContributingSource source : sources) {
            participantState.findByStreamId(source.getSourceId())
                    .ifPresent(device -> resolved.add(new Attributed(device, source.getAudioLevel())));
        }
        // List.sort is stable
        resolved.sort(Comparator.comparingDouble(Attributed::getLevel).reversed());
        return resolved.isEmpty() ? Optional.empty() : Optional.of(resolved.get(0).getDevice());
    }

    @Value
    private static class Attributed {
        Device device;
        double level;
    }
}
