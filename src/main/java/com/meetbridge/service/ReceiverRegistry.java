package com.meetbridge.service;

import com.meetbridge.model.ContributingSource;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Latest contributing-source poll per audio receiver.
 */
@Component
public class ReceiverRegistry {

    private final Map<String, List<ContributingSource>> sourcesByReceiver = new HashMap<>();

    public void update(String receiverId, List<ContributingSource> sources) {
        sourcesByReceiver.put(receiverId, List.copyOf(sources));
    }

    public List<ContributingSource> getContributingSources(String receiverId) {
        return sourcesByReceiver.getOrDefault(receiverId, List.of());
    }

    public void remove(String receiverId) {
        sourcesByReceiver.remove(receiverId);
    }

    public void clear() {
        sourcesByReceiver.clear();
    }
}
