package com.meetbridge.service;

import com.meetbridge.decoder.DecodedMessage;
import com.meetbridge.model.ChatMessageRecord;
import com.meetbridge.model.message.ChatMessageEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Forwards chat messages observed in collection events, once per message id.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatService {

    static final int MAX_REMEMBERED_MESSAGE_IDS = 1000;

    private final BridgeMessageSender sender;

    // insertion order, oldest first
    private final Set<String> seenMessageIds = new LinkedHashSet<>();

    /**
     * Map a decoded ChatMessageWrapper to a record, or empty if it carries no message
     */
    public static Optional<ChatMessageRecord> normalize(DecodedMessage wrapper) {
        DecodedMessage chatMessage = wrapper.getMessage("chatMessage");
        if (chatMessage == null) {
            return Optional.empty();
        }
        DecodedMessage content = chatMessage.getMessage("chatMessageContent");
        return Optional.of(ChatMessageRecord.builder()
                .messageId(chatMessage.getString("messageId"))
                .deviceId(chatMessage.getString("deviceId"))
                .timestamp(chatMessage.getLong("timestamp", 0))
                .text(content != null ? content.getString("text") : null)
                .build());
    }

    public void handleChatMessage(ChatMessageRecord message) {
        if (message.getMessageId() != null && !seenMessageIds.add(message.getMessageId())) {
            log.debug("Chat message {} already forwarded", message.getMessageId());
            return;
        }
        if (message.getMessageId() != null && seenMessageIds.size() > MAX_REMEMBERED_MESSAGE_IDS) {
            Iterator<String> oldest = seenMessageIds.iterator();
            oldest.next();
            oldest.remove();
        }

        sender.sendJson(ChatMessageEvent.builder()
                .messageUuid(message.getMessageId())
                .participantUuid(message.getDeviceId())
                .timestamp(Math.floorDiv(message.getTimestamp(), 1000L))
                .text(message.getText())
                .build());
    }
}
