package com.meetbridge.service;

import com.meetbridge.decoder.DecodedMessage;
import com.meetbridge.model.CaptionRecord;
import com.meetbridge.model.message.CaptionUpdateMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the latest version of every caption and forwards updates while media sending is on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CaptionService {

    private final BridgeMessageSender sender;

    private final Map<Long, CaptionRecord> captions = new LinkedHashMap<>();

    /**
     * Map a decoded Caption message to a record
     */
    public static CaptionRecord normalize(DecodedMessage caption) {
        return CaptionRecord.builder()
                .captionId(caption.getLong("captionId", 0))
                .deviceId(caption.getString("deviceId"))
                .version(caption.getLong("version", 0))
                .finalVersion(caption.getFlag("isFinal"))
                .text(caption.getString("text"))
                .languageId(caption.getLong("languageId", 0))
                .build();
    }

    /**
     * Store the caption, replacing any earlier record with the same id, then surface it
     */
    public void handleCaption(CaptionRecord caption) {
        CaptionRecord previous = captions.put(caption.getCaptionId(), caption);
        if (previous != null && previous.getVersion() > caption.getVersion()) {
            log.debug("Caption {} went from version {} back to {}",
                    caption.getCaptionId(), previous.getVersion(), caption.getVersion());
        }

        if (!sender.isMediaSendingEnabled()) {
            return;
        }
        sender.sendJson(CaptionUpdateMessage.builder().caption(caption).build());
    }

    public Optional<CaptionRecord> getCaption(long captionId) {
        return Optional.ofNullable(captions.get(captionId));
    }

    public List<CaptionRecord> getCaptions() {
        return List.copyOf(captions.values());
    }
}
