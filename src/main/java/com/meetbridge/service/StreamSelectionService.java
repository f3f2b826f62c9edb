package com.meetbridge.service;

import com.meetbridge.media.MonotonicClock;
import com.meetbridge.model.VideoTrackRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tracks the live video tracks and decides which one is relayed.
 * A screen share always wins over cameras; within a kind the most recently seen track wins.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StreamSelectionService {

    private final MonotonicClock clock;

    private final Map<String, VideoTrackRecord> tracks = new LinkedHashMap<>();

    private boolean selectionValid;
    private VideoTrackRecord selected;

    /**
     * Insert or refresh a track. A track seen before keeps its original first-seen time.
     */
    public VideoTrackRecord upsertTrack(String trackId, String streamId, boolean screenShare) {
        VideoTrackRecord existing = tracks.get(trackId);
        long firstSeenAt = existing != null ? existing.getFirstSeenAt() : clock.nanos();

        VideoTrackRecord record = VideoTrackRecord.builder()
                .trackId(trackId)
                .streamId(streamId)
                .screenShare(screenShare)
                .firstSeenAt(firstSeenAt)
                .build();
        tracks.put(trackId, record);
        selectionValid = false;

        log.debug("Video track {} upserted (stream {}, screen share {})", trackId, streamId, screenShare);
        return record;
    }

    public void deleteTrack(String trackId) {
        if (tracks.remove(trackId) != null) {
            log.debug("Video track {} removed", trackId);
        }
        selectionValid = false;
    }

    public Optional<VideoTrackRecord> selectActiveVideoTrack() {
        if (!selectionValid) {
            VideoTrackRecord screenShare = newest(true);
            selected = screenShare != null ? screenShare : newest(false);
            selectionValid = true;
        }
        return Optional.ofNullable(selected);
    }

    public Optional<String> getActiveStreamId() {
        return selectActiveVideoTrack().map(VideoTrackRecord::getStreamId);
    }

    public boolean isActiveTrack(String trackId) {
        return selectActiveVideoTrack()
                .map(track -> track.getTrackId().equals(trackId))
                .orElse(false);
    }

    public Optional<VideoTrackRecord> getTrack(String trackId) {
        return Optional.ofNullable(tracks.get(trackId));
    }

    public List<VideoTrackRecord> getTracks() {
        return List.copyOf(tracks.values());
    }

    public void clear() {
        tracks.clear();
        selectionValid = false;
    }

    private VideoTrackRecord newest(boolean screenShare) {
        VideoTrackRecord newest = null;
        for (VideoTrackRecord track : tracks.values()) {
            if (track.isScreenShare() != screenShare) {
                continue;
            }
            // strictly greater so the earlier-inserted track wins a tie
            if (newest == null || track.getFirstSeenAt() > newest.getFirstSeenAt()) {
                newest = track;
            }
        }
        return newest;
    }
}
