package com.example.presence.tracker.admin;

import com.example.presence.shared.repository.ComplimentChoiceRepository;
import com.example.presence.shared.repository.DurationStore;
import com.example.presence.tracker.dto.TrackerStateResponse;
import com.example.presence.tracker.session.LiveSessionView;
import com.example.presence.tracker.session.SessionTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TrackerStateService {

    private final DurationStore durationStore;
    private final ComplimentChoiceRepository complimentChoiceRepository;
    private final SessionTracker sessionTracker;

    public TrackerStateResponse currentState() {
        LiveSessionView view = sessionTracker.liveSnapshot();
        return TrackerStateResponse.builder()
                .meta(durationStore.getAllMeta())
                .dayTotalRows(durationStore.countDayTotals())
                .complimentRows(complimentChoiceRepository.count())
                .callId(view.callId())
                .sessionStartedAt(view.startedAt())
                .activeSince(view.activeSince())
                .accumulatedSeconds(view.accumulatedSeconds())
                .qualifiedUsers(view.qualified())
                .pendingUsers(view.pendingSegments().size())
                .build();
    }
}
