package com.example.presence.tracker.roster;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One observation of the call. A {@code null} callId means the source saw no call running,
 * which ends the session; it is not the same as an unknown roster.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RosterSnapshot {
    private String callId;
    @Builder.Default
    private List<RosterParticipant> participants = new ArrayList<>();
    private Instant observedAt;
}
