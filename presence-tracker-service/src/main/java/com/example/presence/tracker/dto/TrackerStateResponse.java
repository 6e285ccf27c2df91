package com.example.presence.tracker.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackerStateResponse {
    private Map<String, String> meta;
    private long dayTotalRows;
    private long complimentRows;
    private String callId;
    private Instant sessionStartedAt;
    private Map<String, Instant> activeSince;
    private Map<String, Long> accumulatedSeconds;
    private Set<String> qualifiedUsers;
    private int pendingUsers;
}
