package com.example.presence.tracker.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * One ranked window. An empty window is kept with {@code nobodyQualified} set rather than omitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BoardSnapshot {
    private String scope;
    private int index;
    private OffsetDateTime periodStart;
    private OffsetDateTime periodEnd;
    private String label;
    private boolean nobodyQualified;
    private List<LeaderboardEntry> entries;
}
