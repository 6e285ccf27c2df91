package com.example.presence.tracker.dto;

import com.example.presence.tracker.leaderboard.BadgeTier;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LeaderboardEntry {
    private int rank;
    private String userId;
    private long minutes;
    private long seconds;
    private String displayName;
    private BadgeTier badge;
    private String compliment;
}
