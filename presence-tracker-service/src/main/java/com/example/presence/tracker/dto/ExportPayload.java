package com.example.presence.tracker.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Body POSTed to the leaderboard ingest endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExportPayload {
    private OffsetDateTime postedAt;
    private String source;
    private int dayIndex;
    private List<BoardSnapshot> boards;
    private String wordOfTheDay;
}
