package com.example.presence.tracker.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LeaderboardSnapshot {
    private OffsetDateTime postedAt;
    private LocalDate referenceDate;
    private LocalDate anchorDate;
    private int dayIndex;
    // false for historical rebuilds, which never include the running session
    private boolean live;
    private List<BoardSnapshot> boards;
    private String wordOfTheDay;

    public Optional<BoardSnapshot> findBoard(String scope) {
        return boards == null ? Optional.empty() : boards.stream().filter(b -> scope.equals(b.getScope())).findFirst();
    }
}
