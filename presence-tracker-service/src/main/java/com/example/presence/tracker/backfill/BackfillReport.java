package com.example.presence.tracker.backfill;

import com.example.presence.tracker.dto.LeaderboardSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackfillReport {
    private LocalDate start;
    private LocalDate end;
    private boolean inspect;
    @Builder.Default
    private List<LocalDate> published = new ArrayList<>();
    @Builder.Default
    private List<LocalDate> skippedNoData = new ArrayList<>();
    @Builder.Default
    private List<LocalDate> skippedInvalid = new ArrayList<>();
    @Builder.Default
    private List<LocalDate> failed = new ArrayList<>();
    // Only filled in inspect mode
    @Builder.Default
    private List<LeaderboardSnapshot> snapshots = new ArrayList<>();
}
