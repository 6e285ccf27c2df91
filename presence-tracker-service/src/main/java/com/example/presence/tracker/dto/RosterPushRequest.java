package com.example.presence.tracker.dto;

import com.example.presence.tracker.roster.RosterParticipant;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Roster pushed by the transport adapter. Omit {@code callId} to report that no call is running.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RosterPushRequest {
    private String callId;
    @Valid
    @Builder.Default
    private List<RosterParticipant> participants = new ArrayList<>();
}
