package com.example.presence.tracker.roster;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RosterParticipant {
    @NotBlank(message = "Participant userId cannot be blank")
    private String userId;
    private String displayName;
    private String username;
}
