package com.example.presence.tracker.controller;

import com.example.presence.tracker.dto.RosterPushRequest;
import com.example.presence.tracker.roster.PushedRosterSource;
import com.example.presence.tracker.roster.RosterReconciliationService;
import com.example.presence.tracker.roster.RosterSnapshot;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;

@RestController
@RequestMapping("/api/roster")
@RequiredArgsConstructor
@Slf4j
public class RosterController {

    private final PushedRosterSource pushedRosterSource;
    private final RosterReconciliationService reconciliationService;

    /**
     * Accepts a roster change and schedules a refresh. Returns before the roster is applied.
     */
    @PostMapping
    public ResponseEntity<Void> pushRoster(@Valid @RequestBody RosterPushRequest request) {
        pushedRosterSource.accept(RosterSnapshot.builder()
                .callId(request.getCallId())
                .participants(request.getParticipants() == null ? new ArrayList<>() : request.getParticipants())
                .build());
        reconciliationService.triggerRefresh("push");
        return ResponseEntity.accepted().build();
    }
}
