package com.example.presence.tracker.controller;

import com.example.presence.tracker.admin.TrackerResetService;
import com.example.presence.tracker.admin.TrackerStateService;
import com.example.presence.tracker.alias.AliasResolver;
import com.example.presence.tracker.backfill.BackfillReport;
import com.example.presence.tracker.backfill.BackfillService;
import com.example.presence.tracker.dto.RosterPushRequest;
import com.example.presence.tracker.publish.LeaderboardPublishingService;
import com.example.presence.tracker.roster.PushedRosterSource;
import com.example.presence.tracker.roster.RosterParticipant;
import com.example.presence.tracker.roster.RosterReconciliationService;
import com.example.presence.tracker.roster.RosterSnapshot;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TrackerControllersTest {

    @Test
    void pushedRosterIsStoredAndRefreshTriggered() {
        PushedRosterSource source = mock(PushedRosterSource.class);
        RosterReconciliationService reconciliation = mock(RosterReconciliationService.class);
        RosterController controller = new RosterController(source, reconciliation);

        ResponseEntity<Void> response = controller.pushRoster(RosterPushRequest.builder()
                .callId("call-1")
                .participants(List.of(RosterParticipant.builder().userId("a").build()))
                .build());

        assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
        ArgumentCaptor<RosterSnapshot> captor = ArgumentCaptor.forClass(RosterSnapshot.class);
        verify(source).accept(captor.capture());
        assertEquals("call-1", captor.getValue().getCallId());
        assertEquals(1, captor.getValue().getParticipants().size());
        verify(reconciliation).triggerRefresh("push");
    }

    @Test
    void adminEndpointsDelegateToTheirServices() {
        BackfillService backfillService = mock(BackfillService.class);
        TrackerResetService resetService = mock(TrackerResetService.class);
        LocalDate start = LocalDate.of(2024, 3, 1);
        when(backfillService.replay(start, null, true)).thenReturn(BackfillReport.builder().start(start).inspect(true).build());
        when(resetService.hardReset()).thenReturn(LocalDate.of(2024, 3, 10));
        TrackerAdminController controller = new TrackerAdminController(mock(TrackerStateService.class),
                mock(LeaderboardPublishingService.class), backfillService, resetService, mock(AliasResolver.class),
                Schedulers.immediate());

        ResponseEntity<BackfillReport> backfill = controller.backfill(start, null, true).block();
        ResponseEntity<Map<String, String>> reset = controller.hardReset().block();

        assertEquals(start, backfill.getBody().getStart());
        assertEquals("2024-03-10", reset.getBody().get("anchorDate"));
    }
}
