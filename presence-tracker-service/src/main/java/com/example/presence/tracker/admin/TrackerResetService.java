package com.example.presence.tracker.admin;

import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.repository.ComplimentChoiceRepository;
import com.example.presence.shared.repository.DurationStore;
import com.example.presence.shared.util.Constants.MetaKeys;
import com.example.presence.tracker.leaderboard.AnchorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Wipes totals, compliments and period markers and starts counting from today.
 */
@Service
@Slf4j
public class TrackerResetService {

    private final DurationStore durationStore;
    private final ComplimentChoiceRepository complimentChoiceRepository;
    private final AnchorService anchorService;
    private final Clock clock;
    private final String groupKey;

    public TrackerResetService(DurationStore durationStore,
                               ComplimentChoiceRepository complimentChoiceRepository,
                               AnchorService anchorService,
                               Clock trackerClock,
                               AppProperties appProperties) {
        this.durationStore = durationStore;
        this.complimentChoiceRepository = complimentChoiceRepository;
        this.anchorService = anchorService;
        this.clock = trackerClock;
        this.groupKey = appProperties.getGroupKey();
    }

    /**
     * Resets everything when the configured group differs from the one the data was collected for.
     *
     * @return {@code true} if a reset happened
     */
    public boolean ensureGroupIdentity() {
        Optional<String> stored = durationStore.getMeta(MetaKeys.GROUP_KEY);
        if (stored.isPresent() && stored.get().equals(groupKey)) {
            log.info("Tracking group {} since {}.", groupKey, durationStore.getMeta(MetaKeys.GROUP_SINCE).orElse("unknown"));
            return false;
        }
        log.warn("Tracked group changed from {} to {}; resetting all counters.", stored.orElse("<none>"), groupKey);
        LocalDate today = wipe();
        durationStore.setMeta(MetaKeys.GROUP_KEY, groupKey);
        log.info("Reset for new group {} done. Anchor set to {}.", groupKey, today);
        return true;
    }

    /**
     * Same wipe as a group change, keeping the current group key.
     *
     * @return the new anchor date
     */
    public LocalDate hardReset() {
        LocalDate today = wipe();
        log.warn("Hard reset done. Next post is DAY 1, WEEK 1, MONTH 1 from {}.", today);
        return today;
    }

    private LocalDate wipe() {
        LocalDate today = LocalDate.now(clock);
        durationStore.deleteAllTotals();
        int compliments = complimentChoiceRepository.deleteAll();
        durationStore.deleteMeta(MetaKeys.TIMING_KEYS);
        anchorService.reanchor(today);
        durationStore.setMeta(MetaKeys.GROUP_SINCE, today.toString());
        log.info("Cleared day totals and {} compliment choices.", compliments);
        return today;
    }
}
