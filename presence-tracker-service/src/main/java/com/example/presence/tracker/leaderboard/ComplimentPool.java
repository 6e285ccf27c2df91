package com.example.presence.tracker.leaderboard;

import com.example.presence.shared.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Compliments available for decoration: the configured file (section headers in brackets are
 * skipped) followed by the built-in list, without duplicates.
 */
@Component
@Slf4j
public class ComplimentPool {

    static final List<String> BUILT_IN = List.of(
            "Iron Discipline", "Early Bird Energy", "Distraction Slayer", "Deep Work Dynamo",
            "Laser Precision", "Leveling Up", "Night Owl Power", "Flow Controller",
            "Habit Climber", "Full Throttle", "King of Study", "Lord of Focus",
            "Alpha Concentration", "Craftsman of Consistency", "Power Grinder",
            "Queen of Study", "Angel of Focus", "Graceful Grinder", "Rhythm of Discipline",
            "Weaver of Consistency", "Moonlight Scholar", "Study Engine", "Target Locked",
            "Focus Machine", "Productivity Ninja", "Finish Line Closer", "Streak Keeper",
            "Premium Grinder", "Consistency Beast", "King of Focus", "Study Titan",
            "Mind Sprint", "Momentum Master", "Calm Laser", "Unbreakable Chain",
            "No-Excuse Executor", "Deadline Tamer", "Clarity Crafter", "Courage of Action",
            "Relentless Rhythm", "Focus Lighthouse", "Steady Flame", "Bold Consistency",
            "Quiet Thunder", "Grit Architect", "Habit Sculptor", "Minute Millionaire",
            "Study Momentum", "Page Turner", "First In, Last Out", "Mind Gardener",
            "Storm-Proof Focus", "Precision Pilot", "Depth Diver", "Quiet Conqueror",
            "Willpower Weaver", "Task Wrangler", "Flow Surfer", "Stamina Engine",
            "Focus Alchemist", "Study Sentinel", "Crown of Calm", "Morning Star",
            "Evening Torch", "Focus Smith", "Time Whisperer", "Mind Fortress",
            "Diamond Focus", "Evergreen Habits", "Momentum Rider", "Peak Consistency",
            "Anchor of Habit", "Minute Samurai", "Time Artisan", "Focus Navigator",
            "Calm Commander", "Discipline Smith", "Focus Monk", "Will of Granite",
            "Horizon Hunter", "Endurance Engine", "Mind Cartographer"
    );

    private final List<String> compliments;

    @Autowired
    public ComplimentPool(ResourceLoader resourceLoader, AppProperties appProperties) {
        this(TextResources.readLines(resourceLoader.getResource(appProperties.getLeaderboard().getComplimentsLocation())));
    }

    public ComplimentPool(List<String> fileLines) {
        Set<String> merged = new LinkedHashSet<>();
        for (String line : fileLines) {
            if (!line.startsWith("[")) {
                merged.add(line);
            }
        }
        merged.addAll(BUILT_IN);
        this.compliments = List.copyOf(merged);
        log.info("Compliment pool holds {} entries.", compliments.size());
    }

    public List<String> all() {
        return compliments;
    }
}
