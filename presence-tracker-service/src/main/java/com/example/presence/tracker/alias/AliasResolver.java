package com.example.presence.tracker.alias;

import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.exception.DurationStoreException;
import com.example.presence.shared.model.UserProfile;
import com.example.presence.shared.repository.UserProfileRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Folds raw participant ids into one canonical identity per configured alias group.
 * <p>
 * Group members are usernames (with or without a leading {@code @}) or raw ids, matched against
 * profiles that have actually been observed. The canonical id is the primary's id when observed,
 * otherwise the first observed member. An id already claimed by an earlier group stays there.
 * <p>
 * The mapping is built at construction and swapped as a whole by {@link #refresh()}.
 */
@Component
@Slf4j
public class AliasResolver {

    private final List<AppProperties.Alias.Group> groups;
    private final UserProfileRepository userProfileRepository;
    private volatile AliasMapping mapping;

    public AliasResolver(AppProperties appProperties, UserProfileRepository userProfileRepository) {
        this.groups = List.copyOf(appProperties.getAlias().getGroups());
        this.userProfileRepository = userProfileRepository;
        this.mapping = load();
    }

    public String canonicalOf(String rawId) {
        return mapping.canonicalOf(rawId);
    }

    public Optional<String> labelOf(String canonicalId) {
        return mapping.labelOf(canonicalId);
    }

    public AliasMapping current() {
        return mapping;
    }

    /**
     * Rebuilds the mapping from the profiles observed so far.
     */
    public AliasMapping refresh() {
        AliasMapping refreshed = build(groups, userProfileRepository.findAll());
        this.mapping = refreshed;
        log.info("Alias mapping refreshed: {} raw ids folded across {} configured groups.", refreshed.size(), groups.size());
        return refreshed;
    }

    private AliasMapping load() {
        if (groups.isEmpty()) {
            return AliasMapping.empty();
        }
        try {
            return build(groups, userProfileRepository.findAll());
        } catch (DurationStoreException e) {
            log.error("Could not read observed profiles, aliases fall back to raw ids until the next refresh.", e);
            return AliasMapping.empty();
        }
    }

    static AliasMapping build(List<AppProperties.Alias.Group> groups, List<UserProfile> observed) {
        Map<String, String> idByUsername = new HashMap<>();
        Set<String> observedIds = new HashSet<>();
        for (UserProfile profile : observed) {
            observedIds.add(profile.getUserId());
            String username = normalize(profile.getUsername());
            if (!username.isEmpty()) {
                idByUsername.putIfAbsent(username, profile.getUserId());
            }
        }

        Map<String, String> canonicalByRawId = new HashMap<>();
        Map<String, String> labelByCanonicalId = new HashMap<>();

        for (AppProperties.Alias.Group group : groups) {
            String primary = group.getPrimary();
            if (primary == null || primary.isBlank() || group.getMembers() == null || group.getMembers().isEmpty()) {
                log.warn("Skipping malformed alias group (primary={}, members={}).", primary, group.getMembers());
                continue;
            }

            Set<String> ids = new LinkedHashSet<>();
            resolve(primary, idByUsername, observedIds).ifPresent(ids::add);
            for (String member : group.getMembers()) {
                resolve(member, idByUsername, observedIds).ifPresent(ids::add);
            }
            if (ids.isEmpty()) {
                log.debug("No member of alias group {} has been observed yet.", primary);
                continue;
            }

            List<String> resolved = new ArrayList<>(ids);
            String canonicalId = resolved.get(0);
            if (canonicalByRawId.containsKey(canonicalId)) {
                log.warn("Alias group {} skipped: id {} already belongs to another group.", primary, canonicalId);
                continue;
            }

            for (String rawId : resolved) {
                String existing = canonicalByRawId.putIfAbsent(rawId, canonicalId);
                if (existing != null) {
                    log.warn("Id {} listed in alias group {} is already folded into {}; keeping the first group.", rawId, primary, existing);
                }
            }
            String label = group.getLabel();
            labelByCanonicalId.put(canonicalId, label == null || label.isBlank() ? "@" + stripAt(primary.trim()) : label.trim());
        }
        return new AliasMapping(canonicalByRawId, labelByCanonicalId);
    }

    private static Optional<String> resolve(String token, Map<String, String> idByUsername, Set<String> observedIds) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String byUsername = idByUsername.get(normalize(token));
        if (byUsername != null) {
            return Optional.of(byUsername);
        }
        String rawId = token.trim();
        return observedIds.contains(rawId) ? Optional.of(rawId) : Optional.empty();
    }

    private static String normalize(String username) {
        if (username == null) {
            return "";
        }
        return stripAt(username.trim()).toLowerCase(Locale.ROOT);
    }

    private static String stripAt(String value) {
        return value.startsWith("@") ? value.substring(1) : value;
    }
}
