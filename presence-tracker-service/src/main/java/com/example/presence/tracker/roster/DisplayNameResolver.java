package com.example.presence.tracker.roster;

import com.example.presence.shared.model.UserProfile;
import com.example.presence.shared.repository.UserProfileRepository;
import com.example.presence.tracker.alias.AliasMapping;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Display text for a canonical id: alias label, else {@code @username}, else display name, else the id.
 */
@Component
@RequiredArgsConstructor
public class DisplayNameResolver {

    private final UserProfileRepository userProfileRepository;
    private final Cache<String, String> displayNameCache;

    public String displayNameOf(String canonicalId, AliasMapping aliases) {
        return aliases.labelOf(canonicalId)
                .orElseGet(() -> displayNameCache.get(canonicalId, this::lookup));
    }

    public void invalidate(String userId) {
        displayNameCache.invalidate(userId);
    }

    private String lookup(String userId) {
        return userProfileRepository.findById(userId)
                .map(profile -> fromProfile(profile, userId))
                .orElse(userId);
    }

    private static String fromProfile(UserProfile profile, String userId) {
        String username = profile.getUsername() == null ? "" : profile.getUsername().strip();
        if (!username.isEmpty()) {
            return username.startsWith("@") ? username : "@" + username;
        }
        String displayName = profile.getDisplayName() == null ? "" : profile.getDisplayName().strip();
        return displayName.isEmpty() ? userId : displayName;
    }
}
